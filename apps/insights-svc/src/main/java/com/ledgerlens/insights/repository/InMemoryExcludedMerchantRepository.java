package com.ledgerlens.insights.repository;

import com.ledgerlens.insights.model.ExcludedMerchant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryExcludedMerchantRepository implements ExcludedMerchantRepository {

    private final List<ExcludedMerchant> storage = new CopyOnWriteArrayList<>();

    @Override
    public ExcludedMerchant save(ExcludedMerchant excludedMerchant) {
        ExcludedMerchant stored = new ExcludedMerchant(
                excludedMerchant.normalizedName().toLowerCase(Locale.ROOT),
                excludedMerchant.excludedAt()
        );
        storage.add(stored);
        return stored;
    }

    @Override
    public List<ExcludedMerchant> findAll() {
        return List.copyOf(storage);
    }

    @Override
    public void deleteAll() {
        storage.clear();
    }
}
