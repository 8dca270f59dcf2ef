package com.ledgerlens.insights.repository;

import com.ledgerlens.insights.model.ExcludedMerchant;
import java.util.List;

public interface ExcludedMerchantRepository {

    ExcludedMerchant save(ExcludedMerchant excludedMerchant);

    List<ExcludedMerchant> findAll();

    void deleteAll();
}
