package com.ledgerlens.insights.repository;

import com.ledgerlens.insights.model.Transaction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    // insertion order is the input order the detectors depend on
    private final Map<String, Transaction> storage = new LinkedHashMap<>();

    @Override
    public synchronized void replaceAll(List<Transaction> transactions) {
        storage.clear();
        for (Transaction transaction : transactions) {
            storage.put(transaction.id(), transaction);
        }
    }

    @Override
    public synchronized void updateAll(List<Transaction> transactions) {
        for (Transaction transaction : transactions) {
            storage.computeIfPresent(transaction.id(),
                    (id, existing) -> transaction.withAnomalyDismissed(existing.anomalyDismissed()));
        }
    }

    @Override
    public synchronized Transaction save(Transaction transaction) {
        storage.put(transaction.id(), transaction);
        return transaction;
    }

    @Override
    public synchronized List<Transaction> findAll() {
        return new ArrayList<>(storage.values());
    }

    @Override
    public synchronized Optional<Transaction> findById(String transactionId) {
        return Optional.ofNullable(storage.get(transactionId));
    }

    @Override
    public synchronized long count() {
        return storage.size();
    }
}
