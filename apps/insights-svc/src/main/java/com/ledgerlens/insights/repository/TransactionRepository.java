package com.ledgerlens.insights.repository;

import com.ledgerlens.insights.model.Transaction;
import java.util.List;
import java.util.Optional;

public interface TransactionRepository {

    /**
     * Replaces the stored snapshot, keeping the given order.
     */
    void replaceAll(List<Transaction> transactions);

    /**
     * Writes back re-annotated copies, matched by id. Unknown ids are ignored, and the stored
     * record's {@code anomalyDismissed} flag is kept, so a dismissal saved while the copies were
     * being computed is not overwritten.
     */
    void updateAll(List<Transaction> transactions);

    Transaction save(Transaction transaction);

    List<Transaction> findAll();

    Optional<Transaction> findById(String transactionId);

    long count();
}
