package com.ledgerlens.insights.service;

import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.repository.TransactionRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;

    public TransactionService(TransactionRepository transactionRepository) {
        this.transactionRepository = transactionRepository;
    }

    /**
     * Replaces the whole snapshot. Ids must be present and unique.
     */
    public int importTransactions(List<Transaction> transactions) {
        Set<String> seen = new HashSet<>();
        for (Transaction transaction : transactions) {
            if (transaction.id() == null || transaction.id().isBlank()) {
                throw new IllegalArgumentException("Transaction id must be provided");
            }
            if (!seen.add(transaction.id())) {
                throw new IllegalArgumentException("Duplicate transaction id: " + transaction.id());
            }
        }
        transactionRepository.replaceAll(transactions);
        log.info("Imported {} transactions", transactions.size());
        return transactions.size();
    }

    public List<Transaction> listTransactions(boolean openAnomaliesOnly) {
        List<Transaction> transactions = transactionRepository.findAll();
        if (!openAnomaliesOnly) {
            return transactions;
        }
        return transactions.stream()
                .filter(Transaction::isOpenAnomaly)
                .toList();
    }
}
