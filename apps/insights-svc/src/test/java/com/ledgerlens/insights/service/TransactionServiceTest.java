package com.ledgerlens.insights.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ledgerlens.insights.model.AnomalyFinding;
import com.ledgerlens.insights.model.CategoryType;
import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.model.TransactionDirection;
import com.ledgerlens.insights.repository.InMemoryTransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransactionServiceTest {

    private final InMemoryTransactionRepository transactionRepository = new InMemoryTransactionRepository();
    private final TransactionService transactionService = new TransactionService(transactionRepository);

    @Test
    void importReplacesSnapshot() {
        transactionService.importTransactions(List.of(transaction("old")));

        int imported = transactionService.importTransactions(List.of(transaction("a"), transaction("b")));

        assertThat(imported).isEqualTo(2);
        assertThat(transactionService.listTransactions(false)).extracting(Transaction::id).containsExactly("a", "b");
    }

    @Test
    void rejectsDuplicateOrMissingIds() {
        transactionService.importTransactions(List.of(transaction("keep")));

        assertThatThrownBy(() -> transactionService.importTransactions(List.of(transaction("a"), transaction("a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> transactionService.importTransactions(List.of(transaction(" "))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(transactionService.listTransactions(false)).extracting(Transaction::id).containsExactly("keep");
    }

    @Test
    void listsOnlyOpenAnomaliesWhenAsked() {
        transactionService.importTransactions(List.of(
                transaction("open").withAnomalies(List.of(AnomalyFinding.lowAmount(-3.1))),
                transaction("dismissed").withAnomalies(List.of(AnomalyFinding.lowAmount(-2.9))).withAnomalyDismissed(true),
                transaction("clean")
        ));

        assertThat(transactionService.listTransactions(true)).extracting(Transaction::id).containsExactly("open");
    }

    private static Transaction transaction(String id) {
        return Transaction.builder()
                .id(id)
                .occurredAt(Instant.parse("2024-03-01T12:00:00Z"))
                .description("Merchant")
                .amount(new BigDecimal("10.00"))
                .direction(TransactionDirection.DEBIT)
                .categoryType(CategoryType.EXPENSE)
                .build();
    }
}
