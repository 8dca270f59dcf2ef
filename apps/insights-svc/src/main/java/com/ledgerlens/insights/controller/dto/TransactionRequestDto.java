package com.ledgerlens.insights.controller.dto;

import com.ledgerlens.insights.model.CategoryType;
import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.model.TransactionDirection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;

public record TransactionRequestDto(
        @NotBlank String id,
        @NotNull Instant date,
        @NotNull String description,
        @NotNull BigDecimal amount,
        @NotBlank String direction,
        @NotBlank String categoryType,
        String category,
        String merchant,
        Boolean anomalyDismissed
) {
    public Transaction toTransaction() {
        return Transaction.builder()
                .id(id)
                .occurredAt(date)
                .description(description)
                .amount(amount.abs())
                .direction(TransactionDirection.fromValue(direction))
                .categoryType(CategoryType.fromValue(categoryType))
                .category(category)
                .merchantName(merchant)
                .anomalyDismissed(Boolean.TRUE.equals(anomalyDismissed))
                .build();
    }
}
