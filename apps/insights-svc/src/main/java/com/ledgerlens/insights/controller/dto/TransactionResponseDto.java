package com.ledgerlens.insights.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledgerlens.insights.model.AnomalyDetails;
import com.ledgerlens.insights.model.AnomalyType;
import com.ledgerlens.insights.model.Transaction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record TransactionResponseDto(
        String id,
        Instant date,
        String description,
        BigDecimal amount,
        BigDecimal signedAmount,
        String direction,
        String categoryType,
        String category,
        String merchant,
        @JsonProperty("isAnomaly") boolean anomaly,
        List<String> anomalyTypes,
        AnomalyDetailsDto anomalyDetails,
        boolean anomalyDismissed
) {
    public record AnomalyDetailsDto(
            Double amountDeviation,
            String duplicateOf,
            Integer frequencyCount,
            String frequencyPeriod
    ) {
        static AnomalyDetailsDto from(AnomalyDetails details) {
            return new AnomalyDetailsDto(
                    details.amountDeviation(),
                    details.duplicateOf(),
                    details.frequencyCount(),
                    details.frequencyPeriod() == null ? null : details.frequencyPeriod().value()
            );
        }
    }

    public static TransactionResponseDto from(Transaction transaction) {
        return new TransactionResponseDto(
                transaction.id(),
                transaction.occurredAt(),
                transaction.description(),
                transaction.amount(),
                transaction.signedAmount(),
                transaction.direction() == null ? null : transaction.direction().value(),
                transaction.categoryType() == null ? null : transaction.categoryType().value(),
                transaction.category(),
                transaction.merchantName().orElse(null),
                transaction.anomaly(),
                transaction.anomalyTypes().stream().map(AnomalyType::value).toList(),
                transaction.anomalyDetails().map(AnomalyDetailsDto::from).orElse(null),
                transaction.anomalyDismissed()
        );
    }
}
