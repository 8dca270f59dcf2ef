package com.ledgerlens.insights.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledgerlens.insights.model.RecurringPayment;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RecurringPaymentResponseDto(
        String id,
        String merchantName,
        String normalizedName,
        List<String> originalMerchantNames,
        String category,
        BigDecimal amount,
        BigDecimal averageAmount,
        BigDecimal monthlyAmount,
        String frequency,
        double confidence,
        Instant firstSeen,
        Instant lastSeen,
        int occurrenceCount,
        List<String> transactionIds,
        @JsonProperty("isActive") boolean active,
        LocalDate nextExpectedDate,
        String status
) {
    public static RecurringPaymentResponseDto from(RecurringPayment payment, BigDecimal monthlyAmount) {
        return new RecurringPaymentResponseDto(
                payment.id().toString(),
                payment.merchantName(),
                payment.normalizedName(),
                payment.originalMerchantNames(),
                payment.category(),
                payment.latestAmount(),
                payment.averageAmount(),
                monthlyAmount,
                payment.frequency().value(),
                payment.confidence(),
                payment.firstSeen(),
                payment.lastSeen(),
                payment.occurrenceCount(),
                payment.transactionIds(),
                payment.active(),
                payment.nextExpectedDate().orElse(null),
                payment.status().value()
        );
    }
}
