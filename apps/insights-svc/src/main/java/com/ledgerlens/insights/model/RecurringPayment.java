package com.ledgerlens.insights.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public record RecurringPayment(
        UUID id,
        String merchantName,
        String normalizedName,
        List<String> originalMerchantNames,
        String category,
        BigDecimal latestAmount,
        BigDecimal averageAmount,
        Frequency frequency,
        double confidence,
        Instant firstSeen,
        Instant lastSeen,
        int occurrenceCount,
        List<String> transactionIds,
        boolean active,
        Optional<LocalDate> nextExpectedDate,
        RecurringStatus status
) {
    public RecurringPayment {
        originalMerchantNames = List.copyOf(originalMerchantNames);
        transactionIds = List.copyOf(transactionIds);
        nextExpectedDate = nextExpectedDate == null ? Optional.empty() : nextExpectedDate;
    }
}
