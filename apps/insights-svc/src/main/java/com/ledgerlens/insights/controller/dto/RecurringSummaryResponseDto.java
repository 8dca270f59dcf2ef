package com.ledgerlens.insights.controller.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record RecurringSummaryResponseDto(
        int activeCount,
        int inactiveCount,
        BigDecimal totalMonthlyRecurring,
        Instant lastScannedAt,
        String traceId
) {
}
