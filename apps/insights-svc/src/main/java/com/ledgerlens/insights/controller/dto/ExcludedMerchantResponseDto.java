package com.ledgerlens.insights.controller.dto;

import java.time.Instant;

public record ExcludedMerchantResponseDto(String normalizedName, Instant excludedAt) {
}
