package com.ledgerlens.insights.controller.dto;

public record TransactionsImportResponseDto(int importedCount, String traceId) {
}
