package com.ledgerlens.insights.controller.dto;

import com.ledgerlens.insights.service.ScanResult;
import java.time.Instant;

public record ScanResponseDto(String status, int scannedCount, int resultCount, Instant completedAt, String traceId) {

    public static ScanResponseDto from(ScanResult result, String traceId) {
        return new ScanResponseDto(
                result.status().name(),
                result.scannedCount(),
                result.resultCount(),
                result.completedAt(),
                traceId
        );
    }
}
