package com.ledgerlens.insights.service;

import java.time.Instant;

/**
 * Outcome of a scan request. {@code SKIPPED} means another scan was still running.
 */
public record ScanResult(Status status, int scannedCount, int resultCount, Instant completedAt) {

    public enum Status {
        COMPLETED,
        SKIPPED
    }

    public static ScanResult completed(int scannedCount, int resultCount, Instant completedAt) {
        return new ScanResult(Status.COMPLETED, scannedCount, resultCount, completedAt);
    }

    public static ScanResult skipped() {
        return new ScanResult(Status.SKIPPED, 0, 0, null);
    }
}
