package com.ledgerlens.insights.model;

import java.time.LocalDate;

/**
 * Canonical billing frequencies, in the order they are tried during classification.
 */
public enum Frequency {
    WEEKLY("weekly", 7, 2),
    MONTHLY("monthly", 30, 7),
    QUARTERLY("quarterly", 91, 14),
    YEARLY("yearly", 365, 30);

    private final String value;
    private final int expectedDays;
    private final int defaultToleranceDays;

    Frequency(String value, int expectedDays, int defaultToleranceDays) {
        this.value = value;
        this.expectedDays = expectedDays;
        this.defaultToleranceDays = defaultToleranceDays;
    }

    public String value() {
        return value;
    }

    public int expectedDays() {
        return expectedDays;
    }

    public int defaultToleranceDays() {
        return defaultToleranceDays;
    }

    /**
     * Adds one billing period using calendar arithmetic, so month ends and leap days clamp
     * instead of drifting.
     */
    public LocalDate next(LocalDate from) {
        return switch (this) {
            case WEEKLY -> from.plusWeeks(1);
            case MONTHLY -> from.plusMonths(1);
            case QUARTERLY -> from.plusMonths(3);
            case YEARLY -> from.plusYears(1);
        };
    }
}
