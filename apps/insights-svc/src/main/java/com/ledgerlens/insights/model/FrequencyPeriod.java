package com.ledgerlens.insights.model;

import java.time.Duration;

/**
 * Windows used by the charge frequency check.
 */
public enum FrequencyPeriod {
    TWENTY_FOUR_HOURS("24h", Duration.ofHours(24)),
    SEVEN_DAYS("7d", Duration.ofDays(7));

    private final String value;
    private final Duration window;

    FrequencyPeriod(String value, Duration window) {
        this.value = value;
        this.window = window;
    }

    public String value() {
        return value;
    }

    public Duration window() {
        return window;
    }
}
