package com.ledgerlens.insights.model;

import java.util.Locale;

public enum RecurringStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    RecurringStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RecurringStatus fromValue(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (RecurringStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown recurring payment status: " + raw);
    }
}
