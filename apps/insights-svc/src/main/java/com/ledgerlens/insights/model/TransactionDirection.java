package com.ledgerlens.insights.model;

import java.util.Locale;

/**
 * Direction of money flow from the account's point of view.
 */
public enum TransactionDirection {
    CREDIT("credit"),
    DEBIT("debit");

    private final String value;

    TransactionDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static TransactionDirection fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("direction must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TransactionDirection direction : values()) {
            if (direction.value.equals(normalized)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown transaction direction: " + raw);
    }
}
