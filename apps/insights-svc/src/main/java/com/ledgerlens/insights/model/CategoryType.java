package com.ledgerlens.insights.model;

import java.util.Locale;

/**
 * Economic type of a transaction's category. Transfers and investments are {@link #EXCLUDED}
 * from income and expense totals.
 */
public enum CategoryType {
    INCOME("income"),
    EXPENSE("expense"),
    EXCLUDED("excluded");

    private final String value;

    CategoryType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static CategoryType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("categoryType must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CategoryType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown category type: " + raw);
    }
}
