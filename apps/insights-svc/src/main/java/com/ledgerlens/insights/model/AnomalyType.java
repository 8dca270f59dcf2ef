package com.ledgerlens.insights.model;

public enum AnomalyType {
    HIGH_AMOUNT("high_amount", "unusually high amount"),
    LOW_AMOUNT("low_amount", "unusually low amount"),
    DUPLICATE("duplicate", "potential duplicate"),
    UNUSUAL_FREQUENCY("unusual_frequency", "unusual frequency");

    private final String value;
    private final String label;

    AnomalyType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String value() {
        return value;
    }

    public String label() {
        return label;
    }
}
