package com.ledgerlens.insights.model;

/**
 * One reason a transaction was flagged. Only the fields belonging to {@link #type()} are set;
 * use the factory methods to build instances.
 */
public record AnomalyFinding(
        AnomalyType type,
        Double amountDeviation,
        String duplicateOf,
        Integer frequencyCount,
        FrequencyPeriod frequencyPeriod
) {
    public AnomalyFinding {
        if (type == null) {
            throw new IllegalArgumentException("type must be provided");
        }
    }

    public static AnomalyFinding highAmount(double zScore) {
        return new AnomalyFinding(AnomalyType.HIGH_AMOUNT, zScore, null, null, null);
    }

    public static AnomalyFinding lowAmount(double zScore) {
        return new AnomalyFinding(AnomalyType.LOW_AMOUNT, zScore, null, null, null);
    }

    public static AnomalyFinding duplicateOf(String transactionId) {
        return new AnomalyFinding(AnomalyType.DUPLICATE, null, transactionId, null, null);
    }

    public static AnomalyFinding unusualFrequency(int count, FrequencyPeriod period) {
        return new AnomalyFinding(AnomalyType.UNUSUAL_FREQUENCY, null, null, count, period);
    }
}
