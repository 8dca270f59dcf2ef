package com.ledgerlens.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "insights")
public record InsightsProperties(
        Anomaly anomaly,
        Recurring recurring
) {

    @ConstructorBinding
    public InsightsProperties {
        // either block may be omitted entirely; fall back to the documented defaults
        if (anomaly == null) {
            anomaly = Anomaly.defaults();
        }
        if (recurring == null) {
            recurring = Recurring.defaults();
        }
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(Anomaly.defaults(), Recurring.defaults());
    }

    public record Anomaly(
            Double amountStdDevThreshold,
            Integer minTransactionsForStats,
            Double duplicateMerchantSimilarity,
            Integer duplicateWindowHours,
            Integer frequencyThreshold24h,
            Integer frequencyThreshold7d
    ) {
        public Anomaly {
            if (amountStdDevThreshold == null) amountStdDevThreshold = 2.5d;
            if (minTransactionsForStats == null) minTransactionsForStats = 5;
            if (duplicateMerchantSimilarity == null) duplicateMerchantSimilarity = 0.8d;
            if (duplicateWindowHours == null) duplicateWindowHours = 48;
            if (frequencyThreshold24h == null) frequencyThreshold24h = 3;
            if (frequencyThreshold7d == null) frequencyThreshold7d = 5;
            if (amountStdDevThreshold <= 0) {
                throw new IllegalArgumentException("amountStdDevThreshold must be positive");
            }
            if (minTransactionsForStats < 2) {
                throw new IllegalArgumentException("minTransactionsForStats must be at least 2");
            }
            if (duplicateMerchantSimilarity < 0 || duplicateMerchantSimilarity > 1) {
                throw new IllegalArgumentException("duplicateMerchantSimilarity must be between 0 and 1");
            }
            if (duplicateWindowHours <= 0) {
                throw new IllegalArgumentException("duplicateWindowHours must be positive");
            }
            if (frequencyThreshold24h <= 1 || frequencyThreshold7d <= 1) {
                throw new IllegalArgumentException("frequency thresholds must be greater than 1");
            }
        }

        public static Anomaly defaults() {
            return new Anomaly(null, null, null, null, null, null);
        }
    }

    public record Recurring(
            Integer minOccurrences,
            Integer minOccurrencesYearly,
            Double amountVariance,
            Integer intervalToleranceDays,
            Integer inactiveAfterMissed,
            Double confidenceThreshold,
            Boolean excludeVariableAmounts
    ) {
        public Recurring {
            if (minOccurrences == null) minOccurrences = 2;
            if (minOccurrencesYearly == null) minOccurrencesYearly = 1;
            if (amountVariance == null) amountVariance = 0.10d;
            if (intervalToleranceDays == null) intervalToleranceDays = 7;
            if (inactiveAfterMissed == null) inactiveAfterMissed = 2;
            if (confidenceThreshold == null) confidenceThreshold = 0.7d;
            if (excludeVariableAmounts == null) excludeVariableAmounts = Boolean.TRUE;
            if (minOccurrences < 1 || minOccurrencesYearly < 1) {
                throw new IllegalArgumentException("minimum occurrences must be at least 1");
            }
            if (amountVariance <= 0) {
                throw new IllegalArgumentException("amountVariance must be positive");
            }
            if (intervalToleranceDays < 0) {
                throw new IllegalArgumentException("intervalToleranceDays must not be negative");
            }
            if (inactiveAfterMissed < 0) {
                throw new IllegalArgumentException("inactiveAfterMissed must not be negative");
            }
            if (confidenceThreshold < 0 || confidenceThreshold > 1) {
                throw new IllegalArgumentException("confidenceThreshold must be between 0 and 1");
            }
        }

        public static Recurring defaults() {
            return new Recurring(null, null, null, null, null, null, null);
        }
    }
}
