package com.ledgerlens.insights.analytics;

import java.util.Collection;

/**
 * Population mean and standard deviation helpers shared by the detectors.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(Collection<? extends Number> values) {
        return values.stream()
                .mapToDouble(Number::doubleValue)
                .average()
                .orElse(0d);
    }

    public static double populationStdDev(Collection<? extends Number> values) {
        if (values.isEmpty()) {
            return 0d;
        }
        double mean = mean(values);
        double variance = values.stream()
                .mapToDouble(value -> Math.pow(value.doubleValue() - mean, 2))
                .average()
                .orElse(0d);
        return Math.sqrt(variance);
    }
}
