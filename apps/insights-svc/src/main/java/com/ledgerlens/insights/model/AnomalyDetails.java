package com.ledgerlens.insights.model;

import java.util.List;

/**
 * Merged view of all findings on a transaction.
 */
public record AnomalyDetails(
        Double amountDeviation,
        String duplicateOf,
        Integer frequencyCount,
        FrequencyPeriod frequencyPeriod
) {
    public static AnomalyDetails merge(List<AnomalyFinding> findings) {
        Double amountDeviation = null;
        String duplicateOf = null;
        Integer frequencyCount = null;
        FrequencyPeriod frequencyPeriod = null;
        for (AnomalyFinding finding : findings) {
            if (finding.amountDeviation() != null) {
                amountDeviation = finding.amountDeviation();
            }
            if (finding.duplicateOf() != null) {
                duplicateOf = finding.duplicateOf();
            }
            if (finding.frequencyCount() != null) {
                frequencyCount = finding.frequencyCount();
                frequencyPeriod = finding.frequencyPeriod();
            }
        }
        return new AnomalyDetails(amountDeviation, duplicateOf, frequencyCount, frequencyPeriod);
    }
}
