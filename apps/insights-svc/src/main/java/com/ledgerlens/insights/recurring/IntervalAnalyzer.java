package com.ledgerlens.insights.recurring;

import com.ledgerlens.insights.analytics.Statistics;
import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.model.Frequency;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class IntervalAnalyzer {

    private static final double DAY_MILLIS = Duration.ofDays(1).toMillis();
    private static final double MAX_SPREAD_FACTOR = 1.5d;

    public record FrequencyAnalysis(Optional<Frequency> frequency, double intervalVariance, double avgInterval) {

        static FrequencyAnalysis unclassified(double avgInterval) {
            return new FrequencyAnalysis(Optional.empty(), 1d, avgInterval);
        }
    }

    /**
     * Whole-day gaps between consecutive dates, oldest first. Same-day repeats are dropped.
     */
    public List<Integer> intervals(List<Instant> dates) {
        List<Instant> sorted = dates.stream()
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        List<Integer> intervals = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            long millis = Duration.between(sorted.get(i - 1), sorted.get(i)).toMillis();
            int days = (int) Math.round(millis / DAY_MILLIS);
            if (days > 0) {
                intervals.add(days);
            }
        }
        return intervals;
    }

    /**
     * Picks the first frequency whose band contains the average interval and whose tolerance
     * covers the spread of the intervals. {@code intervalVariance} is the spread relative to the
     * expected interval, or 1 when nothing matched.
     */
    public FrequencyAnalysis analyze(List<Integer> intervals, InsightsProperties.Recurring config) {
        if (intervals.isEmpty()) {
            return FrequencyAnalysis.unclassified(0d);
        }
        double avgInterval = Statistics.mean(intervals);
        double spread = Statistics.populationStdDev(intervals);
        for (Frequency frequency : Frequency.values()) {
            int tolerance = toleranceFor(frequency, config);
            if (Math.abs(avgInterval - frequency.expectedDays()) <= tolerance
                    && spread <= tolerance * MAX_SPREAD_FACTOR) {
                return new FrequencyAnalysis(
                        Optional.of(frequency),
                        spread / frequency.expectedDays(),
                        avgInterval
                );
            }
        }
        return FrequencyAnalysis.unclassified(avgInterval);
    }

    static int toleranceFor(Frequency frequency, InsightsProperties.Recurring config) {
        return frequency == Frequency.MONTHLY ? config.intervalToleranceDays() : frequency.defaultToleranceDays();
    }
}
