package com.ledgerlens.insights.recurring;

import com.ledgerlens.insights.analytics.Statistics;
import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.model.Transaction;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class ConfidenceScorer {

    private static final double BASE_SCORE = 0.5d;
    private static final double KEYWORD_BONUS = 0.1d;
    private static final double INCONSISTENCY_PENALTY = 0.1d;
    private static final List<String> SUBSCRIPTION_KEYWORDS = List.of(
            "netflix", "spotify", "amazon prime", "youtube", "google", "apple",
            "microsoft", "adobe", "dropbox", "zoom", "slack", "notion", "canva",
            "gym", "fitness", "club", "membership", "subscription", "monthly",
            "annual", "yearly", "weekly", "insurance", "utility", "electric",
            "water", "gas", "internet", "phone", "mobile", "broadband", "dth",
            "hosting", "domain", "cloud", "saas", "patreon", "github", "gitlab"
    );

    public record ConfidenceResult(double score, double amountVariance, double intervalVariance, double occurrenceBonus) {
    }

    public ConfidenceResult score(
            List<Transaction> transactions,
            IntervalAnalyzer.FrequencyAnalysis analysis,
            InsightsProperties.Recurring config
    ) {
        double occurrenceBonus = occurrenceBonus(transactions.size());

        List<Double> amounts = transactions.stream()
                .map(Transaction::amount)
                .filter(Objects::nonNull)
                .map(amount -> amount.abs().doubleValue())
                .toList();
        double averageAmount = Statistics.mean(amounts);
        double amountVariance = averageAmount > 0 ? Statistics.populationStdDev(amounts) / averageAmount : 1d;

        if (config.excludeVariableAmounts() && amountVariance > config.amountVariance()) {
            return new ConfidenceResult(0d, amountVariance, 1d, occurrenceBonus);
        }
        double intervalVariance = analysis.intervalVariance();
        if (analysis.frequency().isEmpty()) {
            return new ConfidenceResult(0d, amountVariance, intervalVariance, occurrenceBonus);
        }

        double score = BASE_SCORE + occurrenceBonus;
        if (amountVariance < 0.05) {
            score += 0.2;
        } else if (amountVariance < 0.10) {
            score += 0.15;
        } else if (amountVariance < config.amountVariance()) {
            score += 0.1;
        } else {
            score -= INCONSISTENCY_PENALTY;
        }

        if (intervalVariance < 0.1) {
            score += 0.2;
        } else if (intervalVariance < 0.2) {
            score += 0.15;
        } else if (intervalVariance < 0.3) {
            score += 0.1;
        } else {
            score -= INCONSISTENCY_PENALTY;
        }

        if (!transactions.isEmpty() && hasSubscriptionKeyword(transactions.get(0))) {
            score += KEYWORD_BONUS;
        }
        score = Math.max(0d, Math.min(1d, score));
        return new ConfidenceResult(score, amountVariance, intervalVariance, occurrenceBonus);
    }

    static double occurrenceBonus(int count) {
        if (count >= 6) return 0.3;
        if (count >= 4) return 0.2;
        if (count >= 3) return 0.1;
        if (count >= 2) return 0.05;
        return 0d;
    }

    private static boolean hasSubscriptionKeyword(Transaction representative) {
        String name = representative.merchantOrDescription();
        if (name == null) {
            return false;
        }
        String lowered = name.toLowerCase(Locale.ROOT);
        return SUBSCRIPTION_KEYWORDS.stream().anyMatch(lowered::contains);
    }
}
