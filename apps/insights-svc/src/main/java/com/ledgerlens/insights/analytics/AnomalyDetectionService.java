package com.ledgerlens.insights.analytics;

import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.matching.MerchantNameNormalizer;
import com.ledgerlens.insights.matching.StringSimilarity;
import com.ledgerlens.insights.model.AnomalyFinding;
import com.ledgerlens.insights.model.CategoryStats;
import com.ledgerlens.insights.model.FrequencyPeriod;
import com.ledgerlens.insights.model.Transaction;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags unusual amounts, likely duplicate charges and bursts of charges to one merchant.
 * Each check is independent and skips records missing the fields it needs. Duplicate and
 * frequency checks scan the whole list for every transaction, so a run is quadratic in the
 * number of expenses.
 */
@Component
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private static final BigDecimal AMOUNT_TOLERANCE = new BigDecimal("0.01");
    private static final double VARIANCE_EPSILON = 1e-9;

    private final CategoryStatisticsCalculator categoryStatisticsCalculator;
    private final MerchantNameNormalizer merchantNameNormalizer;
    private final StringSimilarity stringSimilarity;

    public AnomalyDetectionService(
            CategoryStatisticsCalculator categoryStatisticsCalculator,
            MerchantNameNormalizer merchantNameNormalizer,
            StringSimilarity stringSimilarity
    ) {
        this.categoryStatisticsCalculator = categoryStatisticsCalculator;
        this.merchantNameNormalizer = merchantNameNormalizer;
        this.stringSimilarity = stringSimilarity;
    }

    /**
     * Returns annotated copies of {@code transactions} in the same order. Transactions without
     * findings come back with their anomaly annotation cleared; the dismissed flag is kept as is.
     */
    public List<Transaction> detectAnomalies(List<Transaction> transactions, InsightsProperties.Anomaly config) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        Map<String, CategoryStats> categoryStats = categoryStatisticsCalculator.calculate(transactions, config);
        Map<Transaction, String> frequencyKeys = frequencyKeys(transactions);

        List<Transaction> annotated = new ArrayList<>(transactions.size());
        int flagged = 0;
        for (Transaction tx : transactions) {
            if (tx == null) {
                continue;
            }
            List<AnomalyFinding> findings = new ArrayList<>(3);
            detectAmountAnomaly(tx, categoryStats, config).ifPresent(findings::add);
            detectDuplicate(tx, transactions, config).ifPresent(findings::add);
            detectFrequencyAnomaly(tx, transactions, frequencyKeys, config).ifPresent(findings::add);
            if (!findings.isEmpty()) {
                flagged++;
            }
            annotated.add(tx.withAnomalies(findings));
        }
        log.debug("Anomaly detection: {} of {} transactions flagged across {} categories with stats",
                flagged, annotated.size(), categoryStats.size());
        return annotated;
    }

    /**
     * Z-score of the absolute amount against the rest of its category. The transaction under test
     * is taken out of the category baseline so that a single large outlier cannot mask itself.
     * When the rest of the category has no spread (a fixed-price merchant), the full category
     * stats are used instead.
     */
    public Optional<AnomalyFinding> detectAmountAnomaly(
            Transaction tx,
            Map<String, CategoryStats> categoryStats,
            InsightsProperties.Anomaly config
    ) {
        if (!tx.isExpense() || tx.amount() == null) {
            return Optional.empty();
        }
        CategoryStats stats = categoryStats.get(tx.categoryOrDefault());
        if (stats == null || stats.stdDev() == 0d) {
            return Optional.empty();
        }
        double amount = tx.amount().abs().doubleValue();
        CategoryStats baseline = baselineExcluding(stats, amount).orElse(stats);
        double zScore = (amount - baseline.mean()) / baseline.stdDev();
        if (zScore > config.amountStdDevThreshold()) {
            return Optional.of(AnomalyFinding.highAmount(zScore));
        }
        if (zScore < -config.amountStdDevThreshold()) {
            return Optional.of(AnomalyFinding.lowAmount(zScore));
        }
        return Optional.empty();
    }

    /**
     * Another expense of the same amount (within a cent), close in time and with a similar
     * description. The first such candidate in input order is reported.
     */
    public Optional<AnomalyFinding> detectDuplicate(
            Transaction tx,
            List<Transaction> allTransactions,
            InsightsProperties.Anomaly config
    ) {
        if (!tx.isExpense() || tx.amount() == null || tx.occurredAt() == null) {
            return Optional.empty();
        }
        Duration window = Duration.ofHours(config.duplicateWindowHours());
        String description = merchantNameNormalizer.withoutReferenceNumbers(tx.description());
        for (Transaction other : allTransactions) {
            if (other == null || isSameTransaction(tx, other) || !other.isExpense()) {
                continue;
            }
            if (other.amount() == null || other.occurredAt() == null) {
                continue;
            }
            BigDecimal difference = tx.amount().abs().subtract(other.amount().abs()).abs();
            if (difference.compareTo(AMOUNT_TOLERANCE) > 0) {
                continue;
            }
            if (Duration.between(other.occurredAt(), tx.occurredAt()).abs().compareTo(window) > 0) {
                continue;
            }
            String otherDescription = merchantNameNormalizer.withoutReferenceNumbers(other.description());
            if (stringSimilarity.similarity(description, otherDescription) >= config.duplicateMerchantSimilarity()) {
                return Optional.of(AnomalyFinding.duplicateOf(other.id()));
            }
        }
        return Optional.empty();
    }

    public Optional<AnomalyFinding> detectFrequencyAnomaly(
            Transaction tx,
            List<Transaction> allTransactions,
            InsightsProperties.Anomaly config
    ) {
        return detectFrequencyAnomaly(tx, allTransactions, frequencyKeys(allTransactions), config);
    }

    private Optional<AnomalyFinding> detectFrequencyAnomaly(
            Transaction tx,
            List<Transaction> allTransactions,
            Map<Transaction, String> frequencyKeys,
            InsightsProperties.Anomaly config
    ) {
        if (!tx.isExpense() || tx.occurredAt() == null) {
            return Optional.empty();
        }
        String key = frequencyKeys.get(tx);
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        int count24h = countSameMerchantWithin(tx, key, allTransactions, frequencyKeys, FrequencyPeriod.TWENTY_FOUR_HOURS);
        if (count24h >= config.frequencyThreshold24h()) {
            return Optional.of(AnomalyFinding.unusualFrequency(count24h, FrequencyPeriod.TWENTY_FOUR_HOURS));
        }
        int count7d = countSameMerchantWithin(tx, key, allTransactions, frequencyKeys, FrequencyPeriod.SEVEN_DAYS);
        if (count7d >= config.frequencyThreshold7d()) {
            return Optional.of(AnomalyFinding.unusualFrequency(count7d, FrequencyPeriod.SEVEN_DAYS));
        }
        return Optional.empty();
    }

    // counts the transaction itself
    private int countSameMerchantWithin(
            Transaction tx,
            String key,
            List<Transaction> allTransactions,
            Map<Transaction, String> frequencyKeys,
            FrequencyPeriod period
    ) {
        int count = 1;
        for (Transaction other : allTransactions) {
            if (other == null || isSameTransaction(tx, other) || !other.isExpense() || other.occurredAt() == null) {
                continue;
            }
            if (Duration.between(other.occurredAt(), tx.occurredAt()).abs().compareTo(period.window()) > 0) {
                continue;
            }
            if (key.equals(frequencyKeys.get(other))) {
                count++;
            }
        }
        return count;
    }

    private Map<Transaction, String> frequencyKeys(List<Transaction> transactions) {
        Map<Transaction, String> keys = new IdentityHashMap<>();
        for (Transaction tx : transactions) {
            if (tx != null && tx.isExpense()) {
                keys.put(tx, merchantNameNormalizer.frequencyKey(tx.description()));
            }
        }
        return keys;
    }

    static Optional<CategoryStats> baselineExcluding(CategoryStats stats, double amount) {
        int remaining = stats.count() - 1;
        if (remaining < 2) {
            return Optional.empty();
        }
        double sum = stats.mean() * stats.count();
        double sumOfSquares = stats.count() * (stats.stdDev() * stats.stdDev() + stats.mean() * stats.mean());
        double mean = (sum - amount) / remaining;
        double variance = (sumOfSquares - amount * amount) / remaining - mean * mean;
        if (variance <= VARIANCE_EPSILON * Math.max(1d, mean * mean)) {
            return Optional.empty();
        }
        return Optional.of(new CategoryStats(remaining, mean, Math.sqrt(variance)));
    }

    private static boolean isSameTransaction(Transaction tx, Transaction other) {
        return tx == other || (tx.id() != null && tx.id().equals(other.id()));
    }
}
