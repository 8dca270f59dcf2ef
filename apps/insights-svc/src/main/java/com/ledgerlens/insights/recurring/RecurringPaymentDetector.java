package com.ledgerlens.insights.recurring;

import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.model.ExcludedMerchant;
import com.ledgerlens.insights.model.Frequency;
import com.ledgerlens.insights.model.MerchantGroup;
import com.ledgerlens.insights.model.RecurringPayment;
import com.ledgerlens.insights.model.RecurringStatus;
import com.ledgerlens.insights.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives recurring payments from a full transaction snapshot. Every call recomputes from
 * scratch; payment ids are fresh on each run, so callers should reconcile by merchant name.
 */
@Component
public class RecurringPaymentDetector {

    private static final Logger log = LoggerFactory.getLogger(RecurringPaymentDetector.class);

    private static final double DAY_MILLIS = Duration.ofDays(1).toMillis();
    private static final int MEANINGFUL_NAME_LENGTH = 3;
    private static final String UNKNOWN_MERCHANT = "Unknown Merchant";

    private final MerchantGrouper merchantGrouper;
    private final IntervalAnalyzer intervalAnalyzer;
    private final ConfidenceScorer confidenceScorer;

    public RecurringPaymentDetector(
            MerchantGrouper merchantGrouper,
            IntervalAnalyzer intervalAnalyzer,
            ConfidenceScorer confidenceScorer
    ) {
        this.merchantGrouper = merchantGrouper;
        this.intervalAnalyzer = intervalAnalyzer;
        this.confidenceScorer = confidenceScorer;
    }

    public List<RecurringPayment> detect(List<Transaction> transactions, InsightsProperties.Recurring config, Instant now) {
        return detect(transactions, config, now, List.of());
    }

    /**
     * Runs detection and drops payments whose normalised merchant name contains, or is contained
     * in, an excluded name. Active payments come first, then higher latest amounts.
     */
    public List<RecurringPayment> detect(
            List<Transaction> transactions,
            InsightsProperties.Recurring config,
            Instant now,
            Collection<ExcludedMerchant> exclusions
    ) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        List<String> excludedNames = exclusions.stream()
                .map(ExcludedMerchant::normalizedName)
                .filter(Objects::nonNull)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .filter(name -> !name.isEmpty())
                .toList();

        List<MerchantGroup> groups = merchantGrouper.group(transactions);
        List<RecurringPayment> payments = groups.stream()
                .map(group -> evaluate(group, config, now))
                .flatMap(Optional::stream)
                .filter(payment -> !isExcluded(payment, excludedNames))
                .sorted(Comparator.comparing(RecurringPayment::active).reversed()
                        .thenComparing(RecurringPayment::latestAmount, Comparator.reverseOrder()))
                .toList();
        log.debug("Recurring detection: {} merchant groups, {} recurring payments, {} exclusions",
                groups.size(), payments.size(), excludedNames.size());
        return payments;
    }

    Optional<RecurringPayment> evaluate(MerchantGroup group, InsightsProperties.Recurring config, Instant now) {
        List<Transaction> groupTransactions = group.transactions();
        int occurrences = groupTransactions.size();
        if (occurrences < config.minOccurrencesYearly()) {
            return Optional.empty();
        }
        boolean yearlyOnly = occurrences < config.minOccurrences();

        List<Transaction> dated = groupTransactions.stream()
                .filter(tx -> tx.occurredAt() != null)
                .sorted(Comparator.comparing(Transaction::occurredAt))
                .toList();
        List<Integer> intervals = intervalAnalyzer.intervals(dated.stream().map(Transaction::occurredAt).toList());
        IntervalAnalyzer.FrequencyAnalysis analysis = intervalAnalyzer.analyze(intervals, config);
        ConfidenceScorer.ConfidenceResult confidence = confidenceScorer.score(groupTransactions, analysis, config);

        if (confidence.score() < config.confidenceThreshold() || analysis.frequency().isEmpty()) {
            return Optional.empty();
        }
        Frequency frequency = analysis.frequency().get();
        if (yearlyOnly && frequency != Frequency.YEARLY) {
            return Optional.empty();
        }

        Optional<BigDecimal> latestAmount = latestAmount(dated);
        if (latestAmount.isEmpty()) {
            return Optional.empty();
        }
        Instant firstSeen = dated.get(0).occurredAt();
        Instant lastSeen = dated.get(dated.size() - 1).occurredAt();
        boolean active = isActive(lastSeen, frequency, config, now);
        Optional<LocalDate> nextExpectedDate = active
                ? Optional.of(frequency.next(lastSeen.atZone(ZoneOffset.UTC).toLocalDate()))
                : Optional.empty();

        return Optional.of(new RecurringPayment(
                UUID.randomUUID(),
                chooseDisplayName(group.originalNames()),
                group.normalizedName(),
                group.originalNames(),
                groupTransactions.get(0).categoryOrDefault(),
                latestAmount.get(),
                averageAmount(groupTransactions),
                frequency,
                confidence.score(),
                firstSeen,
                lastSeen,
                occurrences,
                groupTransactions.stream().map(Transaction::id).filter(Objects::nonNull).toList(),
                active,
                nextExpectedDate,
                active ? RecurringStatus.ACTIVE : RecurringStatus.INACTIVE
        ));
    }

    /**
     * Active while the time since the last charge is within one expected interval plus the
     * allowance for missed payments.
     */
    static boolean isActive(Instant lastSeen, Frequency frequency, InsightsProperties.Recurring config, Instant now) {
        long daysSinceLastSeen = Math.round(Duration.between(lastSeen, now).toMillis() / DAY_MILLIS);
        long gracePeriod = (long) frequency.expectedDays() * config.inactiveAfterMissed();
        return daysSinceLastSeen <= frequency.expectedDays() + gracePeriod;
    }

    static String chooseDisplayName(List<String> originalNames) {
        if (originalNames.isEmpty()) {
            return UNKNOWN_MERCHANT;
        }
        List<String> byLength = originalNames.stream()
                .sorted(Comparator.comparingInt(String::length))
                .toList();
        return byLength.stream()
                .filter(name -> name.length() > MEANINGFUL_NAME_LENGTH)
                .findFirst()
                .orElse(byLength.get(0));
    }

    private static Optional<BigDecimal> latestAmount(List<Transaction> datedAscending) {
        for (int i = datedAscending.size() - 1; i >= 0; i--) {
            BigDecimal amount = datedAscending.get(i).amount();
            if (amount != null) {
                return Optional.of(amount.abs().setScale(2, RoundingMode.HALF_UP));
            }
        }
        return Optional.empty();
    }

    private static BigDecimal averageAmount(List<Transaction> transactions) {
        List<BigDecimal> amounts = transactions.stream()
                .map(Transaction::amount)
                .filter(Objects::nonNull)
                .map(BigDecimal::abs)
                .toList();
        if (amounts.isEmpty()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return amounts.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(amounts.size()), 2, RoundingMode.HALF_UP);
    }

    private static boolean isExcluded(RecurringPayment payment, List<String> excludedNames) {
        String name = payment.normalizedName().toLowerCase(Locale.ROOT);
        return excludedNames.stream().anyMatch(excluded -> name.contains(excluded) || excluded.contains(name));
    }
}
