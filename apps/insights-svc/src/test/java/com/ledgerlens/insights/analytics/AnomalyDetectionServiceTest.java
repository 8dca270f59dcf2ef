package com.ledgerlens.insights.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.matching.MerchantNameNormalizer;
import com.ledgerlens.insights.matching.StringSimilarity;
import com.ledgerlens.insights.model.AnomalyDetails;
import com.ledgerlens.insights.model.AnomalyType;
import com.ledgerlens.insights.model.CategoryStats;
import com.ledgerlens.insights.model.CategoryType;
import com.ledgerlens.insights.model.FrequencyPeriod;
import com.ledgerlens.insights.model.Transaction;
import com.ledgerlens.insights.model.TransactionDirection;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AnomalyDetectionServiceTest {

    private final MerchantNameNormalizer normalizer = new MerchantNameNormalizer();
    private final AnomalyDetectionService service = new AnomalyDetectionService(
            new CategoryStatisticsCalculator(),
            normalizer,
            new StringSimilarity()
    );
    private final InsightsProperties.Anomaly config = InsightsProperties.Anomaly.defaults();

    @Test
    void flagsDiningOutlierAgainstTheRestOfItsCategory() {
        List<Transaction> transactions = List.of(
                expense("d1", "Bistro Uno", "20.00", "2024-03-01T12:00:00Z", "dining"),
                expense("d2", "Taco Stand", "22.00", "2024-03-02T12:00:00Z", "dining"),
                expense("d3", "Noodle Bar", "21.00", "2024-03-03T12:00:00Z", "dining"),
                expense("d4", "Pizza Place", "23.00", "2024-03-04T12:00:00Z", "dining"),
                expense("d5", "Sushi Corner", "19.00", "2024-03-05T12:00:00Z", "dining"),
                expense("d6", "Burger Joint", "20.00", "2024-03-06T12:00:00Z", "dining"),
                expense("d7", "Steak House", "100.00", "2024-03-07T12:00:00Z", "dining")
        );

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result).extracting(Transaction::id)
                .containsExactly("d1", "d2", "d3", "d4", "d5", "d6", "d7");
        Transaction outlier = result.get(6);
        assertThat(outlier.anomaly()).isTrue();
        assertThat(outlier.anomalyTypes()).containsExactly(AnomalyType.HIGH_AMOUNT);
        assertThat(outlier.anomalyDetails().orElseThrow().amountDeviation()).isCloseTo(58.9, within(0.5));
        assertThat(result.subList(0, 6)).noneMatch(Transaction::anomaly);
    }

    @Test
    void flagsOutlierAmongFixedPriceCharges() {
        List<String> studios = List.of("Yoga Loft", "Climb Hall", "Spin Studio", "Pool Entry",
                "Boxing Club", "Pilates Barn", "Rowing Shed");
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < studios.size(); i++) {
            transactions.add(expense("f" + i, studios.get(i), "20.00",
                    "2024-03-" + String.format("%02d", 3 * (i + 1)) + "T07:00:00Z", "fitness"));
        }
        transactions.add(expense("f8", "Personal Trainer", "100.00", "2024-03-25T07:00:00Z", "fitness"));

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result).filteredOn(Transaction::anomaly)
                .singleElement()
                .satisfies(tx -> {
                    assertThat(tx.id()).isEqualTo("f8");
                    assertThat(tx.anomalyTypes()).containsExactly(AnomalyType.HIGH_AMOUNT);
                    assertThat(tx.anomalyDetails().orElseThrow().amountDeviation())
                            .isCloseTo(70d / Math.sqrt(700d), within(1e-6));
                });
    }

    @Test
    void flagsUnusuallyLowAmount() {
        List<Transaction> transactions = List.of(
                expense("g1", "Fresh Market", "50.00", "2024-03-01T09:00:00Z", "groceries"),
                expense("g2", "Green Grocer", "52.00", "2024-03-03T09:00:00Z", "groceries"),
                expense("g3", "Corner Deli", "51.00", "2024-03-05T09:00:00Z", "groceries"),
                expense("g4", "Farm Stand", "49.00", "2024-03-07T09:00:00Z", "groceries"),
                expense("g5", "Fresh Market", "50.00", "2024-03-09T09:00:00Z", "groceries"),
                expense("g6", "Bulk Barn", "48.00", "2024-03-11T09:00:00Z", "groceries"),
                expense("g7", "Kiosk", "2.00", "2024-03-13T09:00:00Z", "groceries")
        );

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result).filteredOn(Transaction::anomaly)
                .singleElement()
                .satisfies(tx -> {
                    assertThat(tx.id()).isEqualTo("g7");
                    assertThat(tx.anomalyTypes()).containsExactly(AnomalyType.LOW_AMOUNT);
                    assertThat(tx.anomalyDetails().orElseThrow().amountDeviation()).isLessThan(-2.5);
                });
    }

    @Test
    void flagsBothSidesOfADuplicateChargeDespiteDifferentStoreNumbers() {
        List<Transaction> transactions = List.of(
                expense("s1", "STARBUCKS #123", "4.50", "2024-03-01T10:00:00Z", "coffee"),
                expense("s2", "STARBUCKS #456", "4.50", "2024-03-02T09:00:00Z", "coffee")
        );

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result.get(1).anomalyTypes()).containsExactly(AnomalyType.DUPLICATE);
        assertThat(result.get(1).anomalyDetails().orElseThrow().duplicateOf()).isEqualTo("s1");
        assertThat(result.get(0).anomalyTypes()).containsExactly(AnomalyType.DUPLICATE);
        assertThat(result.get(0).anomalyDetails().orElseThrow().duplicateOf()).isEqualTo("s2");
    }

    @Test
    void duplicateOfPointsAtFirstMatchingCandidateInInputOrder() {
        List<Transaction> transactions = List.of(
                expense("a", "Uber Eats", "23.40", "2024-03-01T10:00:00Z", "delivery"),
                expense("b", "Uber Eats", "23.40", "2024-03-01T12:00:00Z", "delivery"),
                expense("c", "Uber Eats", "23.40", "2024-03-01T14:00:00Z", "delivery")
        );

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result.get(0).anomalyDetails().orElseThrow().duplicateOf()).isEqualTo("b");
        assertThat(result.get(2).anomalyDetails().orElseThrow().duplicateOf()).isEqualTo("a");
        for (Transaction tx : result) {
            String target = tx.anomalyDetails().orElseThrow().duplicateOf();
            Transaction other = transactions.stream().filter(candidate -> candidate.id().equals(target)).findFirst().orElseThrow();
            assertThat(other.id()).isNotEqualTo(tx.id());
            assertThat(other.amount().subtract(tx.amount()).abs()).isLessThanOrEqualTo(new BigDecimal("0.01"));
            assertThat(Duration.between(other.occurredAt(), tx.occurredAt()).abs()).isLessThanOrEqualTo(Duration.ofHours(48));
        }
    }

    @Test
    void doesNotFlagDuplicatesOutsideWindowOrWithDifferentAmounts() {
        List<Transaction> transactions = List.of(
                expense("p1", "Parking Garage", "8.00", "2024-03-01T10:00:00Z", "parking"),
                expense("p2", "Parking Garage", "8.00", "2024-03-04T10:00:00Z", "parking"),
                expense("p3", "Parking Garage", "8.02", "2024-03-04T11:00:00Z", "parking")
        );

        assertThat(service.detectAnomalies(transactions, config)).noneMatch(Transaction::anomaly);
    }

    @Test
    void flagsThreeChargesToTheSameMerchantWithinADay() {
        List<Transaction> transactions = List.of(
                expense("u1", "UBER *TRIP", "12.30", "2024-03-01T10:00:00Z", "transport"),
                expense("u2", "UBER *TRIP", "8.75", "2024-03-01T12:00:00Z", "transport"),
                expense("u3", "UBER *TRIP", "15.10", "2024-03-01T14:00:00Z", "transport")
        );

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result).allSatisfy(tx -> {
            assertThat(tx.anomalyTypes()).containsExactly(AnomalyType.UNUSUAL_FREQUENCY);
            AnomalyDetails details = tx.anomalyDetails().orElseThrow();
            assertThat(details.frequencyCount()).isEqualTo(3);
            assertThat(details.frequencyPeriod()).isEqualTo(FrequencyPeriod.TWENTY_FOUR_HOURS);
        });
    }

    @Test
    void flagsFiveChargesWithinAWeek() {
        Instant start = Instant.parse("2024-03-01T08:00:00Z");
        List<String> amounts = List.of("4.10", "5.20", "3.80", "6.40", "4.90");
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < amounts.size(); i++) {
            transactions.add(expense("c" + i, "Corner Cafe", amounts.get(i),
                    start.plus(Duration.ofHours(30L * i)).toString(), "coffee-" + i));
        }

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result).allSatisfy(tx -> {
            assertThat(tx.anomalyTypes()).containsExactly(AnomalyType.UNUSUAL_FREQUENCY);
            assertThat(tx.anomalyDetails().orElseThrow().frequencyCount()).isEqualTo(5);
            assertThat(tx.anomalyDetails().orElseThrow().frequencyPeriod()).isEqualTo(FrequencyPeriod.SEVEN_DAYS);
        });
    }

    @Test
    void twoChargesInADayAreNotUnusual() {
        List<Transaction> transactions = List.of(
                expense("t1", "Metro Ticket", "2.90", "2024-03-01T08:00:00Z", "transport"),
                expense("t2", "Metro Ticket", "3.10", "2024-03-01T18:00:00Z", "transport")
        );

        assertThat(service.detectFrequencyAnomaly(transactions.get(0), transactions, config)).isEmpty();
    }

    @Test
    void skipsRecordsWithMissingFieldsAndNullEntries() {
        Transaction undated = expense("x1", "Mystery", "10.00", "2024-03-01T10:00:00Z", "misc").toBuilder()
                .occurredAt(null)
                .amount(null)
                .build();
        List<Transaction> transactions = Arrays.asList(
                undated,
                null,
                expense("x2", "Mystery", "10.00", "2024-03-01T11:00:00Z", "misc")
        );

        List<Transaction> result = service.detectAnomalies(transactions, config);

        assertThat(result).extracting(Transaction::id).containsExactly("x1", "x2");
        assertThat(result).noneMatch(Transaction::anomaly);
    }

    @Test
    void neverFlagsIncome() {
        List<Transaction> transactions = List.of(
                expense("i1", "Payroll", "2500.00", "2024-03-01T10:00:00Z", "salary").toBuilder()
                        .categoryType(CategoryType.INCOME).direction(TransactionDirection.CREDIT).build(),
                expense("i2", "Payroll", "2500.00", "2024-03-01T11:00:00Z", "salary").toBuilder()
                        .categoryType(CategoryType.INCOME).direction(TransactionDirection.CREDIT).build()
        );

        assertThat(service.detectAnomalies(transactions, config)).noneMatch(Transaction::anomaly);
    }

    @Test
    void keepsDismissedFlagAndClearsStaleAnnotations() {
        Transaction dismissed = expense("k1", "Gas Station", "40.00", "2024-03-01T10:00:00Z", "fuel")
                .withAnomalyDismissed(true);
        Transaction duplicate = expense("k2", "Gas Station", "40.00", "2024-03-01T11:00:00Z", "fuel");
        Transaction stale = expense("k3", "Hardware Store", "15.00", "2024-03-05T10:00:00Z", "home").toBuilder()
                .anomaly(true)
                .anomalyTypes(List.of(AnomalyType.HIGH_AMOUNT))
                .build();

        List<Transaction> result = service.detectAnomalies(List.of(dismissed, duplicate, stale), config);

        assertThat(result.get(0).anomaly()).isTrue();
        assertThat(result.get(0).anomalyDismissed()).isTrue();
        assertThat(result.get(0).isOpenAnomaly()).isFalse();
        assertThat(result.get(1).isOpenAnomaly()).isTrue();
        assertThat(result.get(2).anomaly()).isFalse();
        assertThat(result.get(2).anomalyTypes()).isEmpty();
        assertThat(result.get(2).anomalyDetails()).isEmpty();
    }

    @Test
    void baselineNeedsAtLeastTwoOtherSamplesWithSpread() {
        assertThat(AnomalyDetectionService.baselineExcluding(new CategoryStats(2, 15d, 5d), 20d)).isEmpty();
        assertThat(AnomalyDetectionService.baselineExcluding(new CategoryStats(3, 40d, Math.sqrt(800d)), 80d)).isEmpty();
        assertThat(AnomalyDetectionService.baselineExcluding(new CategoryStats(3, 20d, Math.sqrt(200d / 3)), 10d))
                .get()
                .satisfies(baseline -> {
                    assertThat(baseline.count()).isEqualTo(2);
                    assertThat(baseline.mean()).isCloseTo(25d, within(1e-9));
                    assertThat(baseline.stdDev()).isCloseTo(5d, within(1e-9));
                });
    }

    @Test
    void amountCheckNeedsCategoryStats() {
        Transaction tx = expense("z1", "Anything", "999.00", "2024-03-01T10:00:00Z", "rare");

        Optional<?> finding = service.detectAmountAnomaly(tx, Map.of(), config);

        assertThat(finding).isEmpty();
    }

    private static Transaction expense(String id, String description, String amount, String occurredAt, String category) {
        return Transaction.builder()
                .id(id)
                .occurredAt(Instant.parse(occurredAt))
                .description(description)
                .amount(new BigDecimal(amount))
                .direction(TransactionDirection.DEBIT)
                .categoryType(CategoryType.EXPENSE)
                .category(category)
                .build();
    }
}
