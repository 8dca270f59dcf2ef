package com.ledgerlens.insights.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransactionTest {

    @Test
    void signedAmountFollowsDirection() {
        assertThat(base().signedAmount()).isEqualByComparingTo("-12.50");
        assertThat(base().toBuilder().direction(TransactionDirection.CREDIT).build().signedAmount())
                .isEqualByComparingTo("12.50");
    }

    @Test
    void onlyExpenseCategoryTypeCountsAsExpense() {
        assertThat(base().isExpense()).isTrue();
        assertThat(base().toBuilder().categoryType(CategoryType.INCOME).build().isExpense()).isFalse();
        assertThat(base().toBuilder().categoryType(CategoryType.EXCLUDED).build().isExpense()).isFalse();
        assertThat(base().toBuilder().categoryType(null).build().isExpense()).isFalse();
    }

    @Test
    void mergesFindingsIntoDetails() {
        Transaction flagged = base().withAnomalies(List.of(
                AnomalyFinding.highAmount(3.2),
                AnomalyFinding.duplicateOf("t-0"),
                AnomalyFinding.unusualFrequency(4, FrequencyPeriod.TWENTY_FOUR_HOURS)
        ));

        assertThat(flagged.anomaly()).isTrue();
        assertThat(flagged.anomalyTypes())
                .containsExactly(AnomalyType.HIGH_AMOUNT, AnomalyType.DUPLICATE, AnomalyType.UNUSUAL_FREQUENCY);
        assertThat(flagged.anomalyDetails()).contains(
                new AnomalyDetails(3.2, "t-0", 4, FrequencyPeriod.TWENTY_FOUR_HOURS));
    }

    @Test
    void dismissalSurvivesReannotation() {
        Transaction dismissed = base().withAnomalies(List.of(AnomalyFinding.duplicateOf("t-0")))
                .withAnomalyDismissed(true);

        assertThat(dismissed.isOpenAnomaly()).isFalse();
        assertThat(dismissed.withoutAnomalies().anomalyDismissed()).isTrue();
        assertThat(dismissed.withAnomalies(List.of(AnomalyFinding.lowAmount(-3))).anomalyDismissed()).isTrue();
    }

    @Test
    void fallsBackToDescriptionAndDefaultCategory() {
        Transaction tx = base().toBuilder().merchantName(" ").category(null).build();

        assertThat(tx.merchantName()).isEmpty();
        assertThat(tx.merchantOrDescription()).isEqualTo("Corner Shop 0042");
        assertThat(tx.categoryOrDefault()).isEqualTo(Transaction.UNCATEGORIZED);
        assertThat(tx.toBuilder().build()).isEqualTo(tx);
    }

    @Test
    void parsesWireValues() {
        assertThat(TransactionDirection.fromValue("debit")).isEqualTo(TransactionDirection.DEBIT);
        assertThat(CategoryType.fromValue("INCOME")).isEqualTo(CategoryType.INCOME);
        assertThatThrownBy(() -> TransactionDirection.fromValue("sideways"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nextBillingDateUsesCalendarArithmetic() {
        assertThat(Frequency.WEEKLY.next(LocalDate.of(2024, 12, 28))).isEqualTo(LocalDate.of(2025, 1, 4));
        assertThat(Frequency.MONTHLY.next(LocalDate.of(2024, 1, 31))).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(Frequency.QUARTERLY.next(LocalDate.of(2023, 11, 30))).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(Frequency.YEARLY.next(LocalDate.of(2024, 2, 29))).isEqualTo(LocalDate.of(2025, 2, 28));
    }

    private static Transaction base() {
        return Transaction.builder()
                .id("t-1")
                .occurredAt(Instant.parse("2024-03-01T12:00:00Z"))
                .description("Corner Shop 0042")
                .amount(new BigDecimal("12.50"))
                .direction(TransactionDirection.DEBIT)
                .categoryType(CategoryType.EXPENSE)
                .category("groceries")
                .merchantName("Corner Shop")
                .build();
    }
}
