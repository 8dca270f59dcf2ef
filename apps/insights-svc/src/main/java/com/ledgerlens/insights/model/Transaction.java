package com.ledgerlens.insights.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A normalised transaction as supplied by the caller. {@code amount} is the absolute value;
 * {@code direction} carries the sign. {@code occurredAt} or {@code amount} may be {@code null}
 * when the upstream value could not be resolved, in which case the affected checks skip the record.
 */
public record Transaction(
        String id,
        Instant occurredAt,
        String description,
        BigDecimal amount,
        TransactionDirection direction,
        CategoryType categoryType,
        String category,
        Optional<String> merchantName,
        boolean anomaly,
        List<AnomalyType> anomalyTypes,
        Optional<AnomalyDetails> anomalyDetails,
        boolean anomalyDismissed
) {
    public static final String UNCATEGORIZED = "uncategorized";

    public Transaction {
        merchantName = merchantName == null ? Optional.empty() : merchantName.filter(name -> !name.isBlank());
        anomalyTypes = anomalyTypes == null ? List.of() : List.copyOf(anomalyTypes);
        anomalyDetails = anomalyDetails == null ? Optional.empty() : anomalyDetails;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .occurredAt(occurredAt)
                .description(description)
                .amount(amount)
                .direction(direction)
                .categoryType(categoryType)
                .category(category)
                .merchantName(merchantName.orElse(null))
                .anomaly(anomaly)
                .anomalyTypes(anomalyTypes)
                .anomalyDetails(anomalyDetails.orElse(null))
                .anomalyDismissed(anomalyDismissed);
    }

    public boolean isExpense() {
        if (categoryType == null) {
            return false;
        }
        return switch (categoryType) {
            case EXPENSE -> true;
            case INCOME, EXCLUDED -> false;
        };
    }

    public boolean isIncome() {
        return categoryType == CategoryType.INCOME;
    }

    public boolean isDebit() {
        return direction == TransactionDirection.DEBIT;
    }

    /**
     * Negative for debits, positive for credits.
     */
    public BigDecimal signedAmount() {
        if (amount == null) {
            return null;
        }
        return isDebit() ? amount.abs().negate() : amount.abs();
    }

    public String categoryOrDefault() {
        return category == null || category.isBlank() ? UNCATEGORIZED : category;
    }

    /**
     * Merchant display name when known, otherwise the raw description.
     */
    public String merchantOrDescription() {
        return merchantName.orElse(description);
    }

    public Transaction withAnomalies(List<AnomalyFinding> findings) {
        if (findings == null || findings.isEmpty()) {
            return withoutAnomalies();
        }
        return toBuilder()
                .anomaly(true)
                .anomalyTypes(findings.stream().map(AnomalyFinding::type).toList())
                .anomalyDetails(AnomalyDetails.merge(findings))
                .build();
    }

    public Transaction withoutAnomalies() {
        return toBuilder()
                .anomaly(false)
                .anomalyTypes(List.of())
                .anomalyDetails(null)
                .build();
    }

    public Transaction withAnomalyDismissed(boolean dismissed) {
        return toBuilder().anomalyDismissed(dismissed).build();
    }

    public boolean isOpenAnomaly() {
        return anomaly && !anomalyDismissed;
    }

    public static final class Builder {
        private String id;
        private Instant occurredAt;
        private String description;
        private BigDecimal amount;
        private TransactionDirection direction;
        private CategoryType categoryType;
        private String category;
        private String merchantName;
        private boolean anomaly;
        private List<AnomalyType> anomalyTypes = List.of();
        private AnomalyDetails anomalyDetails;
        private boolean anomalyDismissed;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder direction(TransactionDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder categoryType(CategoryType categoryType) {
            this.categoryType = categoryType;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder merchantName(String merchantName) {
            this.merchantName = merchantName;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder anomalyTypes(List<AnomalyType> anomalyTypes) {
            this.anomalyTypes = anomalyTypes;
            return this;
        }

        public Builder anomalyDetails(AnomalyDetails anomalyDetails) {
            this.anomalyDetails = anomalyDetails;
            return this;
        }

        public Builder anomalyDismissed(boolean anomalyDismissed) {
            this.anomalyDismissed = anomalyDismissed;
            return this;
        }

        public Transaction build() {
            return new Transaction(
                    id,
                    occurredAt,
                    description,
                    amount,
                    direction,
                    categoryType,
                    category,
                    Optional.ofNullable(merchantName),
                    anomaly,
                    anomalyTypes,
                    Optional.ofNullable(anomalyDetails),
                    anomalyDismissed
            );
        }
    }
}
