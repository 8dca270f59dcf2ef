package com.ledgerlens.insights.model;

import java.time.Instant;

/**
 * A user's "not recurring" decision for a merchant, keyed by its normalised name.
 */
public record ExcludedMerchant(String normalizedName, Instant excludedAt) {
}
