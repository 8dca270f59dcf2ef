package com.ledgerlens.insights.model;

import java.util.List;

public record MerchantGroup(
        String normalizedName,
        List<String> originalNames,
        List<Transaction> transactions
) {
    public MerchantGroup {
        originalNames = List.copyOf(originalNames);
        transactions = List.copyOf(transactions);
    }
}
