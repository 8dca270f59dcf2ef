package com.ledgerlens.insights.recurring;

import com.ledgerlens.insights.matching.MerchantNameNormalizer;
import com.ledgerlens.insights.model.MerchantGroup;
import com.ledgerlens.insights.model.Transaction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class MerchantGrouper {

    private final MerchantNameNormalizer merchantNameNormalizer;

    public MerchantGrouper(MerchantNameNormalizer merchantNameNormalizer) {
        this.merchantNameNormalizer = merchantNameNormalizer;
    }

    /**
     * Clusters expenses by merchant. Each transaction joins the first existing group whose key
     * matches it, so the outcome depends on input order.
     */
    public List<MerchantGroup> group(List<Transaction> transactions) {
        Map<String, Accumulator> groups = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (tx == null || !tx.isExpense()) {
                continue;
            }
            String merchantName = tx.merchantOrDescription();
            String normalized = merchantNameNormalizer.normalize(merchantName);
            if (normalized.isEmpty()) {
                continue;
            }
            Accumulator target = null;
            for (Map.Entry<String, Accumulator> entry : groups.entrySet()) {
                if (merchantNameNormalizer.merchantsMatch(normalized, entry.getKey())) {
                    target = entry.getValue();
                    break;
                }
            }
            if (target == null) {
                target = new Accumulator(normalized);
                groups.put(normalized, target);
            }
            target.add(merchantName, tx);
        }
        return groups.values().stream()
                .map(Accumulator::toGroup)
                .toList();
    }

    private static final class Accumulator {
        private final String normalizedName;
        private final List<String> originalNames = new ArrayList<>();
        private final List<Transaction> transactions = new ArrayList<>();

        private Accumulator(String normalizedName) {
            this.normalizedName = normalizedName;
        }

        private void add(String originalName, Transaction tx) {
            if (!originalNames.contains(originalName)) {
                originalNames.add(originalName);
            }
            transactions.add(tx);
        }

        private MerchantGroup toGroup() {
            return new MerchantGroup(normalizedName, originalNames, transactions);
        }
    }
}
