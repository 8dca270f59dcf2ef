package com.ledgerlens.insights.analytics;

import com.ledgerlens.insights.config.InsightsProperties;
import com.ledgerlens.insights.model.CategoryStats;
import com.ledgerlens.insights.model.Transaction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CategoryStatisticsCalculator {

    /**
     * Per-category mean and standard deviation of absolute expense amounts. Categories with too
     * few samples or no spread are left out, since a z-score against them is meaningless.
     */
    public Map<String, CategoryStats> calculate(List<Transaction> transactions, InsightsProperties.Anomaly config) {
        Map<String, List<Double>> amountsByCategory = new LinkedHashMap<>();
        for (Transaction tx : transactions) {
            if (tx == null || !tx.isExpense() || tx.amount() == null) {
                continue;
            }
            amountsByCategory.computeIfAbsent(tx.categoryOrDefault(), key -> new ArrayList<>())
                    .add(tx.amount().abs().doubleValue());
        }

        Map<String, CategoryStats> stats = new LinkedHashMap<>();
        amountsByCategory.forEach((category, amounts) -> {
            if (amounts.size() < config.minTransactionsForStats()) {
                return;
            }
            double stdDev = Statistics.populationStdDev(amounts);
            if (stdDev == 0d) {
                return;
            }
            stats.put(category, new CategoryStats(amounts.size(), Statistics.mean(amounts), stdDev));
        });
        return stats;
    }
}
