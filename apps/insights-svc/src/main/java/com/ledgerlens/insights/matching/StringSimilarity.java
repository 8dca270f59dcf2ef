package com.ledgerlens.insights.matching;

import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Normalised Levenshtein similarity in {@code [0, 1]}.
 */
@Component
public class StringSimilarity {

    public double similarity(String a, String b) {
        String left = a == null ? "" : a.trim().toLowerCase(Locale.ROOT);
        String right = b == null ? "" : b.trim().toLowerCase(Locale.ROOT);
        if (left.isEmpty() || right.isEmpty()) {
            return 0d;
        }
        if (left.equals(right)) {
            return 1d;
        }
        int distance = levenshtein(left, right);
        return 1d - (double) distance / Math.max(left.length(), right.length());
    }

    int levenshtein(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(previous[j] + 1, current[j - 1] + 1),
                        previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }
}
