package com.ledgerlens.insights.matching;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns free-text transaction descriptions into stable merchant keys.
 */
@Component
public class MerchantNameNormalizer {

    private static final Pattern LEADING_PHRASE = Pattern.compile(
            "^(?:bill\\s*payment(?:\\s+to)?|payment(?:\\s+(?:to|for))?|purchase(?:\\s+(?:at|from))?|sub)\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<Pattern> TRAILING_SUFFIXES = List.of(
            "pvt ltd", "private limited", "ltd", "limited", "inc", "incorporated",
            "corp", "corporation", "co", "company", "llc", "llp", "gmbh",
            "subscription", "payment", "charge", "billing", "auto", "recurring"
    ).stream()
            .map(suffix -> Pattern.compile("\\s+" + Pattern.quote(suffix) + "\\s*$"))
            .toList();
    private static final Set<String> COMMON_WORDS = Set.of("the", "and", "for", "inc", "ltd");

    private static final Pattern CODE_PREFIX = Pattern.compile("^[a-z]{2,4}\\s*\\*\\s*");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\d+\\s+");
    private static final Pattern REFERENCE_NUMBER = Pattern.compile("(?:^|\\s)(?:#\\s*\\d+|\\d+)(?=\\s|$)");
    private static final int FREQUENCY_KEY_TOKENS = 3;

    /**
     * Lowercases, strips leading payment phrasing and trailing legal/billing suffixes, and reduces
     * punctuation to single spaces. Runs to a fixed point, so the result normalises to itself.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String current = name.toLowerCase(Locale.ROOT);
        String previous;
        do {
            previous = current;
            current = collapse(NON_ALPHANUMERIC.matcher(current).replaceAll(" "));
            current = LEADING_PHRASE.matcher(current).replaceFirst("");
            for (Pattern suffix : TRAILING_SUFFIXES) {
                current = suffix.matcher(current).replaceFirst("");
            }
            current = collapse(current);
        } while (!current.equals(previous));
        return current;
    }

    /**
     * Whether two names likely refer to the same merchant: equal once normalised, one contains
     * the other, or they share a significant first word.
     */
    public boolean merchantsMatch(String first, String second) {
        String left = normalize(first);
        String right = normalize(second);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        if (left.equals(right) || left.contains(right) || right.contains(left)) {
            return true;
        }
        String leftWord = firstSignificantWord(left);
        String rightWord = firstSignificantWord(right);
        return leftWord != null && leftWord.equals(rightWord) && !COMMON_WORDS.contains(leftWord);
    }

    /**
     * Coarse merchant key for the charge frequency check: drops a processor code such as
     * {@code "AMZN *"} and leading digits, then keeps the first three tokens.
     */
    public String frequencyKey(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        String stripped = description.trim().toLowerCase(Locale.ROOT);
        stripped = CODE_PREFIX.matcher(stripped).replaceFirst("");
        stripped = LEADING_DIGITS.matcher(stripped).replaceFirst("");
        return Arrays.stream(WHITESPACE.split(stripped.trim()))
                .filter(token -> !token.isEmpty())
                .limit(FREQUENCY_KEY_TOKENS)
                .collect(Collectors.joining(" "));
    }

    /**
     * Description with store and reference numbers ({@code "#123"}, {@code "4471"}) removed, used
     * when comparing two charges for duplication. Falls back to the trimmed description when
     * nothing else is left.
     */
    public String withoutReferenceNumbers(String description) {
        if (description == null) {
            return "";
        }
        String lowered = description.trim().toLowerCase(Locale.ROOT);
        String stripped = collapse(REFERENCE_NUMBER.matcher(lowered).replaceAll(" "));
        return stripped.isEmpty() ? lowered : stripped;
    }

    private static String firstSignificantWord(String normalized) {
        for (String word : normalized.split(" ")) {
            if (word.length() > 2) {
                return word;
            }
        }
        return null;
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
