package com.flagship.audit_trail.normalization;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes human-entered text (user names, matter descriptions, activity names).
 *
 * All methods are pure and total: they never throw and never return null.
 * Case is preserved by {@link #normalize(String)}; comparisons that must ignore
 * case go through {@link #comparisonKey(String)} so that equality and hashing
 * agree.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Trims and collapses internal whitespace runs to a single space.
     *
     * @return canonical text, or an empty string for null/blank input
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text.strip()).replaceAll(" ");
    }

    /**
     * Case-insensitive comparison key: normalized text lower-cased with {@link Locale#ROOT}.
     */
    public static String comparisonKey(String text) {
        return normalize(text).toLowerCase(Locale.ROOT);
    }

    /**
     * Canonical activity spelling: normalized and upper-cased ("checked  in " becomes "CHECKED IN").
     */
    public static String normalizeActivity(String activity) {
        return normalize(activity).toUpperCase(Locale.ROOT);
    }

    /**
     * Two texts are equivalent when both are non-blank and share a comparison key.
     */
    public static boolean areEquivalent(String first, String second) {
        String firstKey = comparisonKey(first);
        return !firstKey.isEmpty() && firstKey.equals(comparisonKey(second));
    }

    public static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
