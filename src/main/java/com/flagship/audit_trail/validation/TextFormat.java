package com.flagship.audit_trail.validation;

import java.util.regex.Pattern;

/**
 * Character-level format checks shared by the short-text rules.
 *
 * Each check returns a problem description or {@code null} when the text is
 * well formed, so the full validator and the quick predicate evaluate the
 * same conditions.
 */
final class TextFormat {

    private static final Pattern SHORT_TEXT_CHARACTERS = Pattern.compile("^[\\p{L}\\p{N} ._\\-]+$");
    private static final String[] DOUBLED_SEPARATORS = {"..", "__", "--", "  "};

    private TextFormat() {
        // Utility class
    }

    /**
     * Letters, digits, spaces, periods, hyphens and underscores; starts and ends
     * alphanumeric; no doubled separators.
     */
    static String shortTextProblem(String trimmed) {
        if (!SHORT_TEXT_CHARACTERS.matcher(trimmed).matches()) {
            return "can only contain letters, numbers, spaces, periods, hyphens, and underscores.";
        }
        if (!startsAndEndsAlphanumeric(trimmed)) {
            return "must start and end with a letter or number.";
        }
        for (String doubled : DOUBLED_SEPARATORS) {
            if (trimmed.contains(doubled)) {
                return "cannot contain consecutive special characters or spaces.";
            }
        }
        return null;
    }

    static boolean startsAndEndsAlphanumeric(String text) {
        return !text.isEmpty()
            && Character.isLetterOrDigit(text.codePointAt(0))
            && Character.isLetterOrDigit(text.codePointBefore(text.length()));
    }

    static boolean containsLetter(String text) {
        return text.codePoints().anyMatch(Character::isLetter);
    }
}
