package com.flagship.audit_trail.validation;

import com.flagship.audit_trail.normalization.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rules for descriptive text: matter descriptions and document file names.
 */
public final class DescriptionRules {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 128;

    private static final Pattern EXTENSION_FORMAT = Pattern.compile("^\\.[A-Za-z0-9]{1,9}$");

    private static final Set<String> RESERVED_PHRASES = Set.of(
        "system", "admin", "administrator", "root", "sa", "default",
        "matter", "document", "file", "folder", "directory",
        "court", "judge", "clerk", "registry", "docket",
        "adms", "database", "backup", "temp", "temporary", "test",
        "null", "undefined", "none", "empty", "void", "unknown",
        "security", "auth", "authentication", "token", "session",
        "new", "copy", "duplicate", "sample", "example",
        "new matter", "new document", "untitled", "untitled document"
    );

    private DescriptionRules() {
        // Utility class
    }

    /**
     * Reserved phrases are matched case- and whitespace-insensitively.
     */
    public static boolean isReserved(String description) {
        return RESERVED_PHRASES.contains(TextNormalizer.comparisonKey(description));
    }

    public static boolean isValid(String description) {
        if (TextNormalizer.isBlank(description)) {
            return false;
        }
        String trimmed = description.strip();
        return hasValidLength(trimmed)
            && TextFormat.containsLetter(trimmed)
            && TextFormat.startsAndEndsAlphanumeric(trimmed)
            && !isReserved(trimmed);
    }

    public static List<ValidationViolation> validate(String description, String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        List<ValidationViolation> violations = new ArrayList<>();
        if (TextNormalizer.isBlank(description)) {
            violations.add(ValidationViolation.of(fieldName + " is required and cannot be empty.", fieldName));
            return violations;
        }
        String trimmed = description.strip();
        if (!hasValidLength(trimmed)) {
            violations.add(ValidationViolation.of(
                String.format("%s must be between %d and %d characters.", fieldName, MIN_LENGTH, MAX_LENGTH),
                fieldName));
        }
        if (!TextFormat.containsLetter(trimmed)) {
            violations.add(ValidationViolation.of(fieldName + " must contain at least one letter.", fieldName));
        }
        if (!TextFormat.startsAndEndsAlphanumeric(trimmed)) {
            violations.add(ValidationViolation.of(
                fieldName + " must start and end with a letter or number.", fieldName));
        }
        if (isReserved(trimmed)) {
            violations.add(ValidationViolation.of(
                fieldName + " is a reserved term and cannot be used.", fieldName));
        }
        return violations;
    }

    /**
     * File extensions are optional; when present they look like {@code .pdf}.
     */
    public static boolean isValidExtension(String extension) {
        return TextNormalizer.isBlank(extension) || EXTENSION_FORMAT.matcher(extension).matches();
    }

    public static List<ValidationViolation> validateExtension(String extension, String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        if (isValidExtension(extension)) {
            return List.of();
        }
        return List.of(ValidationViolation.of(
            fieldName + " must be a period followed by 1 to 9 letters or digits.", fieldName));
    }

    private static boolean hasValidLength(String trimmed) {
        return trimmed.length() >= MIN_LENGTH && trimmed.length() <= MAX_LENGTH;
    }
}
