package com.flagship.audit_trail.validation;

import java.time.Instant;
import java.util.List;

/**
 * Rules for revision numbering and revision date ordering.
 */
public final class RevisionRules {

    public static final int MIN_REVISION_NUMBER = 1;
    public static final int MAX_REVISION_NUMBER = 999_999;

    private RevisionRules() {
        // Utility class
    }

    public static boolean isValidRevisionNumber(int revisionNumber) {
        return revisionNumber >= MIN_REVISION_NUMBER && revisionNumber <= MAX_REVISION_NUMBER;
    }

    public static List<ValidationViolation> validateRevisionNumber(int revisionNumber, String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        if (isValidRevisionNumber(revisionNumber)) {
            return List.of();
        }
        return List.of(ValidationViolation.of(
            String.format("%s must be between %d and %d.", fieldName, MIN_REVISION_NUMBER, MAX_REVISION_NUMBER),
            fieldName));
    }

    /**
     * A modification date, when both dates are present, cannot precede the creation date.
     */
    public static boolean isValidDateOrder(Instant creationDate, Instant modificationDate) {
        return creationDate == null || modificationDate == null || !modificationDate.isBefore(creationDate);
    }

    public static List<ValidationViolation> validateDateOrder(Instant creationDate, Instant modificationDate,
                                                              String creationField, String modificationField) {
        if (isValidDateOrder(creationDate, modificationDate)) {
            return List.of();
        }
        return List.of(ValidationViolation.of(
            modificationField + " cannot be earlier than " + creationField + ".",
            modificationField, creationField));
    }
}
