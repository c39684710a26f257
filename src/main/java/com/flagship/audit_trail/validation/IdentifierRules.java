package com.flagship.audit_trail.validation;

import java.util.List;
import java.util.UUID;

/**
 * Rules for GUID-like identifiers. Both {@code null} and the nil UUID count as empty.
 */
public final class IdentifierRules {

    public static final UUID NIL = new UUID(0L, 0L);

    private IdentifierRules() {
        // Utility class
    }

    public static boolean isValid(UUID id) {
        return id != null && !NIL.equals(id);
    }

    public static boolean isEmpty(UUID id) {
        return !isValid(id);
    }

    public static List<ValidationViolation> validate(UUID id, String fieldName) {
        requireFieldName(fieldName);
        if (isValid(id)) {
            return List.of();
        }
        return List.of(ValidationViolation.of(
            fieldName + " must be a valid non-empty identifier.", fieldName));
    }

    static void requireFieldName(String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("Field name is required");
        }
    }
}
