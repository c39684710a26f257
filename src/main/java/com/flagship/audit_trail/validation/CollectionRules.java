package com.flagship.audit_trail.validation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Recursive validation of collection-valued fields.
 *
 * A null collection is treated as absent unless the field is required.
 * Elements that do not implement {@link Validatable} are skipped.
 */
public final class CollectionRules {

    private CollectionRules() {
        // Utility class
    }

    public static List<ValidationViolation> validateEach(Collection<?> items, String fieldName,
                                                         boolean required, Clock clock) {
        IdentifierRules.requireFieldName(fieldName);
        List<ValidationViolation> violations = new ArrayList<>();
        if (items == null) {
            if (required) {
                violations.add(ValidationViolation.of(fieldName + " is required.", fieldName));
            }
            return violations;
        }
        int index = 0;
        for (Object item : items) {
            String path = fieldName + "[" + index + "]";
            if (item == null) {
                violations.add(ValidationViolation.of(path + " cannot be null.", fieldName));
            } else if (item instanceof Validatable validatable) {
                validatable.validate(clock).forEach(violation -> violations.add(violation.prefixed(path)));
            }
            index++;
        }
        return violations;
    }

    public static boolean isValidEach(Collection<?> items, boolean required, Clock clock) {
        if (items == null) {
            return !required;
        }
        for (Object item : items) {
            if (item == null) {
                return false;
            }
            if (item instanceof Validatable validatable && !validatable.isValid(clock)) {
                return false;
            }
        }
        return true;
    }
}
