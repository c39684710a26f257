package com.flagship.audit_trail.validation;

import lombok.Value;

import java.util.List;

/**
 * A single field-scoped rule failure.
 *
 * Violations are data: validators collect and return them, they are never thrown
 * on their own. A referential-integrity violation is a violation whose member
 * names list both the attached sub-record and its foreign key.
 */
@Value
public class ValidationViolation {
    String message;
    List<String> memberNames;

    public static ValidationViolation of(String message, String... memberNames) {
        return new ValidationViolation(message, List.of(memberNames));
    }

    /**
     * Creates a copy of this violation reported under a parent context,
     * e.g. {@code "Matter: Description is required."}.
     */
    public ValidationViolation prefixed(String context) {
        return new ValidationViolation(context + ": " + message, memberNames);
    }

    public boolean concerns(String memberName) {
        return memberNames.contains(memberName);
    }
}
