package com.flagship.audit_trail.exception;

import com.flagship.audit_trail.validation.ValidationViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a record converted from a source entity fails full validation.
 *
 * This signals corrupt upstream data, not user input: normal validation
 * returns violations as data instead.
 */
public class AuditValidationException extends AuditTrailException {

    private final String recordType;
    private final List<ValidationViolation> violations;

    public AuditValidationException(String recordType, List<ValidationViolation> violations) {
        super(String.format("Failed to create valid %s: %s", recordType, joinMessages(violations)));
        this.recordType = recordType;
        this.violations = List.copyOf(violations);
    }

    public String getRecordType() {
        return recordType;
    }

    public List<ValidationViolation> getViolations() {
        return violations;
    }

    private static String joinMessages(List<ValidationViolation> violations) {
        return violations.stream()
            .map(ValidationViolation::getMessage)
            .collect(Collectors.joining(", "));
    }
}
