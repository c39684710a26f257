package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.exception.AuditValidationException;
import com.flagship.audit_trail.model.Identified;
import com.flagship.audit_trail.normalization.TextNormalizer;
import com.flagship.audit_trail.validation.IdentifierRules;
import com.flagship.audit_trail.validation.TimestampRules;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Validation and display helpers shared by the audit association records.
 */
final class AuditRecords {

    static final String CREATED_AT = "CreatedAt";

    private static final DateTimeFormatter AUDIT_TIMESTAMP =
        DateTimeFormatter.ofPattern("EEEE, dd MMMM yyyy HH:mm:ss", Locale.ENGLISH);

    private AuditRecords() {
    }

    static void validateKey(List<ValidationViolation> violations, UUID id, String fieldName) {
        violations.addAll(IdentifierRules.validate(id, fieldName));
    }

    static void validateTimestamp(List<ValidationViolation> violations, Instant createdAt, Clock clock) {
        violations.addAll(TimestampRules.validate(createdAt, CREATED_AT, clock));
    }

    static boolean isValidTimestamp(Instant createdAt, Clock clock) {
        return TimestampRules.isValid(createdAt, clock);
    }

    /**
     * Validates an attached sub-record and checks it points at the same row as the foreign key.
     * Absent sub-records are skipped. The reference check is skipped when the key itself is empty,
     * that case is already reported by the key validation.
     */
    static <S extends Identified & Validatable> void validateAttached(List<ValidationViolation> violations,
                                                                      S attached, String attachedName,
                                                                      UUID foreignKey, String foreignKeyName,
                                                                      Clock clock) {
        if (attached == null) {
            return;
        }
        for (ValidationViolation violation : attached.validate(clock)) {
            violations.add(violation.prefixed(attachedName));
        }
        if (IdentifierRules.isValid(foreignKey) && !foreignKey.equals(attached.getId())) {
            violations.add(ValidationViolation.of(
                String.format("%s.Id does not match %s - referential integrity violation.", attachedName, foreignKeyName),
                attachedName, foreignKeyName));
        }
    }

    static <S extends Identified & Validatable> boolean isValidAttached(S attached, UUID foreignKey, Clock clock) {
        if (attached == null) {
            return true;
        }
        return attached.isValid(clock) && (IdentifierRules.isEmpty(foreignKey) || foreignKey.equals(attached.getId()));
    }

    static <T> T requireValid(String recordType, T record, List<ValidationViolation> violations) {
        if (!violations.isEmpty()) {
            throw new AuditValidationException(recordType, violations);
        }
        return record;
    }

    static String label(Identified attached, String missing) {
        if (attached == null) {
            return missing;
        }
        String label = attached.displayLabel();
        return TextNormalizer.isBlank(label) ? missing : label;
    }

    static String formatTimestamp(Instant timestamp, ZoneId zone) {
        if (timestamp == null) {
            return "an unknown date";
        }
        return AUDIT_TIMESTAMP.format(timestamp.atZone(zone));
    }
}
