package com.flagship.audit_trail.validation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Temporal rules for audit timestamps.
 *
 * A timestamp is valid when it is present, not a default value, no later than
 * "now" plus {@link #FUTURE_TOLERANCE} and no earlier than {@link #HISTORICAL_FLOOR}.
 */
public final class TimestampRules {

    public static final Instant HISTORICAL_FLOOR = Instant.parse("1980-01-01T00:00:00Z");
    public static final Duration FUTURE_TOLERANCE = Duration.ofMinutes(5);

    private TimestampRules() {
        // Utility class
    }

    /**
     * Null, {@link Instant#EPOCH} and {@link Instant#MIN} stand for "never set".
     */
    public static boolean isDefault(Instant timestamp) {
        return timestamp == null || Instant.EPOCH.equals(timestamp) || Instant.MIN.equals(timestamp);
    }

    public static boolean isInFuture(Instant timestamp, Clock clock) {
        return timestamp.isAfter(clock.instant().plus(FUTURE_TOLERANCE));
    }

    public static boolean isBeforeFloor(Instant timestamp) {
        return timestamp.isBefore(HISTORICAL_FLOOR);
    }

    public static boolean isValid(Instant timestamp, Clock clock) {
        return !isDefault(timestamp)
            && !isInFuture(timestamp, clock)
            && !isBeforeFloor(timestamp);
    }

    public static List<ValidationViolation> validate(Instant timestamp, String fieldName, Clock clock) {
        IdentifierRules.requireFieldName(fieldName);
        List<ValidationViolation> violations = new ArrayList<>();
        if (timestamp == null) {
            violations.add(ValidationViolation.of(fieldName + " is required.", fieldName));
            return violations;
        }
        if (isDefault(timestamp)) {
            violations.add(ValidationViolation.of(
                fieldName + " must be a valid date for audit trail integrity.", fieldName));
            return violations;
        }
        if (isInFuture(timestamp, clock)) {
            violations.add(ValidationViolation.of(
                fieldName + " must not be in the future for audit trail integrity.", fieldName));
        }
        if (isBeforeFloor(timestamp)) {
            violations.add(ValidationViolation.of(
                fieldName + " is unreasonably far in the past for an audit trail entry.", fieldName));
        }
        return violations;
    }
}
