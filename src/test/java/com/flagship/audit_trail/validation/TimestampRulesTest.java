package com.flagship.audit_trail.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimestampRulesTest {

    private static final Instant NOW = Instant.parse("2024-06-03T10:15:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("Timestamp far in the future is rejected")
    void testFutureTimestamp() {
        List<ValidationViolation> violations =
            TimestampRules.validate(Instant.parse("2200-01-01T00:00:00Z"), "CreatedAt", clock);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).getMessage().contains("must not be in the future"));
        assertEquals(List.of("CreatedAt"), violations.get(0).getMemberNames());
    }

    @Test
    @DisplayName("Timestamp before 1980 is unreasonably far in the past")
    void testAncientTimestamp() {
        List<ValidationViolation> violations =
            TimestampRules.validate(Instant.parse("1975-01-01T00:00:00Z"), "CreatedAt", clock);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).getMessage().contains("unreasonably far in the past"));
    }

    @Test
    @DisplayName("Small clock skew inside the tolerance is accepted")
    void testSkewTolerance() {
        assertTrue(TimestampRules.isValid(NOW.plus(Duration.ofMinutes(4)), clock));
        assertTrue(TimestampRules.isValid(NOW.plus(TimestampRules.FUTURE_TOLERANCE), clock));
        assertFalse(TimestampRules.isValid(NOW.plus(Duration.ofMinutes(6)), clock));
    }

    @Test
    @DisplayName("Null and default timestamps report a single violation")
    void testDefaultTimestamps() {
        assertEquals("CreatedAt is required.", TimestampRules.validate(null, "CreatedAt", clock).get(0).getMessage());
        for (Instant value : List.of(Instant.EPOCH, Instant.MIN)) {
            List<ValidationViolation> violations = TimestampRules.validate(value, "CreatedAt", clock);
            assertEquals(1, violations.size());
            assertTrue(violations.get(0).getMessage().contains("must be a valid date"));
            assertFalse(TimestampRules.isValid(value, clock));
        }
    }

    @Test
    @DisplayName("Floor itself is a valid timestamp")
    void testFloorBoundary() {
        assertTrue(TimestampRules.validate(TimestampRules.HISTORICAL_FLOOR, "CreatedAt", clock).isEmpty());
        assertTrue(TimestampRules.isBeforeFloor(TimestampRules.HISTORICAL_FLOOR.minusSeconds(1)));
    }
}
