package com.flagship.audit_trail.validation;

import com.flagship.audit_trail.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CollectionRulesTest {

    private final Clock clock = Clock.systemUTC();

    @Test
    @DisplayName("Element violations are prefixed with their path")
    void testElementPaths() {
        List<User> users = List.of(User.of(UUID.randomUUID(), "Jane Smith"), User.of(UUID.randomUUID(), "admin"));

        List<ValidationViolation> violations = CollectionRules.validateEach(users, "Users", true, clock);

        assertEquals(1, violations.size());
        assertEquals("Users[1]: Name is a reserved name and cannot be used.", violations.get(0).getMessage());
        assertFalse(CollectionRules.isValidEach(users, true, clock));
    }

    @Test
    @DisplayName("Missing collection is a violation only when required")
    void testNullCollection() {
        assertTrue(CollectionRules.validateEach(null, "Users", false, clock).isEmpty());
        assertEquals("Users is required.", CollectionRules.validateEach(null, "Users", true, clock).get(0).getMessage());
        assertTrue(CollectionRules.isValidEach(null, false, clock));
    }

    @Test
    @DisplayName("Null elements are reported and plain values skipped")
    void testNullAndPlainElements() {
        List<Object> items = Arrays.asList("not validatable", null);

        List<ValidationViolation> violations = CollectionRules.validateEach(items, "Items", true, clock);

        assertEquals(1, violations.size());
        assertEquals("Items[1] cannot be null.", violations.get(0).getMessage());
    }
}
