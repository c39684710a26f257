package com.flagship.audit_trail.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserNameRulesTest {

    @Test
    @DisplayName("Professional names are accepted")
    void testValidNames() {
        for (String name : List.of("Jane Smith", "J. Doe", "mary-anne_o", "Li")) {
            assertTrue(UserNameRules.validate(name, "Name").isEmpty(), name);
            assertTrue(UserNameRules.isValid(name), name);
        }
    }

    @Test
    @DisplayName("Reserved names are rejected regardless of case and padding")
    void testReservedNames() {
        List<ValidationViolation> violations = UserNameRules.validate("  ADMIN ", "Name");

        assertEquals(1, violations.size());
        assertEquals("Name is a reserved name and cannot be used.", violations.get(0).getMessage());
        assertTrue(UserNameRules.isReserved("System"));
    }

    @Test
    @DisplayName("Length and format problems are all reported")
    void testLengthAndFormat() {
        assertEquals("Name must be between 2 and 50 characters.",
            UserNameRules.validate("J", "Name").get(0).getMessage());
        assertFalse(UserNameRules.isValid("a".repeat(51)));
        assertFalse(UserNameRules.isValid("Jane  Smith"));
        assertFalse(UserNameRules.isValid("Jane@Smith"));
        assertFalse(UserNameRules.isValid(".Jane"));
        assertEquals("Name is required and cannot be empty.",
            UserNameRules.validate(null, "Name").get(0).getMessage());
    }

    @Test
    @DisplayName("isValid agrees with validate")
    void testQuickCheckConsistency() {
        for (String name : List.of("Jane Smith", "root", "x", "Bad--Name", "  ", "Ok Name ")) {
            assertEquals(UserNameRules.validate(name, "Name").isEmpty(), UserNameRules.isValid(name), name);
        }
    }
}
