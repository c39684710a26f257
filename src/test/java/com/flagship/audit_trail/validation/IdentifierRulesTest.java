package com.flagship.audit_trail.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierRulesTest {

    @Test
    @DisplayName("Nil and null identifiers are empty")
    void testEmptyIdentifiers() {
        assertTrue(IdentifierRules.isEmpty(null));
        assertTrue(IdentifierRules.isEmpty(UUID.fromString("00000000-0000-0000-0000-000000000000")));
        assertTrue(IdentifierRules.isValid(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Empty identifier produces one violation naming the field")
    void testValidateMessage() {
        List<ValidationViolation> violations = IdentifierRules.validate(IdentifierRules.NIL, "MatterId");

        assertEquals(1, violations.size());
        assertEquals("MatterId must be a valid non-empty identifier.", violations.get(0).getMessage());
        assertTrue(violations.get(0).concerns("MatterId"));
    }

    @Test
    @DisplayName("Blank field name is a programming error")
    void testBlankFieldName() {
        assertThrows(IllegalArgumentException.class, () -> IdentifierRules.validate(UUID.randomUUID(), " "));
    }
}
