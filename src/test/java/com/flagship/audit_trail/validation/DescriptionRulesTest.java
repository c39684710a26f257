package com.flagship.audit_trail.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionRulesTest {

    @Test
    @DisplayName("Descriptions with letters and clean edges are valid")
    void testValidDescription() {
        assertTrue(DescriptionRules.validate("Smith Trust 2024", "Description").isEmpty());
        assertTrue(DescriptionRules.isValid("Acme v. Jones Appeal"));
    }

    @Test
    @DisplayName("Reserved phrases are matched ignoring case and spacing")
    void testReservedPhrase() {
        List<ValidationViolation> violations = DescriptionRules.validate("  New   MATTER ", "Description");

        assertEquals(1, violations.size());
        assertEquals("Description is a reserved term and cannot be used.", violations.get(0).getMessage());
    }

    @Test
    @DisplayName("All description problems are accumulated")
    void testAccumulatesViolations() {
        List<ValidationViolation> violations = DescriptionRules.validate("-1", "Description");

        assertEquals(3, violations.size());
        assertFalse(DescriptionRules.isValid("-1"));
    }

    @Test
    @DisplayName("Extension is optional but must be well formed")
    void testExtension() {
        assertTrue(DescriptionRules.isValidExtension(null));
        assertTrue(DescriptionRules.isValidExtension(".pdf"));
        assertFalse(DescriptionRules.isValidExtension("pdf"));
        assertFalse(DescriptionRules.isValidExtension(".toolongext"));
        assertEquals(1, DescriptionRules.validateExtension(".p-f", "Extension").size());
    }

    @Test
    @DisplayName("isValid agrees with validate")
    void testQuickCheckConsistency() {
        for (String description : List.of("Smith Trust 2024", "Smith Trust ", "  Smith Trust", "new matter",
                "ab", "2024", "(Draft) Lease", "Lease Review)", " ", "a".repeat(129))) {
            assertEquals(DescriptionRules.validate(description, "Description").isEmpty(),
                DescriptionRules.isValid(description), description);
        }
    }
}
