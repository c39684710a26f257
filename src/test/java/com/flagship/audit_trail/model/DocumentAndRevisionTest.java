package com.flagship.audit_trail.model;

import com.flagship.audit_trail.entity.DocumentEntity;
import com.flagship.audit_trail.entity.RevisionEntity;
import com.flagship.audit_trail.validation.ValidationViolation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DocumentAndRevisionTest {

    private static final Instant CREATED = Instant.parse("2024-02-01T08:00:00Z");
    private final Clock clock = Clock.fixed(Instant.parse("2024-06-03T10:15:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Document label joins file name and extension")
    void testDocumentLabel() {
        Document document = Document.from(DocumentEntity.builder()
            .id(UUID.randomUUID()).fileName("Engagement Letter").extension(".pdf").creationDate(CREATED).build());

        assertEquals("Engagement Letter.pdf", document.displayLabel());
        assertTrue(document.isValid(clock));
    }

    @Test
    @DisplayName("Deleted document cannot stay checked out")
    void testCheckedOutAndDeleted() {
        Document document = Document.builder()
            .id(UUID.randomUUID()).fileName("Engagement Letter").checkedOut(true).deleted(true)
            .creationDate(CREATED).build();

        List<ValidationViolation> violations = document.validate(clock);

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).concerns("IsCheckedOut"));
        assertFalse(document.isValid(clock));
    }

    @Test
    @DisplayName("Documents are equal by identifier")
    void testDocumentEquality() {
        UUID id = UUID.randomUUID();

        assertEquals(Document.builder().id(id).fileName("Draft One").build(),
            Document.builder().id(id).fileName("Final").build());
    }

    @Test
    @DisplayName("Revision dates must be ordered")
    void testRevisionDates() {
        Revision revision = Revision.from(RevisionEntity.builder()
            .id(UUID.randomUUID()).revisionNumber(3).documentId(UUID.randomUUID())
            .creationDate(CREATED).modificationDate(CREATED.minusSeconds(1)).build());

        List<ValidationViolation> violations = revision.validate(clock);

        assertEquals(1, violations.size());
        assertEquals("ModificationDate cannot be earlier than CreationDate.", violations.get(0).getMessage());
        assertEquals("Revision 3", revision.displayLabel());
    }

    @Test
    @DisplayName("Revision zero is invalid")
    void testRevisionNumber() {
        Revision revision = Revision.builder()
            .id(UUID.randomUUID()).revisionNumber(0).creationDate(CREATED).modificationDate(CREATED).build();

        assertEquals(1, revision.validate(clock).size());
        assertFalse(revision.isValid(clock));
    }
}
