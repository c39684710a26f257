package com.flagship.audit_trail.model;

import com.flagship.audit_trail.entity.RevisionEntity;
import com.flagship.audit_trail.validation.IdentifierRules;
import com.flagship.audit_trail.validation.RevisionRules;
import com.flagship.audit_trail.validation.TimestampRules;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A numbered revision of a document. Equal by id.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Revision implements Identified, Validatable {
    @EqualsAndHashCode.Include
    UUID id;
    int revisionNumber;
    UUID documentId;
    Instant creationDate;
    Instant modificationDate;
    boolean deleted;

    public static Revision from(RevisionEntity entity) {
        Objects.requireNonNull(entity, "Revision entity is required");
        return new Revision(
            entity.getId(),
            entity.getRevisionNumber(),
            entity.getDocumentId(),
            entity.getCreationDate(),
            entity.getModificationDate(),
            entity.isDeleted()
        );
    }

    @Override
    public String displayLabel() {
        return "Revision " + revisionNumber;
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        violations.addAll(IdentifierRules.validate(id, "Id"));
        violations.addAll(RevisionRules.validateRevisionNumber(revisionNumber, "RevisionNumber"));
        violations.addAll(TimestampRules.validate(creationDate, "CreationDate", clock));
        violations.addAll(TimestampRules.validate(modificationDate, "ModificationDate", clock));
        violations.addAll(RevisionRules.validateDateOrder(
            creationDate, modificationDate, "CreationDate", "ModificationDate"));
        if (documentId != null) {
            violations.addAll(IdentifierRules.validate(documentId, "DocumentId"));
        }
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(id)
            && RevisionRules.isValidRevisionNumber(revisionNumber)
            && TimestampRules.isValid(creationDate, clock)
            && TimestampRules.isValid(modificationDate, clock)
            && RevisionRules.isValidDateOrder(creationDate, modificationDate)
            && (documentId == null || IdentifierRules.isValid(documentId));
    }

    @Override
    public String toString() {
        return "Revision " + revisionNumber + " (" + id + ")";
    }
}
