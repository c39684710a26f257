package com.flagship.audit_trail.model;

import com.flagship.audit_trail.entity.MatterEntity;
import com.flagship.audit_trail.normalization.TextNormalizer;
import com.flagship.audit_trail.validation.DescriptionRules;
import com.flagship.audit_trail.validation.IdentifierRules;
import com.flagship.audit_trail.validation.TimestampRules;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A legal matter: the top-level container for documents.
 *
 * Equality has two branches. Persisted matters (non-empty id on both sides)
 * compare by id. Matters that have not been persisted yet compare by
 * normalized description, ignoring case, plus the lifecycle flags. A persisted
 * matter never equals an unpersisted one, which keeps {@link #hashCode()} in
 * step with {@link #equals(Object)}.
 */
@Value
@Builder(toBuilder = true)
public class Matter implements Identified, Validatable {
    UUID id;
    String description;
    boolean archived;
    boolean deleted;
    Instant creationDate;

    public static Matter from(MatterEntity entity) {
        Objects.requireNonNull(entity, "Matter entity is required");
        return new Matter(
            entity.getId(),
            entity.getDescription(),
            entity.isArchived(),
            entity.isDeleted(),
            entity.getCreationDate()
        );
    }

    public boolean isPersisted() {
        return IdentifierRules.isValid(id);
    }

    public String status() {
        if (deleted) {
            return "Deleted";
        }
        return archived ? "Archived" : "Active";
    }

    @Override
    public String displayLabel() {
        return TextNormalizer.normalize(description);
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        violations.addAll(IdentifierRules.validate(id, "Id"));
        violations.addAll(DescriptionRules.validate(description, "Description"));
        violations.addAll(TimestampRules.validate(creationDate, "CreationDate", clock));
        // Deletion implies archival
        if (deleted && !archived) {
            violations.add(ValidationViolation.of(
                "Deleted matters must be archived for audit trail integrity.", "IsArchived", "IsDeleted"));
        }
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(id)
            && DescriptionRules.isValid(description)
            && TimestampRules.isValid(creationDate, clock)
            && (!deleted || archived);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matter other)) {
            return false;
        }
        if (isPersisted() || other.isPersisted()) {
            return isPersisted() && other.isPersisted() && id.equals(other.id);
        }
        return TextNormalizer.comparisonKey(description).equals(TextNormalizer.comparisonKey(other.description))
            && archived == other.archived
            && deleted == other.deleted;
    }

    @Override
    public int hashCode() {
        if (isPersisted()) {
            return id.hashCode();
        }
        return Objects.hash(TextNormalizer.comparisonKey(description), archived, deleted);
    }

    @Override
    public String toString() {
        return "Matter: " + displayLabel() + " (" + status() + ")";
    }
}
