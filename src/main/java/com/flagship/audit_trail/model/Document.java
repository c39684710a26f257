package com.flagship.audit_trail.model;

import com.flagship.audit_trail.entity.DocumentEntity;
import com.flagship.audit_trail.normalization.TextNormalizer;
import com.flagship.audit_trail.validation.DescriptionRules;
import com.flagship.audit_trail.validation.IdentifierRules;
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
 * A document filed under a matter. Equal by id.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Document implements Identified, Validatable {
    @EqualsAndHashCode.Include
    UUID id;
    String fileName;
    String extension;
    boolean checkedOut;
    boolean deleted;
    Instant creationDate;

    public static Document from(DocumentEntity entity) {
        Objects.requireNonNull(entity, "Document entity is required");
        return new Document(
            entity.getId(),
            entity.getFileName(),
            entity.getExtension(),
            entity.isCheckedOut(),
            entity.isDeleted(),
            entity.getCreationDate()
        );
    }

    /**
     * File name with its extension, e.g. {@code "Engagement Letter.pdf"}.
     */
    @Override
    public String displayLabel() {
        String name = TextNormalizer.normalize(fileName);
        return TextNormalizer.isBlank(extension) ? name : name + extension.strip();
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        violations.addAll(IdentifierRules.validate(id, "Id"));
        violations.addAll(DescriptionRules.validate(fileName, "FileName"));
        violations.addAll(DescriptionRules.validateExtension(extension, "Extension"));
        violations.addAll(TimestampRules.validate(creationDate, "CreationDate", clock));
        if (checkedOut && deleted) {
            violations.add(ValidationViolation.of(
                "A deleted document cannot remain checked out.", "IsCheckedOut", "IsDeleted"));
        }
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(id)
            && DescriptionRules.isValid(fileName)
            && DescriptionRules.isValidExtension(extension)
            && TimestampRules.isValid(creationDate, clock)
            && !(checkedOut && deleted);
    }

    @Override
    public String toString() {
        return "Document: " + displayLabel() + " (" + id + ")";
    }
}
