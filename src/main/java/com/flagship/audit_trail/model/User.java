package com.flagship.audit_trail.model;

import com.flagship.audit_trail.entity.UserEntity;
import com.flagship.audit_trail.normalization.TextNormalizer;
import com.flagship.audit_trail.validation.IdentifierRules;
import com.flagship.audit_trail.validation.UserNameRules;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;
import lombok.Value;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A user who performs audited activities.
 *
 * Compares by id when both sides are persisted, otherwise by normalized
 * name ignoring case. Persisted and unpersisted users are never equal.
 */
@Value
public class User implements Identified, Validatable {
    UUID id;
    String name;

    public static User of(UUID id, String name) {
        return new User(id, name);
    }

    public static User from(UserEntity entity) {
        Objects.requireNonNull(entity, "User entity is required");
        return new User(entity.getId(), entity.getName());
    }

    public boolean isPersisted() {
        return IdentifierRules.isValid(id);
    }

    @Override
    public String displayLabel() {
        return TextNormalizer.normalize(name);
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        violations.addAll(IdentifierRules.validate(id, "Id"));
        violations.addAll(UserNameRules.validate(name, "Name"));
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(id) && UserNameRules.isValid(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof User other)) {
            return false;
        }
        if (isPersisted() || other.isPersisted()) {
            return isPersisted() && other.isPersisted() && id.equals(other.id);
        }
        return TextNormalizer.comparisonKey(name).equals(TextNormalizer.comparisonKey(other.name));
    }

    @Override
    public int hashCode() {
        return isPersisted() ? id.hashCode() : TextNormalizer.comparisonKey(name).hashCode();
    }

    @Override
    public String toString() {
        return "User: " + displayLabel() + " (" + id + ")";
    }
}
