package com.flagship.audit_trail.model;

import com.flagship.audit_trail.entity.ActivityEntity;
import com.flagship.audit_trail.normalization.TextNormalizer;
import com.flagship.audit_trail.validation.ActivityRules;
import com.flagship.audit_trail.validation.IdentifierRules;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An activity classification (CREATED, CHECKED IN, MOVED, ...) within one {@link ActivityScope}.
 *
 * Custom activities skip the allowed-set check but still obey length, format
 * and reserved-word rules. Equal by id.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Activity implements Identified, Validatable {
    @EqualsAndHashCode.Include
    UUID id;
    String activity;
    ActivityScope scope;
    boolean custom;

    public static Activity of(UUID id, String activity, ActivityScope scope) {
        return new Activity(id, activity, scope, false);
    }

    public static Activity custom(UUID id, String activity, ActivityScope scope) {
        return new Activity(id, activity, scope, true);
    }

    /**
     * Builds a standard activity carrying its seeded identifier and canonical spelling.
     *
     * @throws IllegalArgumentException if the name is not part of the scope
     */
    public static Activity seeded(ActivityScope scope, String activityName) {
        UUID seededId = getSeededActivityId(scope, activityName);
        if (IdentifierRules.isEmpty(seededId)) {
            throw new IllegalArgumentException(
                String.format("'%s' is not a standard %s activity", activityName, scope.getDisplayName()));
        }
        return of(seededId, TextNormalizer.normalizeActivity(activityName), scope);
    }

    /**
     * Returns the fixed identifier assigned to a standard activity, or the nil UUID.
     */
    public static UUID getSeededActivityId(ActivityScope scope, String activityName) {
        Objects.requireNonNull(scope, "Activity scope is required");
        return scope.seededActivityId(activityName);
    }

    public static Activity from(ActivityEntity entity, ActivityScope scope) {
        Objects.requireNonNull(entity, "Activity entity is required");
        Objects.requireNonNull(scope, "Activity scope is required");
        // Names outside the standard set are treated as custom
        boolean custom = !TextNormalizer.isBlank(entity.getActivity()) && !scope.isAllowed(entity.getActivity());
        return new Activity(entity.getId(), entity.getActivity(), scope, custom);
    }

    /**
     * Case-insensitive comparison against a canonical activity name.
     */
    public boolean is(String activityName) {
        String canonical = TextNormalizer.normalizeActivity(activity);
        return !canonical.isEmpty() && canonical.equals(TextNormalizer.normalizeActivity(activityName));
    }

    public boolean isStandard() {
        return scope != null && scope.isAllowed(activity);
    }

    @Override
    public String displayLabel() {
        return TextNormalizer.normalizeActivity(activity);
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        violations.addAll(IdentifierRules.validate(id, "Id"));
        if (scope == null) {
            violations.add(ValidationViolation.of("Scope is required for activity classification.", "Scope"));
            return violations;
        }
        violations.addAll(ActivityRules.validate(activity, scope, custom, "Activity"));
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(id)
            && scope != null
            && ActivityRules.isValid(activity, scope, custom);
    }

    @Override
    public String toString() {
        return "Activity: " + displayLabel() + " (" + id + ")";
    }
}
