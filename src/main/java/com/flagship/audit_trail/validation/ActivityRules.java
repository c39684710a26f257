package com.flagship.audit_trail.validation;

import com.flagship.audit_trail.model.ActivityScope;
import com.flagship.audit_trail.normalization.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.flagship.audit_trail.model.ActivityNames.*;

/**
 * Rules for activity classification names.
 *
 * Besides field validation this class holds the context predicates that decide
 * whether an activity makes sense for the current state of its subject. Those
 * take the subject's state as plain booleans; there is no state machine here.
 */
public final class ActivityRules {

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 50;

    private static final Set<String> RESERVED_ACTIVITIES = Set.of(
        "SYSTEM", "ADMIN", "ROOT", "SETUP", "CONFIG",
        "INSERT", "UPDATE", "DELETE", "SELECT", "DROP",
        "NULL", "VOID", "EMPTY", "NONE", "UNDEFINED",
        "AUTH", "LOGIN", "LOGOUT", "SECURITY", "TOKEN",
        "ADMS", "MATTER", "DOCUMENT", "USER", "ACTIVITY"
    );

    private ActivityRules() {
        // Utility class
    }

    public static boolean isReserved(String activity) {
        return RESERVED_ACTIVITIES.contains(TextNormalizer.normalizeActivity(activity));
    }

    public static boolean isValid(String activity, ActivityScope scope, boolean custom) {
        requireScope(scope);
        if (TextNormalizer.isBlank(activity)) {
            return false;
        }
        String trimmed = activity.strip();
        return hasValidLength(trimmed)
            && !isReserved(trimmed)
            && (custom || scope.isAllowed(trimmed))
            && TextFormat.shortTextProblem(trimmed) == null
            && trimmed.equals(activity);
    }

    /**
     * Validates an activity name against the rules of its scope.
     *
     * @param custom when true the allowed-set membership check is skipped
     */
    public static List<ValidationViolation> validate(String activity, ActivityScope scope,
                                                     boolean custom, String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        requireScope(scope);
        List<ValidationViolation> violations = new ArrayList<>();
        if (TextNormalizer.isBlank(activity)) {
            violations.add(ValidationViolation.of(
                fieldName + " is required for activity classification.", fieldName));
            return violations;
        }
        String trimmed = activity.strip();
        if (!hasValidLength(trimmed)) {
            violations.add(ValidationViolation.of(
                String.format("%s must be between %d and %d characters.", fieldName, MIN_LENGTH, MAX_LENGTH),
                fieldName));
        }
        if (isReserved(trimmed)) {
            violations.add(ValidationViolation.of(
                fieldName + " is a reserved activity name and cannot be used.", fieldName));
        }
        if (!custom && !scope.isAllowed(trimmed)) {
            violations.add(ValidationViolation.of(
                String.format("%s '%s' is not a recognized %s activity. Allowed activities: %s",
                    fieldName, trimmed, scope.getDisplayName().toLowerCase(), scope.allowedActivitiesList()),
                fieldName));
        }
        String formatProblem = TextFormat.shortTextProblem(trimmed);
        if (formatProblem != null) {
            violations.add(ValidationViolation.of(fieldName + " " + formatProblem, fieldName));
        }
        if (!trimmed.equals(activity)) {
            violations.add(ValidationViolation.of(
                fieldName + " should not have leading or trailing whitespace.", fieldName));
        }
        return violations;
    }

    /**
     * Whether a matter activity can apply to a matter in the given state.
     * CREATED never applies to a matter that already exists.
     */
    public static boolean isAppropriateForMatterStatus(String activity, boolean archived, boolean deleted) {
        if (TextNormalizer.isBlank(activity)) {
            return false;
        }
        return switch (TextNormalizer.normalizeActivity(activity)) {
            case ARCHIVED -> !archived && !deleted;
            case UNARCHIVED -> archived && !deleted;
            case DELETED -> !deleted;
            case RESTORED -> deleted;
            case CREATED -> false;
            case VIEWED -> !deleted;
            default -> true;
        };
    }

    public static List<ValidationViolation> validateMatterContext(String activity, boolean archived,
                                                                  boolean deleted, String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        if (TextNormalizer.isBlank(activity) || isAppropriateForMatterStatus(activity, archived, deleted)) {
            return List.of();
        }
        String status;
        if (deleted && archived) {
            status = "archived and deleted";
        } else if (deleted) {
            status = "deleted";
        } else if (archived) {
            status = "archived";
        } else {
            status = "active";
        }
        return List.of(ValidationViolation.of(
            String.format("Activity '%s' is not appropriate for a %s matter.", activity.strip(), status),
            fieldName));
    }

    /**
     * Whether a revision activity can apply given whether the revision exists yet
     * and whether it is deleted. CREATED only applies to a revision that does not exist.
     */
    public static boolean isAppropriateForRevisionContext(String activity, boolean revisionExists, boolean deleted) {
        if (TextNormalizer.isBlank(activity)) {
            return false;
        }
        return switch (TextNormalizer.normalizeActivity(activity)) {
            case CREATED -> !revisionExists;
            case SAVED, DELETED -> revisionExists && !deleted;
            case RESTORED -> revisionExists && deleted;
            default -> true;
        };
    }

    /**
     * Checks a document activity against the document's check-out and deletion state
     * and, when known, the activity recorded just before it.
     */
    public static List<ValidationViolation> validateDocumentSequence(String currentActivity, String previousActivity,
                                                                     boolean checkedOut, boolean deleted,
                                                                     String fieldName) {
        IdentifierRules.requireFieldName(fieldName);
        List<ValidationViolation> violations = new ArrayList<>();
        if (TextNormalizer.isBlank(currentActivity)) {
            return violations;
        }
        String current = TextNormalizer.normalizeActivity(currentActivity);
        switch (current) {
            case CHECKED_IN:
                if (!checkedOut) {
                    violations.add(sequenceViolation(fieldName, "Cannot check in document that is not checked out."));
                }
                break;
            case CHECKED_OUT:
                if (checkedOut) {
                    violations.add(sequenceViolation(fieldName, "Cannot check out document that is already checked out."));
                }
                if (deleted) {
                    violations.add(sequenceViolation(fieldName, "Cannot check out deleted document."));
                }
                break;
            case SAVED:
                if (!checkedOut) {
                    violations.add(sequenceViolation(fieldName, "Document must be checked out before saving changes."));
                }
                if (deleted) {
                    violations.add(sequenceViolation(fieldName, "Cannot save deleted document."));
                }
                break;
            case DELETED:
                if (deleted) {
                    violations.add(sequenceViolation(fieldName, "Document is already deleted."));
                }
                break;
            case RESTORED:
                if (!deleted) {
                    violations.add(sequenceViolation(fieldName, "Cannot restore document that is not deleted."));
                }
                break;
            default:
                break;
        }

        if (TextNormalizer.isBlank(previousActivity)) {
            return violations;
        }
        String previous = TextNormalizer.normalizeActivity(previousActivity);
        if (CHECKED_IN.equals(current) && !CHECKED_OUT.equals(previous) && !SAVED.equals(previous)) {
            violations.add(sequenceViolation(fieldName, "Check-in should follow check-out or save operations."));
        } else if (RESTORED.equals(current) && !DELETED.equals(previous)) {
            violations.add(sequenceViolation(fieldName, "Restore operation should follow deletion."));
        }
        return violations;
    }

    /**
     * Reporting category of a document activity.
     */
    public static String documentActivityCategory(String activity) {
        return switch (TextNormalizer.normalizeActivity(activity)) {
            case CREATED -> "Creation";
            case SAVED -> "Modification";
            case CHECKED_IN, CHECKED_OUT -> "Version Control";
            case DELETED, RESTORED -> "Lifecycle";
            default -> "Unknown";
        };
    }

    private static ValidationViolation sequenceViolation(String fieldName, String message) {
        return ValidationViolation.of(fieldName + ": " + message, fieldName);
    }

    private static void requireScope(ActivityScope scope) {
        if (scope == null) {
            throw new IllegalArgumentException("Activity scope is required");
        }
    }

    private static boolean hasValidLength(String trimmed) {
        return trimmed.length() >= MIN_LENGTH && trimmed.length() <= MAX_LENGTH;
    }
}
