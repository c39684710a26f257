package com.flagship.audit_trail.model;

import com.flagship.audit_trail.normalization.TextNormalizer;
import com.flagship.audit_trail.validation.IdentifierRules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.audit_trail.model.ActivityNames.*;

/**
 * The entity type an activity classification applies to.
 *
 * Each scope owns a closed set of activity names together with the fixed
 * identifiers the database seed assigns to them. Identifier prefixes are
 * 1 (revision), 2 (document), 3 (matter) and 4 (matter document transfer).
 */
public enum ActivityScope {
    REVISION("Revision", 1, CREATED, DELETED, RESTORED, SAVED),
    DOCUMENT("Document", 2, CHECKED_IN, CHECKED_OUT, CREATED, DELETED, RESTORED, SAVED),
    MATTER("Matter", 3, ARCHIVED, CREATED, DELETED, RESTORED, UNARCHIVED, VIEWED),
    MATTER_DOCUMENT("Matter document", 4, COPIED, MOVED);

    private final String displayName;
    private final Map<String, UUID> seededIds;

    ActivityScope(String displayName, int seedPrefix, String... activities) {
        this.displayName = displayName;
        Map<String, UUID> ids = new LinkedHashMap<>();
        for (int i = 0; i < activities.length; i++) {
            ids.put(activities[i], UUID.fromString(
                String.format("%d0000000-0000-0000-0000-%012d", seedPrefix, i + 1)));
        }
        this.seededIds = Collections.unmodifiableMap(ids);
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Allowed activity names, in seed order.
     */
    public List<String> allowedActivities() {
        return List.copyOf(seededIds.keySet());
    }

    public String allowedActivitiesList() {
        return String.join(", ", seededIds.keySet());
    }

    /**
     * Case-insensitive, whitespace-insensitive membership test.
     */
    public boolean isAllowed(String activity) {
        return seededIds.containsKey(TextNormalizer.normalizeActivity(activity));
    }

    /**
     * Returns the seeded identifier for an activity name, or the nil UUID when
     * the name is blank or not part of this scope.
     */
    public UUID seededActivityId(String activityName) {
        return seededIds.getOrDefault(TextNormalizer.normalizeActivity(activityName), IdentifierRules.NIL);
    }

    /**
     * Reverse lookup of a seeded identifier.
     */
    public Optional<String> activityNameOf(UUID activityId) {
        return seededIds.entrySet().stream()
            .filter(entry -> entry.getValue().equals(activityId))
            .map(Map.Entry::getKey)
            .findFirst();
    }
}
