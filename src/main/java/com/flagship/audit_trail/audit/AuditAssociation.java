package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.User;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.UUID;

import static com.flagship.audit_trail.model.ActivityNames.*;

/**
 * Junction record stating that a user performed an activity on a subject at a point in time.
 *
 * The composite key is (subject id(s), activity id, user id, createdAt). Attached
 * sub-records (activity, user, subject) are optional navigation data: queries
 * and display fall back to placeholders when they are missing.
 */
public interface AuditAssociation {

    /**
     * Oldest first, ties broken by subject id.
     */
    Comparator<AuditAssociation> CHRONOLOGICAL = Comparator
        .comparing(AuditAssociation::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(AuditAssociation::getSubjectId, Comparator.nullsFirst(Comparator.naturalOrder()));

    double MILLIS_PER_DAY = 86_400_000d;

    UUID getSubjectId();

    UUID getActivityId();

    UUID getUserId();

    Instant getCreatedAt();

    /**
     * Attached activity, or {@code null} when it was not loaded.
     */
    Activity getActivity();

    /**
     * Attached user, or {@code null} when it was not loaded.
     */
    User getUser();

    /**
     * Subject as it reads in an audit message, e.g. {@code "Contract.pdf FROM Smith Trust"}.
     */
    String describeSubject(String missing);

    /**
     * {@code "<subject> <ACTIVITY> by <user>"} with {@code missing} standing in for any absent part.
     */
    String summary(String missing);

    /**
     * Summary using a per-part default for each absent part.
     */
    String summary();

    /**
     * Audit report line: {@code "On Monday, 01 January 2024 10:15:00, <user> <ACTIVITY> <subject>"}.
     */
    default String auditMessage(ZoneId zone, String missing) {
        return "On " + AuditRecords.formatTimestamp(getCreatedAt(), zone) + ", "
            + AuditRecords.label(getUser(), missing) + " "
            + AuditRecords.label(getActivity(), missing) + " "
            + describeSubject(missing);
    }

    /**
     * Fractional days elapsed since the record was created. Negative for timestamps
     * inside the future tolerance.
     */
    default double ageInDays(Clock clock) {
        if (getCreatedAt() == null) {
            throw new IllegalStateException("Audit record has no timestamp");
        }
        return Duration.between(getCreatedAt(), clock.instant()).toMillis() / MILLIS_PER_DAY;
    }

    default boolean isRecent(int withinDays, Clock clock) {
        if (withinDays < 0) {
            throw new IllegalArgumentException("withinDays must not be negative");
        }
        return ageInDays(clock) <= withinDays;
    }

    default boolean activityIs(String activityName) {
        Activity activity = getActivity();
        return activity != null && activity.is(activityName);
    }

    default boolean isCreation() {
        return activityIs(CREATED);
    }

    default boolean isDeletion() {
        return activityIs(DELETED);
    }

    default boolean isRestoration() {
        return activityIs(RESTORED);
    }

    default boolean isViewing() {
        return activityIs(VIEWED);
    }

    default boolean isSave() {
        return activityIs(SAVED);
    }

    default boolean isCheckIn() {
        return activityIs(CHECKED_IN);
    }

    default boolean isCheckOut() {
        return activityIs(CHECKED_OUT);
    }

    default boolean isVersionControlOperation() {
        return isCheckIn() || isCheckOut();
    }

    default boolean isMove() {
        return activityIs(MOVED);
    }

    default boolean isCopy() {
        return activityIs(COPIED);
    }

    default boolean isTransfer() {
        return isMove() || isCopy();
    }

    default boolean isLifecycleOperation() {
        return isCreation() || isDeletion() || isRestoration();
    }
}
