package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.entity.MatterActivityUserEntity;
import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.ActivityScope;
import com.flagship.audit_trail.model.Matter;
import com.flagship.audit_trail.model.User;
import com.flagship.audit_trail.validation.ActivityRules;
import com.flagship.audit_trail.validation.CreationResult;
import com.flagship.audit_trail.validation.IdentifierRules;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import static com.flagship.audit_trail.model.ActivityNames.*;

/**
 * Audit record: a user performed a matter activity (CREATED, ARCHIVED, VIEWED, ...) on a matter.
 *
 * Equality and ordering use the composite key only; attached sub-records are ignored.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MatterActivityUser implements AuditAssociation, Validatable, Comparable<MatterActivityUser> {

    private static final Comparator<MatterActivityUser> ORDER = Comparator
        .<MatterActivityUser, MatterActivityUser>comparing(r -> r, AuditAssociation.CHRONOLOGICAL)
        .thenComparing(MatterActivityUser::getMatterActivityId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(MatterActivityUser::getUserId, Comparator.nullsFirst(Comparator.naturalOrder()));

    @NotNull
    @EqualsAndHashCode.Include
    UUID matterId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID matterActivityId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID userId;

    @NotNull
    @EqualsAndHashCode.Include
    Instant createdAt;

    Matter matter;
    Activity matterActivity;
    User user;

    /**
     * Creates a record from raw identifiers, defaulting the timestamp to {@code clock.instant()}.
     *
     * @return the record, or every violation that prevented its creation
     */
    public static CreationResult<MatterActivityUser> fromSource(UUID matterId, UUID activityId, UUID userId,
                                                                Instant timestamp, Clock clock) {
        MatterActivityUser record = MatterActivityUser.builder()
            .matterId(matterId)
            .matterActivityId(activityId)
            .userId(userId)
            .createdAt(timestamp != null ? timestamp : clock.instant())
            .build();
        List<ValidationViolation> violations = record.validate(clock);
        return violations.isEmpty() ? CreationResult.success(record) : CreationResult.failure(violations);
    }

    public static CreationResult<MatterActivityUser> fromSource(UUID matterId, UUID activityId, UUID userId,
                                                                Instant timestamp) {
        return fromSource(matterId, activityId, userId, timestamp, Clock.systemUTC());
    }

    public static MatterActivityUser fromEntity(MatterActivityUserEntity entity) {
        return fromEntity(entity, false, Clock.systemUTC());
    }

    /**
     * Maps a junction row, optionally with its attached matter, activity and user rows.
     *
     * @throws com.flagship.audit_trail.exception.AuditValidationException if the mapped record is invalid
     */
    public static MatterActivityUser fromEntity(MatterActivityUserEntity entity, boolean includeNavigation, Clock clock) {
        Objects.requireNonNull(entity, "Matter activity entity is required");
        MatterActivityUserBuilder builder = MatterActivityUser.builder()
            .matterId(entity.getMatterId())
            .matterActivityId(entity.getMatterActivityId())
            .userId(entity.getUserId())
            .createdAt(entity.getCreatedAt());
        if (includeNavigation) {
            builder.matter(entity.getMatter() != null ? Matter.from(entity.getMatter()) : null)
                .matterActivity(entity.getMatterActivity() != null
                    ? Activity.from(entity.getMatterActivity(), ActivityScope.MATTER) : null)
                .user(entity.getUser() != null ? User.from(entity.getUser()) : null);
        }
        MatterActivityUser record = builder.build();
        return AuditRecords.requireValid("matter activity audit entry", record, record.validate(clock));
    }

    @Override
    public UUID getSubjectId() {
        return matterId;
    }

    @Override
    public UUID getActivityId() {
        return matterActivityId;
    }

    @Override
    public Activity getActivity() {
        return matterActivity;
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        AuditRecords.validateKey(violations, matterId, "MatterId");
        AuditRecords.validateKey(violations, matterActivityId, "MatterActivityId");
        AuditRecords.validateKey(violations, userId, "UserId");
        AuditRecords.validateTimestamp(violations, createdAt, clock);
        AuditRecords.validateAttached(violations, matter, "Matter", matterId, "MatterId", clock);
        AuditRecords.validateAttached(violations, matterActivity, "MatterActivity", matterActivityId,
            "MatterActivityId", clock);
        AuditRecords.validateAttached(violations, user, "User", userId, "UserId", clock);
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(matterId)
            && IdentifierRules.isValid(matterActivityId)
            && IdentifierRules.isValid(userId)
            && AuditRecords.isValidTimestamp(createdAt, clock)
            && AuditRecords.isValidAttached(matter, matterId, clock)
            && AuditRecords.isValidAttached(matterActivity, matterActivityId, clock)
            && AuditRecords.isValidAttached(user, userId, clock);
    }

    /**
     * Matter lifecycle covers archival and deletion transitions, not creation.
     */
    @Override
    public boolean isLifecycleOperation() {
        return activityIs(ARCHIVED) || activityIs(UNARCHIVED) || isDeletion() || isRestoration();
    }

    /**
     * Whether the attached activity makes sense for the attached matter's current state.
     * True when either is missing.
     */
    public boolean isAppropriateForMatterStatus() {
        if (matter == null || matterActivity == null) {
            return true;
        }
        return ActivityRules.isAppropriateForMatterStatus(
            matterActivity.getActivity(), matter.isArchived(), matter.isDeleted());
    }

    public List<ValidationViolation> validateMatterContext() {
        if (matter == null || matterActivity == null) {
            return List.of();
        }
        return ActivityRules.validateMatterContext(
            matterActivity.getActivity(), matter.isArchived(), matter.isDeleted(), "MatterActivity");
    }

    @Override
    public String describeSubject(String missing) {
        return AuditRecords.label(matter, missing);
    }

    @Override
    public String summary(String missing) {
        return AuditRecords.label(matter, missing) + " "
            + AuditRecords.label(matterActivity, missing) + " by "
            + AuditRecords.label(user, missing);
    }

    @Override
    public String summary() {
        return AuditRecords.label(matter, "Matter") + " "
            + AuditRecords.label(matterActivity, "ACTIVITY") + " by "
            + AuditRecords.label(user, "User");
    }

    @Override
    public int compareTo(MatterActivityUser other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return summary();
    }
}
