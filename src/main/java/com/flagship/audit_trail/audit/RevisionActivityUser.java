package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.entity.RevisionActivityUserEntity;
import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.ActivityScope;
import com.flagship.audit_trail.model.Revision;
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
import java.util.Optional;
import java.util.UUID;

/**
 * Audit record: a user performed a revision activity (CREATED, SAVED, ...) on a document revision.
 *
 * Revision lifecycle is creation, deletion and restoration; SAVED counts as a modification.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RevisionActivityUser implements AuditAssociation, Validatable, Comparable<RevisionActivityUser> {

    private static final Comparator<RevisionActivityUser> ORDER = Comparator
        .<RevisionActivityUser, RevisionActivityUser>comparing(r -> r, AuditAssociation.CHRONOLOGICAL)
        .thenComparing(RevisionActivityUser::getRevisionActivityId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(RevisionActivityUser::getUserId, Comparator.nullsFirst(Comparator.naturalOrder()));

    @NotNull
    @EqualsAndHashCode.Include
    UUID revisionId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID revisionActivityId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID userId;

    @NotNull
    @EqualsAndHashCode.Include
    Instant createdAt;

    Revision revision;
    Activity revisionActivity;
    User user;

    public static CreationResult<RevisionActivityUser> fromSource(UUID revisionId, UUID activityId, UUID userId,
                                                                  Instant timestamp, Clock clock) {
        RevisionActivityUser record = RevisionActivityUser.builder()
            .revisionId(revisionId)
            .revisionActivityId(activityId)
            .userId(userId)
            .createdAt(timestamp != null ? timestamp : clock.instant())
            .build();
        List<ValidationViolation> violations = record.validate(clock);
        return violations.isEmpty() ? CreationResult.success(record) : CreationResult.failure(violations);
    }

    public static CreationResult<RevisionActivityUser> fromSource(UUID revisionId, UUID activityId, UUID userId,
                                                                  Instant timestamp) {
        return fromSource(revisionId, activityId, userId, timestamp, Clock.systemUTC());
    }

    public static RevisionActivityUser fromEntity(RevisionActivityUserEntity entity) {
        return fromEntity(entity, false, Clock.systemUTC());
    }

    public static RevisionActivityUser fromEntity(RevisionActivityUserEntity entity, boolean includeNavigation,
                                                  Clock clock) {
        Objects.requireNonNull(entity, "Revision activity entity is required");
        RevisionActivityUserBuilder builder = RevisionActivityUser.builder()
            .revisionId(entity.getRevisionId())
            .revisionActivityId(entity.getRevisionActivityId())
            .userId(entity.getUserId())
            .createdAt(entity.getCreatedAt());
        if (includeNavigation) {
            builder.revision(entity.getRevision() != null ? Revision.from(entity.getRevision()) : null)
                .revisionActivity(entity.getRevisionActivity() != null
                    ? Activity.from(entity.getRevisionActivity(), ActivityScope.REVISION) : null)
                .user(entity.getUser() != null ? User.from(entity.getUser()) : null);
        }
        RevisionActivityUser record = builder.build();
        return AuditRecords.requireValid("revision activity audit entry", record, record.validate(clock));
    }

    @Override
    public UUID getSubjectId() {
        return revisionId;
    }

    @Override
    public UUID getActivityId() {
        return revisionActivityId;
    }

    @Override
    public Activity getActivity() {
        return revisionActivity;
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        AuditRecords.validateKey(violations, revisionId, "RevisionId");
        AuditRecords.validateKey(violations, revisionActivityId, "RevisionActivityId");
        AuditRecords.validateKey(violations, userId, "UserId");
        AuditRecords.validateTimestamp(violations, createdAt, clock);
        AuditRecords.validateAttached(violations, revision, "Revision", revisionId, "RevisionId", clock);
        AuditRecords.validateAttached(violations, revisionActivity, "RevisionActivity", revisionActivityId,
            "RevisionActivityId", clock);
        AuditRecords.validateAttached(violations, user, "User", userId, "UserId", clock);
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(revisionId)
            && IdentifierRules.isValid(revisionActivityId)
            && IdentifierRules.isValid(userId)
            && AuditRecords.isValidTimestamp(createdAt, clock)
            && AuditRecords.isValidAttached(revision, revisionId, clock)
            && AuditRecords.isValidAttached(revisionActivity, revisionActivityId, clock)
            && AuditRecords.isValidAttached(user, userId, clock);
    }

    /**
     * Whether the attached activity can apply to a revision in the given state.
     * True when the activity is not loaded.
     */
    public boolean isAppropriateForRevisionContext(boolean revisionExists, boolean deleted) {
        if (revisionActivity == null) {
            return true;
        }
        return ActivityRules.isAppropriateForRevisionContext(revisionActivity.getActivity(), revisionExists, deleted);
    }

    public boolean isModification() {
        return isSave();
    }

    /**
     * Document owning the attached revision, empty when the revision is not loaded.
     */
    public Optional<UUID> owningDocumentId() {
        return revision == null ? Optional.empty() : Optional.ofNullable(revision.getDocumentId());
    }

    @Override
    public String describeSubject(String missing) {
        return AuditRecords.label(revision, missing);
    }

    @Override
    public String summary(String missing) {
        return AuditRecords.label(revision, missing) + " "
            + AuditRecords.label(revisionActivity, missing) + " by "
            + AuditRecords.label(user, missing);
    }

    @Override
    public String summary() {
        return AuditRecords.label(revision, "Revision") + " "
            + AuditRecords.label(revisionActivity, "ACTIVITY") + " by "
            + AuditRecords.label(user, "User");
    }

    @Override
    public int compareTo(RevisionActivityUser other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return summary();
    }
}
