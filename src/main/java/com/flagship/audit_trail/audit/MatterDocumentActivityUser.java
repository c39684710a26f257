package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.entity.TransferAuditEntity;
import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.ActivityScope;
import com.flagship.audit_trail.model.Document;
import com.flagship.audit_trail.model.Matter;
import com.flagship.audit_trail.model.User;
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

/**
 * One side of a document transfer (MOVED or COPIED) between matters.
 *
 * A FROM record names the source matter, a TO record the destination. A complete
 * transfer is a FROM and a TO sharing document, activity, user and timestamp;
 * pairing is checked by {@link TransferReconciliation}, not by validation.
 * The direction is part of the key.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MatterDocumentActivityUser
    implements AuditAssociation, Validatable, Comparable<MatterDocumentActivityUser> {

    private static final Comparator<MatterDocumentActivityUser> ORDER = Comparator
        .<MatterDocumentActivityUser, MatterDocumentActivityUser>comparing(r -> r, AuditAssociation.CHRONOLOGICAL)
        .thenComparing(MatterDocumentActivityUser::getDirection, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(MatterDocumentActivityUser::getMatterId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(MatterDocumentActivityUser::getMatterDocumentActivityId,
            Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(MatterDocumentActivityUser::getUserId, Comparator.nullsFirst(Comparator.naturalOrder()));

    @NotNull
    @EqualsAndHashCode.Include
    TransferDirection direction;

    @NotNull
    @EqualsAndHashCode.Include
    UUID matterId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID documentId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID matterDocumentActivityId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID userId;

    @NotNull
    @EqualsAndHashCode.Include
    Instant createdAt;

    Matter matter;
    Document document;
    Activity matterDocumentActivity;
    User user;

    public static CreationResult<MatterDocumentActivityUser> fromSource(TransferDirection direction, UUID matterId,
                                                                        UUID documentId, UUID activityId,
                                                                        UUID userId, Instant timestamp, Clock clock) {
        MatterDocumentActivityUser record = MatterDocumentActivityUser.builder()
            .direction(direction)
            .matterId(matterId)
            .documentId(documentId)
            .matterDocumentActivityId(activityId)
            .userId(userId)
            .createdAt(timestamp != null ? timestamp : clock.instant())
            .build();
        List<ValidationViolation> violations = record.validate(clock);
        return violations.isEmpty() ? CreationResult.success(record) : CreationResult.failure(violations);
    }

    public static CreationResult<MatterDocumentActivityUser> fromSource(TransferDirection direction, UUID matterId,
                                                                        UUID documentId, UUID activityId,
                                                                        UUID userId, Instant timestamp) {
        return fromSource(direction, matterId, documentId, activityId, userId, timestamp, Clock.systemUTC());
    }

    public static MatterDocumentActivityUser fromEntity(TransferAuditEntity entity, TransferDirection direction) {
        return fromEntity(entity, direction, false, Clock.systemUTC());
    }

    /**
     * Maps a row read from the "from" or "to" transfer table.
     *
     * @param direction which table the row came from
     * @throws com.flagship.audit_trail.exception.AuditValidationException if the mapped record is invalid
     */
    public static MatterDocumentActivityUser fromEntity(TransferAuditEntity entity, TransferDirection direction,
                                                        boolean includeNavigation, Clock clock) {
        Objects.requireNonNull(entity, "Transfer entity is required");
        MatterDocumentActivityUserBuilder builder = MatterDocumentActivityUser.builder()
            .direction(direction)
            .matterId(entity.getMatterId())
            .documentId(entity.getDocumentId())
            .matterDocumentActivityId(entity.getMatterDocumentActivityId())
            .userId(entity.getUserId())
            .createdAt(entity.getCreatedAt());
        if (includeNavigation) {
            builder.matter(entity.getMatter() != null ? Matter.from(entity.getMatter()) : null)
                .document(entity.getDocument() != null ? Document.from(entity.getDocument()) : null)
                .matterDocumentActivity(entity.getMatterDocumentActivity() != null
                    ? Activity.from(entity.getMatterDocumentActivity(), ActivityScope.MATTER_DOCUMENT) : null)
                .user(entity.getUser() != null ? User.from(entity.getUser()) : null);
        }
        MatterDocumentActivityUser record = builder.build();
        return AuditRecords.requireValid("document transfer audit entry", record, record.validate(clock));
    }

    @Override
    public UUID getSubjectId() {
        return documentId;
    }

    @Override
    public UUID getActivityId() {
        return matterDocumentActivityId;
    }

    @Override
    public Activity getActivity() {
        return matterDocumentActivity;
    }

    public boolean isFrom() {
        return direction == TransferDirection.FROM;
    }

    public boolean isTo() {
        return direction == TransferDirection.TO;
    }

    /**
     * Whether {@code other} is the opposite side of the same transfer.
     */
    public boolean isCounterpartOf(MatterDocumentActivityUser other) {
        return other != null
            && direction != null
            && other.direction == direction.opposite()
            && Objects.equals(documentId, other.documentId)
            && Objects.equals(matterDocumentActivityId, other.matterDocumentActivityId)
            && Objects.equals(userId, other.userId)
            && Objects.equals(createdAt, other.createdAt);
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        if (direction == null) {
            violations.add(ValidationViolation.of("Direction is required for a document transfer.", "Direction"));
        }
        AuditRecords.validateKey(violations, matterId, "MatterId");
        AuditRecords.validateKey(violations, documentId, "DocumentId");
        AuditRecords.validateKey(violations, matterDocumentActivityId, "MatterDocumentActivityId");
        AuditRecords.validateKey(violations, userId, "UserId");
        AuditRecords.validateTimestamp(violations, createdAt, clock);
        AuditRecords.validateAttached(violations, matter, "Matter", matterId, "MatterId", clock);
        AuditRecords.validateAttached(violations, document, "Document", documentId, "DocumentId", clock);
        AuditRecords.validateAttached(violations, matterDocumentActivity, "MatterDocumentActivity",
            matterDocumentActivityId, "MatterDocumentActivityId", clock);
        AuditRecords.validateAttached(violations, user, "User", userId, "UserId", clock);
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return direction != null
            && IdentifierRules.isValid(matterId)
            && IdentifierRules.isValid(documentId)
            && IdentifierRules.isValid(matterDocumentActivityId)
            && IdentifierRules.isValid(userId)
            && AuditRecords.isValidTimestamp(createdAt, clock)
            && AuditRecords.isValidAttached(matter, matterId, clock)
            && AuditRecords.isValidAttached(document, documentId, clock)
            && AuditRecords.isValidAttached(matterDocumentActivity, matterDocumentActivityId, clock)
            && AuditRecords.isValidAttached(user, userId, clock);
    }

    @Override
    public String describeSubject(String missing) {
        String keyword = direction == null ? "BETWEEN" : direction.name();
        return AuditRecords.label(document, missing) + " " + keyword + " " + AuditRecords.label(matter, missing);
    }

    @Override
    public String summary(String missing) {
        return AuditRecords.label(document, missing) + " "
            + AuditRecords.label(matterDocumentActivity, missing) + " "
            + preposition() + " " + AuditRecords.label(matter, missing) + " by "
            + AuditRecords.label(user, missing);
    }

    @Override
    public String summary() {
        return AuditRecords.label(document, "Document") + " "
            + AuditRecords.label(matterDocumentActivity, "TRANSFERRED") + " "
            + preposition() + " " + AuditRecords.label(matter, "Matter") + " by "
            + AuditRecords.label(user, "User");
    }

    @Override
    public int compareTo(MatterDocumentActivityUser other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return summary();
    }

    private String preposition() {
        return direction == null ? "between" : direction.getPreposition();
    }
}
