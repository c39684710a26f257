package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.entity.DocumentActivityUserEntity;
import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.ActivityScope;
import com.flagship.audit_trail.model.Document;
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

/**
 * Audit record: a user performed a document activity (CHECKED OUT, SAVED, ...) on a document.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DocumentActivityUser implements AuditAssociation, Validatable, Comparable<DocumentActivityUser> {

    private static final Comparator<DocumentActivityUser> ORDER = Comparator
        .<DocumentActivityUser, DocumentActivityUser>comparing(r -> r, AuditAssociation.CHRONOLOGICAL)
        .thenComparing(DocumentActivityUser::getDocumentActivityId, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(DocumentActivityUser::getUserId, Comparator.nullsFirst(Comparator.naturalOrder()));

    @NotNull
    @EqualsAndHashCode.Include
    UUID documentId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID documentActivityId;

    @NotNull
    @EqualsAndHashCode.Include
    UUID userId;

    @NotNull
    @EqualsAndHashCode.Include
    Instant createdAt;

    Document document;
    Activity documentActivity;
    User user;

    public static CreationResult<DocumentActivityUser> fromSource(UUID documentId, UUID activityId, UUID userId,
                                                                  Instant timestamp, Clock clock) {
        DocumentActivityUser record = DocumentActivityUser.builder()
            .documentId(documentId)
            .documentActivityId(activityId)
            .userId(userId)
            .createdAt(timestamp != null ? timestamp : clock.instant())
            .build();
        List<ValidationViolation> violations = record.validate(clock);
        return violations.isEmpty() ? CreationResult.success(record) : CreationResult.failure(violations);
    }

    public static CreationResult<DocumentActivityUser> fromSource(UUID documentId, UUID activityId, UUID userId,
                                                                  Instant timestamp) {
        return fromSource(documentId, activityId, userId, timestamp, Clock.systemUTC());
    }

    public static DocumentActivityUser fromEntity(DocumentActivityUserEntity entity) {
        return fromEntity(entity, false, Clock.systemUTC());
    }

    public static DocumentActivityUser fromEntity(DocumentActivityUserEntity entity, boolean includeNavigation,
                                                  Clock clock) {
        Objects.requireNonNull(entity, "Document activity entity is required");
        DocumentActivityUserBuilder builder = DocumentActivityUser.builder()
            .documentId(entity.getDocumentId())
            .documentActivityId(entity.getDocumentActivityId())
            .userId(entity.getUserId())
            .createdAt(entity.getCreatedAt());
        if (includeNavigation) {
            builder.document(entity.getDocument() != null ? Document.from(entity.getDocument()) : null)
                .documentActivity(entity.getDocumentActivity() != null
                    ? Activity.from(entity.getDocumentActivity(), ActivityScope.DOCUMENT) : null)
                .user(entity.getUser() != null ? User.from(entity.getUser()) : null);
        }
        DocumentActivityUser record = builder.build();
        return AuditRecords.requireValid("document activity audit entry", record, record.validate(clock));
    }

    @Override
    public UUID getSubjectId() {
        return documentId;
    }

    @Override
    public UUID getActivityId() {
        return documentActivityId;
    }

    @Override
    public Activity getActivity() {
        return documentActivity;
    }

    @Override
    public List<ValidationViolation> validate(Clock clock) {
        List<ValidationViolation> violations = new ArrayList<>();
        AuditRecords.validateKey(violations, documentId, "DocumentId");
        AuditRecords.validateKey(violations, documentActivityId, "DocumentActivityId");
        AuditRecords.validateKey(violations, userId, "UserId");
        AuditRecords.validateTimestamp(violations, createdAt, clock);
        AuditRecords.validateAttached(violations, document, "Document", documentId, "DocumentId", clock);
        AuditRecords.validateAttached(violations, documentActivity, "DocumentActivity", documentActivityId,
            "DocumentActivityId", clock);
        AuditRecords.validateAttached(violations, user, "User", userId, "UserId", clock);
        return violations;
    }

    @Override
    public boolean isValid(Clock clock) {
        return IdentifierRules.isValid(documentId)
            && IdentifierRules.isValid(documentActivityId)
            && IdentifierRules.isValid(userId)
            && AuditRecords.isValidTimestamp(createdAt, clock)
            && AuditRecords.isValidAttached(document, documentId, clock)
            && AuditRecords.isValidAttached(documentActivity, documentActivityId, clock)
            && AuditRecords.isValidAttached(user, userId, clock);
    }

    /**
     * Reporting category of the attached activity, {@code "Unknown"} when none is attached.
     */
    public String category() {
        return documentActivity == null ? "Unknown" : ActivityRules.documentActivityCategory(documentActivity.getActivity());
    }

    /**
     * Checks this activity against the attached document's state and the activity recorded before it.
     * Nothing is reported when the document or activity is not attached.
     */
    public List<ValidationViolation> validateSequence(String previousActivity) {
        if (document == null || documentActivity == null) {
            return List.of();
        }
        return ActivityRules.validateDocumentSequence(documentActivity.getActivity(), previousActivity,
            document.isCheckedOut(), document.isDeleted(), "DocumentActivity");
    }

    @Override
    public String describeSubject(String missing) {
        return AuditRecords.label(document, missing);
    }

    @Override
    public String summary(String missing) {
        return AuditRecords.label(document, missing) + " "
            + AuditRecords.label(documentActivity, missing) + " by "
            + AuditRecords.label(user, missing);
    }

    @Override
    public String summary() {
        return AuditRecords.label(document, "Document") + " "
            + AuditRecords.label(documentActivity, "ACTIVITY") + " by "
            + AuditRecords.label(user, "User");
    }

    @Override
    public int compareTo(DocumentActivityUser other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return summary();
    }
}
