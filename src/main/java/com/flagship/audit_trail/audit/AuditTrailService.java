package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.config.AuditTrailProperties;
import com.flagship.audit_trail.entity.DocumentActivityUserEntity;
import com.flagship.audit_trail.entity.MatterActivityUserEntity;
import com.flagship.audit_trail.entity.RevisionActivityUserEntity;
import com.flagship.audit_trail.entity.TransferAuditEntity;
import com.flagship.audit_trail.exception.AuditValidationException;
import com.flagship.audit_trail.validation.CollectionRules;
import com.flagship.audit_trail.validation.CreationResult;
import com.flagship.audit_trail.validation.Validatable;
import com.flagship.audit_trail.validation.ValidationViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for recording and reporting audit-trail activity.
 *
 * Recording validates input through the record factories and returns the outcome;
 * nothing is persisted here. Batch conversion maps persisted rows back into
 * records, skipping corrupt rows when {@code audit-trail.skip-invalid-on-batch} is set.
 *
 * Key principles:
 * - Rejected input is logged with identifiers only
 * - All temporal checks read the injected clock
 * - Reporting never mutates its input
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditTrailService {

    private static final String MISSING = "unknown";

    private final Clock clock;
    private final AuditTrailProperties properties;

    public CreationResult<MatterActivityUser> recordMatterActivity(UUID matterId, UUID activityId, UUID userId,
                                                                   Instant timestamp) {
        return logOutcome("matter activity", matterId,
            MatterActivityUser.fromSource(matterId, activityId, userId, timestamp, clock));
    }

    public CreationResult<DocumentActivityUser> recordDocumentActivity(UUID documentId, UUID activityId, UUID userId,
                                                                       Instant timestamp) {
        return logOutcome("document activity", documentId,
            DocumentActivityUser.fromSource(documentId, activityId, userId, timestamp, clock));
    }

    public CreationResult<RevisionActivityUser> recordRevisionActivity(UUID revisionId, UUID activityId, UUID userId,
                                                                       Instant timestamp) {
        return logOutcome("revision activity", revisionId,
            RevisionActivityUser.fromSource(revisionId, activityId, userId, timestamp, clock));
    }

    /**
     * Records both sides of a document transfer with a shared timestamp.
     *
     * @param timestamp when the transfer happened, or {@code null} for now
     * @return the FROM/TO pair, or the violations of either side
     */
    public CreationResult<TransferReconciliation.TransferPair> recordTransfer(UUID sourceMatterId,
                                                                              UUID destinationMatterId,
                                                                              UUID documentId, UUID activityId,
                                                                              UUID userId, Instant timestamp) {
        Instant createdAt = timestamp != null ? timestamp : clock.instant();
        CreationResult<MatterDocumentActivityUser> from = MatterDocumentActivityUser.fromSource(
            TransferDirection.FROM, sourceMatterId, documentId, activityId, userId, createdAt, clock);
        CreationResult<MatterDocumentActivityUser> to = MatterDocumentActivityUser.fromSource(
            TransferDirection.TO, destinationMatterId, documentId, activityId, userId, createdAt, clock);

        List<ValidationViolation> violations = new ArrayList<>();
        if (sourceMatterId != null && sourceMatterId.equals(destinationMatterId)) {
            violations.add(ValidationViolation.of(
                "Source and destination matters must be different.", "SourceMatterId", "DestinationMatterId"));
        }
        from.getViolations().forEach(v -> violations.add(v.prefixed("From")));
        to.getViolations().forEach(v -> violations.add(v.prefixed("To")));

        CreationResult<TransferReconciliation.TransferPair> result = violations.isEmpty()
            ? CreationResult.success(new TransferReconciliation.TransferPair(from.getValue(), to.getValue()))
            : CreationResult.failure(violations);
        return logOutcome("document transfer", documentId, result);
    }

    /**
     * Validates every record of a batch, reporting violations under {@code Records[i]}.
     */
    public List<ValidationViolation> validateRecords(List<? extends Validatable> records) {
        List<ValidationViolation> violations = CollectionRules.validateEach(records, "Records", true, clock);
        if (!violations.isEmpty()) {
            log.warn("Batch of {} audit records has {} violations", records == null ? 0 : records.size(),
                violations.size());
        }
        return violations;
    }

    public List<MatterActivityUser> convertMatterActivities(List<MatterActivityUserEntity> entities,
                                                            boolean includeNavigation) {
        return convertAll("matter activity", entities,
            entity -> MatterActivityUser.fromEntity(entity, includeNavigation, clock));
    }

    public List<DocumentActivityUser> convertDocumentActivities(List<DocumentActivityUserEntity> entities,
                                                                boolean includeNavigation) {
        return convertAll("document activity", entities,
            entity -> DocumentActivityUser.fromEntity(entity, includeNavigation, clock));
    }

    public List<RevisionActivityUser> convertRevisionActivities(List<RevisionActivityUserEntity> entities,
                                                                boolean includeNavigation) {
        return convertAll("revision activity", entities,
            entity -> RevisionActivityUser.fromEntity(entity, includeNavigation, clock));
    }

    /**
     * Converts rows from one transfer table.
     *
     * @param direction FROM for the source-side table, TO for the destination-side table
     */
    public List<MatterDocumentActivityUser> convertTransfers(List<TransferAuditEntity> entities,
                                                             TransferDirection direction,
                                                             boolean includeNavigation) {
        return convertAll("document transfer", entities,
            entity -> MatterDocumentActivityUser.fromEntity(entity, direction, includeNavigation, clock));
    }

    /**
     * Returns a copy sorted oldest first.
     */
    public <T extends AuditAssociation> List<T> chronological(List<T> records) {
        List<T> sorted = new ArrayList<>(records);
        sorted.sort(AuditAssociation.CHRONOLOGICAL);
        return sorted;
    }

    /**
     * Records within the configured recent window, in input order.
     */
    public <T extends AuditAssociation> List<T> recent(List<T> records) {
        int windowDays = properties.getRecentWindowDays();
        return records.stream()
            .filter(record -> record.isRecent(windowDays, clock))
            .collect(Collectors.toList());
    }

    public TransferReconciliation reconcileTransfers(List<MatterDocumentActivityUser> records) {
        TransferReconciliation reconciliation = TransferReconciliation.reconcile(records);
        reconciliation.getUnmatchedFrom().forEach(record ->
            log.warn("Transfer has no matching TO record: documentId={}, matterId={}, createdAt={}",
                record.getDocumentId(), record.getMatterId(), record.getCreatedAt()));
        reconciliation.getUnmatchedTo().forEach(record ->
            log.warn("Transfer has no matching FROM record: documentId={}, matterId={}, createdAt={}",
                record.getDocumentId(), record.getMatterId(), record.getCreatedAt()));
        log.debug("Reconciled transfers: pairs={}, unmatched={}",
            reconciliation.getPairs().size(), reconciliation.unmatchedCount());
        return reconciliation;
    }

    /**
     * Audit report lines, oldest first, rendered in the configured display zone.
     */
    public List<String> auditMessages(List<? extends AuditAssociation> records) {
        List<AuditAssociation> sorted = new ArrayList<>(records);
        sorted.sort(AuditAssociation.CHRONOLOGICAL);
        return sorted.stream()
            .map(record -> record.auditMessage(properties.displayZoneId(), MISSING))
            .collect(Collectors.toList());
    }

    private <T> CreationResult<T> logOutcome(String recordType, UUID subjectId, CreationResult<T> result) {
        MDC.put("subjectId", String.valueOf(subjectId));
        try {
            if (result.isFailure()) {
                log.warn("Rejected {} audit entry: violations={}", recordType,
                    result.getViolations().stream().map(ValidationViolation::getMemberNames).collect(Collectors.toList()));
            } else {
                log.debug("Recorded {} audit entry", recordType);
            }
            return result;
        } finally {
            MDC.remove("subjectId");
        }
    }

    private <E, R> List<R> convertAll(String recordType, List<E> entities, Function<E, R> converter) {
        List<R> converted = new ArrayList<>(entities.size());
        int skipped = 0;
        for (E entity : entities) {
            try {
                converted.add(converter.apply(entity));
            } catch (AuditValidationException e) {
                if (!properties.isSkipInvalidOnBatch()) {
                    throw e;
                }
                skipped++;
                log.warn("Skipping invalid {} row: {}", recordType, e.getMessage());
            }
        }
        log.debug("Converted {} {} rows, skipped {}", converted.size(), recordType, skipped);
        return converted;
    }
}
