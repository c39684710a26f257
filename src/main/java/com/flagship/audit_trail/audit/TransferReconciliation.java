package com.flagship.audit_trail.audit;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of pairing FROM and TO transfer records.
 *
 * Records pair up on (document, activity, user, timestamp). A side left without a
 * counterpart is a compliance concern to report, not a validation failure.
 */
@Value
public class TransferReconciliation {

    List<TransferPair> pairs;
    List<MatterDocumentActivityUser> unmatchedFrom;
    List<MatterDocumentActivityUser> unmatchedTo;

    @Value
    public static class TransferPair {
        MatterDocumentActivityUser from;
        MatterDocumentActivityUser to;

        public UUID getSourceMatterId() {
            return from.getMatterId();
        }

        public UUID getDestinationMatterId() {
            return to.getMatterId();
        }
    }

    /**
     * Pairs each FROM record with one TO record sharing its transfer key, in input order.
     * Records without a direction are ignored.
     */
    public static TransferReconciliation reconcile(List<MatterDocumentActivityUser> records) {
        Map<TransferKey, Deque<MatterDocumentActivityUser>> pendingTo = new LinkedHashMap<>();
        for (MatterDocumentActivityUser record : records) {
            if (record.isTo()) {
                pendingTo.computeIfAbsent(TransferKey.of(record), key -> new ArrayDeque<>()).add(record);
            }
        }

        List<TransferPair> pairs = new ArrayList<>();
        List<MatterDocumentActivityUser> unmatchedFrom = new ArrayList<>();
        for (MatterDocumentActivityUser record : records) {
            if (!record.isFrom()) {
                continue;
            }
            Deque<MatterDocumentActivityUser> candidates = pendingTo.get(TransferKey.of(record));
            if (candidates == null || candidates.isEmpty()) {
                unmatchedFrom.add(record);
            } else {
                pairs.add(new TransferPair(record, candidates.poll()));
            }
        }

        List<MatterDocumentActivityUser> unmatchedTo = new ArrayList<>();
        pendingTo.values().forEach(unmatchedTo::addAll);
        return new TransferReconciliation(List.copyOf(pairs), List.copyOf(unmatchedFrom), List.copyOf(unmatchedTo));
    }

    public boolean isBalanced() {
        return unmatchedFrom.isEmpty() && unmatchedTo.isEmpty();
    }

    public int unmatchedCount() {
        return unmatchedFrom.size() + unmatchedTo.size();
    }

    @Value
    private static class TransferKey {
        UUID documentId;
        UUID activityId;
        UUID userId;
        Instant createdAt;

        static TransferKey of(MatterDocumentActivityUser record) {
            return new TransferKey(record.getDocumentId(), record.getMatterDocumentActivityId(),
                record.getUserId(), record.getCreatedAt());
        }
    }
}
