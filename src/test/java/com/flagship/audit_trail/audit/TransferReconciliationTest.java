package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.ActivityScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransferReconciliationTest {

    private static final Instant NOW = Instant.parse("2024-06-03T10:15:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private final UUID copiedId = Activity.getSeededActivityId(ActivityScope.MATTER_DOCUMENT, "COPIED");
    private final UUID userId = UUID.randomUUID();

    private MatterDocumentActivityUser side(TransferDirection direction, UUID matterId, UUID documentId, Instant at) {
        return MatterDocumentActivityUser.fromSource(direction, matterId, documentId, copiedId, userId, at, clock)
            .orElseThrow();
    }

    @Test
    @DisplayName("Matching FROM and TO records pair up")
    void testBalanced() {
        UUID documentId = UUID.randomUUID();
        UUID source = UUID.randomUUID();
        UUID destination = UUID.randomUUID();

        TransferReconciliation reconciliation = TransferReconciliation.reconcile(List.of(
            side(TransferDirection.TO, destination, documentId, NOW),
            side(TransferDirection.FROM, source, documentId, NOW)));

        assertTrue(reconciliation.isBalanced());
        assertEquals(1, reconciliation.getPairs().size());
        assertEquals(source, reconciliation.getPairs().get(0).getSourceMatterId());
        assertEquals(destination, reconciliation.getPairs().get(0).getDestinationMatterId());
    }

    @Test
    @DisplayName("Unmatched sides are reported, not rejected")
    void testUnmatched() {
        UUID documentId = UUID.randomUUID();
        MatterDocumentActivityUser orphanFrom = side(TransferDirection.FROM, UUID.randomUUID(), documentId, NOW);
        MatterDocumentActivityUser lateTo = side(TransferDirection.TO, UUID.randomUUID(), documentId, NOW.minusSeconds(5));

        TransferReconciliation reconciliation = TransferReconciliation.reconcile(List.of(orphanFrom, lateTo));

        assertFalse(reconciliation.isBalanced());
        assertEquals(List.of(orphanFrom), reconciliation.getUnmatchedFrom());
        assertEquals(List.of(lateTo), reconciliation.getUnmatchedTo());
        assertEquals(2, reconciliation.unmatchedCount());
    }

    @Test
    @DisplayName("Each TO record is used by one FROM record only")
    void testDuplicateFrom() {
        UUID documentId = UUID.randomUUID();
        UUID source = UUID.randomUUID();

        TransferReconciliation reconciliation = TransferReconciliation.reconcile(List.of(
            side(TransferDirection.FROM, source, documentId, NOW),
            side(TransferDirection.FROM, UUID.randomUUID(), documentId, NOW),
            side(TransferDirection.TO, UUID.randomUUID(), documentId, NOW)));

        assertEquals(1, reconciliation.getPairs().size());
        assertEquals(source, reconciliation.getPairs().get(0).getSourceMatterId());
        assertEquals(1, reconciliation.getUnmatchedFrom().size());
        assertTrue(reconciliation.getUnmatchedTo().isEmpty());
    }
}
