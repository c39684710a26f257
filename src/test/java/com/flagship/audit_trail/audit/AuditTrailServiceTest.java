package com.flagship.audit_trail.audit;

import com.flagship.audit_trail.config.AuditTrailProperties;
import com.flagship.audit_trail.entity.MatterActivityUserEntity;
import com.flagship.audit_trail.entity.TransferAuditEntity;
import com.flagship.audit_trail.exception.AuditValidationException;
import com.flagship.audit_trail.model.Activity;
import com.flagship.audit_trail.model.ActivityScope;
import com.flagship.audit_trail.model.User;
import com.flagship.audit_trail.validation.CreationResult;
import com.flagship.audit_trail.validation.ValidationViolation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service wiring tests: fixed clock, test profile settings
 * (3 day recent window, Europe/London display zone).
 */
@SpringBootTest
@ActiveProfiles("test")
class AuditTrailServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-03T10:15:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private AuditTrailProperties properties;

    private UUID matterId;
    private UUID userId;
    private UUID viewedId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @BeforeEach
    void setUp() {
        matterId = UUID.randomUUID();
        userId = UUID.randomUUID();
        viewedId = Activity.getSeededActivityId(ActivityScope.MATTER, "VIEWED");
    }

    @Test
    @DisplayName("Test profile settings are bound")
    void testPropertiesBound() {
        assertEquals(3, properties.getRecentWindowDays());
        assertEquals("Europe/London", properties.getDisplayZone());
        assertTrue(properties.isSkipInvalidOnBatch());
    }

    @Test
    @DisplayName("Recording without a timestamp uses the injected clock")
    void testRecordMatterActivity() {
        printTestHeader("Record Matter Activity");

        CreationResult<MatterActivityUser> result =
            auditTrailService.recordMatterActivity(matterId, viewedId, userId, null);
        printOutput("Result", result);

        assertTrue(result.isSuccess());
        assertEquals(NOW, result.getValue().getCreatedAt());
    }

    @Test
    @DisplayName("Rejected input comes back as violations")
    void testRecordRejected() {
        CreationResult<DocumentActivityUser> document =
            auditTrailService.recordDocumentActivity(null, viewedId, userId, NOW);
        CreationResult<RevisionActivityUser> revision =
            auditTrailService.recordRevisionActivity(UUID.randomUUID(), viewedId, userId, NOW.plus(Duration.ofDays(1)));

        assertTrue(document.isFailure());
        assertTrue(document.getViolations().get(0).concerns("DocumentId"));
        assertTrue(revision.isFailure());
        assertTrue(revision.getViolations().get(0).concerns("CreatedAt"));
    }

    @Test
    @DisplayName("Transfer records a FROM and TO pair with one timestamp")
    void testRecordTransfer() {
        UUID destination = UUID.randomUUID();
        UUID documentId = UUID.randomUUID();
        UUID movedId = Activity.getSeededActivityId(ActivityScope.MATTER_DOCUMENT, "MOVED");

        TransferReconciliation.TransferPair pair = auditTrailService
            .recordTransfer(matterId, destination, documentId, movedId, userId, null)
            .orElseThrow();

        assertTrue(pair.getFrom().isFrom());
        assertTrue(pair.getTo().isTo());
        assertTrue(pair.getFrom().isCounterpartOf(pair.getTo()));
        assertEquals(NOW, pair.getFrom().getCreatedAt());
        assertEquals(destination, pair.getDestinationMatterId());
    }

    @Test
    @DisplayName("Transfer to the same matter and bad sides are all reported")
    void testRecordTransferRejected() {
        UUID movedId = Activity.getSeededActivityId(ActivityScope.MATTER_DOCUMENT, "MOVED");

        CreationResult<TransferReconciliation.TransferPair> result =
            auditTrailService.recordTransfer(matterId, matterId, UUID.randomUUID(), movedId, null, NOW);

        assertTrue(result.isFailure());
        List<ValidationViolation> violations = result.getViolations();
        assertEquals(3, violations.size());
        assertEquals("Source and destination matters must be different.", violations.get(0).getMessage());
        assertEquals("From: UserId must be a valid non-empty identifier.", violations.get(1).getMessage());
        assertEquals("To: UserId must be a valid non-empty identifier.", violations.get(2).getMessage());
    }

    @Test
    @DisplayName("Batch conversion skips invalid rows when configured")
    void testConvertSkipsInvalid() {
        List<MatterActivityUserEntity> rows = List.of(
            MatterActivityUserEntity.builder().matterId(matterId).matterActivityId(viewedId).userId(userId)
                .createdAt(NOW.minusSeconds(60)).build(),
            MatterActivityUserEntity.builder().matterId(matterId).matterActivityId(viewedId).userId(null)
                .createdAt(NOW).build());

        List<MatterActivityUser> converted = auditTrailService.convertMatterActivities(rows, false);

        assertEquals(1, converted.size());
        assertEquals(userId, converted.get(0).getUserId());
    }

    @Test
    @DisplayName("Batch conversion fails fast when skipping is disabled")
    void testConvertStrict() {
        AuditTrailProperties strict = new AuditTrailProperties();
        strict.setSkipInvalidOnBatch(false);
        AuditTrailService strictService = new AuditTrailService(Clock.fixed(NOW, ZoneOffset.UTC), strict);
        List<TransferAuditEntity> rows = List.of(TransferAuditEntity.builder()
            .matterId(matterId).documentId(UUID.randomUUID()).userId(userId).createdAt(NOW).build());

        assertThrows(AuditValidationException.class,
            () -> strictService.convertTransfers(rows, TransferDirection.FROM, false));
    }

    @Test
    @DisplayName("Recent filter uses the configured window")
    void testRecent() {
        MatterActivityUser twoDaysOld = auditTrailService
            .recordMatterActivity(matterId, viewedId, userId, NOW.minus(Duration.ofDays(2))).orElseThrow();
        MatterActivityUser fourDaysOld = auditTrailService
            .recordMatterActivity(matterId, viewedId, userId, NOW.minus(Duration.ofDays(4))).orElseThrow();

        assertEquals(List.of(twoDaysOld), auditTrailService.recent(List.of(fourDaysOld, twoDaysOld)));
    }

    @Test
    @DisplayName("Audit messages are chronological and use the display zone")
    void testAuditMessages() {
        MatterActivityUser later = auditTrailService
            .recordMatterActivity(matterId, viewedId, userId, NOW).orElseThrow()
            .toBuilder()
            .user(User.of(userId, "Jane Smith"))
            .matterActivity(Activity.seeded(ActivityScope.MATTER, "VIEWED"))
            .build();
        MatterActivityUser earlier = auditTrailService
            .recordMatterActivity(matterId, viewedId, userId, NOW.minus(Duration.ofHours(1))).orElseThrow();

        List<String> messages = auditTrailService.auditMessages(List.of(later, earlier));

        assertEquals(List.of(
            "On Monday, 03 June 2024 10:15:00, unknown unknown unknown",
            "On Monday, 03 June 2024 11:15:00, Jane Smith VIEWED unknown"), messages);
        assertEquals(List.of(earlier, later), auditTrailService.chronological(List.of(later, earlier)));
    }

    @Test
    @DisplayName("Reconciliation reports unmatched transfer sides")
    void testReconcileTransfers() {
        UUID movedId = Activity.getSeededActivityId(ActivityScope.MATTER_DOCUMENT, "MOVED");
        TransferReconciliation.TransferPair pair = auditTrailService
            .recordTransfer(matterId, UUID.randomUUID(), UUID.randomUUID(), movedId, userId, null).orElseThrow();
        MatterDocumentActivityUser orphan = MatterDocumentActivityUser.fromSource(TransferDirection.FROM,
            matterId, UUID.randomUUID(), movedId, userId, NOW, Clock.fixed(NOW, ZoneOffset.UTC)).orElseThrow();

        TransferReconciliation reconciliation =
            auditTrailService.reconcileTransfers(List.of(pair.getFrom(), orphan, pair.getTo()));

        assertEquals(1, reconciliation.getPairs().size());
        assertEquals(List.of(orphan), reconciliation.getUnmatchedFrom());
    }

    @Test
    @DisplayName("Batch validation reports each record by position")
    void testValidateRecords() {
        MatterActivityUser valid = auditTrailService
            .recordMatterActivity(matterId, viewedId, userId, NOW).orElseThrow();
        MatterActivityUser broken = valid.toBuilder().userId(null).build();

        List<ValidationViolation> violations = auditTrailService.validateRecords(List.of(valid, broken));

        assertEquals(1, violations.size());
        assertEquals("Records[1]: UserId must be a valid non-empty identifier.", violations.get(0).getMessage());
    }
}
