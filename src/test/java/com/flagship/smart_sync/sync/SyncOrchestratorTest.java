package com.flagship.smart_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.client.ApiError;
import com.flagship.smart_sync.client.ApiErrorType;
import com.flagship.smart_sync.exception.FatalSyncError;
import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.exception.TransientSyncError;
import com.flagship.smart_sync.exception.UnsupportedRailOperationException;
import com.flagship.smart_sync.log.ChangeSource;
import com.flagship.smart_sync.log.OperationKind;
import com.flagship.smart_sync.log.TransactionLogEntry;
import com.flagship.smart_sync.log.TransactionLogStore;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.mirror.MirrorStore;
import com.flagship.smart_sync.mirror.ReconciliationService;
import com.flagship.smart_sync.rail.RailRecord;
import com.flagship.smart_sync.rail.credential.CredentialStatus;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end sync runs against a real database and an in-memory rail.
 *
 * These tests verify that:
 * - A re-synced bill updates the mirror and adds exactly one log entry with a diff
 * - Re-syncing unchanged data appends nothing and only moves last_synced_at
 * - Two triggers for the same key never run together
 * - A persistence failure halts the batch and the rerun resumes at the failed record
 * - Cancelling a run keeps what was committed
 * - Records sharing a timestamp are never lost when pages split them
 * - Auth failures stop the key until an operator resets it
 * - Transient failures back off and escalate once the retry budget is spent
 * - Pushing a local bill links the id the execution rail assigns
 */
@SpringBootTest
@Testcontainers
class SyncOrchestratorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("smart_sync_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final String RAIL = FakeLedgerRail.RAIL_ID;
    private static final Instant T0 = Instant.parse("2025-01-01T09:00:00Z");

    @Autowired
    private SyncOrchestrator orchestrator;

    @Autowired
    private FakeLedgerRail rail;

    @Autowired
    private FakePaymentRail paymentRail;

    @Autowired
    private MirrorStore mirrorStore;

    @Autowired
    private TransactionLogStore logStore;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private SyncCursorService cursorService;

    @Autowired
    private SyncStatusService statusService;

    @Autowired
    private RailCredentialService credentialService;

    @Autowired
    private ObjectMapper objectMapper;

    private UUID tenantId;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        connect(tenantId);
    }

    private void connect(UUID tenant) {
        credentialService.save(RailCredential.create(tenant, RAIL, "acct-" + tenant, "access-token",
                "refresh-token", null, null));
    }

    private SyncRun sync(UUID tenant, TriggerSource source) {
        return orchestrator.trigger(tenant, RAIL, EntityType.BILL, source);
    }

    private SyncCursor cursor(UUID tenant) {
        return cursorService.find(new SyncKey(tenant, RAIL, EntityType.BILL)).orElseThrow();
    }

    private MirrorRecord bill(UUID tenant, String externalId) {
        return mirrorStore.get(tenant, EntityType.BILL, externalId).orElseThrow();
    }

    private void putTenBills(UUID tenant, String badCurrencyFor) {
        for (int i = 1; i <= 10; i++) {
            String id = String.format("bill-%02d", i);
            String currency = id.equals(badCurrencyFor) ? "TOOLONGCUR" : "USD";
            rail.putBill(tenant, id, String.valueOf(100 * i), currency, "2025-02-01", "0", T0.plusSeconds(i));
        }
    }

    @Test
    @DisplayName("Re-synced amount change: mirror shows 550, history has created then updated with a diff")
    void testResync_AmountChange() throws Exception {
        rail.putBill(tenantId, "bill-1", "500.00", "USD", "2025-01-15", "0", T0);

        SyncRun first = sync(tenantId, TriggerSource.SCHEDULED);
        assertEquals(SyncOutcome.SUCCEEDED, first.getOutcome());
        assertEquals(1, first.getCreated());

        RailRecord changed = rail.putBill(tenantId, "bill-1", "550.00", "USD", "2025-01-15", "1", T0.plusSeconds(60));
        SyncRun second = sync(tenantId, TriggerSource.SCHEDULED);

        assertEquals(SyncOutcome.SUCCEEDED, second.getOutcome());
        assertEquals(1, second.getUpdated());
        assertEquals(0, second.getCreated());

        MirrorRecord record = bill(tenantId, "bill-1");
        assertEquals(0, new BigDecimal("550").compareTo(record.getAmount()));
        assertEquals("2025-01-15", record.getDueDate().toString());
        assertFalse(record.isLogPending());

        List<TransactionLogEntry> history = logStore.history(tenantId, record.getId());
        assertEquals(2, history.size());
        assertEquals(OperationKind.CREATED, history.get(0).getOperationKind());
        assertEquals(OperationKind.UPDATED, history.get(1).getOperationKind());
        assertEquals(RAIL, history.get(1).getSource());
        assertNull(history.get(1).getActorId());

        JsonNode diff = objectMapper.readTree(history.get(1).getDiff());
        assertEquals("500.0000", diff.get("amount").get("from").asText());
        assertEquals("550.0000", diff.get("amount").get("to").asText());
        assertFalse(diff.has("dueDate"));

        SyncCursor cursor = cursor(tenantId);
        assertEquals(SyncState.SUCCEEDED, cursor.getState());
        assertEquals(CursorToken.of(changed), cursor.position());
        assertNotNull(cursor.getLastSuccessAt());

        assertTrue(reconciliationService.verify(tenantId, EntityType.BILL, record.getId()).isConsistent());
    }

    @Test
    @DisplayName("Re-syncing unchanged records appends no log entries and only moves last_synced_at")
    void testResync_UnchangedBatchIsIdempotent() {
        for (int i = 1; i <= 3; i++) {
            rail.putBill(tenantId, "bill-" + i, "120.00", "USD", "2025-03-01", "4", T0.plusSeconds(i));
        }
        sync(tenantId, TriggerSource.SCHEDULED);
        MirrorRecord before = bill(tenantId, "bill-2");
        long entriesBefore = logStore.countForEntity(tenantId, before.getId());

        // the rail reports the same content with newer modification times
        for (int i = 1; i <= 3; i++) {
            rail.touch(tenantId, "bill-" + i, T0.plusSeconds(100 + i));
        }
        SyncRun rerun = sync(tenantId, TriggerSource.SCHEDULED);

        assertEquals(SyncOutcome.SUCCEEDED, rerun.getOutcome());
        assertEquals(3, rerun.getUnchanged());
        assertEquals(0, rerun.getCreated() + rerun.getUpdated());

        MirrorRecord after = bill(tenantId, "bill-2");
        assertEquals(entriesBefore, logStore.countForEntity(tenantId, after.getId()));
        assertEquals(before.getEntity(), after.getEntity());
        assertEquals(before.getUpdatedAt(), after.getUpdatedAt());
        assertTrue(after.getLastSyncedAt().isAfter(before.getLastSyncedAt()));
    }

    @Test
    @DisplayName("A second trigger for a running key is skipped, never queued behind the first")
    void testConcurrentTriggers_SecondSkipsOnLease() throws Exception {
        rail.putBill(tenantId, "bill-1", "10.00", "USD", "2025-03-01", "0", T0);
        FakeLedgerRail.Pause pause = rail.pauseAt("bill-1");

        CompletableFuture<SyncRun> first = CompletableFuture.supplyAsync(() -> sync(tenantId, TriggerSource.SCHEDULED));
        assertTrue(pause.awaitReached());

        SyncRun second = sync(tenantId, TriggerSource.WEBHOOK);
        assertEquals(SyncOutcome.SKIPPED_LEASE_HELD, second.getOutcome());
        assertTrue(second.getOutcome().isSkipped());

        pause.resume();
        SyncRun completed = first.get(10, TimeUnit.SECONDS);
        assertEquals(SyncOutcome.SUCCEEDED, completed.getOutcome());
        assertEquals(1, completed.getCreated());

        // lease released: the next trigger runs
        assertEquals(SyncOutcome.SUCCEEDED, sync(tenantId, TriggerSource.SCHEDULED).getOutcome());
    }

    @Test
    @DisplayName("Persistence failure at record 6: 1-5 commit, rerun processes only 6-10, cursor matches a clean run")
    void testPartialFailure_ResumesAtFailedRecord() {
        putTenBills(tenantId, "bill-06");

        SyncRun failed = sync(tenantId, TriggerSource.SCHEDULED);
        assertEquals(SyncOutcome.PARTIAL, failed.getOutcome());
        assertEquals(SyncErrorKind.PERSISTENCE, failed.getErrorKind());
        assertEquals(5, failed.getCreated());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "bill-05").isPresent());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "bill-06").isEmpty());

        SyncCursor halted = cursor(tenantId);
        assertEquals(SyncState.FAILED_RETRYABLE, halted.getState());
        assertEquals("bill-05", halted.position().getExternalId());
        assertEquals(SyncHealth.DEGRADED, statusService.status(tenantId).getOverallHealth());

        rail.putBill(tenantId, "bill-06", "600", "USD", "2025-02-01", "0", T0.plusSeconds(6));
        SyncRun rerun = sync(tenantId, TriggerSource.MANUAL);

        assertEquals(SyncOutcome.SUCCEEDED, rerun.getOutcome());
        assertEquals(5, rerun.getCreated());
        assertEquals(0, rerun.getUpdated());
        assertEquals(0, rerun.getUnchanged());

        UUID cleanTenant = UUID.randomUUID();
        connect(cleanTenant);
        putTenBills(cleanTenant, null);
        assertEquals(SyncOutcome.SUCCEEDED, sync(cleanTenant, TriggerSource.SCHEDULED).getOutcome());

        assertEquals(cursor(cleanTenant).getCursorToken(), cursor(tenantId).getCursorToken());
        assertEquals(0, cursor(tenantId).getConsecutiveFailures());
        for (int i = 1; i <= 10; i++) {
            MirrorRecord record = bill(tenantId, String.format("bill-%02d", i));
            assertEquals(1, logStore.countForEntity(tenantId, record.getId()));
        }
    }

    @Test
    @DisplayName("Records sharing a timestamp across pages are all synced, whatever their id order")
    void testTiedTimestampsAcrossPages_NoneLost() {
        rail.limitPageSize(tenantId, 1);
        rail.serveTiesDescending(tenantId);
        rail.putBill(tenantId, "5", "50.00", "USD", "2025-03-01", "0", T0);
        rail.putBill(tenantId, "3", "30.00", "USD", "2025-03-01", "0", T0);
        RailRecord last = rail.putBill(tenantId, "7", "70.00", "USD", "2025-03-01", "0", T0.plusSeconds(1));

        SyncRun run = sync(tenantId, TriggerSource.SCHEDULED);

        assertEquals(SyncOutcome.SUCCEEDED, run.getOutcome());
        assertEquals(3, run.getCreated());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "3").isPresent());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "5").isPresent());
        assertEquals(CursorToken.of(last), cursor(tenantId).position());
    }

    @Test
    @DisplayName("A run stopped inside a run of tied timestamps resumes before that timestamp")
    void testCancelInsideTiedTimestamps_ResumesBeforeTie() throws Exception {
        rail.limitPageSize(tenantId, 1);
        rail.serveTiesDescending(tenantId);
        rail.putBill(tenantId, "5", "50.00", "USD", "2025-03-01", "0", T0);
        rail.putBill(tenantId, "3", "30.00", "USD", "2025-03-01", "0", T0);
        rail.putBill(tenantId, "7", "70.00", "USD", "2025-03-01", "0", T0.plusSeconds(1));
        FakeLedgerRail.Pause pause = rail.pauseAt("3");

        CompletableFuture<SyncRun> running = CompletableFuture.supplyAsync(() -> sync(tenantId, TriggerSource.SCHEDULED));
        assertTrue(pause.awaitReached());
        assertTrue(orchestrator.cancel(tenantId, RAIL, EntityType.BILL));
        pause.resume();

        SyncRun cancelled = running.get(10, TimeUnit.SECONDS);
        assertEquals(SyncOutcome.CANCELLED, cancelled.getOutcome());
        assertEquals(CursorToken.before(T0), cursor(tenantId).position());

        SyncRun resumed = sync(tenantId, TriggerSource.SCHEDULED);
        assertEquals(SyncOutcome.SUCCEEDED, resumed.getOutcome());
        assertEquals(1, resumed.getCreated());
        assertEquals(2, resumed.getUnchanged());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "7").isPresent());
    }

    @Test
    @DisplayName("Malformed records are skipped and counted; the batch continues past them")
    void testMappingError_SkipsRecord() {
        rail.putBill(tenantId, "bill-1", "10.00", "USD", "2025-03-01", "0", T0.plusSeconds(1));
        rail.putMalformed(tenantId, "bill-2", T0.plusSeconds(2));
        RailRecord last = rail.putBill(tenantId, "bill-3", "30.00", "USD", "2025-03-01", "0", T0.plusSeconds(3));

        SyncRun run = sync(tenantId, TriggerSource.SCHEDULED);

        assertEquals(SyncOutcome.SUCCEEDED, run.getOutcome());
        assertEquals(3, run.getFetched());
        assertEquals(2, run.getCreated());
        assertEquals(1, run.getSkipped());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "bill-2").isEmpty());
        assertEquals(CursorToken.of(last), cursor(tenantId).position());
    }

    @Test
    @DisplayName("Cancelling mid-run stops before the next record and keeps committed records")
    void testCancel_KeepsCommittedRecords() throws Exception {
        for (int i = 1; i <= 5; i++) {
            rail.putBill(tenantId, "bill-" + i, "10.00", "USD", "2025-03-01", "0", T0.plusSeconds(i));
        }
        FakeLedgerRail.Pause pause = rail.pauseAt("bill-3");

        CompletableFuture<SyncRun> running = CompletableFuture.supplyAsync(() -> sync(tenantId, TriggerSource.SCHEDULED));
        assertTrue(pause.awaitReached());

        assertTrue(orchestrator.cancel(tenantId, RAIL, EntityType.BILL));
        pause.resume();
        SyncRun run = running.get(10, TimeUnit.SECONDS);

        assertEquals(SyncOutcome.CANCELLED, run.getOutcome());
        assertEquals(3, run.getCreated());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "bill-3").isPresent());
        assertTrue(mirrorStore.get(tenantId, EntityType.BILL, "bill-4").isEmpty());

        SyncCursor cursor = cursor(tenantId);
        assertEquals(SyncState.IDLE, cursor.getState());
        assertEquals("bill-3", cursor.position().getExternalId());

        // the next run picks up the rest
        SyncRun resumed = sync(tenantId, TriggerSource.SCHEDULED);
        assertEquals(2, resumed.getCreated());
        assertFalse(orchestrator.cancel(tenantId, RAIL, EntityType.BILL));
    }

    @Test
    @DisplayName("Auth failure: credential expired, key needs attention until reset and reconnect")
    void testFatalAuthFailure_NeedsReconnection() {
        rail.putBill(tenantId, "bill-1", "10.00", "USD", "2025-03-01", "0", T0);
        rail.failFetches(tenantId, new FatalSyncError("HTTP 401 from fakeledger",
                ApiError.of(ApiErrorType.AUTHENTICATION, 401, "token revoked by user")));

        SyncRun failed = sync(tenantId, TriggerSource.SCHEDULED);
        assertEquals(SyncOutcome.FAILED_FATAL, failed.getOutcome());
        assertEquals(SyncErrorKind.AUTHENTICATION, failed.getErrorKind());
        assertEquals(CredentialStatus.EXPIRED, credentialService.find(tenantId, RAIL).orElseThrow().getStatus());

        int fetchesBefore = rail.fetchCalls();
        SyncRun refused = sync(tenantId, TriggerSource.MANUAL);
        assertEquals(SyncOutcome.SKIPPED_NEEDS_ATTENTION, refused.getOutcome());
        assertEquals(fetchesBefore, rail.fetchCalls());

        SyncStatusView status = statusService.status(tenantId);
        assertEquals(SyncHealth.NEEDS_ATTENTION, status.getOverallHealth());
        String message = status.getKeys().get(0).getMessage();
        assertEquals(SyncHealth.MESSAGE_RECONNECT, message);
        assertFalse(message.contains("401"));
        assertFalse(message.contains("revoked"));

        assertEquals(SyncState.IDLE, orchestrator.reset(tenantId, RAIL, EntityType.BILL).getState());
        rail.clearFailures(tenantId);
        connect(tenantId);

        SyncRun recovered = sync(tenantId, TriggerSource.MANUAL);
        assertEquals(SyncOutcome.SUCCEEDED, recovered.getOutcome());
        assertEquals(SyncHealth.OK, statusService.status(tenantId).getOverallHealth());
    }

    @Test
    @DisplayName("A key without a usable credential fails fatally without calling the rail")
    void testMissingCredential_FailsFatal() {
        UUID unconnected = UUID.randomUUID();
        int fetchesBefore = rail.fetchCalls();

        SyncRun run = sync(unconnected, TriggerSource.SCHEDULED);

        assertEquals(SyncOutcome.FAILED_FATAL, run.getOutcome());
        assertEquals(fetchesBefore, rail.fetchCalls());
        assertEquals(SyncState.FAILED_FATAL, cursor(unconnected).getState());
    }

    @Test
    @DisplayName("Transient failures back off, manual triggers bypass backoff, the third failure is fatal")
    void testTransientFailure_BacksOffThenEscalates() {
        rail.failFetches(tenantId, new TransientSyncError("503 after 3 attempts",
                ApiError.of(ApiErrorType.SERVER_ERROR, 503, "unavailable")));
        Instant before = Instant.now();

        SyncRun first = sync(tenantId, TriggerSource.SCHEDULED);
        assertEquals(SyncOutcome.FAILED_RETRYABLE, first.getOutcome());
        SyncCursor backingOff = cursor(tenantId);
        assertEquals(1, backingOff.getConsecutiveFailures());
        assertEquals(SyncErrorKind.TRANSIENT, backingOff.getLastErrorKind());
        assertTrue(backingOff.getNextAttemptAt().isAfter(before.plusSeconds(59)));

        assertEquals(SyncOutcome.SKIPPED_BACKOFF, sync(tenantId, TriggerSource.SCHEDULED).getOutcome());
        assertEquals(SyncOutcome.SKIPPED_BACKOFF, sync(tenantId, TriggerSource.WEBHOOK).getOutcome());

        SyncRun second = sync(tenantId, TriggerSource.MANUAL);
        assertEquals(SyncOutcome.FAILED_RETRYABLE, second.getOutcome());
        assertEquals(2, cursor(tenantId).getConsecutiveFailures());

        SyncRun third = sync(tenantId, TriggerSource.MANUAL);
        assertEquals(SyncOutcome.FAILED_FATAL, third.getOutcome());
        assertEquals(SyncState.FAILED_FATAL, cursor(tenantId).getState());
        assertEquals(SyncHealth.NEEDS_ATTENTION, statusService.status(tenantId).getOverallHealth());
    }

    @Test
    @DisplayName("Reset of a key that never ran is a not-found error")
    void testReset_UnknownKey() {
        assertThrows(NotFoundException.class, () -> orchestrator.reset(UUID.randomUUID(), RAIL, EntityType.BILL));
    }

    @Test
    @DisplayName("Unsupported entity types and rails are refused before anything runs")
    void testTrigger_UnsupportedTarget() {
        assertThrows(UnsupportedRailOperationException.class,
                () -> orchestrator.trigger(tenantId, RAIL, EntityType.PAYMENT, TriggerSource.MANUAL));
        assertThrows(UnsupportedRailOperationException.class,
                () -> orchestrator.push(tenantId, RAIL, EntityType.BILL, UUID.randomUUID()));
        assertThrows(NotFoundException.class,
                () -> orchestrator.trigger(tenantId, "no-such-rail", EntityType.BILL, TriggerSource.MANUAL));
        assertTrue(cursorService.find(new SyncKey(tenantId, RAIL, EntityType.PAYMENT)).isEmpty());
    }

    @Test
    @DisplayName("Push sends a local bill to the execution rail, links the assigned id and logs the link")
    void testPush_LinksAssignedId() {
        credentialService.save(RailCredential.create(tenantId, FakePaymentRail.RAIL_ID, "pay-acct-" + tenantId,
                "access-token", "refresh-token", null, null));
        MirrorRecord local = mirrorStore.upsert(tenantId, CanonicalEntity.builder()
                .entityType(EntityType.BILL)
                .counterpartyName("Globex")
                .amount(new BigDecimal("75.00"))
                .currency("USD")
                .status("DRAFT")
                .build(), ChangeSource.USER, "ap-clerk@example.com").getRecord();
        int pushedBefore = paymentRail.pushed().size();

        MirrorRecord linked = orchestrator.push(tenantId, FakePaymentRail.RAIL_ID, EntityType.BILL, local.getId())
                .getRecord();

        assertEquals(local.getId(), linked.getId());
        assertNotNull(linked.getExternalId());
        assertTrue(linked.getExternalId().startsWith("pay-"));
        assertEquals(pushedBefore + 1, paymentRail.pushed().size());
        assertEquals(local.getId(), paymentRail.pushed().get(pushedBefore).getRecord().getId());
        assertEquals(local.getId(), bill(tenantId, linked.getExternalId()).getId());

        List<TransactionLogEntry> history = logStore.history(tenantId, local.getId());
        assertEquals(2, history.size());
        TransactionLogEntry link = history.get(history.size() - 1);
        assertEquals(OperationKind.UPDATED, link.getOperationKind());
        assertEquals(FakePaymentRail.RAIL_ID, link.getSource());

        assertThrows(IllegalStateException.class,
                () -> orchestrator.push(tenantId, FakePaymentRail.RAIL_ID, EntityType.BILL, local.getId()));
        assertEquals(pushedBefore + 1, paymentRail.pushed().size());
    }

    @Test
    @DisplayName("Cancelling a tenant releases every lease it holds")
    void testCancelTenant() throws Exception {
        rail.putBill(tenantId, "bill-1", "10.00", "USD", "2025-03-01", "0", T0);
        rail.putBill(tenantId, "bill-2", "20.00", "USD", "2025-03-01", "0", T0.plusSeconds(1));
        FakeLedgerRail.Pause pause = rail.pauseAt("bill-1");
        CompletableFuture<SyncRun> running = CompletableFuture.supplyAsync(() -> sync(tenantId, TriggerSource.SCHEDULED));
        assertTrue(pause.awaitReached());

        assertEquals(1, orchestrator.cancelTenant(tenantId));
        pause.resume();

        SyncRun run = running.get(10, TimeUnit.SECONDS);
        assertEquals(SyncOutcome.CANCELLED, run.getOutcome());
        assertEquals(0, orchestrator.cancelTenant(tenantId));
    }
}
