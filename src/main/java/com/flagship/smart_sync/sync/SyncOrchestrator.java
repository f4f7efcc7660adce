package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.client.BackoffPolicy;
import com.flagship.smart_sync.client.RateLimitedClient;
import com.flagship.smart_sync.exception.FatalSyncError;
import com.flagship.smart_sync.exception.MappingError;
import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.exception.PersistenceError;
import com.flagship.smart_sync.exception.TransientSyncError;
import com.flagship.smart_sync.exception.UnsupportedRailOperationException;
import com.flagship.smart_sync.log.OperationKind;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.mirror.MirrorStore;
import com.flagship.smart_sync.mirror.UpsertResult;
import com.flagship.smart_sync.observability.CorrelationContext;
import com.flagship.smart_sync.observability.SyncMetrics;
import com.flagship.smart_sync.rail.PushResult;
import com.flagship.smart_sync.rail.RailFetchRequest;
import com.flagship.smart_sync.rail.RailOperation;
import com.flagship.smart_sync.rail.RailPage;
import com.flagship.smart_sync.rail.RailPushRequest;
import com.flagship.smart_sync.rail.RailRecord;
import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.rail.RailSyncService;
import com.flagship.smart_sync.rail.credential.CredentialStatus;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs incremental syncs, one (tenant, rail, entity type) key at a time.
 *
 * Algorithm for one trigger:
 * 1. Refuse keys that need attention or are still backing off
 * 2. Try to acquire the key's lease; if it is held, skip (never wait)
 * 3. Move the cursor to RUNNING and load the tenant's credential
 * 4. Fetch pages modified at or after the cursor; drop records at or before the cursor
 *    the run started from
 * 5. For each record: map, then upsert into the mirror (which appends the log entry)
 * 6. Checkpoint the cursor after each page; finish in SUCCEEDED, FAILED_RETRYABLE or FAILED_FATAL
 *
 * Rails order pages by modification time only, so records sharing a timestamp can
 * be split across pages in any id order. A successful run stores the highest record
 * it processed. Checkpoints, halts and cancellations store a resume point that stops
 * short of the timestamp a later page may still continue; the records re-read from
 * there come back unchanged.
 *
 * Failure handling:
 * - MappingError: record skipped and counted, cursor moves past it, batch continues
 * - PersistenceError: batch halts, cursor stays on the last committed record
 * - TransientSyncError: FAILED_RETRYABLE with exponential backoff, FAILED_FATAL once
 *   the retry budget is spent
 * - FatalSyncError: FAILED_FATAL; auth failures also mark the credential so every
 *   key of that rail stops until the tenant reconnects
 *
 * Cancellation deletes the lease. The run checks its lease before each record,
 * so it stops within one record, keeping everything committed so far.
 *
 * The tenant id is passed explicitly through every call; it is only copied into
 * MDC for log correlation.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final RailRegistry railRegistry;
    private final RailCredentialService credentialService;
    private final MirrorStore mirrorStore;
    private final SyncCursorService cursorService;
    private final LeaseService leaseService;
    private final SyncRunRepository runRepository;
    private final RateLimitedClient client;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final TaskExecutor taskExecutor;
    private final int pageSize;
    private final int maxRetries;
    private final BackoffPolicy runBackoff;

    public SyncOrchestrator(RailRegistry railRegistry,
                            RailCredentialService credentialService,
                            MirrorStore mirrorStore,
                            SyncCursorService cursorService,
                            LeaseService leaseService,
                            SyncRunRepository runRepository,
                            RateLimitedClient client,
                            SyncMetrics metrics,
                            Clock clock,
                            @Qualifier("syncTaskExecutor") TaskExecutor taskExecutor,
                            @Value("${smart-sync.sync.page-size:100}") int pageSize,
                            @Value("${smart-sync.sync.max-retries:5}") int maxRetries,
                            @Value("${smart-sync.sync.backoff-base-seconds:60}") long backoffBaseSeconds,
                            @Value("${smart-sync.sync.backoff-max-seconds:3600}") long backoffMaxSeconds) {
        this.railRegistry = railRegistry;
        this.credentialService = credentialService;
        this.mirrorStore = mirrorStore;
        this.cursorService = cursorService;
        this.leaseService = leaseService;
        this.runRepository = runRepository;
        this.client = client;
        this.metrics = metrics;
        this.clock = clock;
        this.taskExecutor = taskExecutor;
        this.pageSize = pageSize;
        this.maxRetries = maxRetries;
        this.runBackoff = new BackoffPolicy(Duration.ofSeconds(backoffBaseSeconds), 2.0,
                Duration.ofSeconds(backoffMaxSeconds));
    }

    /**
     * Runs one sync for the key on the calling thread.
     *
     * @return the run, or a skipped run when the lease is held, the key is backing
     *         off, or the key needs attention
     */
    public SyncRun trigger(UUID tenantId, String railId, EntityType entityType, TriggerSource source) {
        RailSyncService rail = readableRail(railId, entityType);
        SyncKey key = new SyncKey(tenantId, railId, entityType);

        MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId.toString());
        MDC.put(CorrelationContext.RAIL_MDC_KEY, railId);
        MDC.put(CorrelationContext.ENTITY_TYPE_MDC_KEY, entityType.name());
        try {
            SyncCursor cursor = cursorService.getOrCreate(key);
            Optional<SyncOutcome> refusal = refusal(cursor, source);
            if (refusal.isPresent()) {
                return skip(key, source, refusal.get(), cursor);
            }

            Optional<SyncLease> lease = leaseService.tryAcquire(key);
            if (lease.isEmpty()) {
                metrics.recordLeaseSkipped(railId, entityType.name());
                log.info("Sync {} skipped, lease held", key);
                return skip(key, source, SyncOutcome.SKIPPED_LEASE_HELD, cursor);
            }

            try {
                return runWithLease(rail, key, lease.get(), source);
            } finally {
                leaseService.release(lease.get());
            }
        } finally {
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.RAIL_MDC_KEY);
            MDC.remove(CorrelationContext.ENTITY_TYPE_MDC_KEY);
        }
    }

    /**
     * Queues a trigger on the sync executor. The caller's correlation id follows the task.
     */
    public CompletableFuture<SyncRun> triggerAsync(UUID tenantId, String railId, EntityType entityType,
                                                   TriggerSource source) {
        String correlationId = CorrelationContext.getCorrelationId();
        return CompletableFuture.supplyAsync(() -> {
            CorrelationContext.setCorrelationId(correlationId);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            try {
                return trigger(tenantId, railId, entityType, source);
            } catch (RuntimeException e) {
                log.error("Async sync {}/{}/{} failed", tenantId, railId, entityType, e);
                throw e;
            } finally {
                CorrelationContext.clear();
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            }
        }, taskExecutor);
    }

    /**
     * Stops the key's current run, if any. Committed records stay; the cursor keeps
     * the last committed position.
     *
     * @return true if a lease was released
     */
    public boolean cancel(UUID tenantId, String railId, EntityType entityType) {
        SyncKey key = new SyncKey(tenantId, railId, entityType);
        boolean released = leaseService.cancel(key);
        log.info("Cancel requested for {}: lease {}", key, released ? "released" : "not held");
        return released;
    }

    /**
     * Stops every run of a tenant, e.g. on deactivation.
     *
     * @return number of runs that were cancelled
     */
    public int cancelTenant(UUID tenantId) {
        List<SyncLease> released = leaseService.cancelTenant(tenantId);
        log.info("Cancelled {} running syncs for tenant {}", released.size(), tenantId);
        return released.size();
    }

    /**
     * Operator action: FAILED_FATAL -> IDLE. Also clears the client's cool-down for
     * the tenant+rail so the next run is not refused locally.
     */
    public SyncCursor reset(UUID tenantId, String railId, EntityType entityType) {
        railRegistry.get(railId);
        SyncKey key = new SyncKey(tenantId, railId, entityType);
        SyncCursor cursor = cursorService.find(key)
                .orElseThrow(() -> new NotFoundException("No sync state for " + key));
        SyncCursor reset = cursorService.save(cursor.reset());
        client.clearCooldown(tenantId, railId);
        log.info("Sync {} reset from FAILED_FATAL to IDLE (last error kind {})", key, cursor.getLastErrorKind());
        return reset;
    }

    /**
     * Moves FAILED_RETRYABLE keys whose backoff has elapsed back to IDLE and queues a run.
     *
     * @return number of keys promoted
     */
    public int promoteDueRetries() {
        int promoted = 0;
        for (SyncCursor cursor : cursorService.findDueForRetry()) {
            SyncKey key = cursor.getKey();
            try {
                cursorService.save(cursor.promote());
                promoted++;
                if (railRegistry.contains(key.getRail())) {
                    triggerAsync(key.getTenantId(), key.getRail(), key.getEntityType(), TriggerSource.RETRY);
                }
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Cursor {} changed while promoting, skipping", key);
            }
        }
        if (promoted > 0) {
            log.info("Promoted {} sync keys out of backoff", promoted);
        }
        return promoted;
    }

    /**
     * Sends a locally created record to an execution rail and links the external id
     * the rail assigns.
     */
    public UpsertResult push(UUID tenantId, String railId, EntityType entityType, UUID mirrorId) {
        RailSyncService rail = railRegistry.get(railId);
        if (!rail.supports(RailOperation.PUSH)) {
            throw new UnsupportedRailOperationException(railId, "push");
        }
        if (!rail.supports(entityType)) {
            throw new UnsupportedRailOperationException(railId, "push of " + entityType);
        }

        MirrorRecord record = mirrorStore.getById(tenantId, entityType, mirrorId)
                .orElseThrow(() -> new NotFoundException(entityType + " " + mirrorId + " not found"));
        if (record.getExternalId() != null) {
            throw new IllegalStateException(entityType + " " + mirrorId + " is already linked to "
                    + record.getExternalId());
        }
        if (!record.isActive()) {
            throw new IllegalStateException(entityType + " " + mirrorId + " is deleted");
        }

        RailCredential credential = credentialService.activeCredential(tenantId, railId);
        PushResult result = rail.push(new RailPushRequest(tenantId, credential, record));
        return mirrorStore.linkExternalId(tenantId, entityType, mirrorId, result.getExternalId(),
                result.getSourceVersion(), railId);
    }

    /**
     * Watchdog path for a lease held past the maximum task duration.
     */
    public void handleExpiredLease(SyncLease lease) {
        SyncKey key = lease.getKey();
        if (!leaseService.forceRelease(lease)) {
            return;
        }
        metrics.recordLeaseForceReleased(key.getRail());
        log.error("Force-released lease for {} held by {} since {}: run exceeded {}",
                key, lease.getHolder(), lease.getAcquiredAt(), leaseService.leaseDuration());

        Optional<SyncCursor> cursor = cursorService.find(key);
        if (cursor.isEmpty() || cursor.get().getState() != SyncState.RUNNING) {
            return;
        }
        SyncCursor running = cursor.get();
        Instant now = clock.instant();
        try {
            SyncCursor failed = cursorService.save(running.failRetryable(running.position(), SyncErrorKind.TIMEOUT,
                    "Run exceeded maximum task duration", maxRetries, retryAt(running, now)));
            recordRun(SyncRun.builder()
                    .id(UUID.randomUUID())
                    .tenantId(key.getTenantId())
                    .rail(key.getRail())
                    .entityType(key.getEntityType())
                    .triggerSource(TriggerSource.SCHEDULED)
                    .outcome(SyncOutcome.TIMED_OUT)
                    .cursorBefore(running.getCursorToken())
                    .cursorAfter(failed.getCursorToken())
                    .errorKind(SyncErrorKind.TIMEOUT)
                    .startedAt(lease.getAcquiredAt())
                    .finishedAt(now)
                    .build());
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("Cursor {} changed while handling expired lease", key);
        }
    }

    private RailSyncService readableRail(String railId, EntityType entityType) {
        RailSyncService rail = railRegistry.get(railId);
        if (!rail.supports(RailOperation.READ)) {
            throw new UnsupportedRailOperationException(railId, "read");
        }
        if (!rail.supports(entityType)) {
            throw new UnsupportedRailOperationException(railId, "sync of " + entityType);
        }
        return rail;
    }

    private Optional<SyncOutcome> refusal(SyncCursor cursor, TriggerSource source) {
        if (cursor.getState() == SyncState.FAILED_FATAL) {
            return Optional.of(SyncOutcome.SKIPPED_NEEDS_ATTENTION);
        }
        if (cursor.getState() == SyncState.FAILED_RETRYABLE
                && source != TriggerSource.MANUAL
                && !cursor.isBackoffElapsed(clock.instant())) {
            return Optional.of(SyncOutcome.SKIPPED_BACKOFF);
        }
        return Optional.empty();
    }

    private SyncRun runWithLease(RailSyncService rail, SyncKey key, SyncLease lease, TriggerSource source) {
        UUID runId = UUID.randomUUID();
        MDC.put(CorrelationContext.RUN_ID_MDC_KEY, runId.toString());
        Instant startedAt = clock.instant();
        try {
            // state may have moved while the lease was being acquired
            SyncCursor cursor = cursorService.getOrCreate(key);
            Optional<SyncOutcome> refusal = refusal(cursor, source);
            if (refusal.isPresent()) {
                return skip(key, source, refusal.get(), cursor);
            }
            cursor = prepareForStart(cursor);
            cursor = cursorService.save(cursor.start(startedAt));

            RunContext run = new RunContext(runId, key, source, cursor, startedAt);
            log.info("Sync {} started (trigger={}, cursor={})", key, source, cursor.getCursorToken());
            execute(rail, lease, run);
            return finish(run);
        } finally {
            MDC.remove(CorrelationContext.RUN_ID_MDC_KEY);
        }
    }

    private SyncCursor prepareForStart(SyncCursor cursor) {
        if (cursor.getState() == SyncState.RUNNING) {
            // we hold the lease, so the previous run is gone
            log.warn("Sync {} was left RUNNING by an abandoned run, recovering", cursor.getKey());
            return cursorService.save(cursor.cancel(cursor.position()));
        }
        if (cursor.getState() == SyncState.FAILED_RETRYABLE) {
            return cursorService.save(cursor.promote());
        }
        return cursor;
    }

    private void execute(RailSyncService rail, SyncLease lease, RunContext run) {
        SyncKey key = run.key;
        try {
            RailCredential credential = credentialService.activeCredential(key.getTenantId(), key.getRail());
            Instant updatedSince = run.startPosition == null ? null : run.startPosition.getLastUpdated();
            String pageToken = null;

            do {
                if (!leaseService.isHeld(lease)) {
                    cancelled(run);
                    return;
                }

                RailPage page = rail.fetch(RailFetchRequest.builder()
                        .tenantId(key.getTenantId())
                        .entityType(key.getEntityType())
                        .credential(credential)
                        .updatedSince(updatedSince)
                        .pageToken(pageToken)
                        .pageSize(pageSize)
                        .runId(run.runId)
                        .build());

                if (!processPage(rail, lease, run, page)) {
                    return;
                }
                checkpoint(run);
                pageToken = page.getNextPageToken();
            } while (pageToken != null);

            run.cursor = cursorService.save(run.cursor.succeed(run.position, clock.instant()));
            run.outcome = SyncOutcome.SUCCEEDED;

        } catch (TransientSyncError e) {
            log.warn("Sync {} hit a transient error: {}", key, e.getMessage());
            failRetryable(run, SyncErrorKind.TRANSIENT, e.getMessage());
        } catch (FatalSyncError e) {
            SyncErrorKind kind = e.requiresReconnection() ? SyncErrorKind.AUTHENTICATION : SyncErrorKind.REJECTED;
            log.error("Sync {} failed permanently ({}): {}", key, kind, e.getMessage());
            if (kind == SyncErrorKind.AUTHENTICATION) {
                credentialService.markStatus(key.getTenantId(), key.getRail(), CredentialStatus.EXPIRED);
            }
            failFatal(run, kind, e.getMessage());
        } catch (ObjectOptimisticLockingFailureException e) {
            // watchdog or operator changed the cursor under us; their state wins
            log.warn("Sync {} lost its cursor to a concurrent change, stopping", key);
            run.outcome = SyncOutcome.TIMED_OUT;
            run.errorKind = SyncErrorKind.TIMEOUT;
        } catch (RuntimeException e) {
            log.error("Sync {} failed unexpectedly", key, e);
            failRetryable(run, SyncErrorKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * @return false when the run has stopped (cancelled or halted) inside this page
     */
    private boolean processPage(RailSyncService rail, SyncLease lease, RunContext run, RailPage page) {
        List<RailRecord> records = new ArrayList<>(page.getRecords());
        records.sort(Comparator.comparing(RailRecord::getLastUpdated).thenComparing(RailRecord::getExternalId));
        SyncKey key = run.key;
        Instant pageLast = records.isEmpty() ? null : records.get(records.size() - 1).getLastUpdated();
        if (!records.isEmpty() && run.previousPageLast != null
                && records.get(0).getLastUpdated().isBefore(run.previousPageLast)) {
            log.warn("Sync {} received a page older than the one before it, holding the checkpoint at {}",
                    key, run.committed);
            run.ordered = false;
        }

        for (RailRecord record : records) {
            run.fetched++;
            if (run.startPosition != null && !run.startPosition.precedes(record)) {
                continue;
            }
            if (!leaseService.isHeld(lease)) {
                cancelled(run);
                return false;
            }

            CanonicalEntity entity;
            try {
                entity = rail.map(key.getEntityType(), record);
            } catch (MappingError e) {
                run.skipped++;
                run.passed(record, pageLast);
                log.warn("Skipping {} {} for tenant {}: {}", key.getEntityType(), record.getExternalId(),
                        key.getTenantId(), e.getMessage());
                continue;
            }
            entity = entity.toBuilder()
                    .entityType(key.getEntityType())
                    .externalId(record.getExternalId())
                    .build();

            UpsertResult result;
            try {
                result = mirrorStore.upsert(key.getTenantId(), entity, key.getRail(), null);
            } catch (PersistenceError e) {
                log.error("Sync {} halted at {} {}: {}", key, key.getEntityType(), record.getExternalId(),
                        e.getMessage());
                run.outcome = SyncOutcome.PARTIAL;
                failRetryable(run, SyncErrorKind.PERSISTENCE,
                        "Persistence failed at " + record.getExternalId() + ": " + e.getMessage());
                return false;
            }

            if (result.getOperation() == null) {
                run.unchanged++;
            } else if (result.getOperation() == OperationKind.CREATED) {
                run.created++;
            } else {
                run.updated++;
            }
            run.passed(record, pageLast);
        }
        if (pageLast != null) {
            run.previousPageLast = pageLast;
        }
        return true;
    }

    private void checkpoint(RunContext run) {
        CursorToken saved = run.cursor.position();
        if (run.committed != null && !run.committed.equals(saved)) {
            run.cursor = cursorService.save(run.cursor.advance(run.committed));
        }
    }

    private void cancelled(RunContext run) {
        log.info("Sync {} cancelled, keeping progress at {}", run.key, run.committed);
        run.outcome = SyncOutcome.CANCELLED;
        try {
            run.cursor = cursorService.save(run.cursor.cancel(run.committed));
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("Cursor {} already changed by another writer after cancel", run.key);
        }
    }

    private void failRetryable(RunContext run, SyncErrorKind kind, String error) {
        Instant now = clock.instant();
        run.cursor = cursorService.save(run.cursor.failRetryable(run.committed, kind, error, maxRetries,
                retryAt(run.cursor, now)));
        if (run.outcome == null) {
            run.outcome = run.cursor.getState() == SyncState.FAILED_FATAL
                    ? SyncOutcome.FAILED_FATAL
                    : SyncOutcome.FAILED_RETRYABLE;
        }
        run.errorKind = kind;
    }

    private void failFatal(RunContext run, SyncErrorKind kind, String error) {
        run.cursor = cursorService.save(run.cursor.failFatal(run.committed, kind, error));
        run.outcome = SyncOutcome.FAILED_FATAL;
        run.errorKind = kind;
    }

    private Instant retryAt(SyncCursor cursor, Instant now) {
        return now.plus(runBackoff.nominalDelay(cursor.getConsecutiveFailures() + 1));
    }

    private SyncRun finish(RunContext run) {
        SyncRun result = SyncRun.builder()
                .id(run.runId)
                .tenantId(run.key.getTenantId())
                .rail(run.key.getRail())
                .entityType(run.key.getEntityType())
                .triggerSource(run.source)
                .outcome(run.outcome)
                .fetched(run.fetched)
                .created(run.created)
                .updated(run.updated)
                .unchanged(run.unchanged)
                .skipped(run.skipped)
                .cursorBefore(run.cursorBefore)
                .cursorAfter(run.cursor.getCursorToken())
                .errorKind(run.errorKind)
                .startedAt(run.startedAt)
                .finishedAt(clock.instant())
                .build();

        recordRun(result);
        log.info("Sync {} finished: outcome={}, fetched={}, created={}, updated={}, unchanged={}, skipped={}, cursor={}",
                run.key, result.getOutcome(), result.getFetched(), result.getCreated(), result.getUpdated(),
                result.getUnchanged(), result.getSkipped(), result.getCursorAfter());
        return result;
    }

    private void recordRun(SyncRun run) {
        String entityType = run.getEntityType().name();
        metrics.recordRun(run.getRail(), entityType, run.getOutcome().name(), run.duration());
        metrics.recordRunRecords(run.getRail(), entityType, "created", run.getCreated());
        metrics.recordRunRecords(run.getRail(), entityType, "updated", run.getUpdated());
        metrics.recordRunRecords(run.getRail(), entityType, "unchanged", run.getUnchanged());
        metrics.recordRunRecords(run.getRail(), entityType, "skipped", run.getSkipped());
        try {
            runRepository.save(SyncRunEntity.fromDomain(run));
        } catch (RuntimeException e) {
            log.warn("Could not persist run {} for {}/{}: {}", run.getId(), run.getRail(), entityType, e.getMessage());
        }
    }

    private SyncRun skip(SyncKey key, TriggerSource source, SyncOutcome outcome, SyncCursor cursor) {
        if (outcome != SyncOutcome.SKIPPED_LEASE_HELD) {
            log.info("Sync {} not started: {} (state={})", key, outcome, cursor.getState());
        }
        return SyncRun.skipped(key, source, outcome, cursor.getCursorToken(), clock.instant());
    }

    /**
     * Mutable state of one run in progress.
     */
    private static final class RunContext {
        final UUID runId;
        final SyncKey key;
        final TriggerSource source;
        final Instant startedAt;
        final String cursorBefore;
        final CursorToken startPosition;
        SyncCursor cursor;
        CursorToken position;           // highest record processed
        CursorToken committed;          // resume point if the run stops early
        Instant previousPageLast;
        boolean ordered = true;
        SyncOutcome outcome;
        SyncErrorKind errorKind;
        int fetched;
        int created;
        int updated;
        int unchanged;
        int skipped;

        RunContext(UUID runId, SyncKey key, TriggerSource source, SyncCursor cursor, Instant startedAt) {
            this.runId = runId;
            this.key = key;
            this.source = source;
            this.cursor = cursor;
            this.startedAt = startedAt;
            this.cursorBefore = cursor.getCursorToken();
            this.startPosition = cursor.position();
            this.position = startPosition;
            this.committed = startPosition;
        }

        void passed(RailRecord record, Instant pageLast) {
            CursorToken token = CursorToken.of(record);
            if (position == null || position.compareTo(token) < 0) {
                position = token;
            }
            if (!ordered) {
                return;
            }
            // the next page may hold more records with the page's last timestamp
            CursorToken resume = record.getLastUpdated().isBefore(pageLast)
                    ? token
                    : CursorToken.before(record.getLastUpdated());
            if (committed == null || committed.compareTo(resume) < 0) {
                committed = resume;
            }
        }
    }
}
