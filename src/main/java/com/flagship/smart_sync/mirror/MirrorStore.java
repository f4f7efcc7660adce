package com.flagship.smart_sync.mirror;

import com.flagship.smart_sync.exception.DuplicateLogEntryException;
import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.exception.PersistenceError;
import com.flagship.smart_sync.log.ChangeSource;
import com.flagship.smart_sync.log.NewLogEntry;
import com.flagship.smart_sync.log.TransactionLogStore;
import com.flagship.smart_sync.observability.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Current-state store for mirrored entities, paired with the transaction log.
 *
 * Every change goes through the same two steps, in this order:
 * 1. Write the mirror row (committed with log_pending = true)
 * 2. Append the log entry, then clear log_pending
 *
 * If step 2 fails the row keeps log_pending and {@link LogReconciler} appends the
 * missing entry later. The reverse order is never used: a log entry without a
 * mirror update is harmless, a mirror update without a log entry is an audit gap.
 *
 * Writers are the sync orchestrator (through rails) and explicit local-mutation
 * paths (source "user"). Upserts are last-write-wins per (tenant, type, external id).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MirrorStore {

    private final MirrorPersistenceService persistence;
    private final TransactionLogStore logStore;
    private final SyncMetrics metrics;
    private final Clock clock;

    /**
     * Creates or updates the row for an entity. An entity without external id is a
     * local creation and always gets a new row.
     *
     * @param source  rail id for synced data, "user" for local actions
     * @param actorId who made a local change; null for syncs
     * @throws PersistenceError if the mirror write fails
     */
    public UpsertResult upsert(UUID tenantId, CanonicalEntity entity, String source, String actorId) {
        requireTenant(tenantId);
        Objects.requireNonNull(entity.getEntityType(), "entityType");
        CanonicalEntity normalized = entity.normalized();

        MirrorWrite write = write(() -> persistence.upsert(tenantId, normalized, source, clock.instant()),
                normalized.getEntityType(), normalized.getExternalId());
        return pairWithLog(write, source, actorId);
    }

    /**
     * Local edit of an existing row, addressed by mirror id. The external id is kept.
     */
    public UpsertResult updateLocal(UUID tenantId, UUID id, CanonicalEntity entity, String actorId) {
        requireTenant(tenantId);
        CanonicalEntity normalized = entity.normalized();
        MirrorWrite write = write(() -> persistence.updateById(tenantId, id, normalized, ChangeSource.USER, clock.instant()),
                normalized.getEntityType(), id.toString());
        return pairWithLog(write, ChangeSource.USER, actorId);
    }

    /**
     * Marks a row deleted. The row stays so its history keeps a target.
     */
    public UpsertResult softDelete(UUID tenantId, EntityType type, String externalId, String source, String actorId) {
        requireTenant(tenantId);
        MirrorWrite write = write(() -> persistence.softDelete(tenantId, type, externalId, source, clock.instant()),
                type, externalId);
        return pairWithLog(write, source, actorId);
    }

    /**
     * Records the external id a rail assigned to a locally created row.
     */
    public UpsertResult linkExternalId(UUID tenantId, EntityType type, UUID id, String externalId,
                                       String sourceVersion, String source) {
        requireTenant(tenantId);
        MirrorWrite write = write(() -> persistence.linkExternalId(tenantId, type, id, externalId,
                sourceVersion, source, clock.instant()), type, externalId);
        return pairWithLog(write, source, null);
    }

    public Optional<MirrorRecord> get(UUID tenantId, EntityType type, String externalId) {
        requireTenant(tenantId);
        return persistence.findByExternalId(tenantId, type, externalId);
    }

    public Optional<MirrorRecord> getById(UUID tenantId, EntityType type, UUID id) {
        requireTenant(tenantId);
        return persistence.findById(tenantId, type, id);
    }

    public List<MirrorRecord> query(UUID tenantId, EntityType type, MirrorFilter filter) {
        requireTenant(tenantId);
        return persistence.query(tenantId, type, filter == null ? MirrorFilter.all() : filter);
    }

    /**
     * Every matching record, read in pages of the filter's limit until a short page.
     */
    public List<MirrorRecord> queryAll(UUID tenantId, EntityType type, MirrorFilter filter) {
        MirrorFilter page = filter == null ? MirrorFilter.all() : filter;
        if (page.getLimit() < 1) {
            throw new IllegalArgumentException("Page limit must be positive");
        }
        List<MirrorRecord> records = new ArrayList<>();
        while (true) {
            List<MirrorRecord> batch = query(tenantId, type, page);
            records.addAll(batch);
            if (batch.size() < page.getLimit()) {
                return records;
            }
            page = page.nextPage();
        }
    }

    private MirrorWrite write(Supplier<MirrorWrite> operation, EntityType type, String reference) {
        try {
            return operation.get();
        } catch (NotFoundException | IllegalStateException e) {
            throw e;
        } catch (DataAccessException e) {
            log.error("Mirror write failed for {} {}: {}", type, reference, e.getMessage());
            throw new PersistenceError("Mirror write failed for " + type + " " + reference, e);
        }
    }

    private UpsertResult pairWithLog(MirrorWrite write, String source, String actorId) {
        MirrorRecord record = write.getRecord();
        if (!write.isChanged()) {
            return UpsertResult.unchanged(record);
        }

        NewLogEntry entry = NewLogEntry.builder()
                .tenantId(record.getTenantId())
                .entityType(record.getEntityType())
                .entityId(record.getId())
                .operationKind(write.getOperation())
                .source(source)
                .snapshot(record.toSnapshot())
                .diff(write.getDiff())
                .actorId(actorId)
                .occurredAt(record.getUpdatedAt())
                .build();

        UUID logId = null;
        try {
            logId = logStore.append(entry);
        } catch (DuplicateLogEntryException e) {
            // this exact change is already in the log
            log.debug("Log entry for {} {} already present", record.getEntityType(), record.getId());
        } catch (RuntimeException e) {
            metrics.recordLogPendingMarked(record.getEntityType().name());
            log.error("Log append failed for {} {} ({}); row left log_pending for reconciliation",
                    record.getEntityType(), record.getId(), write.getOperation(), e);
            return new UpsertResult(record, write.getOperation(), write.getDiff(), null, true);
        }

        boolean pending = true;
        try {
            pending = !persistence.clearLogPending(record);
        } catch (DataAccessException e) {
            log.warn("Could not clear log_pending for {} {}: {}", record.getEntityType(), record.getId(), e.getMessage());
        }

        MirrorRecord settled = new MirrorRecord(record.getId(), record.getTenantId(), record.getEntity(),
                record.getRecordStatus(), record.getSyncSource(), record.getLastSyncedAt(), pending,
                record.getCreatedAt(), record.getUpdatedAt());
        return new UpsertResult(settled, write.getOperation(), write.getDiff(), logId, false);
    }

    private static void requireTenant(UUID tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId is required");
        }
    }
}
