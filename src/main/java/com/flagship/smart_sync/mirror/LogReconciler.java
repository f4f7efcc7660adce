package com.flagship.smart_sync.mirror;

import com.flagship.smart_sync.exception.DuplicateLogEntryException;
import com.flagship.smart_sync.log.NewLogEntry;
import com.flagship.smart_sync.log.OperationKind;
import com.flagship.smart_sync.log.TransactionLogStore;
import com.flagship.smart_sync.observability.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Closes audit gaps left by failed log appends.
 *
 * Finds mirror rows still marked log_pending after a grace period, appends a
 * SYNCED entry carrying the row's current snapshot and clears the flag. The
 * entry's idempotency key is derived from the row's id and updated_at, so
 * concurrent reconcilers on several instances produce one entry at most.
 */
@Component
@ConditionalOnProperty(name = "smart-sync.reconciler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LogReconciler {

    private static final Duration GRACE_PERIOD = Duration.ofMinutes(2);

    private final MirrorPersistenceService persistence;
    private final TransactionLogStore logStore;
    private final SyncMetrics metrics;
    private final Clock clock;

    @Value("${smart-sync.reconciler.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedRateString = "${smart-sync.reconciler.interval-ms:60000}")
    public void reconcilePending() {
        try {
            int reconciled = reconcile(clock.instant().minus(GRACE_PERIOD));
            if (reconciled > 0) {
                log.info("Reconciled {} mirror rows with missing log entries", reconciled);
            }
        } catch (Exception e) {
            log.error("Error in log reconciliation loop", e);
        }
    }

    /**
     * Reconciles rows changed before {@code changedBefore}.
     *
     * @return number of rows whose flag was cleared
     */
    public int reconcile(Instant changedBefore) {
        int reconciled = 0;
        for (EntityType type : EntityType.values()) {
            List<MirrorRecord> pending = persistence.findLogPending(type, changedBefore, batchSize);
            for (MirrorRecord record : pending) {
                if (reconcileRecord(record)) {
                    reconciled++;
                }
            }
        }
        return reconciled;
    }

    private boolean reconcileRecord(MirrorRecord record) {
        NewLogEntry entry = NewLogEntry.builder()
                .tenantId(record.getTenantId())
                .entityType(record.getEntityType())
                .entityId(record.getId())
                .operationKind(OperationKind.SYNCED)
                .source(record.getSyncSource())
                .snapshot(record.toSnapshot())
                .diff(Map.of())
                .occurredAt(record.getUpdatedAt())
                .build();

        try {
            logStore.append(entry);
        } catch (DuplicateLogEntryException e) {
            log.debug("Reconciliation entry for {} {} already present", record.getEntityType(), record.getId());
        } catch (Exception e) {
            log.warn("Reconciliation append failed for {} {}: {}", record.getEntityType(), record.getId(), e.getMessage());
            return false;
        }

        boolean cleared = persistence.clearLogPending(record);
        if (cleared) {
            metrics.recordLogPendingReconciled(record.getEntityType().name());
        }
        return cleared;
    }
}
