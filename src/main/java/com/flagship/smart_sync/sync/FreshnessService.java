package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-entity-type freshness policy over the mirror.
 *
 * Age is measured from the key's last successful sync. Up to the soft TTL the data
 * is FRESH, up to the hard TTL STALE, beyond it EXPIRED. A STRICT reader gets a
 * synchronous refresh first; if that refresh fails, the mirror state is still
 * served, flagged with its real freshness.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FreshnessService {

    private final SyncOrchestrator orchestrator;
    private final SyncCursorService cursorService;
    private final Clock clock;

    public FreshnessResult check(UUID tenantId, String rail, EntityType entityType) {
        Instant lastSuccess = lastSuccess(new SyncKey(tenantId, rail, entityType));
        return new FreshnessResult(classify(entityType, lastSuccess, clock.instant()), lastSuccess, false, null);
    }

    public FreshnessResult ensureFresh(UUID tenantId, String rail, EntityType entityType, FreshnessHint hint) {
        SyncKey key = new SyncKey(tenantId, rail, entityType);
        Instant lastSuccess = lastSuccess(key);
        Freshness freshness = classify(entityType, lastSuccess, clock.instant());

        if (freshness == Freshness.FRESH) {
            return new FreshnessResult(freshness, lastSuccess, false, null);
        }

        if (hint == FreshnessHint.CACHED_OK) {
            if (freshness == Freshness.EXPIRED) {
                queueRefresh(key);
            }
            return new FreshnessResult(freshness, lastSuccess, false, null);
        }

        SyncOutcome outcome;
        try {
            outcome = orchestrator.trigger(tenantId, rail, entityType, TriggerSource.FRESHNESS).getOutcome();
        } catch (RuntimeException e) {
            log.warn("Freshness refresh of {} failed, serving {} data: {}", key, freshness, e.getMessage());
            return new FreshnessResult(freshness, lastSuccess, true, SyncOutcome.FAILED_RETRYABLE);
        }

        Instant refreshedAt = lastSuccess(key);
        Freshness after = classify(entityType, refreshedAt, clock.instant());
        if (outcome != SyncOutcome.SUCCEEDED) {
            log.info("Freshness refresh of {} ended {}, serving {} data", key, outcome, after);
        }
        return new FreshnessResult(after, refreshedAt, true, outcome);
    }

    static Freshness classify(EntityType entityType, Instant lastSuccess, Instant now) {
        if (lastSuccess == null) {
            return Freshness.EXPIRED;
        }
        Duration age = Duration.between(lastSuccess, now);
        if (age.compareTo(entityType.softTtl()) <= 0) {
            return Freshness.FRESH;
        }
        if (age.compareTo(entityType.hardTtl()) <= 0) {
            return Freshness.STALE;
        }
        return Freshness.EXPIRED;
    }

    private Instant lastSuccess(SyncKey key) {
        Optional<SyncCursor> cursor = cursorService.find(key);
        return cursor.map(SyncCursor::getLastSuccessAt).orElse(null);
    }

    private void queueRefresh(SyncKey key) {
        try {
            orchestrator.triggerAsync(key.getTenantId(), key.getRail(), key.getEntityType(), TriggerSource.FRESHNESS);
        } catch (TaskRejectedException e) {
            log.warn("Sync executor full, background refresh of {} dropped", key);
        }
    }
}
