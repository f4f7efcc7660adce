package com.flagship.smart_sync.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized counters and timers for the sync layer.
 *
 * Metrics exposed:
 * - smart_sync.client.calls: external calls by rail and outcome
 * - smart_sync.client.retries: retries by rail and error type
 * - smart_sync.client.throttled: calls refused locally by the rate window or a cool-down
 * - smart_sync.run.duration: run duration by rail, entity type and outcome
 * - smart_sync.run.records: records processed per run by result
 * - smart_sync.lease.skipped / smart_sync.lease.force_released
 * - smart_sync.log.appends / smart_sync.mirror.log_pending
 *
 * Tag values are sanitized so an unexpected value cannot explode cardinality.
 */
@Component
public class SyncMetrics {

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Client ====================

    public void recordClientCall(String rail, String outcome) {
        registry.counter("smart_sync.client.calls",
                "rail", sanitizeTag(rail),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordClientRetry(String rail, String errorType) {
        registry.counter("smart_sync.client.retries",
                "rail", sanitizeTag(rail),
                "error_type", sanitizeTag(errorType)
        ).increment();
    }

    public void recordThrottled(String rail, String reason) {
        registry.counter("smart_sync.client.throttled",
                "rail", sanitizeTag(rail),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    // ==================== Runs ====================

    public void recordRun(String rail, String entityType, String outcome, Duration duration) {
        Timer.builder("smart_sync.run.duration")
                .description("Duration of a sync run")
                .tag("rail", sanitizeTag(rail))
                .tag("entity_type", sanitizeTag(entityType))
                .tag("outcome", sanitizeTag(outcome))
                .register(registry)
                .record(duration);
    }

    public void recordRunRecords(String rail, String entityType, String result, int count) {
        if (count <= 0) {
            return;
        }
        registry.counter("smart_sync.run.records",
                "rail", sanitizeTag(rail),
                "entity_type", sanitizeTag(entityType),
                "result", sanitizeTag(result)
        ).increment(count);
    }

    public void recordLeaseSkipped(String rail, String entityType) {
        registry.counter("smart_sync.lease.skipped",
                "rail", sanitizeTag(rail),
                "entity_type", sanitizeTag(entityType)
        ).increment();
    }

    public void recordLeaseForceReleased(String rail) {
        registry.counter("smart_sync.lease.force_released",
                "rail", sanitizeTag(rail)
        ).increment();
    }

    // ==================== Mirror / Log ====================

    public void recordLogAppend(String source, String result) {
        registry.counter("smart_sync.log.appends",
                "source", sanitizeTag(source),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordLogPendingMarked(String entityType) {
        registry.counter("smart_sync.mirror.log_pending",
                "entity_type", sanitizeTag(entityType),
                "event", "marked"
        ).increment();
    }

    public void recordLogPendingReconciled(String entityType) {
        registry.counter("smart_sync.mirror.log_pending",
                "entity_type", sanitizeTag(entityType),
                "event", "reconciled"
        ).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String normalized = value.toLowerCase().replaceAll("[^a-z0-9_.-]", "_");
        return normalized.length() > 50 ? normalized.substring(0, 50) : normalized;
    }
}
