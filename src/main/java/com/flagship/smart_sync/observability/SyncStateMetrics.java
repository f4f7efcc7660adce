package com.flagship.smart_sync.observability;

import com.flagship.smart_sync.mirror.MirrorPersistenceService;
import com.flagship.smart_sync.sync.SyncCursorService;
import com.flagship.smart_sync.sync.SyncState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over persisted sync state.
 *
 * - smart_sync.keys: sync keys per state (alert on failed_fatal > 0)
 * - smart_sync.mirror.log_pending.rows: mirror rows still waiting for a log entry
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so a scrape never
 * hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncStateMetrics {

    private final SyncCursorService cursorService;
    private final MirrorPersistenceService mirrorPersistence;
    private final MeterRegistry meterRegistry;

    private final Map<SyncState, AtomicLong> keysByState = new EnumMap<>(SyncState.class);
    private final AtomicLong logPendingRows = new AtomicLong(0);

    @PostConstruct
    public void init() {
        for (SyncState state : SyncState.values()) {
            AtomicLong value = new AtomicLong(0);
            keysByState.put(state, value);
            Gauge.builder("smart_sync.keys", value, AtomicLong::get)
                    .description("Sync keys by state")
                    .tag("state", state.name().toLowerCase())
                    .register(meterRegistry);
        }

        Gauge.builder("smart_sync.mirror.log_pending.rows", logPendingRows, AtomicLong::get)
                .description("Mirror rows whose change has no log entry yet")
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        try {
            for (SyncState state : SyncState.values()) {
                keysByState.get(state).set(cursorService.countByState(state));
            }
            logPendingRows.set(mirrorPersistence.countLogPending());
            log.debug("Sync state metrics refreshed: fatal={}, logPending={}",
                    keysByState.get(SyncState.FAILED_FATAL).get(), logPendingRows.get());
        } catch (Exception e) {
            log.warn("Failed to refresh sync state metrics: {}", e.getMessage());
        }
    }
}
