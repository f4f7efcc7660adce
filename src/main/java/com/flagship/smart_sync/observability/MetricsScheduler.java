package com.flagship.smart_sync.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need database queries, so Prometheus
 * scrapes stay cheap.
 */
@Component
@ConditionalOnProperty(name = "metrics.refresh.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class MetricsScheduler {

    private final SyncStateMetrics syncStateMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshSyncStateMetrics() {
        syncStateMetrics.refreshMetrics();
    }
}
