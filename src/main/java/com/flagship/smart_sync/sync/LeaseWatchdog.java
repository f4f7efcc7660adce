package com.flagship.smart_sync.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Force-releases leases held past the maximum task duration.
 *
 * A run stuck on a hung call or a dead instance would otherwise block its key
 * forever. The expired run is recorded as TIMED_OUT and its cursor moves to
 * FAILED_RETRYABLE at the last checkpoint.
 */
@Component
@ConditionalOnProperty(name = "smart-sync.watchdog.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LeaseWatchdog {

    private final LeaseService leaseService;
    private final SyncOrchestrator orchestrator;

    @Scheduled(fixedRateString = "${smart-sync.watchdog.interval-ms:30000}")
    public void releaseExpiredLeases() {
        try {
            List<SyncLease> expired = leaseService.findExpired();
            for (SyncLease lease : expired) {
                orchestrator.handleExpiredLease(lease);
            }
        } catch (Exception e) {
            log.error("Error in lease watchdog loop", e);
        }
    }
}
