package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.RailOperation;
import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.rail.RailSyncService;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic triggers for every connected tenant.
 *
 * This component:
 * 1. Every 15 minutes, queues a sync for each active credential and each entity
 *    type its rail reads
 * 2. Every minute, promotes FAILED_RETRYABLE keys whose backoff has elapsed
 *
 * Runs are queued on the bounded sync executor; a full queue drops the trigger and
 * the next tick picks the key up again. Keys whose lease is held are skipped by
 * the orchestrator, so overlapping ticks are harmless.
 */
@Component
@ConditionalOnProperty(name = "smart-sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SyncScheduler {

    private final SyncOrchestrator orchestrator;
    private final RailCredentialService credentialService;
    private final RailRegistry railRegistry;

    @Scheduled(fixedRateString = "${smart-sync.scheduler.interval-ms:900000}",
            initialDelayString = "${smart-sync.scheduler.initial-delay-ms:30000}")
    public void scheduleSyncs() {
        try {
            List<RailCredential> credentials = credentialService.findActive();
            int queued = 0;
            for (RailCredential credential : credentials) {
                queued += scheduleFor(credential);
            }
            log.info("Scheduled sync tick queued {} runs for {} active credentials", queued, credentials.size());
        } catch (Exception e) {
            log.error("Error in sync scheduling loop", e);
        }
    }

    @Scheduled(fixedRateString = "${smart-sync.scheduler.promotion-interval-ms:60000}")
    public void promoteRetries() {
        try {
            orchestrator.promoteDueRetries();
        } catch (Exception e) {
            log.error("Error in retry promotion loop", e);
        }
    }

    private int scheduleFor(RailCredential credential) {
        if (!railRegistry.contains(credential.getRail())) {
            log.warn("Credential {} references unknown rail, skipping", credential);
            return 0;
        }
        RailSyncService rail = railRegistry.get(credential.getRail());
        if (!rail.supports(RailOperation.READ)) {
            return 0;
        }

        int queued = 0;
        for (EntityType entityType : rail.supportedEntityTypes()) {
            try {
                orchestrator.triggerAsync(credential.getTenantId(), credential.getRail(), entityType,
                        TriggerSource.SCHEDULED);
                queued++;
            } catch (TaskRejectedException e) {
                log.warn("Sync executor full, dropping scheduled trigger {}/{}/{}",
                        credential.getTenantId(), credential.getRail(), entityType);
            }
        }
        return queued;
    }
}
