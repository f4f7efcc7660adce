package com.flagship.smart_sync.webhook;

import com.flagship.smart_sync.exception.InvalidWebhookException;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.RailOperation;
import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.rail.RailSyncService;
import com.flagship.smart_sync.rail.WebhookSignal;
import com.flagship.smart_sync.rail.credential.CredentialStatus;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import com.flagship.smart_sync.sync.SyncOrchestrator;
import com.flagship.smart_sync.sync.TriggerSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns rail webhook deliveries into sync triggers.
 *
 * This service:
 * 1. Lets the rail verify the signature and parse the body into signals
 * 2. Drops redeliveries (same rail and body) using processed_webhooks
 * 3. Resolves each signal's rail account to tenants with an active credential
 * 4. Queues one WEBHOOK-triggered sync per distinct (tenant, entity type)
 * 5. Releases the processed_webhooks row when a trigger could not be queued, so a
 *    redelivery of the same body is processed again
 *
 * Signals never carry data into the mirror; the queued sync fetches changes
 * through the normal incremental path, so a lost webhook only delays data until
 * the next scheduled run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIntakeService {

    private final RailRegistry railRegistry;
    private final RailCredentialService credentialService;
    private final SyncOrchestrator orchestrator;
    private final ProcessedWebhookRepository processedWebhooks;
    private final Clock clock;

    /**
     * @throws InvalidWebhookException if the rail rejects the signature or body
     */
    public WebhookIntakeResult accept(String railId, String body, HttpHeaders headers) {
        RailSyncService rail = railRegistry.get(railId);
        List<WebhookSignal> signals = rail.parseWebhook(body, headers);

        String dedupKey = dedupKey(railId, body);
        if (processedWebhooks.insertIfAbsent(dedupKey, railId, signals.size(), clock.instant()) == 0) {
            log.info("Duplicate {} webhook ignored ({} signals)", railId, signals.size());
            return WebhookIntakeResult.duplicate(signals.size());
        }

        Set<Target> targets = new LinkedHashSet<>();
        for (WebhookSignal signal : signals) {
            if (!rail.supports(RailOperation.READ) || !rail.supports(signal.getEntityType())) {
                continue;
            }
            List<RailCredential> credentials = credentialService.findByExternalAccount(railId,
                    signal.getExternalAccountId());
            if (credentials.isEmpty()) {
                log.warn("{} webhook for unknown account {}, ignoring", railId, signal.getExternalAccountId());
            }
            for (RailCredential credential : credentials) {
                if (credential.getStatus() == CredentialStatus.ACTIVE) {
                    targets.add(new Target(credential.getTenantId(), signal.getEntityType()));
                }
            }
        }

        int triggered = 0;
        for (Target target : targets) {
            try {
                orchestrator.triggerAsync(target.tenantId(), railId, target.entityType(), TriggerSource.WEBHOOK);
                triggered++;
            } catch (TaskRejectedException e) {
                log.warn("Sync executor full, webhook trigger {}/{}/{} dropped",
                        target.tenantId(), railId, target.entityType());
            }
        }

        if (triggered < targets.size()) {
            processedWebhooks.deleteById(dedupKey);
            log.warn("{} of {} {} webhook triggers dropped, delivery left unprocessed for redelivery",
                    targets.size() - triggered, targets.size(), railId);
        }

        log.info("Accepted {} webhook: {} signals, {} syncs queued", railId, signals.size(), triggered);
        return new WebhookIntakeResult(false, signals.size(), triggered);
    }

    static String dedupKey(String railId, String body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((railId + "\n" + body).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Target(UUID tenantId, EntityType entityType) {
    }
}
