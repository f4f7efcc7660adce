package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.credential.CredentialStatus;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the tenant-facing sync status and exposes recent runs to operators.
 */
@Service
@RequiredArgsConstructor
public class SyncStatusService {

    private final SyncCursorService cursorService;
    private final LeaseService leaseService;
    private final RailCredentialService credentialService;
    private final SyncRunRepository runRepository;

    public SyncStatusView status(UUID tenantId) {
        Map<String, CredentialStatus> credentials = credentialService.findForTenant(tenantId).stream()
                .collect(Collectors.toMap(RailCredential::getRail, RailCredential::getStatus, (a, b) -> a));
        Set<SyncKey> running = leaseService.findForTenant(tenantId).stream()
                .map(SyncLease::getKey)
                .collect(Collectors.toSet());

        List<SyncStatusView.KeyStatus> keys = new ArrayList<>();
        SyncHealth overall = SyncHealth.OK;
        for (SyncCursor cursor : cursorService.findForTenant(tenantId)) {
            // a key whose credential row is gone needs reconnection too
            CredentialStatus credentialStatus = credentials.getOrDefault(cursor.getKey().getRail(),
                    CredentialStatus.REVOKED);
            SyncHealth health = SyncHealth.of(cursor, credentialStatus);
            overall = overall.worst(health);
            keys.add(SyncStatusView.KeyStatus.builder()
                    .rail(cursor.getKey().getRail())
                    .entityType(cursor.getKey().getEntityType())
                    .state(cursor.getState())
                    .running(running.contains(cursor.getKey()))
                    .lastSuccessAt(cursor.getLastSuccessAt())
                    .lastRunAt(cursor.getLastRunAt())
                    .nextAttemptAt(cursor.getNextAttemptAt())
                    .consecutiveFailures(cursor.getConsecutiveFailures())
                    .health(health)
                    .message(SyncHealth.message(cursor, credentialStatus))
                    .build());
        }

        return SyncStatusView.builder()
                .tenantId(tenantId)
                .overallHealth(overall)
                .keys(keys)
                .build();
    }

    public List<SyncRun> recentRuns(UUID tenantId, String rail, EntityType entityType) {
        return runRepository.findTop20ByTenantIdAndRailAndEntityTypeOrderByStartedAtDesc(tenantId, rail, entityType)
                .stream()
                .map(SyncRunEntity::toDomain)
                .toList();
    }
}
