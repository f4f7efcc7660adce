package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * What a tenant sees about its syncs: last success and a derived health per key.
 */
@Value
@Builder
public class SyncStatusView {
    UUID tenantId;
    SyncHealth overallHealth;
    List<KeyStatus> keys;

    @Value
    @Builder
    public static class KeyStatus {
        String rail;
        EntityType entityType;
        SyncState state;
        boolean running;
        Instant lastSuccessAt;
        Instant lastRunAt;
        Instant nextAttemptAt;
        int consecutiveFailures;
        SyncHealth health;
        String message;
    }
}
