package com.flagship.smart_sync.rail;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.credential.RailCredential;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Incremental fetch of one page.
 *
 * {@code updatedSince} is inclusive: rails return records modified at or after it,
 * and the orchestrator drops the ones its cursor has already passed. Responses are
 * cached for the run that asked for them and never served to a later run.
 */
@Value
@Builder
public class RailFetchRequest {
    UUID tenantId;
    EntityType entityType;
    RailCredential credential;
    Instant updatedSince;       // null for a full initial sync
    String pageToken;           // continuation from the previous page, null for the first
    int pageSize;
    UUID runId;                 // null outside a sync run: no response caching

    public String cacheScope() {
        return runId == null ? null : runId.toString();
    }
}
