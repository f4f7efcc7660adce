package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * The unit of sync scheduling: one entity type of one rail for one tenant.
 * At most one run per key is active at any time.
 */
@Value
public class SyncKey {
    UUID tenantId;
    String rail;
    EntityType entityType;

    public SyncKey(UUID tenantId, String rail, EntityType entityType) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.rail = Objects.requireNonNull(rail, "rail");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
    }

    @Override
    public String toString() {
        return tenantId + "/" + rail + "/" + entityType;
    }
}
