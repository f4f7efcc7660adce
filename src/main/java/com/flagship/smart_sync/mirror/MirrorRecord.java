package com.flagship.smart_sync.mirror;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Current state of one mirrored entity for one tenant.
 *
 * Key properties:
 * - {@code id} is stable for the life of the entity and is what log entries reference
 * - At most one row per (tenant, entity type, external id)
 * - Never removed; {@code recordStatus} goes to DELETED instead
 * - {@code logPending} is set while a change has no matching log entry yet
 */
@Value
public class MirrorRecord {
    UUID id;
    UUID tenantId;
    CanonicalEntity entity;
    RecordStatus recordStatus;
    String syncSource;
    Instant lastSyncedAt;
    boolean logPending;
    Instant createdAt;
    Instant updatedAt;

    public EntityType getEntityType() {
        return entity.getEntityType();
    }

    public String getExternalId() {
        return entity.getExternalId();
    }

    public String getCounterpartyName() {
        return entity.getCounterpartyName();
    }

    public BigDecimal getAmount() {
        return entity.getAmount();
    }

    public LocalDate getDueDate() {
        return entity.getDueDate();
    }

    public String getStatus() {
        return entity.getStatus();
    }

    public boolean isActive() {
        return recordStatus == RecordStatus.ACTIVE;
    }

    public MirrorSnapshot toSnapshot() {
        return new MirrorSnapshot(entity, recordStatus);
    }
}
