package com.flagship.smart_sync.log;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.FieldChange;
import com.flagship.smart_sync.mirror.MirrorSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A change to be appended. The idempotency key is derived when not supplied.
 */
@Value
@Builder
public class NewLogEntry {
    UUID tenantId;
    EntityType entityType;
    UUID entityId;
    OperationKind operationKind;
    String source;                  // rail id or "user"
    MirrorSnapshot snapshot;
    Map<String, FieldChange> diff;
    String actorId;
    Instant occurredAt;
    String idempotencyKey;

    public String resolveIdempotencyKey() {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            return idempotencyKey;
        }
        return IdempotencyKeys.forChange(entityId, source, occurredAt, operationKind);
    }
}
