package com.flagship.smart_sync.log;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one change to one mirrored entity.
 *
 * Snapshot and diff are kept as the JSON that was written, so the entry reads
 * back exactly as it was recorded.
 */
@Value
public class TransactionLogEntry {
    UUID logId;
    Long sequenceNumber;        // assigned by the database
    UUID tenantId;
    EntityType entityType;
    UUID entityId;
    OperationKind operationKind;
    String source;
    String snapshot;            // JSON MirrorSnapshot
    String diff;                // JSON map of field -> {from, to}
    String actorId;
    Instant occurredAt;
    String idempotencyKey;
}
