package com.flagship.smart_sync.log;

import com.flagship.smart_sync.mirror.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the transaction_log table.
 *
 * No setters and {@link Immutable}: Hibernate never issues an UPDATE for it,
 * and the table's trigger rejects UPDATE/DELETE from any other path.
 */
@Entity
@Immutable
@Table(name = "transaction_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionLogEntryEntity {

    @Id
    @Column(name = "log_id", nullable = false, updatable = false)
    private UUID logId;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 32)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_kind", nullable = false, updatable = false, length = 16)
    private OperationKind operationKind;

    @Column(name = "source", nullable = false, updatable = false, length = 64)
    private String source;

    @Column(name = "snapshot", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String snapshot;

    @Column(name = "diff", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String diff;

    @Column(name = "actor_id", updatable = false, length = 128)
    private String actorId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 64)
    private String idempotencyKey;

    public static TransactionLogEntryEntity fromDomain(TransactionLogEntry entry) {
        TransactionLogEntryEntity entity = new TransactionLogEntryEntity();
        entity.logId = entry.getLogId();
        entity.tenantId = entry.getTenantId();
        entity.entityType = entry.getEntityType();
        entity.entityId = entry.getEntityId();
        entity.operationKind = entry.getOperationKind();
        entity.source = entry.getSource();
        entity.snapshot = entry.getSnapshot();
        entity.diff = entry.getDiff();
        entity.actorId = entry.getActorId();
        entity.occurredAt = entry.getOccurredAt();
        entity.idempotencyKey = entry.getIdempotencyKey();
        // sequenceNumber is set by database
        return entity;
    }

    public TransactionLogEntry toDomain() {
        return new TransactionLogEntry(
                logId,
                sequenceNumber,
                tenantId,
                entityType,
                entityId,
                operationKind,
                source,
                snapshot,
                diff,
                actorId,
                occurredAt,
                idempotencyKey
        );
    }
}
