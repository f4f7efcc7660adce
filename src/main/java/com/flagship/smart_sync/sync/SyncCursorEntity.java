package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for sync_cursors.
 *
 * Rows are created by {@link SyncCursorRepository#insertIfAbsent}; state columns
 * change only through {@link #updateFromDomain}, guarded by the optimistic version.
 */
@Entity
@Table(name = "sync_cursors")
@Getter
@NoArgsConstructor
public class SyncCursorEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "rail", nullable = false, updatable = false, length = 64)
    private String rail;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 32)
    private EntityType entityType;

    @Column(name = "cursor_token")
    private String cursorToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private SyncState state;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "last_success_at")
    private Instant lastSuccessAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_kind", length = 32)
    private SyncErrorKind lastErrorKind;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    void updateFromDomain(SyncCursor cursor) {
        this.cursorToken = cursor.getCursorToken();
        this.state = cursor.getState();
        this.lastRunAt = cursor.getLastRunAt();
        this.lastSuccessAt = cursor.getLastSuccessAt();
        this.lastErrorKind = cursor.getLastErrorKind();
        this.lastError = cursor.getLastError();
        this.consecutiveFailures = cursor.getConsecutiveFailures();
        this.nextAttemptAt = cursor.getNextAttemptAt();
    }

    public SyncCursor toDomain() {
        return new SyncCursor(id, new SyncKey(tenantId, rail, entityType), cursorToken, state,
                lastRunAt, lastSuccessAt, lastErrorKind, lastError, consecutiveFailures, nextAttemptAt, version);
    }
}
