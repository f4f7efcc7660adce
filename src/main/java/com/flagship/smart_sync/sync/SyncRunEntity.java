package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for sync_runs. Written once when a run finishes.
 */
@Entity
@Table(name = "sync_runs")
@Immutable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "rail", nullable = false, length = 64)
    private String rail;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private EntityType entityType;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_source", nullable = false, length = 16)
    private TriggerSource triggerSource;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 32)
    private SyncOutcome outcome;

    @Column(name = "fetched_count", nullable = false)
    private int fetchedCount;

    @Column(name = "created_count", nullable = false)
    private int createdCount;

    @Column(name = "updated_count", nullable = false)
    private int updatedCount;

    @Column(name = "unchanged_count", nullable = false)
    private int unchangedCount;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @Column(name = "cursor_before")
    private String cursorBefore;

    @Column(name = "cursor_after")
    private String cursorAfter;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 32)
    private SyncErrorKind errorKind;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false)
    private Instant finishedAt;

    public static SyncRunEntity fromDomain(SyncRun run) {
        return new SyncRunEntity(run.getId(), run.getTenantId(), run.getRail(), run.getEntityType(),
                run.getTriggerSource(), run.getOutcome(), run.getFetched(), run.getCreated(), run.getUpdated(),
                run.getUnchanged(), run.getSkipped(), run.getCursorBefore(), run.getCursorAfter(),
                run.getErrorKind(), run.getStartedAt(), run.getFinishedAt());
    }

    public SyncRun toDomain() {
        return SyncRun.builder()
                .id(id)
                .tenantId(tenantId)
                .rail(rail)
                .entityType(entityType)
                .triggerSource(triggerSource)
                .outcome(outcome)
                .fetched(fetchedCount)
                .created(createdCount)
                .updated(updatedCount)
                .unchanged(unchangedCount)
                .skipped(skippedCount)
                .cursorBefore(cursorBefore)
                .cursorAfter(cursorAfter)
                .errorKind(errorKind)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }
}
