package com.flagship.smart_sync.mirror;

import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.log.ChangeSource;
import com.flagship.smart_sync.log.OperationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional mirror writes.
 *
 * Each public method locks the row it changes, compares old and new content,
 * and commits the new state with log_pending set. The caller appends the log
 * entry afterwards and clears the flag; if that never happens the flag stays
 * and the reconciler picks the row up.
 *
 * Changes to one entity get strictly increasing updated_at values, which is
 * also the occurred_at of their log entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MirrorPersistenceService {

    private final MirrorRepository repository;

    @Transactional
    public MirrorWrite upsert(UUID tenantId, CanonicalEntity entity, String source, Instant now) {
        EntityType type = entity.getEntityType();

        if (entity.getExternalId() == null) {
            return insertNew(tenantId, entity, source, now);
        }

        Optional<MirrorRecord> existing = repository.findByExternalId(tenantId, type, entity.getExternalId(), true);
        if (existing.isEmpty()) {
            MirrorRecord created = newRecord(tenantId, entity, source, now);
            if (repository.insert(created)) {
                return new MirrorWrite(created, OperationKind.CREATED,
                        CanonicalDiff.between(null, created.toSnapshot()));
            }
            // another writer inserted it between our lookup and insert
            existing = repository.findByExternalId(tenantId, type, entity.getExternalId(), true);
            if (existing.isEmpty()) {
                throw new IllegalStateException("Mirror row for " + type + "/" + entity.getExternalId()
                        + " conflicted on insert but cannot be read");
            }
        }

        return apply(existing.get(), entity, RecordStatus.ACTIVE, source, now);
    }

    @Transactional
    public MirrorWrite updateById(UUID tenantId, UUID id, CanonicalEntity entity, String source, Instant now) {
        MirrorRecord existing = lockById(tenantId, entity.getEntityType(), id);
        CanonicalEntity next = entity.toBuilder()
                .externalId(existing.getExternalId())
                .sourceVersion(existing.getEntity().getSourceVersion())
                .build();
        return apply(existing, next, existing.getRecordStatus(), source, now);
    }

    @Transactional
    public MirrorWrite softDelete(UUID tenantId, EntityType type, String externalId, String source, Instant now) {
        MirrorRecord existing = repository.findByExternalId(tenantId, type, externalId, true)
                .orElseThrow(() -> new NotFoundException(type + " " + externalId + " not found"));
        return apply(existing, existing.getEntity(), RecordStatus.DELETED, source, now);
    }

    @Transactional
    public MirrorWrite linkExternalId(UUID tenantId, EntityType type, UUID id, String externalId,
                                      String sourceVersion, String source, Instant now) {
        MirrorRecord existing = lockById(tenantId, type, id);
        if (existing.getExternalId() != null && !existing.getExternalId().equals(externalId)) {
            throw new IllegalStateException("Mirror row " + id + " is already linked to " + existing.getExternalId());
        }
        CanonicalEntity linked = existing.getEntity().toBuilder()
                .externalId(externalId)
                .sourceVersion(sourceVersion)
                .build();
        return apply(existing, linked, existing.getRecordStatus(), source, now);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean clearLogPending(MirrorRecord changed) {
        return repository.clearLogPending(changed.getTenantId(), changed.getEntityType(),
                changed.getId(), changed.getUpdatedAt());
    }

    @Transactional(readOnly = true)
    public List<MirrorRecord> findLogPending(EntityType type, Instant changedBefore, int limit) {
        return repository.findLogPending(type, changedBefore, limit);
    }

    @Transactional(readOnly = true)
    public Optional<MirrorRecord> findByExternalId(UUID tenantId, EntityType type, String externalId) {
        return repository.findByExternalId(tenantId, type, externalId, false);
    }

    @Transactional(readOnly = true)
    public Optional<MirrorRecord> findById(UUID tenantId, EntityType type, UUID id) {
        return repository.findById(tenantId, type, id, false);
    }

    @Transactional(readOnly = true)
    public List<MirrorRecord> query(UUID tenantId, EntityType type, MirrorFilter filter) {
        return repository.query(tenantId, type, filter);
    }

    @Transactional(readOnly = true)
    public long countLogPending() {
        long total = 0;
        for (EntityType type : EntityType.values()) {
            total += repository.countLogPending(type);
        }
        return total;
    }

    private MirrorWrite insertNew(UUID tenantId, CanonicalEntity entity, String source, Instant now) {
        MirrorRecord created = newRecord(tenantId, entity, source, now);
        repository.insert(created);
        return new MirrorWrite(created, OperationKind.CREATED, CanonicalDiff.between(null, created.toSnapshot()));
    }

    private MirrorRecord newRecord(UUID tenantId, CanonicalEntity entity, String source, Instant now) {
        return new MirrorRecord(
                UUID.randomUUID(),
                tenantId,
                entity,
                RecordStatus.ACTIVE,
                source,
                ChangeSource.isUser(source) ? null : now,
                true,
                now,
                now
        );
    }

    private MirrorWrite apply(MirrorRecord existing, CanonicalEntity entity, RecordStatus status,
                              String source, Instant now) {
        MirrorSnapshot after = new MirrorSnapshot(entity, status);
        Map<String, FieldChange> diff = CanonicalDiff.between(existing.toSnapshot(), after);
        Instant lastSyncedAt = ChangeSource.isUser(source) ? existing.getLastSyncedAt() : now;

        if (diff.isEmpty()) {
            if (!ChangeSource.isUser(source)) {
                repository.touchSynced(existing.getTenantId(), existing.getEntityType(), existing.getId(), source, now);
            }
            MirrorRecord touched = new MirrorRecord(existing.getId(), existing.getTenantId(), existing.getEntity(),
                    existing.getRecordStatus(), ChangeSource.isUser(source) ? existing.getSyncSource() : source,
                    lastSyncedAt, existing.isLogPending(), existing.getCreatedAt(), existing.getUpdatedAt());
            return new MirrorWrite(touched, null, Map.of());
        }

        Instant changedAt = now.isAfter(existing.getUpdatedAt())
                ? now
                : existing.getUpdatedAt().plus(1, ChronoUnit.MICROS);

        OperationKind kind = status == RecordStatus.DELETED && existing.getRecordStatus() == RecordStatus.ACTIVE
                ? OperationKind.DELETED
                : OperationKind.UPDATED;

        MirrorRecord updated = new MirrorRecord(
                existing.getId(),
                existing.getTenantId(),
                entity,
                status,
                source,
                lastSyncedAt,
                true,
                existing.getCreatedAt(),
                changedAt
        );
        repository.update(updated);

        log.debug("Mirror {} {} {}: fields={}", kind, existing.getEntityType(), existing.getId(), diff.keySet());
        return new MirrorWrite(updated, kind, diff);
    }

    private MirrorRecord lockById(UUID tenantId, EntityType type, UUID id) {
        return repository.findById(tenantId, type, id, true)
                .orElseThrow(() -> new NotFoundException(type + " " + id + " not found"));
    }
}
