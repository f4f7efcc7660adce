package com.flagship.smart_sync.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for sync cursors.
 *
 * Each save commits on its own, so a run's checkpoints survive a later failure
 * of the same run. Saves are optimistic: a cursor changed by someone else
 * since it was read (watchdog, operator reset) is not overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncCursorService {

    private final SyncCursorRepository repository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncCursor getOrCreate(SyncKey key) {
        repository.insertIfAbsent(UUID.randomUUID(), key.getTenantId(), key.getRail(),
                key.getEntityType().name(), clock.instant());
        return repository.findByTenantIdAndRailAndEntityType(key.getTenantId(), key.getRail(), key.getEntityType())
                .map(SyncCursorEntity::toDomain)
                .orElseThrow(() -> new IllegalStateException("Cursor for " + key + " missing after insert"));
    }

    @Transactional(readOnly = true)
    public Optional<SyncCursor> find(SyncKey key) {
        return repository.findByTenantIdAndRailAndEntityType(key.getTenantId(), key.getRail(), key.getEntityType())
                .map(SyncCursorEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<SyncCursor> findForTenant(UUID tenantId) {
        return repository.findByTenantIdOrderByRailAscEntityTypeAsc(tenantId).stream()
                .map(SyncCursorEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SyncCursor> findDueForRetry() {
        return repository.findDueForRetry(clock.instant()).stream()
                .map(SyncCursorEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countByState(SyncState state) {
        return repository.countByState(state);
    }

    /**
     * Writes a cursor transition.
     *
     * @return the stored cursor with its new version
     * @throws ObjectOptimisticLockingFailureException if the row changed since {@code cursor} was read
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncCursor save(SyncCursor cursor) {
        SyncCursorEntity entity = repository.findById(cursor.getId())
                .orElseThrow(() -> new IllegalStateException("Cursor " + cursor.getId() + " not found"));

        if (entity.getVersion() != cursor.getVersion()) {
            throw new ObjectOptimisticLockingFailureException(SyncCursorEntity.class, cursor.getId());
        }

        entity.updateFromDomain(cursor);
        SyncCursor saved = repository.saveAndFlush(entity).toDomain();
        log.debug("Cursor {} -> state={}, token={}", cursor.getKey(), saved.getState(), saved.getCursorToken());
        return saved;
    }
}
