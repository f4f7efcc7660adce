package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SyncCursorRepository extends JpaRepository<SyncCursorEntity, UUID> {

    Optional<SyncCursorEntity> findByTenantIdAndRailAndEntityType(UUID tenantId, String rail, EntityType entityType);

    List<SyncCursorEntity> findByTenantIdOrderByRailAscEntityTypeAsc(UUID tenantId);

    /**
     * Creates the cursor row for a key unless one exists. Safe under concurrent first triggers.
     */
    @Modifying
    @Query(value = """
        INSERT INTO sync_cursors (id, tenant_id, rail, entity_type, state, consecutive_failures, version, created_at, updated_at)
        VALUES (:id, :tenantId, :rail, :entityType, 'IDLE', 0, 0, :now, :now)
        ON CONFLICT (tenant_id, rail, entity_type) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("tenantId") UUID tenantId,
                       @Param("rail") String rail,
                       @Param("entityType") String entityType,
                       @Param("now") Instant now);

    /**
     * Retryable failures whose backoff has elapsed, for promotion back to IDLE.
     */
    @Query("""
        SELECT c FROM SyncCursorEntity c
        WHERE c.state = com.flagship.smart_sync.sync.SyncState.FAILED_RETRYABLE
        AND (c.nextAttemptAt IS NULL OR c.nextAttemptAt <= :now)
        ORDER BY c.nextAttemptAt ASC
        """)
    List<SyncCursorEntity> findDueForRetry(@Param("now") Instant now);

    long countByState(SyncState state);
}
