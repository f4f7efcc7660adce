package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SyncRunRepository extends JpaRepository<SyncRunEntity, UUID> {

    List<SyncRunEntity> findTop20ByTenantIdAndRailAndEntityTypeOrderByStartedAtDesc(
            UUID tenantId, String rail, EntityType entityType);

    long countByTenantIdAndRailAndEntityType(UUID tenantId, String rail, EntityType entityType);
}
