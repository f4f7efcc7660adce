package com.flagship.smart_sync.log;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read and insert access to the transaction log. Nothing here updates or deletes.
 */
@Repository
public interface TransactionLogRepository extends JpaRepository<TransactionLogEntryEntity, UUID> {

    /**
     * Full history of one entity, oldest first. Sequence number breaks ties
     * between entries recorded in the same microsecond.
     */
    @Query("""
        SELECT e FROM TransactionLogEntryEntity e
        WHERE e.tenantId = :tenantId AND e.entityId = :entityId
        ORDER BY e.occurredAt ASC, e.sequenceNumber ASC
        """)
    List<TransactionLogEntryEntity> findHistory(@Param("tenantId") UUID tenantId,
                                                @Param("entityId") UUID entityId);

    boolean existsByIdempotencyKey(String idempotencyKey);

    long countByTenantIdAndEntityId(UUID tenantId, UUID entityId);

    long countByTenantId(UUID tenantId);
}
