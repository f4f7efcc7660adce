package com.flagship.smart_sync.webhook;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ProcessedWebhookRepository extends JpaRepository<ProcessedWebhookEntity, String> {

    /**
     * Records a delivery unless the same one was recorded before.
     *
     * @return 1 for a first delivery, 0 for a redelivery
     */
    @Transactional
    @Modifying
    @Query(value = """
        INSERT INTO processed_webhooks (dedup_key, rail, signal_count, received_at)
        VALUES (:dedupKey, :rail, :signalCount, :receivedAt)
        ON CONFLICT (dedup_key) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("dedupKey") String dedupKey,
                       @Param("rail") String rail,
                       @Param("signalCount") int signalCount,
                       @Param("receivedAt") Instant receivedAt);

    long countByRail(String rail);
}
