package com.flagship.smart_sync.webhook;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One accepted webhook delivery. Rails redeliver on timeouts; a second delivery
 * of the same body finds this row and is acknowledged without triggering again.
 */
@Entity
@Table(name = "processed_webhooks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedWebhookEntity {

    @Id
    @Column(name = "dedup_key", nullable = false, updatable = false, length = 128)
    private String dedupKey;

    @Column(name = "rail", nullable = false, length = 64)
    private String rail;

    @Column(name = "signal_count", nullable = false)
    private int signalCount;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;
}
