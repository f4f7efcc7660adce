package com.flagship.smart_sync.rail;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.Value;

import java.time.Instant;

/**
 * A rail's notice that something changed for one of its accounts.
 *
 * Signals only trigger syncs; the changed data itself is always fetched
 * through the normal incremental path.
 */
@Value
public class WebhookSignal {
    String rail;
    String externalAccountId;
    EntityType entityType;
    String externalId;
    String operation;
    Instant occurredAt;
}
