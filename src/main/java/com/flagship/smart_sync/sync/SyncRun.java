package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Result and counters of one trigger.
 */
@Value
@Builder(toBuilder = true)
public class SyncRun {
    UUID id;
    UUID tenantId;
    String rail;
    EntityType entityType;
    TriggerSource triggerSource;
    SyncOutcome outcome;
    int fetched;
    int created;
    int updated;
    int unchanged;
    int skipped;            // mapping errors; records already behind the cursor only count as fetched
    String cursorBefore;
    String cursorAfter;
    SyncErrorKind errorKind;
    Instant startedAt;
    Instant finishedAt;

    public static SyncRun skipped(SyncKey key, TriggerSource trigger, SyncOutcome outcome, String cursor, Instant now) {
        return SyncRun.builder()
                .id(UUID.randomUUID())
                .tenantId(key.getTenantId())
                .rail(key.getRail())
                .entityType(key.getEntityType())
                .triggerSource(trigger)
                .outcome(outcome)
                .cursorBefore(cursor)
                .cursorAfter(cursor)
                .startedAt(now)
                .finishedAt(now)
                .build();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public int processed() {
        return created + updated + unchanged;
    }
}
