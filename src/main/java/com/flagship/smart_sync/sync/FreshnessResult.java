package com.flagship.smart_sync.sync;

import lombok.Value;

import java.time.Instant;

/**
 * Freshness of one key's mirror data at the time it was checked.
 */
@Value
public class FreshnessResult {
    Freshness freshness;
    Instant lastSuccessAt;      // null if the key never synced
    boolean refreshAttempted;
    SyncOutcome refreshOutcome; // null unless a refresh ran

    public boolean isRefreshFailed() {
        return refreshAttempted && refreshOutcome != SyncOutcome.SUCCEEDED;
    }
}
