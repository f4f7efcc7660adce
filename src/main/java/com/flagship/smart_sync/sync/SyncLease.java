package com.flagship.smart_sync.sync;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof that a run holds the exclusive right to sync a key until {@code expiresAt}.
 */
@Value
public class SyncLease {
    SyncKey key;
    UUID holder;
    Instant acquiredAt;
    Instant expiresAt;
}
