package com.flagship.smart_sync.sync;

/**
 * How much staleness a reader accepts.
 */
public enum FreshnessHint {
    /** Data older than the soft TTL is refreshed before it is returned. */
    STRICT,
    /** Mirror state is returned as-is; expired data only queues a background refresh. */
    CACHED_OK
}
