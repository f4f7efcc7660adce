package com.flagship.smart_sync.sync;

/**
 * How a trigger ended. Skipped outcomes mean no run took place.
 */
public enum SyncOutcome {
    SUCCEEDED,
    /** Halted at a record that could not be persisted; earlier records are committed. */
    PARTIAL,
    FAILED_RETRYABLE,
    FAILED_FATAL,
    CANCELLED,
    TIMED_OUT,
    SKIPPED_LEASE_HELD,
    SKIPPED_BACKOFF,
    SKIPPED_NEEDS_ATTENTION;

    public boolean isSkipped() {
        return this == SKIPPED_LEASE_HELD || this == SKIPPED_BACKOFF || this == SKIPPED_NEEDS_ATTENTION;
    }
}
