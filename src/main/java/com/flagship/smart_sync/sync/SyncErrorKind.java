package com.flagship.smart_sync.sync;

/**
 * Why the last run of a key failed. Tenant-facing wording is derived from this,
 * never from the stored error text.
 */
public enum SyncErrorKind {
    /** Network, 5xx or throttling that outlasted the client's retries. */
    TRANSIENT,
    /** The rail rejected our credential; the tenant has to reconnect. */
    AUTHENTICATION,
    /** Permanent rejection by the rail other than auth. */
    REJECTED,
    /** Mirror or log write failure; the batch halted at the failing record. */
    PERSISTENCE,
    /** The run held its lease past the maximum task duration. */
    TIMEOUT,
    INTERNAL
}
