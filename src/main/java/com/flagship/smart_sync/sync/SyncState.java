package com.flagship.smart_sync.sync;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sync state per (tenant, rail, entity type).
 *
 * <pre>
 * IDLE -> RUNNING -> SUCCEEDED | FAILED_RETRYABLE | FAILED_FATAL
 * RUNNING -> IDLE                      (cancelled or abandoned)
 * SUCCEEDED -> RUNNING                 (next trigger)
 * FAILED_RETRYABLE -> IDLE             (backoff elapsed)
 * FAILED_RETRYABLE -> FAILED_FATAL     (retry budget spent)
 * FAILED_FATAL -> IDLE                 (operator reset only)
 * </pre>
 */
public enum SyncState {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED_FATAL;

    public Set<SyncState> allowedTargets() {
        return switch (this) {
            case IDLE -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED_RETRYABLE, FAILED_FATAL, IDLE);
            case SUCCEEDED -> EnumSet.of(RUNNING);
            case FAILED_RETRYABLE -> EnumSet.of(IDLE, FAILED_FATAL);
            case FAILED_FATAL -> EnumSet.of(IDLE);
        };
    }

    public boolean canTransitionTo(SyncState target) {
        return allowedTargets().contains(target);
    }

    /**
     * States from which a trigger may start a run.
     */
    public boolean isStartable() {
        return this == IDLE || this == SUCCEEDED;
    }
}
