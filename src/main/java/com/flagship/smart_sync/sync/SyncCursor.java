package com.flagship.smart_sync.sync;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Sync position and state machine for one {@link SyncKey}.
 *
 * Key principles:
 * - Transitions are explicit and validated against {@link SyncState}
 * - Every transition returns a new instance; persistence checks {@code version}
 * - {@code lastError} is for operators; tenants only ever see a health derived
 *   from {@code lastErrorKind} and {@code consecutiveFailures}
 */
@Value
public class SyncCursor {
    UUID id;
    SyncKey key;
    String cursorToken;
    SyncState state;
    Instant lastRunAt;
    Instant lastSuccessAt;
    SyncErrorKind lastErrorKind;
    String lastError;
    int consecutiveFailures;
    Instant nextAttemptAt;
    long version;

    public static SyncCursor initial(UUID id, SyncKey key) {
        return new SyncCursor(id, key, null, SyncState.IDLE, null, null, null, null, 0, null, 0);
    }

    public CursorToken position() {
        return CursorToken.parse(cursorToken);
    }

    /**
     * IDLE/SUCCEEDED -> RUNNING.
     */
    public SyncCursor start(Instant now) {
        requireTransition(SyncState.RUNNING);
        return new SyncCursor(id, key, cursorToken, SyncState.RUNNING, now, lastSuccessAt,
                lastErrorKind, lastError, consecutiveFailures, null, version);
    }

    /**
     * Records progress without changing state.
     */
    public SyncCursor advance(CursorToken position) {
        if (state != SyncState.RUNNING) {
            throw new IllegalStateException("Cannot advance cursor of " + key + " in state " + state);
        }
        return new SyncCursor(id, key, CursorToken.format(position), state, lastRunAt, lastSuccessAt,
                lastErrorKind, lastError, consecutiveFailures, nextAttemptAt, version);
    }

    /**
     * RUNNING -> SUCCEEDED. Clears the failure streak.
     */
    public SyncCursor succeed(CursorToken position, Instant now) {
        requireTransition(SyncState.SUCCEEDED);
        return new SyncCursor(id, key, CursorToken.format(position), SyncState.SUCCEEDED, lastRunAt, now,
                null, null, 0, null, version);
    }

    /**
     * RUNNING -> FAILED_RETRYABLE, or FAILED_FATAL once the retry budget is spent.
     *
     * @param retryAt when the key may run again
     */
    public SyncCursor failRetryable(CursorToken position, SyncErrorKind kind, String error,
                                    int maxRetries, Instant retryAt) {
        int failures = consecutiveFailures + 1;
        if (failures >= maxRetries) {
            return failFatal(position, kind, error + " (gave up after " + failures + " consecutive failures)");
        }
        requireTransition(SyncState.FAILED_RETRYABLE);
        return new SyncCursor(id, key, CursorToken.format(position), SyncState.FAILED_RETRYABLE, lastRunAt,
                lastSuccessAt, kind, error, failures, retryAt, version);
    }

    /**
     * RUNNING (or FAILED_RETRYABLE) -> FAILED_FATAL. Only an operator reset leaves this state.
     */
    public SyncCursor failFatal(CursorToken position, SyncErrorKind kind, String error) {
        requireTransition(SyncState.FAILED_FATAL);
        return new SyncCursor(id, key, CursorToken.format(position), SyncState.FAILED_FATAL, lastRunAt,
                lastSuccessAt, kind, error, consecutiveFailures + 1, null, version);
    }

    /**
     * RUNNING -> IDLE after cancellation. Progress up to {@code position} is kept.
     */
    public SyncCursor cancel(CursorToken position) {
        requireTransition(SyncState.IDLE);
        return new SyncCursor(id, key, CursorToken.format(position), SyncState.IDLE, lastRunAt, lastSuccessAt,
                lastErrorKind, lastError, consecutiveFailures, null, version);
    }

    /**
     * FAILED_RETRYABLE -> IDLE once the backoff has elapsed.
     */
    public SyncCursor promote() {
        requireTransition(SyncState.IDLE);
        if (state != SyncState.FAILED_RETRYABLE) {
            throw new IllegalStateException("Only FAILED_RETRYABLE cursors are promoted, " + key + " is " + state);
        }
        return new SyncCursor(id, key, cursorToken, SyncState.IDLE, lastRunAt, lastSuccessAt,
                lastErrorKind, lastError, consecutiveFailures, null, version);
    }

    /**
     * FAILED_FATAL -> IDLE by operator action. The failure streak starts over.
     */
    public SyncCursor reset() {
        if (state != SyncState.FAILED_FATAL) {
            throw new IllegalStateException("Only FAILED_FATAL cursors can be reset, " + key + " is " + state);
        }
        return new SyncCursor(id, key, cursorToken, SyncState.IDLE, lastRunAt, lastSuccessAt,
                lastErrorKind, lastError, 0, null, version);
    }

    public boolean isBackoffElapsed(Instant now) {
        return nextAttemptAt == null || !now.isBefore(nextAttemptAt);
    }

    private void requireTransition(SyncState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(
                    String.format("Cannot move sync %s from %s to %s", key, state, target));
        }
    }
}
