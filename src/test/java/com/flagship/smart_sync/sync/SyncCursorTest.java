package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine tests for {@link SyncCursor}.
 *
 * Valid paths:
 * - IDLE -> RUNNING -> SUCCEEDED -> RUNNING
 * - RUNNING -> FAILED_RETRYABLE -> IDLE (promotion)
 * - RUNNING -> FAILED_RETRYABLE ... -> FAILED_FATAL (retry budget spent)
 * - FAILED_FATAL -> IDLE (reset only)
 */
class SyncCursorTest {

    private static final Instant T0 = Instant.parse("2025-01-10T00:00:00Z");

    private final SyncKey key = new SyncKey(UUID.randomUUID(), "quickbooks", EntityType.BILL);
    private final CursorToken position = new CursorToken(Instant.parse("2025-01-09T12:00:00Z"), "146");

    private SyncCursor running() {
        return SyncCursor.initial(UUID.randomUUID(), key).start(T0);
    }

    @Test
    @DisplayName("A successful run records the position and clears the failure streak")
    void testSucceed_ClearsFailures() {
        SyncCursor failed = running().failRetryable(null, SyncErrorKind.TRANSIENT, "503", 5, T0.plusSeconds(60));
        assertEquals(1, failed.getConsecutiveFailures());

        SyncCursor succeeded = failed.promote().start(T0.plusSeconds(120)).succeed(position, T0.plusSeconds(130));

        assertEquals(SyncState.SUCCEEDED, succeeded.getState());
        assertEquals(position, succeeded.position());
        assertEquals(T0.plusSeconds(130), succeeded.getLastSuccessAt());
        assertEquals(T0.plusSeconds(120), succeeded.getLastRunAt());
        assertEquals(0, succeeded.getConsecutiveFailures());
        assertNull(succeeded.getLastErrorKind());
        assertNull(succeeded.getLastError());
    }

    @Test
    @DisplayName("Retryable failures escalate to fatal once the retry budget is spent")
    void testFailRetryable_EscalatesAtMaxRetries() {
        SyncCursor cursor = running().failRetryable(position, SyncErrorKind.TRANSIENT, "timeout", 3, T0.plusSeconds(60));
        assertEquals(SyncState.FAILED_RETRYABLE, cursor.getState());
        assertEquals(T0.plusSeconds(60), cursor.getNextAttemptAt());
        assertEquals(position, cursor.position());

        cursor = cursor.promote().start(T0.plusSeconds(60))
                .failRetryable(position, SyncErrorKind.TRANSIENT, "timeout", 3, T0.plusSeconds(180));
        assertEquals(SyncState.FAILED_RETRYABLE, cursor.getState());
        assertEquals(2, cursor.getConsecutiveFailures());

        cursor = cursor.promote().start(T0.plusSeconds(180))
                .failRetryable(position, SyncErrorKind.TRANSIENT, "timeout", 3, T0.plusSeconds(420));
        assertEquals(SyncState.FAILED_FATAL, cursor.getState());
        assertEquals(3, cursor.getConsecutiveFailures());
        assertNull(cursor.getNextAttemptAt());
        assertTrue(cursor.getLastError().contains("gave up after 3"));
    }

    @Test
    @DisplayName("Fatal cursors only leave FAILED_FATAL through reset")
    void testFatal_OnlyResetLeaves() {
        SyncCursor fatal = running().failFatal(position, SyncErrorKind.AUTHENTICATION, "401");

        assertThrows(IllegalStateException.class, () -> fatal.start(T0));
        assertThrows(IllegalStateException.class, fatal::promote);

        SyncCursor reset = fatal.reset();
        assertEquals(SyncState.IDLE, reset.getState());
        assertEquals(0, reset.getConsecutiveFailures());
        assertEquals(position, reset.position(), "reset keeps the position");
        assertEquals(SyncState.RUNNING, reset.start(T0).getState());
    }

    @Test
    @DisplayName("Cancelling a run keeps committed progress and returns to IDLE")
    void testCancel_KeepsProgress() {
        SyncCursor cancelled = running().advance(position).cancel(position);

        assertEquals(SyncState.IDLE, cancelled.getState());
        assertEquals(position, cancelled.position());
        assertNull(cancelled.getLastSuccessAt());
    }

    @Test
    @DisplayName("Invalid transitions are rejected")
    void testInvalidTransitions() {
        SyncCursor idle = SyncCursor.initial(UUID.randomUUID(), key);

        assertThrows(IllegalStateException.class, () -> idle.succeed(position, T0));
        assertThrows(IllegalStateException.class, () -> idle.advance(position));
        assertThrows(IllegalStateException.class, idle::reset);
        assertThrows(IllegalStateException.class, idle::promote);
        assertThrows(IllegalStateException.class, () -> running().start(T0));

        SyncCursor succeeded = running().succeed(position, T0);
        assertThrows(IllegalStateException.class, succeeded::promote);
        assertThrows(IllegalStateException.class, () -> succeeded.cancel(position));
    }

    @Test
    @DisplayName("Backoff has elapsed at, not before, the next attempt time")
    void testIsBackoffElapsed() {
        SyncCursor failed = running().failRetryable(null, SyncErrorKind.TRANSIENT, "503", 5, T0.plusSeconds(60));

        assertFalse(failed.isBackoffElapsed(T0.plusSeconds(59)));
        assertTrue(failed.isBackoffElapsed(T0.plusSeconds(60)));
        assertTrue(SyncCursor.initial(UUID.randomUUID(), key).isBackoffElapsed(T0));
    }

    @Test
    @DisplayName("Only IDLE and SUCCEEDED are startable")
    void testSyncState_Startable() {
        assertTrue(SyncState.IDLE.isStartable());
        assertTrue(SyncState.SUCCEEDED.isStartable());
        assertFalse(SyncState.RUNNING.isStartable());
        assertFalse(SyncState.FAILED_RETRYABLE.isStartable());
        assertFalse(SyncState.FAILED_FATAL.isStartable());
        assertFalse(SyncState.FAILED_FATAL.canTransitionTo(SyncState.RUNNING));
        assertTrue(SyncState.FAILED_RETRYABLE.canTransitionTo(SyncState.FAILED_FATAL));
    }
}
