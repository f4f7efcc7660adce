package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.credential.CredentialStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tenant-visible health derivation. Messages are fixed texts, never error details.
 */
class SyncHealthTest {

    private static final Instant T0 = Instant.parse("2025-01-10T00:00:00Z");

    private final SyncKey key = new SyncKey(UUID.randomUUID(), "quickbooks", EntityType.BILL);

    private SyncCursor running() {
        return SyncCursor.initial(UUID.randomUUID(), key).start(T0);
    }

    @Test
    @DisplayName("Healthy cursor with an active credential is OK")
    void testOk() {
        SyncCursor cursor = running().succeed(null, T0);

        assertEquals(SyncHealth.OK, SyncHealth.of(cursor, CredentialStatus.ACTIVE));
        assertEquals(SyncHealth.MESSAGE_OK, SyncHealth.message(cursor, CredentialStatus.ACTIVE));
    }

    @Test
    @DisplayName("Retrying cursor is DEGRADED without leaking the error text")
    void testDegraded() {
        SyncCursor cursor = running().failRetryable(null, SyncErrorKind.TRANSIENT,
                "java.net.SocketTimeoutException: Read timed out", 5, T0.plusSeconds(60));

        assertEquals(SyncHealth.DEGRADED, SyncHealth.of(cursor, CredentialStatus.ACTIVE));
        String message = SyncHealth.message(cursor, CredentialStatus.ACTIVE);
        assertEquals(SyncHealth.MESSAGE_RETRYING, message);
        assertFalse(message.contains("Socket"));
    }

    @Test
    @DisplayName("Auth failure asks the tenant to reconnect")
    void testNeedsReconnection() {
        SyncCursor cursor = running().failFatal(null, SyncErrorKind.AUTHENTICATION, "401 Unauthorized");

        assertEquals(SyncHealth.NEEDS_ATTENTION, SyncHealth.of(cursor, CredentialStatus.ACTIVE));
        assertEquals(SyncHealth.MESSAGE_RECONNECT, SyncHealth.message(cursor, CredentialStatus.ACTIVE));
    }

    @Test
    @DisplayName("An expired or revoked credential needs attention even on a healthy cursor")
    void testCredentialNotActive() {
        SyncCursor cursor = running().succeed(null, T0);

        assertEquals(SyncHealth.NEEDS_ATTENTION, SyncHealth.of(cursor, CredentialStatus.EXPIRED));
        assertEquals(SyncHealth.MESSAGE_RECONNECT, SyncHealth.message(cursor, CredentialStatus.REVOKED));
    }

    @Test
    @DisplayName("Non-auth fatal failures report that syncing stopped")
    void testStopped() {
        SyncCursor cursor = running().failFatal(null, SyncErrorKind.REJECTED, "400 bad query");

        assertEquals(SyncHealth.NEEDS_ATTENTION, SyncHealth.of(cursor, CredentialStatus.ACTIVE));
        assertEquals(SyncHealth.MESSAGE_STOPPED, SyncHealth.message(cursor, CredentialStatus.ACTIVE));
    }

    @Test
    @DisplayName("worst picks the more severe health")
    void testWorst() {
        assertEquals(SyncHealth.DEGRADED, SyncHealth.OK.worst(SyncHealth.DEGRADED));
        assertEquals(SyncHealth.NEEDS_ATTENTION, SyncHealth.NEEDS_ATTENTION.worst(SyncHealth.OK));
        assertEquals(SyncHealth.OK, SyncHealth.OK.worst(SyncHealth.OK));
    }
}
