package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.rail.credential.CredentialStatus;

/**
 * Tenant-visible health of a sync key.
 *
 * Derived only from the cursor's error kind and failure streak plus the credential
 * status. Messages are fixed remediation texts; error details never reach tenants.
 */
public enum SyncHealth {
    OK,
    DEGRADED,
    NEEDS_ATTENTION;

    static final String MESSAGE_OK = "Up to date";
    static final String MESSAGE_RETRYING = "Recent syncs failed and are being retried. Data may be out of date.";
    static final String MESSAGE_RECONNECT = "Connection expired. Reconnect the account to resume syncing.";
    static final String MESSAGE_STOPPED = "Syncing stopped after repeated failures. Our team has been notified.";

    public static SyncHealth of(SyncCursor cursor, CredentialStatus credentialStatus) {
        if (needsReconnection(cursor, credentialStatus) || cursor.getState() == SyncState.FAILED_FATAL) {
            return NEEDS_ATTENTION;
        }
        if (cursor.getState() == SyncState.FAILED_RETRYABLE || cursor.getConsecutiveFailures() > 0) {
            return DEGRADED;
        }
        return OK;
    }

    public static String message(SyncCursor cursor, CredentialStatus credentialStatus) {
        if (needsReconnection(cursor, credentialStatus)) {
            return MESSAGE_RECONNECT;
        }
        return switch (of(cursor, credentialStatus)) {
            case OK -> MESSAGE_OK;
            case DEGRADED -> MESSAGE_RETRYING;
            case NEEDS_ATTENTION -> MESSAGE_STOPPED;
        };
    }

    /**
     * Worst of two healths.
     */
    public SyncHealth worst(SyncHealth other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    private static boolean needsReconnection(SyncCursor cursor, CredentialStatus credentialStatus) {
        if (credentialStatus != CredentialStatus.ACTIVE) {
            return true;
        }
        return cursor.getState() == SyncState.FAILED_FATAL && cursor.getLastErrorKind() == SyncErrorKind.AUTHENTICATION;
    }
}
