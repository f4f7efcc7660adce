package com.flagship.smart_sync.rail.credential;

public enum CredentialStatus {
    ACTIVE,
    EXPIRED,
    REVOKED,
    ERROR
}
