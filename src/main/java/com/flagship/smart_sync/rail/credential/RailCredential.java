package com.flagship.smart_sync.rail.credential;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Auth material a tenant has granted for one rail.
 *
 * Opaque to everything except the rail that issued it and the client that
 * attaches the access token to outgoing calls.
 */
@Value
public class RailCredential {
    UUID id;
    UUID tenantId;
    String rail;
    String externalAccountId;   // e.g. QuickBooks realm id
    String accessToken;
    String refreshToken;
    Instant accessExpiresAt;    // null means the rail does not expire tokens
    Instant refreshExpiresAt;
    CredentialStatus status;

    public static RailCredential create(UUID tenantId, String rail, String externalAccountId,
                                        String accessToken, String refreshToken,
                                        Instant accessExpiresAt, Instant refreshExpiresAt) {
        return new RailCredential(UUID.randomUUID(), tenantId, rail, externalAccountId,
                accessToken, refreshToken, accessExpiresAt, refreshExpiresAt, CredentialStatus.ACTIVE);
    }

    /**
     * True when the access token expires within {@code buffer}.
     */
    public boolean needsRefresh(Instant now, Duration buffer) {
        return accessExpiresAt != null && !now.plus(buffer).isBefore(accessExpiresAt);
    }

    public boolean canRefresh(Instant now) {
        return refreshToken != null && (refreshExpiresAt == null || now.isBefore(refreshExpiresAt));
    }

    public RailCredential withTokens(String newAccessToken, String newRefreshToken,
                                     Instant newAccessExpiresAt, Instant newRefreshExpiresAt) {
        return new RailCredential(id, tenantId, rail, externalAccountId,
                newAccessToken,
                newRefreshToken != null ? newRefreshToken : refreshToken,
                newAccessExpiresAt,
                newRefreshExpiresAt != null ? newRefreshExpiresAt : refreshExpiresAt,
                CredentialStatus.ACTIVE);
    }

    public RailCredential withStatus(CredentialStatus newStatus) {
        return new RailCredential(id, tenantId, rail, externalAccountId, accessToken, refreshToken,
                accessExpiresAt, refreshExpiresAt, newStatus);
    }

    @Override
    public String toString() {
        // tokens stay out of logs
        return "RailCredential(id=" + id + ", tenantId=" + tenantId + ", rail=" + rail
                + ", externalAccountId=" + externalAccountId + ", status=" + status + ")";
    }
}
