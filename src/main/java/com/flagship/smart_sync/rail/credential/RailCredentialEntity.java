package com.flagship.smart_sync.rail.credential;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for rail_credentials. One row per tenant and rail.
 */
@Entity
@Table(name = "rail_credentials")
@Getter
@Setter
@NoArgsConstructor
public class RailCredentialEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "rail", nullable = false, updatable = false, length = 64)
    private String rail;

    @Column(name = "external_account_id", nullable = false, length = 128)
    private String externalAccountId;

    @Column(name = "access_token", nullable = false, columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private String refreshToken;

    @Column(name = "access_expires_at")
    private Instant accessExpiresAt;

    @Column(name = "refresh_expires_at")
    private Instant refreshExpiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CredentialStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static RailCredentialEntity fromDomain(RailCredential credential) {
        RailCredentialEntity entity = new RailCredentialEntity();
        entity.setId(credential.getId());
        entity.setTenantId(credential.getTenantId());
        entity.setRail(credential.getRail());
        entity.apply(credential);
        return entity;
    }

    /**
     * Copies the mutable parts of a credential onto this row.
     */
    public void apply(RailCredential credential) {
        this.externalAccountId = credential.getExternalAccountId();
        this.accessToken = credential.getAccessToken();
        this.refreshToken = credential.getRefreshToken();
        this.accessExpiresAt = credential.getAccessExpiresAt();
        this.refreshExpiresAt = credential.getRefreshExpiresAt();
        this.status = credential.getStatus();
    }

    public RailCredential toDomain() {
        return new RailCredential(id, tenantId, rail, externalAccountId, accessToken, refreshToken,
                accessExpiresAt, refreshExpiresAt, status);
    }
}
