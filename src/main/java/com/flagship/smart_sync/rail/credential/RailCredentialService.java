package com.flagship.smart_sync.rail.credential;

import com.flagship.smart_sync.exception.FatalSyncError;
import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.rail.RailSyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out usable credentials.
 *
 * Key behaviors:
 * - Access tokens expiring within the refresh buffer (default 5 minutes) are refreshed first
 * - A missing, revoked or unrefreshable credential is a {@link FatalSyncError}: the tenant
 *   has to reconnect the rail, retrying will not help
 * - Refreshes for one tenant+rail are serialized in this instance, since rails rotate
 *   refresh tokens and two concurrent refreshes would invalidate each other
 */
@Service
@Slf4j
public class RailCredentialService {

    private final RailCredentialRepository repository;
    private final RailRegistry railRegistry;
    private final Clock clock;
    private final Duration refreshBuffer;
    private final ConcurrentHashMap<String, Object> refreshLocks = new ConcurrentHashMap<>();

    public RailCredentialService(RailCredentialRepository repository,
                                 RailRegistry railRegistry,
                                 Clock clock,
                                 @Value("${smart-sync.credentials.refresh-buffer-seconds:300}") long refreshBufferSeconds) {
        this.repository = repository;
        this.railRegistry = railRegistry;
        this.clock = clock;
        this.refreshBuffer = Duration.ofSeconds(refreshBufferSeconds);
    }

    /**
     * Returns an active credential whose access token is good for at least the refresh buffer.
     *
     * @throws FatalSyncError if the tenant has no usable credential for the rail
     */
    public RailCredential activeCredential(UUID tenantId, String rail) {
        RailCredential credential = find(tenantId, rail)
                .orElseThrow(() -> FatalSyncError.credentialUnavailable(rail, "not connected"));

        if (credential.getStatus() != CredentialStatus.ACTIVE) {
            throw FatalSyncError.credentialUnavailable(rail, "credential " + credential.getStatus().name().toLowerCase());
        }

        if (!credential.needsRefresh(clock.instant(), refreshBuffer)) {
            return credential;
        }

        Object lock = refreshLocks.computeIfAbsent(tenantId + ":" + rail, key -> new Object());
        synchronized (lock) {
            // another thread may have refreshed while we waited
            RailCredential current = find(tenantId, rail).orElse(credential);
            if (current.getStatus() == CredentialStatus.ACTIVE && !current.needsRefresh(clock.instant(), refreshBuffer)) {
                return current;
            }
            return refresh(current);
        }
    }

    private RailCredential refresh(RailCredential credential) {
        Instant now = clock.instant();
        if (!credential.canRefresh(now)) {
            log.warn("Credential for tenant {} rail {} expired and cannot be refreshed",
                    credential.getTenantId(), credential.getRail());
            save(credential.withStatus(CredentialStatus.EXPIRED));
            throw FatalSyncError.credentialUnavailable(credential.getRail(), "refresh token expired");
        }

        RailSyncService rail = railRegistry.get(credential.getRail());
        try {
            RailCredential refreshed = rail.refreshCredential(credential);
            save(refreshed);
            log.info("Refreshed credential for tenant {} rail {}, access token valid until {}",
                    credential.getTenantId(), credential.getRail(), refreshed.getAccessExpiresAt());
            return refreshed;
        } catch (FatalSyncError e) {
            log.warn("Credential refresh rejected for tenant {} rail {}: {}",
                    credential.getTenantId(), credential.getRail(), e.getMessage());
            save(credential.withStatus(CredentialStatus.REVOKED));
            throw FatalSyncError.credentialUnavailable(credential.getRail(), "refresh rejected");
        }
    }

    /**
     * Stores a credential, replacing any existing one for the same tenant and rail.
     */
    @Transactional
    public RailCredential save(RailCredential credential) {
        RailCredentialEntity entity = repository.findByTenantIdAndRail(credential.getTenantId(), credential.getRail())
                .map(existing -> {
                    existing.apply(credential);
                    return existing;
                })
                .orElseGet(() -> RailCredentialEntity.fromDomain(credential));
        return repository.save(entity).toDomain();
    }

    @Transactional
    public void markStatus(UUID tenantId, String rail, CredentialStatus status) {
        repository.findByTenantIdAndRail(tenantId, rail).ifPresent(entity -> {
            entity.setStatus(status);
            repository.save(entity);
            log.info("Credential for tenant {} rail {} marked {}", tenantId, rail, status);
        });
    }

    @Transactional(readOnly = true)
    public Optional<RailCredential> find(UUID tenantId, String rail) {
        return repository.findByTenantIdAndRail(tenantId, rail).map(RailCredentialEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<RailCredential> findActive() {
        return repository.findByStatus(CredentialStatus.ACTIVE).stream()
                .map(RailCredentialEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RailCredential> findForTenant(UUID tenantId) {
        return repository.findByTenantId(tenantId).stream()
                .map(RailCredentialEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RailCredential> findByExternalAccount(String rail, String externalAccountId) {
        return repository.findByRailAndExternalAccountId(rail, externalAccountId).stream()
                .map(RailCredentialEntity::toDomain)
                .toList();
    }
}
