package com.flagship.smart_sync.rail.credential;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RailCredentialRepository extends JpaRepository<RailCredentialEntity, UUID> {

    Optional<RailCredentialEntity> findByTenantIdAndRail(UUID tenantId, String rail);

    /**
     * Resolves the tenant behind a webhook, which only names the rail's own account id.
     */
    List<RailCredentialEntity> findByRailAndExternalAccountId(String rail, String externalAccountId);

    List<RailCredentialEntity> findByStatus(CredentialStatus status);

    List<RailCredentialEntity> findByTenantId(UUID tenantId);
}
