package com.flagship.smart_sync.rail;

import com.flagship.smart_sync.exception.MappingError;
import com.flagship.smart_sync.exception.UnsupportedRailOperationException;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.credential.RailCredential;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Set;

/**
 * Capability interface for one external rail.
 *
 * Implementations translate the rail's native payloads into {@link CanonicalEntity}
 * and declare what they support. They do no retrying or caching of their own;
 * every HTTP call goes through the rate-limited client and the orchestrator
 * decides when to run again.
 *
 * New rails are added as new implementations of this interface, registered as
 * Spring beans; nothing else needs to change.
 */
public interface RailSyncService {

    /**
     * Stable identifier used in URLs, cursors, log sources and credentials, e.g. "quickbooks".
     */
    String railId();

    Set<RailOperation> operations();

    Set<EntityType> supportedEntityTypes();

    /**
     * Fetches one page of records modified at or after {@code request.updatedSince}.
     * Pages should come oldest modification first; order within a timestamp does not matter.
     */
    RailPage fetch(RailFetchRequest request);

    /**
     * Maps one native record to its canonical form.
     *
     * @throws MappingError when the payload does not have the expected shape
     */
    CanonicalEntity map(EntityType entityType, RailRecord record);

    default boolean supports(RailOperation operation) {
        return operations().contains(operation);
    }

    default boolean supports(EntityType entityType) {
        return supportedEntityTypes().contains(entityType);
    }

    /**
     * Sends a locally created record to the rail. Only execution rails implement this.
     */
    default PushResult push(RailPushRequest request) {
        throw new UnsupportedRailOperationException(railId(), "push");
    }

    /**
     * Exchanges the refresh token for new tokens.
     */
    default RailCredential refreshCredential(RailCredential credential) {
        throw new UnsupportedRailOperationException(railId(), "credential refresh");
    }

    /**
     * Verifies and parses a webhook delivery.
     *
     * @throws com.flagship.smart_sync.exception.InvalidWebhookException if the signature does not verify
     */
    default List<WebhookSignal> parseWebhook(String body, HttpHeaders headers) {
        return List.of();
    }
}
