package com.flagship.smart_sync.rail.quickbooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.client.ApiRequest;
import com.flagship.smart_sync.client.RateLimitedClient;
import com.flagship.smart_sync.exception.InvalidWebhookException;
import com.flagship.smart_sync.exception.MappingError;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.RailFetchRequest;
import com.flagship.smart_sync.rail.RailOperation;
import com.flagship.smart_sync.rail.RailPage;
import com.flagship.smart_sync.rail.RailRecord;
import com.flagship.smart_sync.rail.RailSyncService;
import com.flagship.smart_sync.rail.WebhookSignal;
import com.flagship.smart_sync.rail.WebhookSignatures;
import com.flagship.smart_sync.rail.credential.OAuthTokenRefresher;
import com.flagship.smart_sync.rail.credential.RailCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * QuickBooks Online: a read-only ledger rail.
 *
 * Fetches through the company query endpoint, ordered by MetaData.LastUpdatedTime
 * with STARTPOSITION/MAXRESULTS paging. Webhooks are verified with the
 * intuit-signature header (base64 HMAC-SHA256 of the body keyed by the verifier token).
 */
@Service
@Slf4j
public class QuickBooksRailSyncService implements RailSyncService {

    public static final String RAIL_ID = "quickbooks";
    static final String SIGNATURE_HEADER = "intuit-signature";

    private static final DateTimeFormatter QUERY_TIME = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    private final RateLimitedClient client;
    private final ObjectMapper objectMapper;
    private final QuickBooksMapper mapper = new QuickBooksMapper();
    private final OAuthTokenRefresher tokenRefresher;
    private final String baseUrl;
    private final String webhookVerifierToken;
    private final String minorVersion;

    public QuickBooksRailSyncService(RateLimitedClient client,
                                     ObjectMapper objectMapper,
                                     Clock clock,
                                     @Value("${smart-sync.rails.quickbooks.base-url}") String baseUrl,
                                     @Value("${smart-sync.rails.quickbooks.token-url}") String tokenUrl,
                                     @Value("${smart-sync.rails.quickbooks.client-id:}") String clientId,
                                     @Value("${smart-sync.rails.quickbooks.client-secret:}") String clientSecret,
                                     @Value("${smart-sync.rails.quickbooks.webhook-verifier-token:}") String webhookVerifierToken,
                                     @Value("${smart-sync.rails.quickbooks.minor-version:65}") String minorVersion) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.tokenRefresher = new OAuthTokenRefresher(client, clock, tokenUrl, clientId, clientSecret);
        this.baseUrl = baseUrl;
        this.webhookVerifierToken = webhookVerifierToken;
        this.minorVersion = minorVersion;
    }

    @Override
    public String railId() {
        return RAIL_ID;
    }

    @Override
    public Set<RailOperation> operations() {
        return EnumSet.of(RailOperation.READ);
    }

    @Override
    public Set<EntityType> supportedEntityTypes() {
        return EnumSet.allOf(EntityType.class);
    }

    @Override
    public RailPage fetch(RailFetchRequest request) {
        RailCredential credential = request.getCredential();
        String entityName = QuickBooksMapper.qboEntityName(request.getEntityType());
        int startPosition = request.getPageToken() == null ? 1 : Integer.parseInt(request.getPageToken());

        ApiRequest apiRequest = ApiRequest.builder()
                .tenantId(request.getTenantId())
                .rail(RAIL_ID)
                .operation("query:" + entityName)
                .url(baseUrl + "/" + credential.getExternalAccountId() + "/query")
                .queryParam("query", buildQuery(entityName, request.getUpdatedSince(), startPosition, request.getPageSize()))
                .queryParam("minorversion", minorVersion)
                .cacheable(true)
                .cacheScope(request.cacheScope())
                .build();

        JsonNode body = client.call(apiRequest, credential).getBody();
        JsonNode objects = body.path("QueryResponse").path(entityName);

        List<RailRecord> records = new ArrayList<>();
        int returned = 0;
        for (JsonNode node : objects) {
            returned++;
            try {
                records.add(mapper.toRecord(node));
            } catch (MappingError e) {
                log.warn("Dropping unreadable QuickBooks {} for tenant {}: {}",
                        entityName, request.getTenantId(), e.getMessage());
            }
        }

        String next = returned >= request.getPageSize()
                ? String.valueOf(startPosition + returned)
                : null;
        log.debug("QuickBooks {} page at {} returned {} records", entityName, startPosition, returned);
        return new RailPage(records, next);
    }

    static String buildQuery(String entityName, Instant updatedSince, int startPosition, int pageSize) {
        StringBuilder query = new StringBuilder("SELECT * FROM ").append(entityName);
        if (updatedSince != null) {
            // LastUpdatedTime has second precision on the QuickBooks side
            query.append(" WHERE MetaData.LastUpdatedTime >= '")
                    .append(QUERY_TIME.format(updatedSince.truncatedTo(ChronoUnit.SECONDS)))
                    .append("'");
        }
        query.append(" ORDERBY MetaData.LastUpdatedTime")
                .append(" STARTPOSITION ").append(startPosition)
                .append(" MAXRESULTS ").append(pageSize);
        return query.toString();
    }

    @Override
    public CanonicalEntity map(EntityType entityType, RailRecord record) {
        return mapper.map(entityType, record);
    }

    @Override
    public RailCredential refreshCredential(RailCredential credential) {
        return tokenRefresher.refresh(credential);
    }

    @Override
    public List<WebhookSignal> parseWebhook(String body, HttpHeaders headers) {
        WebhookSignatures.verifyBase64(webhookVerifierToken, body, headers.getFirst(SIGNATURE_HEADER));

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookException("QuickBooks webhook body is not JSON", e);
        }

        List<WebhookSignal> signals = new ArrayList<>();
        for (JsonNode notification : root.path("eventNotifications")) {
            String realmId = notification.path("realmId").asText(null);
            for (JsonNode entity : notification.path("dataChangeEvent").path("entities")) {
                EntityType type = QuickBooksMapper.fromQboEntityName(entity.path("name").asText(null));
                if (type == null || realmId == null) {
                    continue;
                }
                signals.add(new WebhookSignal(RAIL_ID, realmId, type,
                        entity.path("id").asText(null),
                        entity.path("operation").asText(null),
                        parseLastUpdated(entity.path("lastUpdated").asText(null))));
            }
        }
        return signals;
    }

    private static Instant parseLastUpdated(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
