package com.flagship.smart_sync.rail.ramp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.client.ApiRequest;
import com.flagship.smart_sync.client.RateLimitedClient;
import com.flagship.smart_sync.exception.InvalidWebhookException;
import com.flagship.smart_sync.exception.MappingError;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.PushResult;
import com.flagship.smart_sync.rail.RailFetchRequest;
import com.flagship.smart_sync.rail.RailOperation;
import com.flagship.smart_sync.rail.RailPage;
import com.flagship.smart_sync.rail.RailPushRequest;
import com.flagship.smart_sync.rail.RailRecord;
import com.flagship.smart_sync.rail.RailSyncService;
import com.flagship.smart_sync.rail.WebhookSignal;
import com.flagship.smart_sync.rail.WebhookSignatures;
import com.flagship.smart_sync.rail.credential.OAuthTokenRefresher;
import com.flagship.smart_sync.rail.credential.RailCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ramp: an execution rail.
 *
 * Reads bills and vendors with Ramp's "start" cursor paging and can push locally
 * created bills so Ramp pays them. Webhooks carry X-Ramp-Signature, a hex
 * HMAC-SHA256 of the body keyed by the webhook secret.
 */
@Service
@Slf4j
public class RampRailSyncService implements RailSyncService {

    public static final String RAIL_ID = "ramp";
    static final String SIGNATURE_HEADER = "X-Ramp-Signature";

    private static final DateTimeFormatter FILTER_TIME = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    private final RateLimitedClient client;
    private final ObjectMapper objectMapper;
    private final RampMapper mapper = new RampMapper();
    private final OAuthTokenRefresher tokenRefresher;
    private final String baseUrl;
    private final String webhookSecret;

    public RampRailSyncService(RateLimitedClient client,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${smart-sync.rails.ramp.base-url}") String baseUrl,
                               @Value("${smart-sync.rails.ramp.token-url}") String tokenUrl,
                               @Value("${smart-sync.rails.ramp.client-id:}") String clientId,
                               @Value("${smart-sync.rails.ramp.client-secret:}") String clientSecret,
                               @Value("${smart-sync.rails.ramp.webhook-secret:}") String webhookSecret) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.tokenRefresher = new OAuthTokenRefresher(client, clock, tokenUrl, clientId, clientSecret);
        this.baseUrl = baseUrl;
        this.webhookSecret = webhookSecret;
    }

    @Override
    public String railId() {
        return RAIL_ID;
    }

    @Override
    public Set<RailOperation> operations() {
        return EnumSet.of(RailOperation.READ, RailOperation.PUSH);
    }

    @Override
    public Set<EntityType> supportedEntityTypes() {
        return EnumSet.of(EntityType.BILL, EntityType.VENDOR);
    }

    @Override
    public RailPage fetch(RailFetchRequest request) {
        String resource = resourceFor(request.getEntityType());

        ApiRequest.ApiRequestBuilder builder = ApiRequest.builder()
                .tenantId(request.getTenantId())
                .rail(RAIL_ID)
                .operation("list:" + resource)
                .url(baseUrl + "/" + resource)
                .queryParam("page_size", String.valueOf(request.getPageSize()))
                .cacheable(true)
                .cacheScope(request.cacheScope());
        if (request.getUpdatedSince() != null) {
            builder.queryParam("updated_after", FILTER_TIME.format(request.getUpdatedSince()));
        }
        if (request.getPageToken() != null) {
            builder.queryParam("start", request.getPageToken());
        }

        JsonNode body = client.call(builder.build(), request.getCredential()).getBody();

        List<RailRecord> records = new ArrayList<>();
        for (JsonNode node : body.path("data")) {
            try {
                records.add(mapper.toRecord(node));
            } catch (MappingError e) {
                log.warn("Dropping unreadable Ramp {} for tenant {}: {}", resource, request.getTenantId(), e.getMessage());
            }
        }
        return new RailPage(records, nextStart(body.path("page").path("next").asText(null)));
    }

    /**
     * Ramp returns the next page as a full URL; only its "start" parameter is kept.
     */
    static String nextStart(String nextUrl) {
        if (nextUrl == null || nextUrl.isBlank()) {
            return null;
        }
        return UriComponentsBuilder.fromUriString(nextUrl).build().getQueryParams().getFirst("start");
    }

    @Override
    public CanonicalEntity map(EntityType entityType, RailRecord record) {
        return mapper.map(entityType, record);
    }

    @Override
    public PushResult push(RailPushRequest request) {
        CanonicalEntity bill = request.getRecord().getEntity();
        if (bill.getEntityType() != EntityType.BILL) {
            throw new IllegalArgumentException("Ramp only accepts bills, not " + bill.getEntityType());
        }

        ApiRequest apiRequest = ApiRequest.builder()
                .tenantId(request.getTenantId())
                .rail(RAIL_ID)
                .operation("create:bills")
                .method(HttpMethod.POST)
                .url(baseUrl + "/bills")
                // lets Ramp drop a resubmitted push
                .header("Idempotency-Key", request.getRecord().getId().toString())
                .jsonBody(mapper.toCreateBillBody(bill))
                .build();

        JsonNode body = client.call(apiRequest, request.getCredential()).getBody();
        String externalId = body.path("id").asText(null);
        if (externalId == null) {
            throw new MappingError(null, "Ramp bill creation returned no id");
        }
        log.info("Pushed bill {} to Ramp for tenant {}, assigned id {}",
                request.getRecord().getId(), request.getTenantId(), externalId);
        return new PushResult(externalId, body.path("updated_at").asText(null), body.path("status").asText(null));
    }

    @Override
    public RailCredential refreshCredential(RailCredential credential) {
        return tokenRefresher.refresh(credential);
    }

    @Override
    public List<WebhookSignal> parseWebhook(String body, HttpHeaders headers) {
        WebhookSignatures.verifyHex(webhookSecret, body, headers.getFirst(SIGNATURE_HEADER));

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookException("Ramp webhook body is not JSON", e);
        }

        // event types look like "bills.updated" or "vendors.created"
        String eventType = root.path("type").asText("");
        int dot = eventType.indexOf('.');
        if (dot <= 0) {
            return List.of();
        }
        EntityType type = switch (eventType.substring(0, dot)) {
            case "bills" -> EntityType.BILL;
            case "vendors" -> EntityType.VENDOR;
            default -> null;
        };
        String businessId = root.path("business_id").asText(null);
        if (type == null || businessId == null) {
            return List.of();
        }
        return List.of(new WebhookSignal(RAIL_ID, businessId, type,
                root.path("data").path("id").asText(null),
                eventType.substring(dot + 1),
                parseInstant(root.path("created_at").asText(null))));
    }

    private static String resourceFor(EntityType type) {
        return switch (type) {
            case BILL -> "bills";
            case VENDOR -> "vendors";
            default -> throw new IllegalArgumentException("Ramp does not provide " + type);
        };
    }

    private static Instant parseInstant(String value) {
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
