package com.flagship.smart_sync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.exception.FatalSyncError;
import com.flagship.smart_sync.exception.TransientSyncError;
import com.flagship.smart_sync.observability.SyncMetrics;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * The only path from this service to a rail's API.
 *
 * Every call goes through, in order:
 * 1. Cool-down check for the tenant+rail key (fail fast while the rail is refusing us)
 * 2. Short-TTL response cache for cacheable GETs, reused only within the same sync run
 * 3. Fixed-window rate limit for the tenant+rail key
 * 4. The HTTP exchange, bounded by the RestClient's timeouts
 * 5. Classification of failures, jittered exponential retry for retryable ones
 *
 * Failure semantics:
 * - Retryable errors (429, 5xx, I/O) that outlast maxAttempts become {@link TransientSyncError}
 * - Non-retryable errors (401/403, other 4xx) surface immediately as {@link FatalSyncError}
 *
 * Rails never retry or cache on their own; they hand an {@link ApiRequest} to this client.
 */
@Component
@Slf4j
public class RateLimitedClient {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 300;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final SyncMetrics metrics;
    private final ClientSettings settings;
    private final FixedWindowRateLimiter rateLimiter;
    private final CooldownRegistry cooldowns;
    private final Cache<String, ApiResponse> responseCache;
    private final Sleeper sleeper;

    @Autowired
    public RateLimitedClient(RestClient railRestClient, ObjectMapper objectMapper,
                             SyncMetrics metrics, ClientSettings settings) {
        this(railRestClient, objectMapper, metrics, settings, Ticker.systemTicker(), Sleeper.threadSleeper());
    }

    public RateLimitedClient(RestClient restClient, ObjectMapper objectMapper, SyncMetrics metrics,
                             ClientSettings settings, Ticker ticker, Sleeper sleeper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.settings = settings;
        this.sleeper = sleeper;
        this.rateLimiter = new FixedWindowRateLimiter(
                settings.getCallsPerWindow(), settings.getWindow(), settings.getMinInterval(), ticker);
        this.cooldowns = new CooldownRegistry(ticker);
        this.responseCache = Caffeine.newBuilder()
                .expireAfterWrite(settings.getCacheTtl())
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    /**
     * Executes a rail call on behalf of a tenant.
     *
     * @param request    what to call
     * @param credential the tenant's credential for the rail, or null when the request
     *                   carries its own Authorization header (token refresh)
     * @return the successful response
     * @throws TransientSyncError when retryable failures outlast the retry budget
     * @throws FatalSyncError     when the rail rejects the call permanently
     */
    public ApiResponse call(ApiRequest request, RailCredential credential) {
        String limiterKey = limiterKey(request);
        String rail = request.getRail();

        var cooldown = cooldowns.active(limiterKey);
        if (cooldown.isPresent()) {
            ApiError error = cooldown.get();
            metrics.recordThrottled(rail, "cooldown");
            log.debug("Call {} for {} refused during cool-down ({})", request.getOperation(), limiterKey, error.getType());
            throw toException(request, error, 0);
        }

        if (request.usesCache()) {
            ApiResponse cached = responseCache.getIfPresent(request.cacheKey());
            if (cached != null) {
                metrics.recordClientCall(rail, "cached");
                return cached.asCached();
            }
        }

        int attempt = 0;
        while (true) {
            attempt++;
            waitForPermit(request, limiterKey);

            try {
                ApiResponse response = execute(request, credential);
                metrics.recordClientCall(rail, "success");
                if (request.usesCache()) {
                    responseCache.put(request.cacheKey(), response);
                }
                return response;

            } catch (FailedCall failed) {
                ApiError error = failed.error;

                if (!error.isRetryable()) {
                    if (error.getType() == ApiErrorType.AUTHENTICATION) {
                        cooldowns.open(limiterKey, error, settings.getAuthCooldown());
                    }
                    metrics.recordClientCall(rail, "fatal");
                    log.warn("Call {} for tenant {} failed permanently: type={}, status={}",
                            request.getOperation(), request.getTenantId(), error.getType(), error.getStatusCode());
                    throw toException(request, error, attempt);
                }

                if (attempt >= settings.getMaxAttempts()) {
                    if (error.getType() == ApiErrorType.RATE_LIMIT) {
                        cooldowns.open(limiterKey, error, settings.getRateLimitCooldown());
                    }
                    metrics.recordClientCall(rail, "transient");
                    log.warn("Call {} for tenant {} exhausted {} attempts: type={}, status={}",
                            request.getOperation(), request.getTenantId(), attempt, error.getType(), error.getStatusCode());
                    throw toException(request, error, attempt);
                }

                Duration delay = settings.getBackoff().delayFor(attempt, error.getRetryAfterSeconds());
                metrics.recordClientRetry(rail, error.getType().name());
                log.info("Retrying {} for tenant {} in {}ms (attempt {}/{}, type={})",
                        request.getOperation(), request.getTenantId(), delay.toMillis(),
                        attempt, settings.getMaxAttempts(), error.getType());
                pause(request, delay);
            }
        }
    }

    /**
     * Drops any cool-down for the key, e.g. after the tenant reconnects the rail.
     */
    public void clearCooldown(UUID tenantId, String rail) {
        cooldowns.clear(tenantId + ":" + rail);
    }

    int permitsUsed(UUID tenantId, String rail) {
        return rateLimiter.permitsUsed(tenantId + ":" + rail);
    }

    private void waitForPermit(ApiRequest request, String limiterKey) {
        boolean granted;
        try {
            granted = rateLimiter.acquire(limiterKey, settings.getMaxThrottleWait(), sleeper);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientSyncError("Interrupted while waiting for rate window",
                    ApiError.of(ApiErrorType.NETWORK, null, "interrupted"), e);
        }
        if (!granted) {
            metrics.recordThrottled(request.getRail(), "window");
            throw new TransientSyncError("Rate window full for " + limiterKey,
                    ApiError.throttled(429, settings.getWindow().toSeconds(), "local rate window exhausted"));
        }
    }

    private void pause(ApiRequest request, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientSyncError("Interrupted while backing off " + request.getOperation(),
                    ApiError.of(ApiErrorType.NETWORK, null, "interrupted"), e);
        }
    }

    private ApiResponse execute(ApiRequest request, RailCredential credential) {
        URI uri = buildUri(request);
        try {
            RestClient.RequestBodySpec spec = restClient.method(request.getMethod())
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> applyHeaders(headers, request, credential));

            if (request.hasFormBody()) {
                MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                request.getFormFields().forEach(form::add);
                spec = spec.contentType(MediaType.APPLICATION_FORM_URLENCODED).body(form);
            } else if (request.getJsonBody() != null) {
                spec = spec.contentType(MediaType.APPLICATION_JSON).body(writeJson(request.getJsonBody()));
            }

            return spec.exchange((clientRequest, clientResponse) -> {
                int status = clientResponse.getStatusCode().value();
                String text = StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8);
                if (clientResponse.getStatusCode().is2xxSuccessful()) {
                    return new ApiResponse(status, readJson(text), false);
                }
                throw new FailedCall(classify(status, clientResponse.getHeaders(), text));
            });

        } catch (ResourceAccessException e) {
            throw new FailedCall(ApiError.of(ApiErrorType.NETWORK, null, truncate(e.getMessage())));
        }
    }

    private void applyHeaders(HttpHeaders headers, ApiRequest request, RailCredential credential) {
        if (credential != null && credential.getAccessToken() != null) {
            headers.setBearerAuth(credential.getAccessToken());
        }
        request.getHeaders().forEach(headers::set);
    }

    private URI buildUri(ApiRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(request.getUrl());
        request.getQueryParams().forEach(builder::queryParam);
        return builder.build().encode().toUri();
    }

    ApiError classify(int status, HttpHeaders headers, String body) {
        ApiErrorType type = ApiErrorType.fromStatus(status);
        String message = truncate(body);
        if (type == ApiErrorType.RATE_LIMIT) {
            return ApiError.throttled(status, parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER)), message);
        }
        return ApiError.of(type, status, message);
    }

    private Long parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by the rails we talk to
            return null;
        }
    }

    private JsonNode readJson(String text) {
        if (text == null || text.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new FailedCall(ApiError.of(ApiErrorType.UNKNOWN, 200, "Response is not JSON: " + truncate(text)));
        }
    }

    private String writeJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request body", e);
        }
    }

    private RuntimeException toException(ApiRequest request, ApiError error, int attempts) {
        String message = String.format("%s %s failed after %d attempt(s): %s",
                request.getRail(), request.getOperation(), attempts, error.getType());
        return error.isRetryable()
                ? new TransientSyncError(message, error)
                : new FatalSyncError(message, error);
    }

    private static String limiterKey(ApiRequest request) {
        return request.getTenantId() + ":" + request.getRail();
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() > MAX_ERROR_MESSAGE_LENGTH ? value.substring(0, MAX_ERROR_MESSAGE_LENGTH) : value;
    }

    /**
     * Internal signal carrying a classified failure out of the exchange callback.
     */
    private static final class FailedCall extends RuntimeException {
        private final ApiError error;

        FailedCall(ApiError error) {
            super(error.getMessage(), null, false, false);
            this.error = error;
        }
    }
}
