package com.flagship.smart_sync.rail.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.smart_sync.client.ApiError;
import com.flagship.smart_sync.client.ApiErrorType;
import com.flagship.smart_sync.client.ApiRequest;
import com.flagship.smart_sync.client.RateLimitedClient;
import com.flagship.smart_sync.exception.FatalSyncError;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * OAuth2 refresh_token grant against a rail's token endpoint.
 *
 * Rails that use standard OAuth2 refresh delegate to this; the call still goes
 * through the rate-limited client so refreshes count against the tenant's window.
 */
public class OAuthTokenRefresher {

    private final RateLimitedClient client;
    private final Clock clock;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;

    public OAuthTokenRefresher(RateLimitedClient client, Clock clock,
                               String tokenUrl, String clientId, String clientSecret) {
        this.client = client;
        this.clock = clock;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    public RailCredential refresh(RailCredential credential) {
        String basic = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        ApiRequest request = ApiRequest.builder()
                .tenantId(credential.getTenantId())
                .rail(credential.getRail())
                .operation("oauth:refresh")
                .method(HttpMethod.POST)
                .url(tokenUrl)
                .header(HttpHeaders.AUTHORIZATION, "Basic " + basic)
                .formField("grant_type", "refresh_token")
                .formField("refresh_token", credential.getRefreshToken())
                .build();

        // no bearer token on the refresh call itself
        JsonNode body = client.call(request, null).getBody();

        String accessToken = body.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new FatalSyncError("Token endpoint returned no access token",
                    ApiError.of(ApiErrorType.AUTHENTICATION, 200, "missing access_token"));
        }

        Instant now = clock.instant();
        Instant accessExpiresAt = body.hasNonNull("expires_in")
                ? now.plusSeconds(body.get("expires_in").asLong())
                : null;
        Instant refreshExpiresAt = body.hasNonNull("x_refresh_token_expires_in")
                ? now.plusSeconds(body.get("x_refresh_token_expires_in").asLong())
                : null;

        return credential.withTokens(accessToken, body.path("refresh_token").asText(null),
                accessExpiresAt, refreshExpiresAt);
    }
}
