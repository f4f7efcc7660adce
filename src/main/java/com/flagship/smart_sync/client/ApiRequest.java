package com.flagship.smart_sync.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A single call a rail wants to make. Rails build these; only the client executes them.
 */
@Value
@Builder
public class ApiRequest {
    UUID tenantId;
    String rail;
    String operation;          // short label for logs and metrics, e.g. "query:Bill"
    @Builder.Default
    HttpMethod method = HttpMethod.GET;
    String url;
    @Singular
    Map<String, String> queryParams;
    @Singular
    Map<String, String> headers;
    @Singular
    Map<String, String> formFields;
    Object jsonBody;
    boolean cacheable;
    String cacheScope;         // sync run that may reuse the response; null disables caching

    public boolean usesCache() {
        return cacheable && cacheScope != null;
    }

    /**
     * Cache key scoped to run, tenant and rail so cached pages never cross runs or tenants.
     */
    public String cacheKey() {
        return cacheScope + "|" + tenantId + "|" + rail + "|" + method + "|" + url + "|" + new TreeMap<>(queryParams);
    }

    public boolean hasFormBody() {
        return !formFields.isEmpty();
    }
}
