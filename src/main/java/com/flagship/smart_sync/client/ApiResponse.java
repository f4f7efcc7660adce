package com.flagship.smart_sync.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class ApiResponse {
    int statusCode;
    JsonNode body;
    boolean fromCache;

    public ApiResponse asCached() {
        return new ApiResponse(statusCode, body, true);
    }
}
