package com.flagship.smart_sync.client;

import lombok.Value;

/**
 * Details of a failed rail call.
 *
 * The message is for operators and logs only; tenant-facing surfaces derive
 * their wording from the type.
 */
@Value
public class ApiError {
    ApiErrorType type;
    Integer statusCode;       // null when no response was received
    String message;
    Long retryAfterSeconds;   // from Retry-After on 429, otherwise null

    public static ApiError of(ApiErrorType type, Integer statusCode, String message) {
        return new ApiError(type, statusCode, message, null);
    }

    public static ApiError throttled(int statusCode, Long retryAfterSeconds, String message) {
        return new ApiError(ApiErrorType.RATE_LIMIT, statusCode, message, retryAfterSeconds);
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
