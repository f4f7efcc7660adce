package com.flagship.smart_sync.client;

/**
 * Classification of failed rail calls. Drives retry decisions in the client
 * and state transitions in the orchestrator.
 */
public enum ApiErrorType {
    RATE_LIMIT(true),
    AUTHENTICATION(false),
    NETWORK(true),
    VALIDATION(false),
    SERVER_ERROR(true),
    UNKNOWN(false);

    private final boolean retryable;

    ApiErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Maps an HTTP status to an error type.
     * 401/403 are auth problems, 429 is throttling, 5xx is the rail's fault,
     * anything else in 4xx is a request the rail will keep rejecting.
     */
    public static ApiErrorType fromStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 429) {
            return RATE_LIMIT;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        if (status >= 400) {
            return VALIDATION;
        }
        return UNKNOWN;
    }
}
