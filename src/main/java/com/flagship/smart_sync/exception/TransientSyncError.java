package com.flagship.smart_sync.exception;

import com.flagship.smart_sync.client.ApiError;

/**
 * A failure that is expected to clear on its own: network timeouts, 5xx responses,
 * throttling. Raised by the client once its own retries are exhausted; the
 * orchestrator then retries the whole run on its backoff schedule.
 */
public class TransientSyncError extends RuntimeException {

    private final ApiError apiError;

    public TransientSyncError(String message, ApiError apiError) {
        super(message);
        this.apiError = apiError;
    }

    public TransientSyncError(String message, ApiError apiError, Throwable cause) {
        super(message, cause);
        this.apiError = apiError;
    }

    public ApiError getApiError() {
        return apiError;
    }
}
