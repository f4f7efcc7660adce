package com.flagship.smart_sync.exception;

import com.flagship.smart_sync.client.ApiError;
import com.flagship.smart_sync.client.ApiErrorType;

/**
 * A failure that retrying will not fix: expired or revoked credentials, permanent 4xx.
 * Carries the original status so the tenant can be asked to remediate (usually reconnect).
 */
public class FatalSyncError extends RuntimeException {

    private final ApiError apiError;

    public FatalSyncError(String message, ApiError apiError) {
        super(message);
        this.apiError = apiError;
    }

    public ApiError getApiError() {
        return apiError;
    }

    /**
     * True when the tenant has to re-authorize the rail before syncing can resume.
     */
    public boolean requiresReconnection() {
        return apiError != null && apiError.getType() == ApiErrorType.AUTHENTICATION;
    }

    /**
     * Fatal error for a tenant that has no usable credential for a rail.
     */
    public static FatalSyncError credentialUnavailable(String rail, String reason) {
        return new FatalSyncError(
                "No usable credential for rail " + rail + ": " + reason,
                ApiError.of(ApiErrorType.AUTHENTICATION, null, reason));
    }
}
