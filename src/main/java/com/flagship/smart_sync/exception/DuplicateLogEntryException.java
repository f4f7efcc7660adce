package com.flagship.smart_sync.exception;

/**
 * Thrown when a log append reuses an idempotency key that is already recorded.
 */
public class DuplicateLogEntryException extends RuntimeException {

    private final String idempotencyKey;

    public DuplicateLogEntryException(String idempotencyKey) {
        super("Log entry already recorded for idempotency key " + idempotencyKey);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
