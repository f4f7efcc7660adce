package com.flagship.smart_sync.exception;

/**
 * A rail record whose payload does not have the expected shape.
 * The record is skipped; the rest of the batch continues.
 */
public class MappingError extends RuntimeException {

    private final String externalId;

    public MappingError(String externalId, String message) {
        super(message);
        this.externalId = externalId;
    }

    public MappingError(String externalId, String message, Throwable cause) {
        super(message, cause);
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
