package com.flagship.smart_sync.exception;

/**
 * Mirror write failure. Halts the batch at the failing record so the cursor
 * never moves past something that was not committed.
 */
public class PersistenceError extends RuntimeException {

    public PersistenceError(String message, Throwable cause) {
        super(message, cause);
    }
}
