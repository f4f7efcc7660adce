package com.flagship.smart_sync.exception;

/**
 * Webhook delivery whose signature does not verify or whose body cannot be read.
 */
public class InvalidWebhookException extends RuntimeException {

    public InvalidWebhookException(String message) {
        super(message);
    }

    public InvalidWebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
