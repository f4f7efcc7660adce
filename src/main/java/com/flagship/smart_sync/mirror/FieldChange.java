package com.flagship.smart_sync.mirror;

/**
 * One field's before and after value in a log entry's diff.
 */
public record FieldChange(String from, String to) {
}
