package com.flagship.smart_sync.mirror;

/**
 * Lifecycle of a mirror row. Rows are never removed; deletion is a status.
 */
public enum RecordStatus {
    ACTIVE,
    DELETED
}
