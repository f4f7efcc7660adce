package com.flagship.smart_sync.log;

/**
 * What happened to an entity.
 *
 * CREATED / UPDATED / DELETED record content changes. SYNCED records a state the
 * mirror already holds but the log had not yet captured (written by the reconciler).
 */
public enum OperationKind {
    CREATED,
    UPDATED,
    SYNCED,
    DELETED
}
