package com.flagship.smart_sync.mirror;

import com.flagship.smart_sync.log.OperationKind;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a paired mirror write and log append.
 */
@Value
public class UpsertResult {
    MirrorRecord record;
    OperationKind operation;            // null when nothing changed
    Map<String, FieldChange> diff;
    UUID logId;                         // null when unchanged, duplicate, or log append failed
    boolean logPending;                 // true when the change awaits reconciliation

    public boolean isChanged() {
        return operation != null;
    }

    static UpsertResult unchanged(MirrorRecord record) {
        return new UpsertResult(record, null, Map.of(), null, false);
    }
}
