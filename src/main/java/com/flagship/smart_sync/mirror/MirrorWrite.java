package com.flagship.smart_sync.mirror;

import com.flagship.smart_sync.log.OperationKind;
import lombok.Value;

import java.util.Map;

/**
 * Result of the mirror half of a change, before the log half has run.
 */
@Value
public class MirrorWrite {
    MirrorRecord record;
    OperationKind operation;            // null when the content did not change
    Map<String, FieldChange> diff;

    public boolean isChanged() {
        return operation != null;
    }
}
