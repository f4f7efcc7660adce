package com.flagship.smart_sync.rail;

import lombok.Value;

/**
 * What the rail assigned to a pushed record.
 */
@Value
public class PushResult {
    String externalId;
    String sourceVersion;
    String status;
}
