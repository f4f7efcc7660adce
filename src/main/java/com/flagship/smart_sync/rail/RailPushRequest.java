package com.flagship.smart_sync.rail;

import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.rail.credential.RailCredential;
import lombok.Value;

import java.util.UUID;

/**
 * A locally created record to be sent to an execution rail.
 */
@Value
public class RailPushRequest {
    UUID tenantId;
    RailCredential credential;
    MirrorRecord record;
}
