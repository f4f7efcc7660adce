package com.flagship.smart_sync.rail;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Instant;

/**
 * One native record as fetched from a rail, before mapping.
 */
@Value
public class RailRecord {
    String externalId;
    String sourceVersion;
    Instant lastUpdated;        // rail's own modification time, drives the cursor
    JsonNode payload;
}
