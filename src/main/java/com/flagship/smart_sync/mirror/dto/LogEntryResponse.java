package com.flagship.smart_sync.mirror.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.log.OperationKind;
import com.flagship.smart_sync.log.TransactionLogEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A log entry as returned by the history endpoint, with snapshot and diff as
 * embedded JSON rather than strings.
 */
@Value
@Builder
public class LogEntryResponse {

    @JsonProperty("log_id")
    UUID logId;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("operation_kind")
    OperationKind operationKind;

    @JsonProperty("source")
    String source;

    @JsonProperty("actor_id")
    String actorId;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("snapshot")
    JsonNode snapshot;

    @JsonProperty("diff")
    JsonNode diff;

    public static LogEntryResponse from(TransactionLogEntry entry, ObjectMapper objectMapper) {
        return LogEntryResponse.builder()
                .logId(entry.getLogId())
                .sequenceNumber(entry.getSequenceNumber())
                .operationKind(entry.getOperationKind())
                .source(entry.getSource())
                .actorId(entry.getActorId())
                .occurredAt(entry.getOccurredAt())
                .snapshot(readJson(entry.getSnapshot(), objectMapper))
                .diff(readJson(entry.getDiff(), objectMapper))
                .build();
    }

    private static JsonNode readJson(String json, ObjectMapper objectMapper) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored log JSON is unreadable", e);
        }
    }
}
