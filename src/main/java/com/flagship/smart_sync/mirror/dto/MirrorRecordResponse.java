package com.flagship.smart_sync.mirror.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.mirror.RecordStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class MirrorRecordResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entity_type")
    EntityType entityType;

    @JsonProperty("external_id")
    String externalId;

    @JsonProperty("counterparty_name")
    String counterpartyName;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    String status;

    @JsonProperty("attributes")
    Map<String, String> attributes;

    @JsonProperty("record_status")
    RecordStatus recordStatus;

    @JsonProperty("sync_source")
    String syncSource;

    @JsonProperty("last_synced_at")
    Instant lastSyncedAt;

    @JsonProperty("log_pending")
    boolean logPending;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static MirrorRecordResponse from(MirrorRecord record) {
        return MirrorRecordResponse.builder()
                .id(record.getId())
                .entityType(record.getEntityType())
                .externalId(record.getExternalId())
                .counterpartyName(record.getCounterpartyName())
                .amount(record.getAmount())
                .currency(record.getEntity().getCurrency())
                .dueDate(record.getDueDate())
                .status(record.getStatus())
                .attributes(record.getEntity().getAttributes())
                .recordStatus(record.getRecordStatus())
                .syncSource(record.getSyncSource())
                .lastSyncedAt(record.getLastSyncedAt())
                .logPending(record.isLogPending())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
