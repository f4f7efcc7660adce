package com.flagship.smart_sync.mirror.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Body of a local create or edit. Local records carry no external id; one is
 * linked when the record is pushed to a rail.
 */
@Value
@Builder
@Jacksonized
public class MirrorEntityRequest {

    @JsonProperty("counterparty_name")
    String counterpartyName;

    @DecimalMin(value = "0.00", message = "Amount must not be negative")
    @JsonProperty("amount")
    BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @NotBlank(message = "Status is required")
    @JsonProperty("status")
    String status;

    @JsonProperty("attributes")
    Map<String, String> attributes;

    public CanonicalEntity toEntity(EntityType entityType) {
        return CanonicalEntity.builder()
                .entityType(entityType)
                .counterpartyName(counterpartyName)
                .amount(amount)
                .currency(currency)
                .dueDate(dueDate)
                .status(status)
                .attributes(attributes != null ? attributes : Map.of())
                .build();
    }
}
