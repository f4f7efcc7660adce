package com.flagship.smart_sync.view;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DecisionRequest {

    @Size(max = 2000, message = "Note must be at most 2000 characters")
    @JsonProperty("note")
    String note;
}
