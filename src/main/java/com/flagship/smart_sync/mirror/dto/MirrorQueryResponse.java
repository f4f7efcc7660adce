package com.flagship.smart_sync.mirror.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.smart_sync.sync.FreshnessResult;
import lombok.Value;

import java.util.List;

@Value
public class MirrorQueryResponse {

    @JsonProperty("records")
    List<MirrorRecordResponse> records;

    @JsonProperty("count")
    int count;

    @JsonProperty("freshness")
    FreshnessResult freshness;      // null unless a rail was named
}
