package com.flagship.smart_sync.mirror;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * Query criteria for {@link MirrorStore#query}. Null fields do not filter.
 * {@code limit} and {@code offset} select one page of the result.
 */
@Value
@Builder(toBuilder = true)
public class MirrorFilter {
    Set<String> statuses;
    String counterpartyName;
    LocalDate dueOnOrBefore;
    LocalDate dueOnOrAfter;
    BigDecimal minAmount;
    String attributeName;       // with attributeValue: match on attributes->>name
    String attributeValue;
    boolean includeDeleted;
    @Builder.Default
    int limit = 500;
    int offset;

    public static MirrorFilter all() {
        return MirrorFilter.builder().build();
    }

    public MirrorFilter nextPage() {
        return toBuilder().offset(offset + limit).build();
    }
}
