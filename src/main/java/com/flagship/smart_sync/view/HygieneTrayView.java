package com.flagship.smart_sync.view;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class HygieneTrayView {
    UUID tenantId;
    Instant generatedAt;
    List<Item> urgent;
    List<Item> upcoming;
    int urgentCount;
    int upcomingCount;
    BigDecimal totalAmount;

    @Value
    @Builder
    public static class Item {
        UUID billId;
        String externalId;
        String counterpartyName;
        BigDecimal amount;
        LocalDate dueDate;
        String status;
        List<HygieneIssue> issues;
    }
}
