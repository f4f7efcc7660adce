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
public class ApprovalQueueView {
    UUID tenantId;
    Instant generatedAt;
    List<Item> pending;
    List<Item> decided;
    BigDecimal cashPosition;
    BigDecimal dueWithinWeek;
    int billsDueWithinWeek;
    Integer runwayDays;         // null when there are no upcoming payables
    RunwayHealth health;

    @Value
    @Builder
    public static class Item {
        UUID billId;
        String externalId;
        String counterpartyName;
        BigDecimal amount;
        LocalDate dueDate;
        String status;
        ApprovalDecision decision;      // null while pending
        BigDecimal approvedAmount;
        boolean amountChangedSinceApproval;
        String decidedBy;
        Instant decidedAt;
    }

    public enum RunwayHealth {
        HEALTHY,
        WARNING,
        CRITICAL
    }
}
