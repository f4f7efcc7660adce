package com.flagship.smart_sync.view;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A decision taken on a payment-ready bill. Written once per (tenant, bill).
 *
 * The approved amount is kept so the queue can flag bills whose amount changed
 * on the rail after they were approved.
 */
@Entity
@Table(
    name = "approval_queue_items",
    uniqueConstraints = @UniqueConstraint(name = "uq_approval_queue_bill", columnNames = {"tenant_id", "bill_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalQueueItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "bill_id", nullable = false, updatable = false)
    private UUID billId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private ApprovalDecision decision;

    @Column(name = "approved_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal approvedAmount;

    @Column(name = "decided_by", nullable = false, updatable = false, length = 128)
    private String decidedBy;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String note;

    @Column(name = "decided_at", nullable = false, updatable = false)
    private Instant decidedAt;

    public static ApprovalQueueItemEntity decide(UUID tenantId, UUID billId, ApprovalDecision decision,
                                                 BigDecimal amount, String decidedBy, String note,
                                                 Instant decidedAt) {
        return new ApprovalQueueItemEntity(UUID.randomUUID(), tenantId, billId, decision, amount,
                decidedBy, note, decidedAt);
    }
}
