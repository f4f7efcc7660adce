package com.flagship.smart_sync.view;

import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.MirrorFilter;
import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.mirror.MirrorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Payment-ready bills with their approval decisions and the cash context for them.
 *
 * Key features:
 * - A bill is payment-ready when it has a vendor, a due date, a positive amount,
 *   an external id and status OPEN or SCHEDULED
 * - Decisions live in approval_queue_items, so every instance sees the same queue
 * - An approved bill whose amount later changed on the rail is flagged
 * - Cash position sums bank account balances; runway divides it by the daily
 *   burn of payables due in the next 30 days
 *
 * Health: CRITICAL below 30 days of runway, WARNING below 90 days or with more
 * than 10 bills due this week, HEALTHY otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApprovalQueueOrchestrator implements DataOrchestrator<ApprovalQueueView> {

    static final int DUE_WINDOW_DAYS = 7;
    static final int BURN_WINDOW_DAYS = 30;
    static final int CRITICAL_RUNWAY_DAYS = 30;
    static final int WARNING_RUNWAY_DAYS = 90;
    static final int BUSY_WEEK_BILLS = 10;
    static final String BANK_ACCOUNT_TYPE = "Bank";

    private static final Set<String> PAYABLE_STATUSES = Set.of("OPEN", "SCHEDULED");
    private static final BigDecimal MAX_RUNWAY_DAYS = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final MirrorStore mirrorStore;
    private final ApprovalQueueItemRepository repository;
    private final Clock clock;

    @Override
    public String useCase() {
        return "approvals";
    }

    @Override
    @Transactional(readOnly = true)
    public ApprovalQueueView getView(UUID tenantId) {
        LocalDate today = LocalDate.now(clock);
        List<MirrorRecord> ready = mirrorStore.queryAll(tenantId, EntityType.BILL,
                        MirrorFilter.builder().statuses(PAYABLE_STATUSES).build()).stream()
                .filter(ApprovalQueueOrchestrator::isPaymentReady)
                .sorted(Comparator.comparing(MirrorRecord::getDueDate))
                .toList();
        Map<UUID, ApprovalQueueItemEntity> decisions = repository.findByTenantId(tenantId).stream()
                .collect(Collectors.toMap(ApprovalQueueItemEntity::getBillId, Function.identity()));

        List<ApprovalQueueView.Item> pending = new ArrayList<>();
        List<ApprovalQueueView.Item> decided = new ArrayList<>();
        BigDecimal dueWithinWeek = BigDecimal.ZERO;
        BigDecimal burnWindowTotal = BigDecimal.ZERO;
        int billsDueWithinWeek = 0;

        for (MirrorRecord bill : ready) {
            ApprovalQueueItemEntity decision = decisions.get(bill.getId());
            ApprovalQueueView.Item item = toItem(bill, decision);
            if (decision == null) {
                pending.add(item);
            } else {
                decided.add(item);
            }

            if (!bill.getDueDate().isAfter(today.plusDays(DUE_WINDOW_DAYS))) {
                dueWithinWeek = dueWithinWeek.add(bill.getAmount());
                billsDueWithinWeek++;
            }
            if (!bill.getDueDate().isAfter(today.plusDays(BURN_WINDOW_DAYS))) {
                burnWindowTotal = burnWindowTotal.add(bill.getAmount());
            }
        }

        BigDecimal cash = cashPosition(tenantId);
        Integer runway = runwayDays(cash, burnWindowTotal);

        return ApprovalQueueView.builder()
                .tenantId(tenantId)
                .generatedAt(clock.instant())
                .pending(pending)
                .decided(decided)
                .cashPosition(cash)
                .dueWithinWeek(dueWithinWeek)
                .billsDueWithinWeek(billsDueWithinWeek)
                .runwayDays(runway)
                .health(health(runway, billsDueWithinWeek))
                .build();
    }

    @Transactional
    public ApprovalQueueView.Item approve(UUID tenantId, UUID billId, String actorId, String note) {
        return decide(tenantId, billId, ApprovalDecision.APPROVED, actorId, note);
    }

    @Transactional
    public ApprovalQueueView.Item reject(UUID tenantId, UUID billId, String actorId, String note) {
        return decide(tenantId, billId, ApprovalDecision.REJECTED, actorId, note);
    }

    private ApprovalQueueView.Item decide(UUID tenantId, UUID billId, ApprovalDecision decision,
                                          String actorId, String note) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("An actor is required to decide on a bill");
        }
        MirrorRecord bill = mirrorStore.getById(tenantId, EntityType.BILL, billId)
                .orElseThrow(() -> new NotFoundException("Bill " + billId + " not found"));
        if (!isPaymentReady(bill)) {
            throw new IllegalStateException("Bill " + billId + " is not ready for payment");
        }
        if (repository.findByTenantIdAndBillId(tenantId, billId).isPresent()) {
            throw new IllegalStateException("Bill " + billId + " already has a decision");
        }

        ApprovalQueueItemEntity entity = ApprovalQueueItemEntity.decide(tenantId, billId, decision,
                bill.getAmount(), actorId, note, clock.instant());
        try {
            repository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            throw new IllegalStateException("Bill " + billId + " already has a decision", e);
        }
        log.info("Bill {} of tenant {} {} by {}", billId, tenantId, decision, actorId);
        return toItem(bill, entity);
    }

    static boolean isPaymentReady(MirrorRecord bill) {
        return bill.isActive()
                && bill.getExternalId() != null
                && bill.getCounterpartyName() != null && !bill.getCounterpartyName().isBlank()
                && bill.getDueDate() != null
                && bill.getAmount() != null && bill.getAmount().signum() > 0
                && bill.getStatus() != null && PAYABLE_STATUSES.contains(bill.getStatus());
    }

    /**
     * Whole days of cash at the 30-day burn rate, capped at {@link Integer#MAX_VALUE}.
     * Computed as cash * 30 / burn so a tiny burn never rounds to a zero divisor.
     */
    static Integer runwayDays(BigDecimal cash, BigDecimal burnWindowTotal) {
        if (burnWindowTotal.signum() <= 0) {
            return null;
        }
        if (cash.signum() <= 0) {
            return 0;
        }
        BigDecimal days = cash.multiply(BigDecimal.valueOf(BURN_WINDOW_DAYS))
                .divide(burnWindowTotal, 0, RoundingMode.DOWN);
        return days.compareTo(MAX_RUNWAY_DAYS) > 0 ? Integer.MAX_VALUE : days.intValue();
    }

    static ApprovalQueueView.RunwayHealth health(Integer runwayDays, int billsDueWithinWeek) {
        if (runwayDays != null && runwayDays < CRITICAL_RUNWAY_DAYS) {
            return ApprovalQueueView.RunwayHealth.CRITICAL;
        }
        if ((runwayDays != null && runwayDays < WARNING_RUNWAY_DAYS) || billsDueWithinWeek > BUSY_WEEK_BILLS) {
            return ApprovalQueueView.RunwayHealth.WARNING;
        }
        return ApprovalQueueView.RunwayHealth.HEALTHY;
    }

    private BigDecimal cashPosition(UUID tenantId) {
        return mirrorStore.queryAll(tenantId, EntityType.BALANCE, MirrorFilter.builder()
                        .attributeName("account_type")
                        .attributeValue(BANK_ACCOUNT_TYPE)
                        .build()).stream()
                .map(MirrorRecord::getAmount)
                .filter(amount -> amount != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static ApprovalQueueView.Item toItem(MirrorRecord bill, ApprovalQueueItemEntity decision) {
        ApprovalQueueView.Item.ItemBuilder item = ApprovalQueueView.Item.builder()
                .billId(bill.getId())
                .externalId(bill.getExternalId())
                .counterpartyName(bill.getCounterpartyName())
                .amount(bill.getAmount())
                .dueDate(bill.getDueDate())
                .status(bill.getStatus());
        if (decision != null) {
            item.decision(decision.getDecision())
                    .approvedAmount(decision.getApprovedAmount())
                    .amountChangedSinceApproval(decision.getDecision() == ApprovalDecision.APPROVED
                            && decision.getApprovedAmount().compareTo(bill.getAmount()) != 0)
                    .decidedBy(decision.getDecidedBy())
                    .decidedAt(decision.getDecidedAt());
        }
        return item.build();
    }
}
