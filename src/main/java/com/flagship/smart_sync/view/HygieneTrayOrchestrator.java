package com.flagship.smart_sync.view;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.MirrorFilter;
import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.mirror.MirrorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Open bills with data-quality issues, split into urgent and upcoming.
 *
 * An item is urgent when an issue blocks payment (no vendor, no due date, no
 * usable amount) or when it is due within {@link #URGENT_WINDOW_DAYS} days,
 * overdue included. Everything else waits in upcoming.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HygieneTrayOrchestrator implements DataOrchestrator<HygieneTrayView> {

    static final int URGENT_WINDOW_DAYS = 7;
    private static final Set<String> OPEN_STATUSES = Set.of("OPEN", "SCHEDULED", "DRAFT");

    private final MirrorStore mirrorStore;
    private final Clock clock;

    @Override
    public String useCase() {
        return "hygiene";
    }

    @Override
    public HygieneTrayView getView(UUID tenantId) {
        LocalDate today = LocalDate.now(clock);
        List<MirrorRecord> bills = mirrorStore.queryAll(tenantId, EntityType.BILL,
                MirrorFilter.builder().statuses(OPEN_STATUSES).build());

        List<HygieneTrayView.Item> urgent = new ArrayList<>();
        List<HygieneTrayView.Item> upcoming = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (MirrorRecord bill : bills) {
            List<HygieneIssue> issues = issuesOf(bill);
            if (issues.isEmpty()) {
                continue;
            }
            HygieneTrayView.Item item = HygieneTrayView.Item.builder()
                    .billId(bill.getId())
                    .externalId(bill.getExternalId())
                    .counterpartyName(bill.getCounterpartyName())
                    .amount(bill.getAmount())
                    .dueDate(bill.getDueDate())
                    .status(bill.getStatus())
                    .issues(issues)
                    .build();
            if (isUrgent(issues, bill.getDueDate(), today)) {
                urgent.add(item);
            } else {
                upcoming.add(item);
            }
            if (bill.getAmount() != null && bill.getAmount().signum() > 0) {
                total = total.add(bill.getAmount());
            }
        }

        Comparator<HygieneTrayView.Item> byDueDate = Comparator.comparing(HygieneTrayView.Item::getDueDate,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        urgent.sort(byDueDate);
        upcoming.sort(byDueDate);

        log.debug("Hygiene tray for tenant {}: {} urgent, {} upcoming", tenantId, urgent.size(), upcoming.size());
        return HygieneTrayView.builder()
                .tenantId(tenantId)
                .generatedAt(clock.instant())
                .urgent(urgent)
                .upcoming(upcoming)
                .urgentCount(urgent.size())
                .upcomingCount(upcoming.size())
                .totalAmount(total)
                .build();
    }

    static List<HygieneIssue> issuesOf(MirrorRecord bill) {
        List<HygieneIssue> issues = new ArrayList<>();
        if (bill.getCounterpartyName() == null || bill.getCounterpartyName().isBlank()) {
            issues.add(HygieneIssue.MISSING_VENDOR);
        }
        if (bill.getDueDate() == null) {
            issues.add(HygieneIssue.MISSING_DUE_DATE);
        }
        if (bill.getAmount() == null || bill.getAmount().signum() <= 0) {
            issues.add(HygieneIssue.INVALID_AMOUNT);
        }
        if (bill.getExternalId() == null) {
            issues.add(HygieneIssue.NOT_SYNCED);
        }
        return issues;
    }

    static boolean isUrgent(List<HygieneIssue> issues, LocalDate dueDate, LocalDate today) {
        if (issues.stream().anyMatch(HygieneIssue::isBlocking)) {
            return true;
        }
        return dueDate != null && !dueDate.isAfter(today.plusDays(URGENT_WINDOW_DAYS));
    }
}
