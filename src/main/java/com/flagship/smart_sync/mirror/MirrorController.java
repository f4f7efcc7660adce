package com.flagship.smart_sync.mirror;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.exception.NotFoundException;
import com.flagship.smart_sync.log.ChangeSource;
import com.flagship.smart_sync.log.TransactionLogStore;
import com.flagship.smart_sync.mirror.dto.LogEntryResponse;
import com.flagship.smart_sync.mirror.dto.MirrorEntityRequest;
import com.flagship.smart_sync.mirror.dto.MirrorQueryResponse;
import com.flagship.smart_sync.mirror.dto.MirrorRecordResponse;
import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.sync.FreshnessHint;
import com.flagship.smart_sync.sync.FreshnessResult;
import com.flagship.smart_sync.sync.FreshnessService;
import com.flagship.smart_sync.sync.SyncOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Read access to the mirror and the log, plus the explicit local-mutation paths.
 *
 * Local creates and edits are written with source "user" and the actor from the
 * X-Actor-Id header, and are logged like any synced change.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
@RequiredArgsConstructor
@Slf4j
public class MirrorController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final MirrorStore mirrorStore;
    private final TransactionLogStore logStore;
    private final ReconciliationService reconciliationService;
    private final FreshnessService freshnessService;
    private final SyncOrchestrator orchestrator;
    private final RailRegistry railRegistry;
    private final ObjectMapper objectMapper;

    /**
     * Queries one entity type. With {@code rail}, the freshness policy for that rail
     * is applied first: STRICT refreshes stale data before reading.
     */
    @GetMapping("/mirror/{entityType}")
    public ResponseEntity<MirrorQueryResponse> query(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @RequestParam(value = "status", required = false) Set<String> statuses,
            @RequestParam(value = "counterparty", required = false) String counterparty,
            @RequestParam(value = "due_before", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueBefore,
            @RequestParam(value = "due_after", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueAfter,
            @RequestParam(value = "min_amount", required = false) BigDecimal minAmount,
            @RequestParam(value = "include_deleted", defaultValue = "false") boolean includeDeleted,
            @RequestParam(value = "limit", defaultValue = "500") int limit,
            @RequestParam(value = "rail", required = false) String rail,
            @RequestParam(value = "freshness", defaultValue = "CACHED_OK") String freshness) {

        EntityType type = EntityType.fromPath(entityType);
        if (limit < 1 || limit > 5000) {
            throw new IllegalArgumentException("limit must be between 1 and 5000");
        }

        FreshnessResult freshnessResult = null;
        if (rail != null) {
            railRegistry.get(rail);
            freshnessResult = freshnessService.ensureFresh(tenantId, rail, type, parseHint(freshness));
        }

        MirrorFilter filter = MirrorFilter.builder()
                .statuses(statuses)
                .counterpartyName(counterparty)
                .dueOnOrBefore(dueBefore)
                .dueOnOrAfter(dueAfter)
                .minAmount(minAmount)
                .includeDeleted(includeDeleted)
                .limit(limit)
                .build();
        List<MirrorRecordResponse> records = mirrorStore.query(tenantId, type, filter).stream()
                .map(MirrorRecordResponse::from)
                .toList();

        return ResponseEntity.ok(new MirrorQueryResponse(records, records.size(), freshnessResult));
    }

    @GetMapping("/mirror/{entityType}/external/{externalId}")
    public ResponseEntity<MirrorRecordResponse> getByExternalId(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @PathVariable("externalId") String externalId) {
        EntityType type = EntityType.fromPath(entityType);
        return mirrorStore.get(tenantId, type, externalId)
                .map(record -> ResponseEntity.ok(MirrorRecordResponse.from(record)))
                .orElseThrow(() -> new NotFoundException(type + " with external id " + externalId + " not found"));
    }

    @PostMapping("/mirror/{entityType}")
    public ResponseEntity<MirrorRecordResponse> createLocal(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @Valid @RequestBody MirrorEntityRequest request) {
        EntityType type = EntityType.fromPath(entityType);
        UpsertResult result = mirrorStore.upsert(tenantId, request.toEntity(type), ChangeSource.USER, actorId);
        log.info("Local {} {} created by {}", type, result.getRecord().getId(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(MirrorRecordResponse.from(result.getRecord()));
    }

    @PutMapping("/mirror/{entityType}/{id}")
    public ResponseEntity<MirrorRecordResponse> updateLocal(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @PathVariable("id") UUID id,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @Valid @RequestBody MirrorEntityRequest request) {
        EntityType type = EntityType.fromPath(entityType);
        UpsertResult result = mirrorStore.updateLocal(tenantId, id, request.toEntity(type), actorId);
        return ResponseEntity.ok(MirrorRecordResponse.from(result.getRecord()));
    }

    /**
     * Sends a locally created record to an execution rail.
     */
    @PostMapping("/mirror/{entityType}/{id}/push/{rail}")
    public ResponseEntity<MirrorRecordResponse> push(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @PathVariable("id") UUID id,
            @PathVariable("rail") String rail) {
        EntityType type = EntityType.fromPath(entityType);
        UpsertResult result = orchestrator.push(tenantId, rail, type, id);
        log.info("Pushed {} {} to {} as {}", type, id, rail, result.getRecord().getExternalId());
        return ResponseEntity.ok(MirrorRecordResponse.from(result.getRecord()));
    }

    @GetMapping("/history/{entityType}/{entityId}")
    public ResponseEntity<List<LogEntryResponse>> history(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @PathVariable("entityId") UUID entityId) {
        EntityType type = EntityType.fromPath(entityType);
        mirrorStore.getById(tenantId, type, entityId)
                .orElseThrow(() -> new NotFoundException(type + " " + entityId + " not found"));
        List<LogEntryResponse> entries = logStore.history(tenantId, entityId).stream()
                .map(entry -> LogEntryResponse.from(entry, objectMapper))
                .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/history/{entityType}/{entityId}/verify")
    public ResponseEntity<ReconciliationService.ReconciliationReport> verify(
            @PathVariable("tenantId") UUID tenantId,
            @PathVariable("entityType") String entityType,
            @PathVariable("entityId") UUID entityId) {
        return ResponseEntity.ok(reconciliationService.verify(tenantId, EntityType.fromPath(entityType), entityId));
    }

    private static FreshnessHint parseHint(String value) {
        try {
            return FreshnessHint.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("freshness must be STRICT or CACHED_OK");
        }
    }
}
