package com.flagship.smart_sync.sync;

import com.flagship.smart_sync.mirror.EntityType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Manual sync control and tenant-visible sync status.
 *
 * A manual trigger runs on the request thread by default and returns the run;
 * with {@code async=true} it is queued and answered with 202.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncController {

    private final SyncOrchestrator orchestrator;
    private final SyncStatusService statusService;

    @PostMapping("/{rail}/{entityType}")
    public ResponseEntity<?> trigger(@PathVariable("tenantId") UUID tenantId,
                                     @PathVariable("rail") String rail,
                                     @PathVariable("entityType") String entityType,
                                     @RequestParam(value = "async", defaultValue = "false") boolean async) {
        EntityType type = EntityType.fromPath(entityType);
        log.info("Manual sync requested: tenant={}, rail={}, entityType={}, async={}", tenantId, rail, type, async);

        if (async) {
            orchestrator.triggerAsync(tenantId, rail, type, TriggerSource.MANUAL);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "QUEUED");
            body.put("rail", rail);
            body.put("entityType", type);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        return ResponseEntity.ok(orchestrator.trigger(tenantId, rail, type, TriggerSource.MANUAL));
    }

    /**
     * Operator action that lets a FAILED_FATAL key run again.
     */
    @PostMapping("/{rail}/{entityType}/reset")
    public ResponseEntity<Map<String, Object>> reset(@PathVariable("tenantId") UUID tenantId,
                                                     @PathVariable("rail") String rail,
                                                     @PathVariable("entityType") String entityType) {
        SyncCursor cursor = orchestrator.reset(tenantId, rail, EntityType.fromPath(entityType));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rail", rail);
        body.put("entityType", cursor.getKey().getEntityType());
        body.put("state", cursor.getState());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{rail}/{entityType}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable("tenantId") UUID tenantId,
                                                      @PathVariable("rail") String rail,
                                                      @PathVariable("entityType") String entityType) {
        boolean cancelled = orchestrator.cancel(tenantId, rail, EntityType.fromPath(entityType));
        return ResponseEntity.ok(Map.of("cancelled", cancelled ? 1 : 0));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancelTenant(@PathVariable("tenantId") UUID tenantId) {
        return ResponseEntity.ok(Map.of("cancelled", orchestrator.cancelTenant(tenantId)));
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatusView> status(@PathVariable("tenantId") UUID tenantId) {
        return ResponseEntity.ok(statusService.status(tenantId));
    }

    @GetMapping("/{rail}/{entityType}/runs")
    public ResponseEntity<List<SyncRun>> runs(@PathVariable("tenantId") UUID tenantId,
                                              @PathVariable("rail") String rail,
                                              @PathVariable("entityType") String entityType) {
        return ResponseEntity.ok(statusService.recentRuns(tenantId, rail, EntityType.fromPath(entityType)));
    }
}
