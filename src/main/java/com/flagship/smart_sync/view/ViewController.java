package com.flagship.smart_sync.view;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/views")
@RequiredArgsConstructor
public class ViewController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final HygieneTrayOrchestrator hygieneTray;
    private final ApprovalQueueOrchestrator approvalQueue;

    @GetMapping("/hygiene")
    public ResponseEntity<HygieneTrayView> hygiene(@PathVariable("tenantId") UUID tenantId) {
        return ResponseEntity.ok(hygieneTray.getView(tenantId));
    }

    @GetMapping("/approvals")
    public ResponseEntity<ApprovalQueueView> approvals(@PathVariable("tenantId") UUID tenantId) {
        return ResponseEntity.ok(approvalQueue.getView(tenantId));
    }

    @PostMapping("/approvals/{billId}/approve")
    public ResponseEntity<ApprovalQueueView.Item> approve(@PathVariable("tenantId") UUID tenantId,
                                                          @PathVariable("billId") UUID billId,
                                                          @RequestHeader(ACTOR_HEADER) String actorId,
                                                          @Valid @RequestBody(required = false) DecisionRequest request) {
        return ResponseEntity.ok(approvalQueue.approve(tenantId, billId, actorId, note(request)));
    }

    @PostMapping("/approvals/{billId}/reject")
    public ResponseEntity<ApprovalQueueView.Item> reject(@PathVariable("tenantId") UUID tenantId,
                                                         @PathVariable("billId") UUID billId,
                                                         @RequestHeader(ACTOR_HEADER) String actorId,
                                                         @Valid @RequestBody(required = false) DecisionRequest request) {
        return ResponseEntity.ok(approvalQueue.reject(tenantId, billId, actorId, note(request)));
    }

    private static String note(DecisionRequest request) {
        return request != null ? request.getNote() : null;
    }
}
