package com.flagship.smart_sync.webhook;

import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.rail.RailOperation;
import com.flagship.smart_sync.rail.RailRegistry;
import com.flagship.smart_sync.rail.RailSyncService;
import com.flagship.smart_sync.rail.WebhookSignal;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import com.flagship.smart_sync.sync.SyncOrchestrator;
import com.flagship.smart_sync.sync.TriggerSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Webhook intake without HTTP.
 *
 * These tests verify:
 * - A delivery whose triggers were all queued stays recorded
 * - A delivery with a trigger the executor refused is released for redelivery
 */
@ExtendWith(MockitoExtension.class)
class WebhookIntakeServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-10T08:00:00Z");
    private static final String RAIL = "quickbooks";
    private static final String BODY = "{\"eventNotifications\":[]}";

    @Mock
    private RailRegistry railRegistry;

    @Mock
    private RailCredentialService credentialService;

    @Mock
    private SyncOrchestrator orchestrator;

    @Mock
    private ProcessedWebhookRepository processedWebhooks;

    @Mock
    private RailSyncService rail;

    private WebhookIntakeService intakeService;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        intakeService = new WebhookIntakeService(railRegistry, credentialService, orchestrator, processedWebhooks,
                Clock.fixed(NOW, ZoneOffset.UTC));
        tenantId = UUID.randomUUID();

        when(railRegistry.get(RAIL)).thenReturn(rail);
        when(rail.parseWebhook(eq(BODY), any(HttpHeaders.class))).thenReturn(List.of(
                new WebhookSignal(RAIL, "realm-1", EntityType.BILL, "146", "Update", NOW)));
        when(rail.supports(RailOperation.READ)).thenReturn(true);
        when(rail.supports(EntityType.BILL)).thenReturn(true);
        when(processedWebhooks.insertIfAbsent(anyString(), eq(RAIL), anyInt(), eq(NOW))).thenReturn(1);
        when(credentialService.findByExternalAccount(RAIL, "realm-1")).thenReturn(List.of(
                RailCredential.create(tenantId, RAIL, "realm-1", "access", "refresh", null, null)));
    }

    @Test
    @DisplayName("Queued triggers keep the delivery recorded")
    void testAccept_Queued() {
        when(orchestrator.triggerAsync(tenantId, RAIL, EntityType.BILL, TriggerSource.WEBHOOK))
                .thenReturn(new CompletableFuture<>());

        WebhookIntakeResult result = intakeService.accept(RAIL, BODY, new HttpHeaders());

        assertFalse(result.isDuplicate());
        assertEquals(1, result.getTriggered());
        verify(processedWebhooks, never()).deleteById(anyString());
    }

    @Test
    @DisplayName("A refused trigger releases the delivery so the rail's redelivery is processed")
    void testAccept_TriggerRejected() {
        when(orchestrator.triggerAsync(tenantId, RAIL, EntityType.BILL, TriggerSource.WEBHOOK))
                .thenThrow(new TaskRejectedException("executor full"));

        WebhookIntakeResult result = intakeService.accept(RAIL, BODY, new HttpHeaders());

        assertEquals(0, result.getTriggered());
        verify(processedWebhooks).deleteById(WebhookIntakeService.dedupKey(RAIL, BODY));
    }
}
