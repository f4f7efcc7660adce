package com.flagship.smart_sync.view;

import com.flagship.smart_sync.log.ChangeSource;
import com.flagship.smart_sync.mirror.CanonicalEntity;
import com.flagship.smart_sync.mirror.EntityType;
import com.flagship.smart_sync.mirror.MirrorRecord;
import com.flagship.smart_sync.mirror.MirrorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * View API tests.
 *
 * These tests verify:
 * - The hygiene tray lists bills that need fixing before they can be paid
 * - Approve and reject over HTTP require an actor and record the decision
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class ViewControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("smart_sync_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MirrorStore mirrorStore;

    @Autowired
    private Clock clock;

    private UUID tenantId;
    private String base;
    private LocalDate today;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        base = "/api/v1/tenants/" + tenantId + "/views";
        today = LocalDate.now(clock);
    }

    private MirrorRecord syncedBill(String externalId, String vendor, String amount, LocalDate dueDate) {
        return mirrorStore.upsert(tenantId, CanonicalEntity.builder()
                .entityType(EntityType.BILL)
                .externalId(externalId)
                .counterpartyName(vendor)
                .amount(new BigDecimal(amount))
                .currency("USD")
                .dueDate(dueDate)
                .status("OPEN")
                .build(), "quickbooks", null).getRecord();
    }

    @Test
    @DisplayName("Hygiene tray shows a local bill due soon as urgent and not synced")
    void testHygiene() throws Exception {
        printTestHeader("Hygiene Tray");
        syncedBill("b-1", "Acme", "100.00", today.plusDays(2));
        MirrorRecord local = mirrorStore.upsert(tenantId, CanonicalEntity.builder()
                .entityType(EntityType.BILL)
                .counterpartyName("Globex")
                .amount(new BigDecimal("75.00"))
                .currency("USD")
                .dueDate(today.plusDays(3))
                .status("OPEN")
                .build(), ChangeSource.USER, "ap-clerk@example.com").getRecord();

        MvcResult result = mockMvc.perform(get(base + "/hygiene"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.urgentCount").value(1))
                .andExpect(jsonPath("$.upcomingCount").value(0))
                .andExpect(jsonPath("$.urgent[0].billId").value(local.getId().toString()))
                .andExpect(jsonPath("$.urgent[0].issues[0]").value("NOT_SYNCED"))
                .andReturn();
        printOutput("View", result.getResponse().getContentAsString());
        printSuccess("Unsynced bill flagged");
    }

    @Test
    @DisplayName("Approve and reject record the decision; a missing actor is 400, a second decision 409")
    void testDecisions() throws Exception {
        printTestHeader("Approval Decisions");
        MirrorRecord first = syncedBill("b-1", "Acme", "1000.00", today.plusDays(3));
        MirrorRecord second = syncedBill("b-2", "Globex", "250.00", today.plusDays(10));

        mockMvc.perform(post(base + "/approvals/" + first.getId() + "/approve"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));

        mockMvc.perform(post(base + "/approvals/" + first.getId() + "/approve")
                        .header("X-Actor-Id", "cfo@example.com")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\": \"ok to pay\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("APPROVED"))
                .andExpect(jsonPath("$.decidedBy").value("cfo@example.com"))
                .andExpect(jsonPath("$.amountChangedSinceApproval").value(false));

        mockMvc.perform(post(base + "/approvals/" + second.getId() + "/reject")
                        .header("X-Actor-Id", "cfo@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("REJECTED"));

        mockMvc.perform(post(base + "/approvals/" + first.getId() + "/reject")
                        .header("X-Actor-Id", "cfo@example.com"))
                .andExpect(status().isConflict());

        mockMvc.perform(post(base + "/approvals/" + UUID.randomUUID() + "/approve")
                        .header("X-Actor-Id", "cfo@example.com"))
                .andExpect(status().isNotFound());

        MvcResult result = mockMvc.perform(get(base + "/approvals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending.length()").value(0))
                .andExpect(jsonPath("$.decided.length()").value(2))
                .andReturn();
        printOutput("View", result.getResponse().getContentAsString());
        printSuccess("Decisions recorded");
    }
}
