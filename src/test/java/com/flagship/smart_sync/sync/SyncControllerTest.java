package com.flagship.smart_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.smart_sync.client.ApiError;
import com.flagship.smart_sync.client.ApiErrorType;
import com.flagship.smart_sync.exception.FatalSyncError;
import com.flagship.smart_sync.observability.CorrelationContext;
import com.flagship.smart_sync.rail.credential.RailCredential;
import com.flagship.smart_sync.rail.credential.RailCredentialService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Sync API tests.
 *
 * These tests verify:
 * - A manual trigger runs the sync and returns the run
 * - Async triggers are accepted with 202
 * - Tenant status shows health and wording, never raw error text
 * - Unknown rails, unknown entity types and unsupported operations map to 404, 400 and 422
 * - Reset, cancel and run history endpoints
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class SyncControllerTest {

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

    private static final Instant T0 = Instant.parse("2025-01-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FakeLedgerRail rail;

    @Autowired
    private RailCredentialService credentialService;

    private UUID tenantId;
    private String base;

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
        base = "/api/v1/tenants/" + tenantId + "/sync";
        credentialService.save(RailCredential.create(tenantId, FakeLedgerRail.RAIL_ID, "acct-" + tenantId,
                "access-token", "refresh-token", null, null));
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Manual trigger runs the sync and returns the run summary")
    void testTrigger_Sync() throws Exception {
        printTestHeader("Manual Trigger");
        rail.putBill(tenantId, "bill-1", "500.00", "USD", "2025-01-15", "0", T0);
        rail.putBill(tenantId, "bill-2", "75.00", "USD", "2025-01-20", "0", T0.plusSeconds(1));

        MvcResult result = mockMvc.perform(post(base + "/fakeledger/bills")
                        .header(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(CorrelationContext.CORRELATION_ID_HEADER, "corr-123"))
                .andExpect(jsonPath("$.outcome").value("SUCCEEDED"))
                .andExpect(jsonPath("$.triggerSource").value("MANUAL"))
                .andExpect(jsonPath("$.created").value(2))
                .andReturn();
        printOutput("Run", result.getResponse().getContentAsString());

        mockMvc.perform(get(base + "/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallHealth").value("OK"))
                .andExpect(jsonPath("$.keys[0].rail").value("fakeledger"))
                .andExpect(jsonPath("$.keys[0].entityType").value("BILL"))
                .andExpect(jsonPath("$.keys[0].state").value("SUCCEEDED"))
                .andExpect(jsonPath("$.keys[0].running").value(false))
                .andExpect(jsonPath("$.keys[0].lastSuccessAt").isNotEmpty());

        JsonNode runs = json(mockMvc.perform(get(base + "/fakeledger/bill/runs"))
                .andExpect(status().isOk())
                .andReturn());
        assertEquals(1, runs.size());
        assertEquals("SUCCEEDED", runs.get(0).get("outcome").asText());
        printSuccess("Run recorded and status is OK");
    }

    @Test
    @DisplayName("Async trigger is accepted with 202")
    void testTrigger_Async() throws Exception {
        printTestHeader("Async Trigger");

        mockMvc.perform(post(base + "/fakeledger/bills").param("async", "true"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.entityType").value("BILL"));
        printSuccess("Trigger queued");
    }

    @Test
    @DisplayName("Status after an auth failure asks for reconnection without exposing the error")
    void testStatus_NeedsReconnection() throws Exception {
        printTestHeader("Needs Reconnection");
        rail.failFetches(tenantId, new FatalSyncError("HTTP 401: invalid_grant for realm 9341",
                ApiError.of(ApiErrorType.AUTHENTICATION, 401, "invalid_grant")));

        mockMvc.perform(post(base + "/fakeledger/bills"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("FAILED_FATAL"));

        MvcResult result = mockMvc.perform(get(base + "/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallHealth").value("NEEDS_ATTENTION"))
                .andExpect(jsonPath("$.keys[0].message").value(SyncHealth.MESSAGE_RECONNECT))
                .andReturn();
        String body = result.getResponse().getContentAsString();
        printOutput("Status", body);
        assertFalse(body.contains("invalid_grant"));

        mockMvc.perform(post(base + "/fakeledger/bills"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("SKIPPED_NEEDS_ATTENTION"));

        mockMvc.perform(post(base + "/fakeledger/bills/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"));
        printSuccess("Key reset to IDLE");
    }

    @Test
    @DisplayName("Unknown rail is 404, unknown entity type 400, unsupported entity type 422")
    void testTrigger_BadTargets() throws Exception {
        printTestHeader("Bad Targets");

        mockMvc.perform(post(base + "/no-such-rail/bills"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));

        mockMvc.perform(post(base + "/fakeledger/widgets"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown entity type: widgets"));

        mockMvc.perform(post(base + "/fakeledger/payments"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Unsupported Operation"));

        mockMvc.perform(post("/api/v1/tenants/not-a-uuid/sync/fakeledger/bills"))
                .andExpect(status().isBadRequest());
        printSuccess("Errors mapped");
    }

    @Test
    @DisplayName("Reset is 404 for a key that never ran and 409 for a key that is not failed")
    void testReset_Refusals() throws Exception {
        printTestHeader("Reset Refusals");

        mockMvc.perform(post(base + "/fakeledger/bills/reset"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post(base + "/fakeledger/bills")).andExpect(status().isOk());
        mockMvc.perform(post(base + "/fakeledger/bills/reset"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid State"));
        printSuccess("Reset refused");
    }

    @Test
    @DisplayName("Cancel endpoints report how many runs were stopped")
    void testCancel_NothingRunning() throws Exception {
        printTestHeader("Cancel");

        mockMvc.perform(post(base + "/fakeledger/bills/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(0));

        mockMvc.perform(post(base + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(0));
        printSuccess("Nothing to cancel");
    }
}
