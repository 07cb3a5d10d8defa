package com.flagship.campaign_escrow.campaign;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.campaign_escrow.ledger.PayoutJournal;
import com.flagship.campaign_escrow.outbox.OutboxEvent;
import com.flagship.campaign_escrow.outbox.OutboxService;
import com.flagship.campaign_escrow.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests for the campaign REST API.
 *
 * These tests verify:
 * - The full lifecycle over HTTP: create, contribute, close or withdraw, refund
 * - Error taxonomy mapping: 400 validation, 403 permission, 404 unknown, 409 state, 502 transfer
 * - The caller identity header is required on mutating calls
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class CampaignControllerTest {

    private static final String CALLER = "X-Caller-Id";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("campaign_escrow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("campaign.duration", () -> "7d");
    }

    @TestConfiguration
    static class ClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return MutableClock.startingAt("2026-06-01T00:00:00Z");
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @Autowired
    private PayoutJournal journal;

    @Autowired
    private OutboxService outboxService;

    private final List<String> rejectedRecipients = new ArrayList<>();

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

    @AfterEach
    void tearDown() {
        rejectedRecipients.forEach(journal::acceptPayoutsTo);
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void reject(String recipient) {
        journal.rejectPayoutsTo(recipient, "recipient unreachable");
        rejectedRecipients.add(recipient);
    }

    private String createCampaign(String owner, long goal) throws Exception {
        String body = String.format("{\"owner\":\"%s\",\"goal_amount\":%d}", owner, goal);
        MvcResult result = mockMvc.perform(post("/api/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.owner").value(owner))
                .andExpect(jsonPath("$.goal_amount").value(goal))
                .andExpect(jsonPath("$.raised_amount").value(0))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    private JsonNode contribute(String campaignId, String contributor, long amount) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/campaigns/{id}/contributions", campaignId)
                        .header(CALLER, contributor)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":" + amount + "}"))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Successful campaign: contributions reach the goal and the owner withdraws once")
    void testSuccessfulLifecycle() throws Exception {
        printTestHeader("Successful Lifecycle");

        String owner = unique("owner");
        String alice = unique("alice");
        String bob = unique("bob");
        String id = createCampaign(owner, 10);

        JsonNode first = contribute(id, alice, 6);
        JsonNode second = contribute(id, bob, 5);
        printOutput("Second contribution", second);

        assertFalse(first.get("goal_reached").asBoolean());
        assertEquals(6, first.get("credential_ids").size());
        assertTrue(second.get("goal_reached").asBoolean());
        assertEquals(11, second.get("raised_amount").asLong());

        mockMvc.perform(get("/api/campaigns/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CLOSED"))
                .andExpect(jsonPath("$.close_reason").value("GOAL_REACHED"))
                .andExpect(jsonPath("$.successful").value(true))
                .andExpect(jsonPath("$.withdrawable_amount").value(11));

        mockMvc.perform(post("/api/campaigns/{id}/withdraw", id).header(CALLER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recipient").value(owner))
                .andExpect(jsonPath("$.amount").value(11))
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(post("/api/campaigns/{id}/withdraw", id).header(CALLER, owner))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid State"));

        mockMvc.perform(post("/api/campaigns/{id}/contributions", id)
                        .header(CALLER, unique("late"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1}"))
                .andExpect(status().isConflict());

        assertEquals(11, journal.balanceOf(owner));
        printSuccess("Owner paid exactly once");
    }

    @Test
    @DisplayName("Failed campaign: contributor refunds once after the deadline")
    void testRefundAfterDeadline() throws Exception {
        printTestHeader("Refund After Deadline");

        String owner = unique("owner");
        String alice = unique("alice");
        String id = createCampaign(owner, 100);
        contribute(id, alice, 5);

        mockMvc.perform(post("/api/campaigns/{id}/refund", id).header(CALLER, alice))
                .andExpect(status().isConflict());

        clock.advance(Duration.ofDays(8));

        mockMvc.perform(post("/api/campaigns/{id}/refund", id).header(CALLER, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(5));
        mockMvc.perform(post("/api/campaigns/{id}/refund", id).header(CALLER, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(0));

        mockMvc.perform(post("/api/campaigns/{id}/withdraw", id).header(CALLER, owner))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/campaigns/{id}/contributions/{contributor}", id, alice))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(0))
                .andExpect(jsonPath("$.credential_ids.length()").value(5));

        assertEquals(5, journal.balanceOf(alice));
        printSuccess("Refund paid once");
    }

    @Test
    @DisplayName("Owner cancellation reports failed refunds and pays them on retry")
    void testCloseAndRetry() throws Exception {
        printTestHeader("Close And Retry");

        String owner = unique("owner");
        String alice = unique("alice");
        String bob = unique("bob");
        String id = createCampaign(owner, 100);
        contribute(id, alice, 3);
        contribute(id, bob, 5);
        reject(bob);

        mockMvc.perform(post("/api/campaigns/{id}/close", id).header(CALLER, alice))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Permission Denied"));

        mockMvc.perform(post("/api/campaigns/{id}/close", id).header(CALLER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paid_total").value(3))
                .andExpect(jsonPath("$.failed_total").value(5))
                .andExpect(jsonPath("$.fully_paid").value(false))
                .andExpect(jsonPath("$.failures[0].recipient").value(bob))
                .andExpect(jsonPath("$.failures[0].failure_reason").value("recipient unreachable"));

        mockMvc.perform(get("/api/campaigns/{id}", id))
                .andExpect(jsonPath("$.close_reason").value("OWNER_CANCELLED"))
                .andExpect(jsonPath("$.pending_payout_total").value(5));

        journal.acceptPayoutsTo(bob);

        mockMvc.perform(post("/api/campaigns/{id}/payouts/retry", id).header(CALLER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paid_total").value(5))
                .andExpect(jsonPath("$.fully_paid").value(true));

        assertEquals(3, journal.balanceOf(alice));
        assertEquals(5, journal.balanceOf(bob));
        printSuccess("Every contributor refunded exactly once");
    }

    @Test
    @DisplayName("Failed withdrawal maps to 502 and can be retried")
    void testWithdrawTransferFailure() throws Exception {
        printTestHeader("Withdraw Transfer Failure");

        String owner = unique("owner");
        String id = createCampaign(owner, 4);
        contribute(id, unique("alice"), 4);
        reject(owner);

        mockMvc.perform(post("/api/campaigns/{id}/withdraw", id).header(CALLER, owner))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Transfer Failed"))
                .andExpect(jsonPath("$.details.recipient").value(owner))
                .andExpect(jsonPath("$.details.amount").value("4"));

        journal.acceptPayoutsTo(owner);

        mockMvc.perform(post("/api/campaigns/{id}/withdraw", id).header(CALLER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(4));
        printSuccess("Withdrawal succeeded after the transfer recovered");
    }

    @Test
    @DisplayName("Invalid requests are rejected with 400")
    void testValidation() throws Exception {
        printTestHeader("Validation");

        mockMvc.perform(post("/api/campaigns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"owner\":\"\",\"goal_amount\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.owner").exists())
                .andExpect(jsonPath("$.details.goalAmount").exists());

        String id = createCampaign(unique("owner"), 10);

        mockMvc.perform(post("/api/campaigns/{id}/contributions", id)
                        .header(CALLER, unique("alice"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Request"));

        mockMvc.perform(post("/api/campaigns/{id}/contributions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Required Header"));
        printSuccess("Bad input rejected");
    }

    @Test
    @DisplayName("Correlation id is echoed back and recorded on the events it caused")
    void testCorrelationId() throws Exception {
        String id = createCampaign(unique("owner"), 10);

        mockMvc.perform(post("/api/campaigns/{id}/contributions", id)
                        .header(CALLER, unique("alice"))
                        .header("X-Correlation-ID", "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":3}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-Correlation-ID", "trace-123"));

        mockMvc.perform(get("/api/campaigns/{id}", id))
                .andExpect(header().exists("X-Correlation-ID"));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(
                OutboxCampaignEventSink.AGGREGATE_TYPE, UUID.fromString(id));
        OutboxEvent contributed = events.get(events.size() - 1);
        assertEquals("Contributed", contributed.getEventType());
        assertEquals("trace-123", contributed.getCorrelationId());
    }

    @Test
    @DisplayName("Unknown campaign returns 404")
    void testUnknownCampaign() throws Exception {
        mockMvc.perform(get("/api/campaigns/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }
}
