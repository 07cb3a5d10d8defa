package com.flagship.campaign_escrow.outbox;

import com.flagship.campaign_escrow.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the outbox publisher loop.
 *
 * These tests verify that:
 * - Events are sent to the campaigns topic keyed by campaign id
 * - Failed sends are marked failed and stay in the outbox
 * - A failed event holds back the later events of the same campaign only
 * - Events past max retries are no longer sent
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "campaign-events";
    private static final Instant CREATED_AT = Instant.parse("2026-02-01T00:00:00Z");

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    @Mock
    private OutboxService outboxService;

    private OutboxPublisher publisher;
    private long nextSequence;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "campaignsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        nextSequence = 1;
    }

    private OutboxEvent pending(UUID campaignId, String eventType, String payload, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Campaign", campaignId, eventType, payload, "corr-1",
                CREATED_AT, null, retryCount, retryCount > 0 ? "broker down" : null, nextSequence++);
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(String key, String value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, key, value), metadata));
    }

    @Test
    @DisplayName("Publisher sends events keyed by campaign id and marks them published")
    void testPublishesAndMarks() {
        printTestHeader("Publish And Mark");

        UUID campaignId = UUID.randomUUID();
        OutboxEvent event = pending(campaignId, "Contributed", "{\"amount\":5}", 0);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        when(kafkaTemplate.send(eq(TOPIC), eq(campaignId.toString()), payload.capture()))
                .thenAnswer(invocation -> acknowledged(invocation.getArgument(1), invocation.getArgument(2)));

        int published = publisher.publishBatch();

        assertEquals(1, published);
        assertEquals("{\"amount\":5}", payload.getValue());
        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("Contributed");
        printSuccess("Event published and marked");
    }

    @Test
    @DisplayName("Failed send keeps the event and holds back the rest of that campaign only")
    void testFailureBlocksOnlyItsCampaign() {
        printTestHeader("Per-Campaign Ordering");

        UUID failing = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        OutboxEvent first = pending(failing, "Contributed", "{\"amount\":1}", 0);
        OutboxEvent second = pending(failing, "Refunded", "{\"amount\":1}", 0);
        OutboxEvent other = pending(healthy, "Contributed", "{\"amount\":2}", 0);
        when(outboxService.findUnpublishedEvents(anyInt())).thenReturn(List.of(first, second, other));

        when(kafkaTemplate.send(eq(TOPIC), anyString(), anyString())).thenAnswer(invocation -> {
            String key = invocation.getArgument(1);
            if (key.equals(failing.toString())) {
                return CompletableFuture.failedFuture(new IllegalStateException("broker down"));
            }
            return acknowledged(key, invocation.getArgument(2));
        });

        int published = publisher.publishBatch();

        assertEquals(1, published);
        verify(kafkaTemplate, times(2)).send(anyString(), anyString(), anyString());
        verify(outboxService).markFailed(eq(first.getId()), anyString());
        verify(outboxService, never()).markFailed(eq(second.getId()), anyString());
        verify(outboxService, never()).markPublished(second.getId());
        verify(outboxService).markPublished(other.getId());
        verify(outboxMetrics).recordEventPublishFailed("Contributed");
        printSuccess("Healthy campaign published, failing campaign kept in order");
    }

    @Test
    @DisplayName("Event past max retries is dead-lettered instead of sent")
    void testDeadLetter() {
        printTestHeader("Dead Letter");

        OutboxEvent event = pending(UUID.randomUUID(), "Withdrawn", "{\"amount\":5}", 3);
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of(event));

        assertEquals(0, publisher.publishBatch());

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        verify(outboxMetrics).recordEventDeadLettered("Withdrawn");
        verify(outboxService, never()).markPublished(event.getId());
        printSuccess("Dead-lettered event left in place");
    }

    @Test
    @DisplayName("Empty outbox sends nothing")
    void testEmptyOutbox() {
        when(outboxService.findUnpublishedEvents(100)).thenReturn(List.of());

        assertEquals(0, publisher.publishBatch());
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
