package com.flagship.campaign_escrow.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A campaign event waiting in the outbox to be published to Kafka.
 *
 * Written in the transaction of the campaign operation that produced it. Operations on
 * one campaign hold its row lock, so that campaign's events get increasing
 * {@code sequenceNumber}s in operation order. The correlation id of the request that
 * caused the event, if there was one, is kept for the publisher's logs.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * New unpublished event; the sequence number is assigned by the database on insert.
     */
    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                correlationId, createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
