package com.flagship.campaign_escrow.outbox;

import com.flagship.campaign_escrow.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Background publisher that drains the outbox into the campaign events topic.
 *
 * Each poll:
 * 1. Reads the oldest unpublished events, in sequence order
 * 2. Sends each payload keyed by campaign id, so one campaign's events share a partition
 * 3. Marks it published once the broker acknowledges it
 *
 * Once an event of a campaign fails, the remaining events of that campaign wait for the
 * next poll, so consumers never see a campaign's events out of order. Events that keep
 * failing past max retries are dead-lettered: counted and left in the outbox.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.campaigns:campaign-events}")
    private String campaignsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            publishBatch();
        } catch (RuntimeException e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Publishes one batch. Also called directly to drain the outbox outside the schedule.
     *
     * @return number of events published
     */
    public int publishBatch() {
        List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
        if (events.isEmpty()) {
            return 0;
        }
        log.debug("Found {} unpublished events to process", events.size());

        Set<UUID> blockedCampaigns = new HashSet<>();
        int published = 0;
        for (OutboxEvent event : events) {
            if (blockedCampaigns.contains(event.getAggregateId())) {
                continue;
            }
            if (publishEvent(event)) {
                published++;
            } else {
                blockedCampaigns.add(event.getAggregateId());
            }
        }

        if (!blockedCampaigns.isEmpty()) {
            log.warn("Outbox batch left {} campaigns with unpublished events", blockedCampaigns.size());
        }
        return published;
    }

    private boolean publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), moving to dead letter. eventType={}, campaignId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return false;
        }

        try {
            String key = event.getAggregateId().toString();
            SendResult<String, String> result = kafkaTemplate.send(campaignsTopic, key, event.getPayload()).get();

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}, correlationId={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType(),
                    event.getCorrelationId());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            return false;
        }
    }
}
