package com.flagship.campaign_escrow.observability;

import com.flagship.campaign_escrow.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters.
 *
 * Gauges are recomputed by {@link MetricsScheduler} with aggregate queries on the outbox
 * table: backlog size, age of the oldest waiting event, events past max retries, and the
 * number of campaigns with at least one event waiting.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository repository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlog = new AtomicLong();
    private final AtomicLong oldestAgeSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong waitingCampaigns = new AtomicLong();

    @PostConstruct
    public void init() {
        gauge("outbox.backlog.size", backlog, "Unpublished campaign events");
        gauge("outbox.backlog.age.seconds", oldestAgeSeconds, "Seconds the oldest unpublished event has waited");
        gauge("outbox.events.failed", deadLettered, "Unpublished events past max retries");
        gauge("outbox.campaigns.waiting", waitingCampaigns, "Campaigns with unpublished events");
    }

    private void gauge(String name, AtomicLong holder, String description) {
        Gauge.builder(name, holder, AtomicLong::get)
                .description(description)
                .register(meterRegistry);
    }

    public void refreshMetrics() {
        Instant now = clock.instant();
        long size = repository.countUnpublished();
        long age = repository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, now).getSeconds()))
                .orElse(0L);
        long failed = repository.countDeadLetterEvents(maxRetries);
        long campaigns = repository.countAggregatesWithUnpublished();

        backlog.set(size);
        oldestAgeSeconds.set(age);
        deadLettered.set(failed);
        waitingCampaigns.set(campaigns);

        log.debug("Outbox gauges refreshed: backlog={}, oldestAge={}s, failed={}, campaigns={}",
                size, age, failed, campaigns);
    }

    public void recordEventPublished(String eventType) {
        publishCounter(eventType, "success");
    }

    public void recordEventPublishFailed(String eventType) {
        publishCounter(eventType, "failure");
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }

    private void publishCounter(String eventType, String status) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", status).increment();
    }
}
