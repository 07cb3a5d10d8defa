package com.flagship.campaign_escrow.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Nightly retention job for the outbox: published events older than the retention
 * period are deleted. Unpublished events are never touched.
 */
@Component
@ConditionalOnProperty(name = "outbox.cleanup.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxCleanup {

    private final OutboxService outboxService;
    private final Clock clock;

    @Value("${outbox.cleanup.retention-days:7}")
    private int retentionDays;

    @Scheduled(cron = "${outbox.cleanup.cron:0 0 3 * * *}")
    public void purgePublishedEvents() {
        try {
            purge();
        } catch (RuntimeException e) {
            log.error("Outbox cleanup failed", e);
        }
    }

    /**
     * @return number of events deleted
     */
    public int purge() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        return outboxService.purgePublishedBefore(cutoff);
    }
}
