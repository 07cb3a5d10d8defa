package com.flagship.campaign_escrow.observability;

import com.flagship.campaign_escrow.campaign.PendingPayoutRepository;
import com.flagship.campaign_escrow.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the campaign escrow service.
 */
public class HealthIndicators {

    /**
     * Health indicator for the outbox backlog.
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            long backlogSize = outboxRepository.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Reports campaigns holding payouts that failed and were parked for retry.
     * Parked payouts never make the service unhealthy; they need an operator to retry them.
     */
    @Component("payoutsHealth")
    public static class PendingPayoutsHealthIndicator implements HealthIndicator {

        private final PendingPayoutRepository pendingPayoutRepository;

        public PendingPayoutsHealthIndicator(PendingPayoutRepository pendingPayoutRepository) {
            this.pendingPayoutRepository = pendingPayoutRepository;
        }

        @Override
        public Health health() {
            long campaignsWithPending = pendingPayoutRepository.countCampaignsWithPendingPayouts();
            long pendingTotal = pendingPayoutRepository.sumAmount();

            Health.Builder builder = campaignsWithPending == 0 ? Health.up() : Health.status("WARNING");
            return builder
                    .withDetail("campaignsWithPendingPayouts", campaignsWithPending)
                    .withDetail("pendingPayoutTotal", pendingTotal)
                    .build();
        }
    }

    /**
     * Health indicator for Kafka connectivity. Only present while the outbox publisher runs.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
