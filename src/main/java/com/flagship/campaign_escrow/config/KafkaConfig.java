package com.flagship.campaign_escrow.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for campaign events. Only declared while the outbox publisher runs,
 * so the service starts without a broker when publishing is disabled.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.campaigns:campaign-events}")
    private String campaignsTopic;

    /**
     * Creates the campaign events topic if it doesn't exist.
     * Uses 3 partitions; events are keyed by campaign id.
     */
    @Bean
    public NewTopic campaignsTopic() {
        return TopicBuilder.name(campaignsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
