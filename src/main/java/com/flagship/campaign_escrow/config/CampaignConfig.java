package com.flagship.campaign_escrow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring shared by the campaign components.
 */
@Configuration
@EnableConfigurationProperties(CampaignProperties.class)
public class CampaignConfig {

    /**
     * Source of "now" for deadlines and guards; replaced by a fixed or mutable clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
