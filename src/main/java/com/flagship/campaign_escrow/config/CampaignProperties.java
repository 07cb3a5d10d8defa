package com.flagship.campaign_escrow.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Terms applied to every campaign created by this service.
 *
 * <pre>
 * campaign:
 *   minimum-contribution: 1   # smallest accepted contribution
 *   credential-unit: 1        # one credential per this many units contributed
 *   duration: 30d             # deadline = creation time + duration
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    @Min(1)
    private long minimumContribution = 1;

    @Min(1)
    private long credentialUnit = 1;

    @NotNull
    private Duration duration = Duration.ofDays(30);
}
