package com.flagship.campaign_escrow.campaign.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for creating a campaign.
 */
@Value
public class CreateCampaignRequest {

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner")
    String owner;

    @NotNull(message = "Goal amount is required")
    @Min(value = 1, message = "Goal amount must be greater than 0")
    @JsonProperty("goal_amount")
    Long goalAmount;
}
