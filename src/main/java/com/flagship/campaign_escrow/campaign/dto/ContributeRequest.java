package com.flagship.campaign_escrow.campaign.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Request DTO for a contribution. The contributor is the caller identity header.
 * The configured minimum is enforced by the campaign, not here.
 */
@Value
public class ContributeRequest {

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    @JsonProperty("amount")
    Long amount;
}
