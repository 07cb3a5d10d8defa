package com.flagship.campaign_escrow.campaign.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * A contributor's outstanding balance and the credentials minted to them by one campaign.
 */
@Value
public class ContributorResponse {

    @JsonProperty("contributor")
    String contributor;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("credential_ids")
    List<Long> credentialIds;
}
