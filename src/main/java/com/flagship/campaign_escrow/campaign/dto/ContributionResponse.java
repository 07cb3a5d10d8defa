package com.flagship.campaign_escrow.campaign.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.campaign_escrow.campaign.ContributionReceipt;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ContributionResponse {

    @JsonProperty("campaign_id")
    UUID campaignId;

    @JsonProperty("contributor")
    String contributor;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("total_contributed")
    long totalContributed;

    @JsonProperty("credential_ids")
    List<Long> credentialIds;

    @JsonProperty("raised_amount")
    long raisedAmount;

    @JsonProperty("goal_reached")
    boolean goalReached;

    public static ContributionResponse from(ContributionReceipt receipt) {
        return ContributionResponse.builder()
            .campaignId(receipt.getCampaignId())
            .contributor(receipt.getContributor())
            .amount(receipt.getAmount())
            .totalContributed(receipt.getTotalContributed())
            .credentialIds(receipt.getCredentialIds())
            .raisedAmount(receipt.getRaisedAmount())
            .goalReached(receipt.isGoalReached())
            .build();
    }
}
