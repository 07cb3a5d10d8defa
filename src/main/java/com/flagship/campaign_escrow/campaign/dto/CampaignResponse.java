package com.flagship.campaign_escrow.campaign.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.campaign_escrow.campaign.CampaignSnapshot;
import com.flagship.campaign_escrow.campaign.CampaignStatus;
import com.flagship.campaign_escrow.campaign.CloseReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for campaign state.
 */
@Value
@Builder
public class CampaignResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("goal_amount")
    long goalAmount;

    @JsonProperty("raised_amount")
    long raisedAmount;

    @JsonProperty("withdrawable_amount")
    long withdrawableAmount;

    @JsonProperty("pending_payout_total")
    long pendingPayoutTotal;

    @JsonProperty("contributor_count")
    int contributorCount;

    @JsonProperty("status")
    CampaignStatus status;

    @JsonProperty("close_reason")
    CloseReason closeReason;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("successful")
    boolean successful;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("deadline")
    Instant deadline;

    @JsonProperty("closed_at")
    Instant closedAt;

    public static CampaignResponse from(CampaignSnapshot snapshot) {
        return CampaignResponse.builder()
            .id(snapshot.getId())
            .owner(snapshot.getOwner())
            .goalAmount(snapshot.getGoalAmount())
            .raisedAmount(snapshot.getRaisedAmount())
            .withdrawableAmount(snapshot.getWithdrawableAmount())
            .pendingPayoutTotal(snapshot.getPendingPayoutTotal())
            .contributorCount(snapshot.getContributorCount())
            .status(snapshot.getStatus())
            .closeReason(snapshot.getCloseReason())
            .active(snapshot.isActive())
            .successful(snapshot.isSuccessful())
            .createdAt(snapshot.getCreatedAt())
            .deadline(snapshot.getDeadline())
            .closedAt(snapshot.getClosedAt())
            .build();
    }
}
