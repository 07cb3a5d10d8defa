package com.flagship.campaign_escrow.campaign;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a campaign needs to be stored and later rebuilt with
 * {@link Campaign#restore}.
 *
 * Map iteration order is meaningful: balances follow the contributor index and
 * pending payouts follow the order in which they failed.
 */
@Value
@Builder
public class CampaignState {
    UUID id;
    String owner;
    long goalAmount;
    long minimumContribution;
    long credentialUnit;
    Instant createdAt;
    Instant deadline;
    CampaignStatus status;
    CloseReason closeReason;
    Instant closedAt;
    long raisedAmount;
    long withdrawableAmount;
    @Builder.Default
    Map<String, Long> balances = Map.of();
    @Builder.Default
    Map<String, List<Long>> credentials = Map.of();
    @Builder.Default
    Map<String, Long> pendingPayouts = Map.of();
}
