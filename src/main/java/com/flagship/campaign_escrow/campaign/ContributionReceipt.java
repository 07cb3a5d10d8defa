package com.flagship.campaign_escrow.campaign;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * What an accepted contribution produced.
 */
@Value
public class ContributionReceipt {
    UUID campaignId;
    String contributor;
    long amount;
    long totalContributed;
    List<Long> credentialIds;
    long raisedAmount;
    boolean goalReached;
}
