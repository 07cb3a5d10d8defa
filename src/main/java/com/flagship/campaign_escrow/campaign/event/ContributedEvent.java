package com.flagship.campaign_escrow.campaign.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event published for every accepted contribution.
 *
 * Carries the ids of the credentials minted by this contribution (possibly none)
 * and whether it was the one that reached the goal.
 */
@Value
public class ContributedEvent implements CampaignEvent {
    UUID eventId;
    UUID campaignId;
    String contributor;
    long amount;
    List<Long> credentialIds;
    boolean goalReached;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Contributed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContributedEvent of(UUID campaignId, String contributor, long amount,
                                      List<Long> credentialIds, boolean goalReached, Instant occurredAt) {
        return new ContributedEvent(UUID.randomUUID(), campaignId, contributor, amount,
                List.copyOf(credentialIds), goalReached, occurredAt);
    }
}
