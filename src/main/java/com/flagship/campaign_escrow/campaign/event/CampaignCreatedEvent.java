package com.flagship.campaign_escrow.campaign.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published by the registry when a campaign is created.
 */
@Value
public class CampaignCreatedEvent implements CampaignEvent {
    UUID eventId;
    UUID campaignId;
    String owner;
    long goalAmount;
    Instant deadline;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CampaignCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CampaignCreatedEvent of(UUID campaignId, String owner, long goalAmount,
                                          Instant deadline, Instant occurredAt) {
        return new CampaignCreatedEvent(UUID.randomUUID(), campaignId, owner, goalAmount, deadline, occurredAt);
    }
}
