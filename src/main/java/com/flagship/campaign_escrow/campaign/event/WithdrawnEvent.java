package com.flagship.campaign_escrow.campaign.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class WithdrawnEvent implements CampaignEvent {
    UUID eventId;
    UUID campaignId;
    String owner;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Withdrawn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WithdrawnEvent of(UUID campaignId, String owner, long amount, Instant occurredAt) {
        return new WithdrawnEvent(UUID.randomUUID(), campaignId, owner, amount, occurredAt);
    }
}
