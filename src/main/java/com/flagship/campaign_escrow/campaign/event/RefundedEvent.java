package com.flagship.campaign_escrow.campaign.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RefundedEvent implements CampaignEvent {
    UUID eventId;
    UUID campaignId;
    String contributor;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Refunded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RefundedEvent of(UUID campaignId, String contributor, long amount, Instant occurredAt) {
        return new RefundedEvent(UUID.randomUUID(), campaignId, contributor, amount, occurredAt);
    }
}
