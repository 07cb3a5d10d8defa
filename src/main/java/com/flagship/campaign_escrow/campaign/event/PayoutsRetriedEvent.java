package com.flagship.campaign_escrow.campaign.event;

import com.flagship.campaign_escrow.settlement.SettlementReport;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when payouts that failed in an earlier batch are attempted again.
 */
@Value
public class PayoutsRetriedEvent implements CampaignEvent {
    UUID eventId;
    UUID campaignId;
    SettlementReport settlementReport;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutsRetried";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PayoutsRetriedEvent of(UUID campaignId, SettlementReport report, Instant occurredAt) {
        return new PayoutsRetriedEvent(UUID.randomUUID(), campaignId, report, occurredAt);
    }
}
