package com.flagship.campaign_escrow.campaign.event;

import com.flagship.campaign_escrow.campaign.CloseReason;
import com.flagship.campaign_escrow.settlement.SettlementReport;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when the owner closes a campaign, with the outcome of the refund batch.
 */
@Value
public class CampaignClosedEvent implements CampaignEvent {
    UUID eventId;
    UUID campaignId;
    String owner;
    CloseReason reason;
    SettlementReport settlementReport;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Closed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CampaignClosedEvent of(UUID campaignId, String owner, CloseReason reason,
                                         SettlementReport report, Instant occurredAt) {
        return new CampaignClosedEvent(UUID.randomUUID(), campaignId, owner, reason, report, occurredAt);
    }
}
