package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.campaign.event.CampaignEvent;

/**
 * Where a campaign emits its events. Called inside the campaign's critical section,
 * so events of one campaign are emitted in the order their operations ran.
 */
@FunctionalInterface
public interface CampaignEventSink {

    void emit(CampaignEvent event);
}
