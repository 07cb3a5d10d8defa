package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.campaign.event.CampaignEvent;
import com.flagship.campaign_escrow.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes campaign events into the outbox, from where they are published to Kafka.
 */
@Component
@RequiredArgsConstructor
public class OutboxCampaignEventSink implements CampaignEventSink {

    public static final String AGGREGATE_TYPE = "Campaign";

    private final OutboxService outboxService;

    @Override
    public void emit(CampaignEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getCampaignId(), event.getEventType(), event);
    }
}
