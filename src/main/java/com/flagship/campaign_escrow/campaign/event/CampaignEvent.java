package com.flagship.campaign_escrow.campaign.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for campaign events.
 *
 * Events are facts for external observers; nothing inside the service consumes them.
 * All campaign events share:
 * - Event ID for deduplication
 * - Campaign ID (aggregate ID)
 * - Timestamp of when the event occurred
 */
public interface CampaignEvent {

    /**
     * Unique identifier for this event instance.
     */
    UUID getEventId();

    /**
     * The campaign this event is about.
     */
    UUID getCampaignId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
