package com.flagship.campaign_escrow.campaign;

/**
 * Lifecycle status of a campaign.
 *
 * ACTIVE → CLOSED is the only transition. CLOSED is terminal.
 */
public enum CampaignStatus {
    /**
     * Accepting contributions. Initial state.
     */
    ACTIVE,

    /**
     * No longer accepting contributions; funds are being or have been settled.
     */
    CLOSED
}
