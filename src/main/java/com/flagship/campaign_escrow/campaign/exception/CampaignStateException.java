package com.flagship.campaign_escrow.campaign.exception;

/**
 * Raised when an operation is attempted in a campaign state that does not permit it,
 * e.g. contributing after close or withdrawing from a campaign that missed its goal.
 */
public class CampaignStateException extends IllegalStateException {

    public CampaignStateException(String message) {
        super(message);
    }
}
