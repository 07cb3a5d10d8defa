package com.flagship.campaign_escrow.campaign.exception;

/**
 * Raised when a contribution is rejected on its own merits (below the configured minimum,
 * or large enough to overflow the running totals).
 */
public class ContributionValidationException extends IllegalArgumentException {

    public ContributionValidationException(String message) {
        super(message);
    }
}
