package com.flagship.campaign_escrow.campaign.exception;

/**
 * Raised when an owner-only operation is invoked by any other identity.
 * Always thrown before the campaign is mutated.
 */
public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
