package com.flagship.campaign_escrow.campaign.exception;

/**
 * Raised when the credential issuer fails. Fatal for the triggering contribution,
 * which is rolled back in full.
 */
public class CredentialIssuanceException extends RuntimeException {

    public CredentialIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
