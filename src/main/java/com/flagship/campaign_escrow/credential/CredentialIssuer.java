package com.flagship.campaign_escrow.credential;

/**
 * External capability that mints one non-fungible credential per call.
 *
 * Implementations must hand out globally unique, strictly increasing ids.
 * From the campaign's point of view issuance is infallible; any runtime
 * exception aborts the contribution that triggered it.
 */
@FunctionalInterface
public interface CredentialIssuer {

    /**
     * Mints one credential to {@code holder}.
     *
     * @return the id of the new credential
     */
    long issue(String holder);
}
