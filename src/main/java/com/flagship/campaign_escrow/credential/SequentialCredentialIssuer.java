package com.flagship.campaign_escrow.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Credential issuer backed by the database sequence {@code credential_id_seq}.
 * Shared by all campaigns and all instances, so ids are unique across the service.
 *
 * Only the id is drawn here. Holdings are recorded with the campaign when the
 * contribution commits, so an aborted contribution leaves a gap in the ids and no
 * credential behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SequentialCredentialIssuer implements CredentialIssuer {

    private final CredentialRepository repository;

    @Override
    @Transactional
    public long issue(String holder) {
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Credential holder is required");
        }
        long id = repository.nextCredentialId();
        log.debug("Issued credential: credentialId={}, holder={}", id, holder);
        return id;
    }
}
