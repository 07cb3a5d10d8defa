package com.flagship.campaign_escrow.credential;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CredentialRepository extends JpaRepository<CredentialEntity, Long> {

    /**
     * Draws the next id from the global credential sequence. Not rolled back with the
     * surrounding transaction, so ids of aborted contributions are skipped.
     */
    @Query(value = "SELECT nextval('credential_id_seq')", nativeQuery = true)
    long nextCredentialId();

    List<CredentialEntity> findByCampaignIdOrderByCredentialIdAsc(UUID campaignId);
}
