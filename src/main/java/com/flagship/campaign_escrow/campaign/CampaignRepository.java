package com.flagship.campaign_escrow.campaign;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for campaign rows.
 */
@Repository
public interface CampaignRepository extends JpaRepository<CampaignEntity, UUID> {

    /**
     * Loads a campaign with SELECT ... FOR UPDATE. Every mutating operation starts here,
     * so operations on one campaign are serialized across threads and instances.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CampaignEntity c WHERE c.id = :id")
    Optional<CampaignEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Campaigns still accepting contributions. A campaign past its deadline may still
     * be stored as ACTIVE until an operation observes the deadline.
     */
    long countByStatusAndDeadlineAfter(CampaignStatus status, Instant now);

    /**
     * Funds held in escrow: raised and not yet paid out to the owner or refunded.
     */
    @Query("SELECT COALESCE(SUM(c.withdrawableAmount), 0) FROM CampaignEntity c")
    long sumWithdrawableAmount();
}
