package com.flagship.campaign_escrow.campaign;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PendingPayoutRepository extends JpaRepository<PendingPayoutEntity, UUID> {

    List<PendingPayoutEntity> findByCampaignId(UUID campaignId);

    /**
     * Total parked across all campaigns.
     */
    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM PendingPayoutEntity p")
    long sumAmount();

    @Query("SELECT COUNT(DISTINCT p.campaignId) FROM PendingPayoutEntity p")
    long countCampaignsWithPendingPayouts();
}
