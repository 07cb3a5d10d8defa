package com.flagship.campaign_escrow.campaign;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContributionRepository extends JpaRepository<ContributionEntity, UUID> {

    /**
     * Contributors of a campaign in index order.
     */
    List<ContributionEntity> findByCampaignIdOrderByJoinOrderAsc(UUID campaignId);
}
