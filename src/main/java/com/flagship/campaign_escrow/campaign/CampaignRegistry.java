package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.campaign.event.CampaignCreatedEvent;
import com.flagship.campaign_escrow.campaign.exception.CampaignNotFoundException;
import com.flagship.campaign_escrow.config.CampaignProperties;
import com.flagship.campaign_escrow.credential.CredentialIssuer;
import com.flagship.campaign_escrow.settlement.SettlementEngine;
import com.flagship.campaign_escrow.settlement.TransferCapability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Creates campaigns and rebuilds stored ones around the shared collaborators.
 *
 * Holds no campaign state of its own; every call reads the current state from
 * {@link CampaignPersistenceService}. Mutations go through {@link #mutate}, which holds
 * the campaign's row lock for the whole operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignRegistry {

    private final CampaignProperties properties;
    private final CampaignPersistenceService persistence;
    private final SettlementEngine settlementEngine;
    private final CredentialIssuer credentialIssuer;
    private final TransferCapability transferCapability;
    private final CampaignEventSink eventSink;
    private final Clock clock;

    /**
     * Creates an ACTIVE campaign whose deadline is now plus the configured duration.
     *
     * @throws IllegalArgumentException if the owner is missing or the goal is not positive
     */
    @Transactional
    public Campaign createCampaign(String owner, long goalAmount) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Campaign owner is required");
        }
        if (goalAmount <= 0) {
            throw new IllegalArgumentException("Goal amount must be positive: " + goalAmount);
        }

        Instant now = clock.instant();
        Instant deadline = now.plus(properties.getDuration());
        Campaign campaign = Campaign.builder()
            .id(UUID.randomUUID())
            .owner(owner)
            .goalAmount(goalAmount)
            .createdAt(now)
            .deadline(deadline)
            .minimumContribution(properties.getMinimumContribution())
            .credentialUnit(properties.getCredentialUnit())
            .settlementEngine(settlementEngine)
            .credentialIssuer(credentialIssuer)
            .transfer(transferCapability)
            .eventSink(eventSink)
            .clock(clock)
            .build();

        persistence.insert(campaign.state());
        eventSink.emit(CampaignCreatedEvent.of(campaign.getId(), owner, goalAmount, deadline, now));

        log.info("Campaign created: campaignId={}, owner={}, goal={}, deadline={}",
                campaign.getId(), owner, goalAmount, deadline);
        return campaign;
    }

    /**
     * Current stored state of the campaign, for reading. Changes made to the returned
     * instance are not saved.
     */
    @Transactional(readOnly = true)
    public Optional<Campaign> findById(UUID campaignId) {
        return persistence.load(campaignId).map(this::rebuild);
    }

    /**
     * @throws CampaignNotFoundException if no campaign has this id
     */
    @Transactional(readOnly = true)
    public Campaign require(UUID campaignId) {
        return findById(campaignId).orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    /**
     * Runs {@code operation} against the locked campaign and saves the result.
     *
     * Nothing is saved when the operation throws; the caller's transaction rolls back
     * the events and journal entries it wrote.
     *
     * @throws CampaignNotFoundException if no campaign has this id
     */
    @Transactional
    public <T> T mutate(UUID campaignId, Function<Campaign, T> operation) {
        Campaign campaign = persistence.loadForUpdate(campaignId)
            .map(this::rebuild)
            .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        T result = operation.apply(campaign);
        persistence.update(campaign.state());
        return result;
    }

    private Campaign rebuild(CampaignState state) {
        return Campaign.restore(state, settlementEngine, credentialIssuer, transferCapability, eventSink, clock);
    }
}
