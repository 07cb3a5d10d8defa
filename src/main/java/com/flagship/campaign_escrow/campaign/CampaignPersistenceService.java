package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.credential.CredentialEntity;
import com.flagship.campaign_escrow.credential.CredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stores and loads {@link CampaignState} across the campaign, contribution, credential
 * and pending payout tables.
 *
 * Child rows are updated in place by their natural key (contributor, recipient,
 * credential id); a row is never deleted and re-inserted within one update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignPersistenceService {

    private final CampaignRepository campaignRepository;
    private final ContributionRepository contributionRepository;
    private final PendingPayoutRepository pendingPayoutRepository;
    private final CredentialRepository credentialRepository;

    /**
     * Inserts a new campaign. Child rows are written by later updates.
     */
    @Transactional
    public void insert(CampaignState state) {
        campaignRepository.save(CampaignEntity.fromState(state));
        log.debug("Inserted campaign {}", state.getId());
    }

    @Transactional(readOnly = true)
    public Optional<CampaignState> load(UUID campaignId) {
        return campaignRepository.findById(campaignId).map(this::assemble);
    }

    /**
     * Loads a campaign and holds its row lock until the surrounding transaction ends.
     */
    @Transactional
    public Optional<CampaignState> loadForUpdate(UUID campaignId) {
        return campaignRepository.findByIdForUpdate(campaignId).map(this::assemble);
    }

    /**
     * Writes back everything an operation changed.
     *
     * @throws IllegalArgumentException if the campaign does not exist
     * @throws IllegalStateException if a stored contributor is missing from the state
     */
    @Transactional
    public void update(CampaignState state) {
        UUID campaignId = state.getId();
        CampaignEntity campaign = campaignRepository.findById(campaignId)
            .orElseThrow(() -> new IllegalArgumentException("Campaign not found: " + campaignId));
        campaign.updateFromState(state);
        campaignRepository.save(campaign);

        updateContributions(campaignId, state.getBalances());
        insertNewCredentials(campaignId, state.getCredentials());
        updatePendingPayouts(campaignId, state.getPendingPayouts());

        log.debug("Updated campaign {}: status={}, raised={}, withdrawable={}",
                campaignId, state.getStatus(), state.getRaisedAmount(), state.getWithdrawableAmount());
    }

    private void updateContributions(UUID campaignId, Map<String, Long> balances) {
        Map<String, ContributionEntity> stored = contributionRepository.findByCampaignIdOrderByJoinOrderAsc(campaignId)
            .stream()
            .collect(Collectors.toMap(ContributionEntity::getContributor, Function.identity()));
        if (!balances.keySet().containsAll(stored.keySet())) {
            throw new IllegalStateException("Contributor index of campaign " + campaignId + " lost an entry");
        }

        List<ContributionEntity> changed = new ArrayList<>();
        int joinOrder = 0;
        for (Map.Entry<String, Long> entry : balances.entrySet()) {
            ContributionEntity existing = stored.get(entry.getKey());
            if (existing == null) {
                changed.add(ContributionEntity.create(campaignId, entry.getKey(), joinOrder, entry.getValue()));
            } else if (existing.getBalance() != entry.getValue()) {
                existing.updateBalance(entry.getValue());
                changed.add(existing);
            }
            joinOrder++;
        }
        contributionRepository.saveAll(changed);
    }

    private void insertNewCredentials(UUID campaignId, Map<String, List<Long>> credentials) {
        Set<Long> stored = credentialRepository.findByCampaignIdOrderByCredentialIdAsc(campaignId).stream()
            .map(CredentialEntity::getCredentialId)
            .collect(Collectors.toSet());

        List<CredentialEntity> minted = new ArrayList<>();
        credentials.forEach((holder, ids) -> ids.stream()
            .filter(id -> !stored.contains(id))
            .forEach(id -> minted.add(new CredentialEntity(id, campaignId, holder))));
        credentialRepository.saveAll(minted);
    }

    private void updatePendingPayouts(UUID campaignId, Map<String, Long> pending) {
        Map<String, PendingPayoutEntity> stored = new HashMap<>();
        pendingPayoutRepository.findByCampaignId(campaignId)
            .forEach(payout -> stored.put(payout.getRecipient(), payout));

        List<PendingPayoutEntity> changed = new ArrayList<>();
        pending.forEach((recipient, amount) -> {
            PendingPayoutEntity existing = stored.remove(recipient);
            if (existing == null) {
                changed.add(PendingPayoutEntity.create(campaignId, recipient, amount));
            } else if (existing.getAmount() != amount) {
                existing.updateAmount(amount);
                changed.add(existing);
            }
        });
        pendingPayoutRepository.saveAll(changed);
        // Whatever is left was paid out by a retry
        pendingPayoutRepository.deleteAll(stored.values());
    }

    private CampaignState assemble(CampaignEntity campaign) {
        UUID campaignId = campaign.getId();

        Map<String, Long> balances = new LinkedHashMap<>();
        Map<String, Integer> joinOrder = new HashMap<>();
        contributionRepository.findByCampaignIdOrderByJoinOrderAsc(campaignId).forEach(contribution -> {
            balances.put(contribution.getContributor(), contribution.getBalance());
            joinOrder.put(contribution.getContributor(), contribution.getJoinOrder());
        });

        Map<String, List<Long>> credentials = new LinkedHashMap<>();
        credentialRepository.findByCampaignIdOrderByCredentialIdAsc(campaignId).forEach(credential ->
            credentials.computeIfAbsent(credential.getHolder(), h -> new ArrayList<>()).add(credential.getCredentialId()));

        Map<String, Long> pending = new LinkedHashMap<>();
        pendingPayoutRepository.findByCampaignId(campaignId).stream()
            .sorted(Comparator.comparing((PendingPayoutEntity p) -> joinOrder.getOrDefault(p.getRecipient(), Integer.MAX_VALUE))
                .thenComparing(PendingPayoutEntity::getRecipient))
            .forEach(payout -> pending.put(payout.getRecipient(), payout.getAmount()));

        return campaign.toStateBuilder()
            .balances(balances)
            .credentials(credentials)
            .pendingPayouts(pending)
            .build();
    }
}
