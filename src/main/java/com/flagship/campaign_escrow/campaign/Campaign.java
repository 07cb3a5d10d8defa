package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.campaign.event.CampaignClosedEvent;
import com.flagship.campaign_escrow.campaign.event.ContributedEvent;
import com.flagship.campaign_escrow.campaign.event.PayoutsRetriedEvent;
import com.flagship.campaign_escrow.campaign.event.RefundedEvent;
import com.flagship.campaign_escrow.campaign.event.WithdrawnEvent;
import com.flagship.campaign_escrow.campaign.exception.CampaignStateException;
import com.flagship.campaign_escrow.campaign.exception.ContributionValidationException;
import com.flagship.campaign_escrow.campaign.exception.CredentialIssuanceException;
import com.flagship.campaign_escrow.campaign.exception.PermissionDeniedException;
import com.flagship.campaign_escrow.credential.CredentialIssuer;
import com.flagship.campaign_escrow.ledger.ContributionLedger;
import com.flagship.campaign_escrow.ledger.RecordResult;
import com.flagship.campaign_escrow.settlement.PayoutOutcome;
import com.flagship.campaign_escrow.settlement.SettlementEngine;
import com.flagship.campaign_escrow.settlement.SettlementReport;
import com.flagship.campaign_escrow.settlement.TransferCapability;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One crowdfunding campaign: escrowed contributions toward a goal, settled either to the
 * owner or back to the contributors.
 *
 * Composes the {@link ContributionLedger}, the {@link CampaignStateMachine} and the
 * {@link SettlementEngine} behind four public operations: contribute, close, refund and
 * withdraw.
 *
 * Key principles:
 * - Every public operation runs as one unit under this campaign's lock
 * - Guards are checked before anything is mutated
 * - The deadline is observed lazily at the start of each operation
 * - Pooled funds are tracked in {@code withdrawableAmount}, so that owner-initiated
 *   refunds and the owner's withdrawal can never both pay out the same funds
 *
 * The lock is reentrant. A transfer capability that calls back into the campaign on
 * the same thread gets through, but finds the balances already settled. A credential
 * issuer that calls back is refused outright: nothing may change between recording a
 * contribution and adding it to the raised amount.
 *
 * Instances are rebuilt per operation from their stored {@link CampaignState}; see
 * {@link #restore} and {@link #state()}.
 */
@Slf4j
public class Campaign {

    @Getter
    private final UUID id;
    @Getter
    private final String owner;
    @Getter
    private final Instant createdAt;
    private final long minimumContribution;
    private final long credentialUnit;

    private final ContributionLedger ledger = new ContributionLedger();
    private final CampaignStateMachine stateMachine;
    private final SettlementEngine settlementEngine;
    private final CredentialIssuer credentialIssuer;
    private final TransferCapability transfer;
    private final CampaignEventSink eventSink;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<Long>> credentialsByContributor = new LinkedHashMap<>();
    private final Map<String, Long> pendingPayouts = new LinkedHashMap<>();
    private long withdrawableAmount;
    private boolean withdrawalInProgress;
    private boolean issuingCredentials;

    @Builder
    private Campaign(UUID id, String owner, long goalAmount, Instant createdAt, Instant deadline,
                     long minimumContribution, long credentialUnit,
                     SettlementEngine settlementEngine, CredentialIssuer credentialIssuer,
                     TransferCapability transfer, CampaignEventSink eventSink, Clock clock) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Campaign owner is required");
        }
        if (minimumContribution <= 0) {
            throw new IllegalArgumentException("Minimum contribution must be positive: " + minimumContribution);
        }
        if (credentialUnit <= 0) {
            throw new IllegalArgumentException("Credential unit must be positive: " + credentialUnit);
        }
        this.id = id != null ? id : UUID.randomUUID();
        this.owner = owner;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.minimumContribution = minimumContribution;
        this.credentialUnit = credentialUnit;
        this.stateMachine = new CampaignStateMachine(goalAmount, deadline);
        this.settlementEngine = Objects.requireNonNull(settlementEngine, "settlementEngine");
        this.credentialIssuer = Objects.requireNonNull(credentialIssuer, "credentialIssuer");
        this.transfer = Objects.requireNonNull(transfer, "transfer");
        this.eventSink = eventSink != null ? eventSink : event -> { };
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Rebuilds a stored campaign around the given collaborators.
     */
    public static Campaign restore(CampaignState state, SettlementEngine settlementEngine,
                                   CredentialIssuer credentialIssuer, TransferCapability transfer,
                                   CampaignEventSink eventSink, Clock clock) {
        Campaign campaign = Campaign.builder()
            .id(state.getId())
            .owner(state.getOwner())
            .goalAmount(state.getGoalAmount())
            .createdAt(state.getCreatedAt())
            .deadline(state.getDeadline())
            .minimumContribution(state.getMinimumContribution())
            .credentialUnit(state.getCredentialUnit())
            .settlementEngine(settlementEngine)
            .credentialIssuer(credentialIssuer)
            .transfer(transfer)
            .eventSink(eventSink)
            .clock(clock)
            .build();

        campaign.stateMachine.restore(state.getStatus(), state.getCloseReason(), state.getClosedAt(),
                state.getRaisedAmount());
        campaign.withdrawableAmount = state.getWithdrawableAmount();
        state.getBalances().forEach(campaign.ledger::load);
        state.getCredentials().forEach((holder, ids) ->
                campaign.credentialsByContributor.put(holder, new ArrayList<>(ids)));
        campaign.pendingPayouts.putAll(state.getPendingPayouts());
        return campaign;
    }

    /**
     * Accepts a contribution and mints one credential per whole unit the contributor's
     * cumulative total crosses.
     *
     * Closes the campaign with GOAL_REACHED when the raised amount meets the goal.
     *
     * @throws CampaignStateException if the campaign is not active
     * @throws ContributionValidationException if the amount is below the minimum or overflows
     * @throws CredentialIssuanceException if minting fails; the contribution is rolled back
     */
    public ContributionReceipt contribute(String contributor, long amount) {
        requireIdentity(contributor, "Contributor");
        return mutating(() -> {
            Instant now = observe();
            stateMachine.requireActive(now);
            if (amount < minimumContribution) {
                throw new ContributionValidationException(String.format(
                    "Contribution of %d is below the minimum of %d", amount, minimumContribution));
            }
            requireNoOverflow(stateMachine.getRaisedAmount(), amount);
            requireNoOverflow(withdrawableAmount, amount);

            RecordResult recorded = ledger.record(contributor, amount);
            List<Long> credentialIds;
            issuingCredentials = true;
            try {
                credentialIds = issueCredentials(contributor, recorded.unitsCrossed(credentialUnit));
            } catch (RuntimeException e) {
                ledger.revert(recorded);
                log.error("Credential issuance failed, contribution rolled back: contributor={}, amount={}, error={}",
                        contributor, amount, e.getMessage());
                throw new CredentialIssuanceException(
                    "Credential issuance failed for " + contributor + "; contribution was not recorded", e);
            } finally {
                issuingCredentials = false;
            }

            boolean goalReached = stateMachine.recordRaised(amount, now);
            withdrawableAmount += amount;
            credentialsByContributor.computeIfAbsent(contributor, c -> new ArrayList<>()).addAll(credentialIds);

            if (goalReached) {
                log.info("Campaign goal reached: raised={}, goal={}",
                        stateMachine.getRaisedAmount(), stateMachine.getGoalAmount());
            }
            eventSink.emit(ContributedEvent.of(id, contributor, amount, credentialIds, goalReached, now));

            return new ContributionReceipt(id, contributor, amount, recorded.getNewTotal(),
                    List.copyOf(credentialIds), stateMachine.getRaisedAmount(), goalReached);
        });
    }

    /**
     * Owner cancels an active campaign; every contributor is refunded in one batch.
     *
     * Transfers that fail are reported and parked for {@link #retryFailedPayouts()};
     * they never stop the rest of the batch.
     *
     * @throws PermissionDeniedException if {@code caller} is not the owner
     * @throws CampaignStateException if the campaign is not active
     */
    public SettlementReport close(String caller) {
        return mutating(() -> {
            Instant now = observe();
            requireOwner(caller, "close");
            stateMachine.cancel(now);
            log.info("Campaign cancelled by owner, refunding {} contributors", ledger.contributorCount());

            SettlementReport report = settlementEngine.distributeAll(ledger, transfer);
            withdrawableAmount -= report.getSettledTotal();
            report.getFailures().forEach(failure ->
                    pendingPayouts.merge(failure.getRecipient(), failure.getAmount(), Math::addExact));

            eventSink.emit(CampaignClosedEvent.of(id, owner, stateMachine.getCloseReason(), report, now));
            return report;
        });
    }

    /**
     * Self-service refund of the caller's balance on a closed campaign that missed its goal.
     *
     * A caller with nothing left to refund gets a successful outcome of 0.
     *
     * @throws CampaignStateException if the campaign is still open or reached its goal
     * @throws com.flagship.campaign_escrow.campaign.exception.TransferFailedException if the
     *         transfer fails; the balance stays in place for a retry
     */
    public PayoutOutcome refund(String contributor) {
        requireIdentity(contributor, "Contributor");
        return mutating(() -> {
            Instant now = observe();
            stateMachine.requireClosed(now);
            if (stateMachine.isSuccessful()) {
                throw new CampaignStateException(String.format(
                    "Campaign reached its goal (%d of %d); refunds are not available",
                    stateMachine.getRaisedAmount(), stateMachine.getGoalAmount()));
            }

            PayoutOutcome outcome = settlementEngine.refundOne(ledger, contributor, transfer);
            if (outcome.getAmount() > 0) {
                withdrawableAmount -= outcome.getAmount();
                log.info("Refunded contributor: contributor={}, amount={}", contributor, outcome.getAmount());
                eventSink.emit(RefundedEvent.of(id, contributor, outcome.getAmount(), now));
            }
            return outcome;
        });
    }

    /**
     * Owner collects the pooled funds of a closed, successful campaign.
     *
     * The withdrawable amount is cleared only after the transfer succeeds, so a failed
     * withdrawal can be retried. A second withdrawal, or a reentrant one while the first
     * is still in flight, is rejected.
     *
     * @throws PermissionDeniedException if {@code caller} is not the owner
     * @throws CampaignStateException if the campaign is open, failed, or already withdrawn
     * @throws com.flagship.campaign_escrow.campaign.exception.TransferFailedException if the
     *         transfer fails
     */
    public PayoutOutcome withdraw(String caller) {
        return mutating(() -> {
            Instant now = observe();
            requireOwner(caller, "withdraw");
            stateMachine.requireClosed(now);
            if (stateMachine.isFailed()) {
                throw new CampaignStateException(String.format(
                    "Campaign did not reach its goal (%d of %d); nothing can be withdrawn",
                    stateMachine.getRaisedAmount(), stateMachine.getGoalAmount()));
            }
            if (withdrawalInProgress) {
                throw new CampaignStateException("A withdrawal is already in progress");
            }
            if (withdrawableAmount == 0) {
                throw new CampaignStateException("Nothing left to withdraw");
            }

            long amount = withdrawableAmount;
            PayoutOutcome outcome;
            withdrawalInProgress = true;
            try {
                outcome = settlementEngine.withdrawToOwner(owner, amount, transfer);
            } finally {
                withdrawalInProgress = false;
            }

            withdrawableAmount -= amount;
            ledger.contributors().forEach(ledger::settle);
            log.info("Owner withdrew pooled funds: amount={}", amount);
            eventSink.emit(WithdrawnEvent.of(id, owner, amount, now));
            return outcome;
        });
    }

    /**
     * Attempts again the payouts that failed during {@link #close(String)}.
     * Returns an empty report when nothing is pending.
     *
     * @throws CampaignStateException if the campaign is not closed
     */
    public SettlementReport retryFailedPayouts() {
        return mutating(() -> {
            Instant now = observe();
            stateMachine.requireClosed(now);
            if (pendingPayouts.isEmpty()) {
                return SettlementReport.empty();
            }
            SettlementReport report = settlementEngine.retry(pendingPayouts, transfer);
            eventSink.emit(PayoutsRetriedEvent.of(id, report, now));
            return report;
        });
    }

    // ==================== Read Accessors ====================

    public CampaignSnapshot snapshot() {
        return locked(() -> {
            Instant now = clock.instant();
            return CampaignSnapshot.builder()
                .id(id)
                .owner(owner)
                .goalAmount(stateMachine.getGoalAmount())
                .raisedAmount(stateMachine.getRaisedAmount())
                .withdrawableAmount(withdrawableAmount)
                .pendingPayoutTotal(pendingPayouts.values().stream().mapToLong(Long::longValue).sum())
                .contributorCount(ledger.contributorCount())
                .status(stateMachine.getStatus())
                .closeReason(stateMachine.getCloseReason())
                .active(stateMachine.isActive(now))
                .closed(stateMachine.isClosed(now))
                .successful(stateMachine.isSuccessful())
                .createdAt(createdAt)
                .deadline(stateMachine.getDeadline())
                .closedAt(stateMachine.getClosedAt())
                .observedAt(now)
                .build();
        });
    }

    /**
     * Full stored picture of this campaign, taken under its lock.
     */
    public CampaignState state() {
        return locked(() -> {
            Map<String, List<Long>> credentials = new LinkedHashMap<>();
            credentialsByContributor.forEach((holder, ids) -> credentials.put(holder, List.copyOf(ids)));
            return CampaignState.builder()
                .id(id)
                .owner(owner)
                .goalAmount(stateMachine.getGoalAmount())
                .minimumContribution(minimumContribution)
                .credentialUnit(credentialUnit)
                .createdAt(createdAt)
                .deadline(stateMachine.getDeadline())
                .status(stateMachine.getStatus())
                .closeReason(stateMachine.getCloseReason())
                .closedAt(stateMachine.getClosedAt())
                .raisedAmount(stateMachine.getRaisedAmount())
                .withdrawableAmount(withdrawableAmount)
                .balances(ledger.balances())
                .credentials(Collections.unmodifiableMap(credentials))
                .pendingPayouts(Collections.unmodifiableMap(new LinkedHashMap<>(pendingPayouts)))
                .build();
        });
    }

    public long balanceOf(String contributor) {
        return locked(() -> ledger.balanceOf(contributor));
    }

    public List<Long> credentialsOf(String contributor) {
        return locked(() -> List.copyOf(credentialsByContributor.getOrDefault(contributor, List.of())));
    }

    public List<String> contributors() {
        return locked(() -> List.copyOf(ledger.contributors()));
    }

    public Map<String, Long> pendingPayouts() {
        return locked(() -> Map.copyOf(pendingPayouts));
    }

    /**
     * Sum of all ledger balances, recomputed. For consistency checks only.
     */
    public long totalOutstanding() {
        return locked(ledger::totalOutstanding);
    }

    // ==================== Internals ====================

    private <T> T locked(Supplier<T> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #locked}, but refuses calls made by the credential issuer from inside
     * {@link #contribute}.
     */
    private <T> T mutating(Supplier<T> operation) {
        return locked(() -> {
            if (issuingCredentials) {
                throw new CampaignStateException(
                    "Credentials are being issued for a contribution; the campaign cannot change meanwhile");
            }
            return operation.get();
        });
    }

    private Instant observe() {
        Instant now = clock.instant();
        if (stateMachine.observeDeadline(now)) {
            log.info("Campaign deadline passed: raised={}, goal={}, successful={}",
                    stateMachine.getRaisedAmount(), stateMachine.getGoalAmount(), stateMachine.isSuccessful());
        }
        return now;
    }

    private List<Long> issueCredentials(String contributor, long count) {
        List<Long> ids = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            ids.add(credentialIssuer.issue(contributor));
        }
        return ids;
    }

    private void requireOwner(String caller, String operation) {
        if (!owner.equals(caller)) {
            throw new PermissionDeniedException(String.format(
                "Only the campaign owner may %s; caller %s is not the owner", operation, caller));
        }
    }

    private static void requireIdentity(String identity, String role) {
        if (identity == null || identity.isBlank()) {
            throw new ContributionValidationException(role + " identity is required");
        }
    }

    private static void requireNoOverflow(long total, long amount) {
        try {
            Math.addExact(total, amount);
        } catch (ArithmeticException e) {
            throw new ContributionValidationException(
                String.format("Contribution of %d would overflow the campaign total", amount));
        }
    }
}
