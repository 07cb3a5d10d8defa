package com.flagship.campaign_escrow.settlement;

import com.flagship.campaign_escrow.campaign.exception.TransferFailedException;
import com.flagship.campaign_escrow.ledger.ContributionLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves value out of escrow exactly once per contributor per terminal event.
 *
 * Key principles:
 * - A balance is zeroed in the ledger before its transfer is attempted, so a transfer
 *   that calls back into the campaign finds nothing left to settle
 * - In a batch, one failed recipient never blocks or undoes payouts to the others;
 *   failures are collected into the {@link SettlementReport}
 * - A single-recipient payout either succeeds or leaves state as it was and throws
 *   {@link TransferFailedException}
 *
 * The engine holds no state of its own. Callers run it under the campaign lock.
 */
@Component
@Slf4j
public class SettlementEngine {

    /**
     * Settles and pays every contributor with a non-zero balance, in index order.
     *
     * @return one outcome per contributor that had something to pay out
     */
    public SettlementReport distributeAll(ContributionLedger ledger, TransferCapability transfer) {
        List<PayoutOutcome> outcomes = new ArrayList<>();

        // Snapshot the index; a reentrant contribution must not extend this batch.
        for (String contributor : List.copyOf(ledger.contributors())) {
            long amount = ledger.settle(contributor);
            if (amount == 0) {
                continue;
            }
            outcomes.add(attempt(contributor, amount, transfer));
        }

        SettlementReport report = new SettlementReport(outcomes);
        log.info("Batch settlement finished: recipients={}, paidTotal={}, failedCount={}, failedTotal={}",
                outcomes.size(), report.getPaidTotal(), report.getFailures().size(), report.getFailedTotal());
        return report;
    }

    /**
     * Self-service refund for one contributor.
     *
     * A contributor with nothing left gets a successful outcome of 0 and no transfer.
     * On transfer failure the balance is restored before the exception is thrown.
     *
     * @throws TransferFailedException if the transfer fails
     */
    public PayoutOutcome refundOne(ContributionLedger ledger, String contributor, TransferCapability transfer) {
        long amount = ledger.settle(contributor);
        if (amount == 0) {
            log.debug("Nothing to refund: contributor={}", contributor);
            return PayoutOutcome.nothingOwed(contributor);
        }

        PayoutOutcome outcome = attempt(contributor, amount, transfer);
        if (!outcome.isSuccess()) {
            ledger.restore(contributor, amount);
            throw new TransferFailedException(contributor, amount, outcome.getFailureReason());
        }
        return outcome;
    }

    /**
     * Pays the pooled amount to the owner. Nothing is deducted here; the caller
     * decrements its withdrawable amount only once this returns.
     *
     * @throws TransferFailedException if the transfer fails
     */
    public PayoutOutcome withdrawToOwner(String owner, long amount, TransferCapability transfer) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Withdrawal amount must be positive: " + amount);
        }
        PayoutOutcome outcome = attempt(owner, amount, transfer);
        if (!outcome.isSuccess()) {
            throw new TransferFailedException(owner, amount, outcome.getFailureReason());
        }
        return outcome;
    }

    /**
     * Re-attempts payouts that failed in earlier batches.
     *
     * Each entry leaves {@code pending} before its transfer and goes back in only if the
     * transfer fails again, so a reentrant retry cannot pay the same entry twice.
     */
    public SettlementReport retry(Map<String, Long> pending, TransferCapability transfer) {
        List<PayoutOutcome> outcomes = new ArrayList<>();

        for (Map.Entry<String, Long> entry : new LinkedHashMap<>(pending).entrySet()) {
            String recipient = entry.getKey();
            Long amount = pending.remove(recipient);
            if (amount == null || amount == 0) {
                continue;
            }
            PayoutOutcome outcome = attempt(recipient, amount, transfer);
            if (!outcome.isSuccess()) {
                pending.merge(recipient, amount, Math::addExact);
            }
            outcomes.add(outcome);
        }

        SettlementReport report = new SettlementReport(outcomes);
        log.info("Payout retry finished: attempted={}, paidTotal={}, stillFailing={}",
                outcomes.size(), report.getPaidTotal(), report.getFailures().size());
        return report;
    }

    private PayoutOutcome attempt(String recipient, long amount, TransferCapability transfer) {
        try {
            TransferResult result = transfer.transfer(recipient, amount);
            if (result != null && result.isSuccess()) {
                log.debug("Transfer succeeded: recipient={}, amount={}", recipient, amount);
                return PayoutOutcome.paid(recipient, amount);
            }
            String reason = result == null ? "transfer returned no result" : result.getFailureReason();
            log.warn("Transfer rejected: recipient={}, amount={}, reason={}", recipient, amount, reason);
            return PayoutOutcome.failed(recipient, amount, reason);
        } catch (RuntimeException e) {
            log.error("Transfer threw: recipient={}, amount={}, error={}", recipient, amount, e.getMessage(), e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return PayoutOutcome.failed(recipient, amount, reason);
        }
    }
}
