package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.observability.CampaignMetrics;
import com.flagship.campaign_escrow.observability.CorrelationContext;
import com.flagship.campaign_escrow.settlement.PayoutOutcome;
import com.flagship.campaign_escrow.settlement.SettlementReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Application service in front of the campaign registry.
 *
 * Puts campaign id and caller into the MDC, times the call and records its metrics.
 * Each operation runs in one transaction opened by {@link CampaignRegistry#mutate},
 * under the campaign's row lock; the campaign itself enforces the guards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    private final CampaignRegistry registry;
    private final CampaignMetrics metrics;

    public Campaign createCampaign(String owner, long goalAmount) {
        Campaign campaign = registry.createCampaign(owner, goalAmount);
        metrics.incrementCampaignsCreated();
        return campaign;
    }

    public CampaignSnapshot getCampaign(UUID campaignId) {
        return registry.require(campaignId).snapshot();
    }

    public ContributionReceipt contribute(UUID campaignId, String contributor, long amount) {
        return run("contribute", campaignId, contributor, () -> {
            log.info("Attempting contribution: amount={}", amount);
            ContributionReceipt receipt = registry.mutate(campaignId, c -> c.contribute(contributor, amount));

            metrics.recordContribution(amount, receipt.getCredentialIds().size());
            if (receipt.isGoalReached()) {
                metrics.recordClosed(CloseReason.GOAL_REACHED.name());
            }
            log.info("Contribution accepted: amount={}, total={}, credentials={}, raised={}",
                    amount, receipt.getTotalContributed(), receipt.getCredentialIds().size(),
                    receipt.getRaisedAmount());
            return receipt;
        });
    }

    public SettlementReport close(UUID campaignId, String caller) {
        return run("close", campaignId, caller, () -> {
            SettlementReport report = registry.mutate(campaignId, c -> c.close(caller));

            metrics.recordClosed(CloseReason.OWNER_CANCELLED.name());
            metrics.recordPayouts("batch", report.getSuccesses().size(), report.getFailures().size());
            if (!report.isFullyPaid()) {
                log.warn("Campaign closed with failed refunds: failed={}, failedTotal={}",
                        report.getFailures().size(), report.getFailedTotal());
            }
            return report;
        });
    }

    public PayoutOutcome refund(UUID campaignId, String contributor) {
        return run("refund", campaignId, contributor, () -> {
            PayoutOutcome outcome = registry.mutate(campaignId, c -> c.refund(contributor));
            if (outcome.getAmount() > 0) {
                metrics.recordPayouts("refund", 1, 0);
            }
            return outcome;
        });
    }

    public PayoutOutcome withdraw(UUID campaignId, String caller) {
        return run("withdraw", campaignId, caller, () -> {
            PayoutOutcome outcome = registry.mutate(campaignId, c -> c.withdraw(caller));
            metrics.recordPayouts("withdrawal", 1, 0);
            return outcome;
        });
    }

    public SettlementReport retryFailedPayouts(UUID campaignId, String caller) {
        return run("retry_payouts", campaignId, caller, () -> {
            SettlementReport report = registry.mutate(campaignId, Campaign::retryFailedPayouts);
            metrics.recordPayouts("retry", report.getSuccesses().size(), report.getFailures().size());
            return report;
        });
    }

    public long balanceOf(UUID campaignId, String contributor) {
        return registry.require(campaignId).balanceOf(contributor);
    }

    public List<Long> credentialsOf(UUID campaignId, String contributor) {
        return registry.require(campaignId).credentialsOf(contributor);
    }

    private <T> T run(String operation, UUID campaignId, String caller, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.CAMPAIGN_ID_MDC_KEY, String.valueOf(campaignId));
        MDC.put(CorrelationContext.CALLER_MDC_KEY, String.valueOf(caller));

        try {
            T result = body.get();
            metrics.recordOperation(operation, "success", System.currentTimeMillis() - startTime);
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, e.getClass().getSimpleName(), duration);
            log.warn("Campaign operation rejected: operation={}, error={}, duration={}ms",
                    operation, e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CAMPAIGN_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CALLER_MDC_KEY);
        }
    }
}
