package com.flagship.campaign_escrow.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for campaign operations.
 *
 * Metrics exposed:
 * - campaign.created: Counter of created campaigns
 * - campaign.contributions / campaign.contributed.amount: accepted contributions and their sum
 * - campaign.credentials.issued: Counter of minted credentials
 * - campaign.closed: Counter of campaigns leaving ACTIVE, tagged by reason
 * - campaign.payouts: Counter of payout attempts, tagged by kind and status
 * - campaign.operations: Counter of operation results, tagged by operation and status
 * - campaign.latency: Timer per operation
 * - campaign.active / campaign.escrow.outstanding / campaign.payouts.pending: gauges,
 *   refreshed by {@link MetricsScheduler}
 */
@Component
public class CampaignMetrics {

    private final MeterRegistry registry;

    private final Counter campaignsCreated;
    private final Counter contributions;
    private final Counter contributedAmount;
    private final Counter credentialsIssued;

    private final AtomicLong activeCampaigns = new AtomicLong();
    private final AtomicLong escrowOutstanding = new AtomicLong();
    private final AtomicLong pendingPayouts = new AtomicLong();

    public CampaignMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.campaignsCreated = Counter.builder("campaign.created")
                .description("Number of campaigns created")
                .register(registry);

        this.contributions = Counter.builder("campaign.contributions")
                .description("Number of accepted contributions")
                .register(registry);

        this.contributedAmount = Counter.builder("campaign.contributed.amount")
                .description("Sum of accepted contribution amounts")
                .register(registry);

        this.credentialsIssued = Counter.builder("campaign.credentials.issued")
                .description("Number of credentials minted for contributors")
                .register(registry);

        Gauge.builder("campaign.active", activeCampaigns, AtomicLong::get)
                .description("Campaigns still accepting contributions")
                .register(registry);
        Gauge.builder("campaign.escrow.outstanding", escrowOutstanding, AtomicLong::get)
                .description("Funds raised by active campaigns plus funds awaiting owner withdrawal")
                .register(registry);
        Gauge.builder("campaign.payouts.pending", pendingPayouts, AtomicLong::get)
                .description("Funds owed by failed batch payouts awaiting retry")
                .register(registry);
    }

    public void incrementCampaignsCreated() {
        campaignsCreated.increment();
    }

    public void recordContribution(long amount, int credentialCount) {
        contributions.increment();
        contributedAmount.increment(amount);
        credentialsIssued.increment(credentialCount);
    }

    public void recordClosed(String reason) {
        registry.counter("campaign.closed", "reason", sanitizeTag(reason)).increment();
    }

    /**
     * Records payout attempts of one kind (refund, withdrawal, batch, retry).
     */
    public void recordPayouts(String kind, long succeeded, long failed) {
        if (succeeded > 0) {
            registry.counter("campaign.payouts", "kind", kind, "status", "success").increment(succeeded);
        }
        if (failed > 0) {
            registry.counter("campaign.payouts", "kind", kind, "status", "failure").increment(failed);
        }
    }

    public void updateEscrowGauges(long active, long outstanding, long pending) {
        activeCampaigns.set(active);
        escrowOutstanding.set(outstanding);
        pendingPayouts.set(pending);
    }

    public void recordOperation(String operation, String status, long durationMs) {
        registry.counter("campaign.operations",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
        registry.timer("campaign.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
