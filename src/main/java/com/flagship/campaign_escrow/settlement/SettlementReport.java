package com.flagship.campaign_escrow.settlement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Per-recipient outcome of a settlement batch.
 *
 * Every amount listed here has already been removed from the contribution ledger,
 * whether or not its transfer succeeded. Failed entries are the input of a later retry.
 */
@Value
public class SettlementReport {

    @JsonProperty("outcomes")
    List<PayoutOutcome> outcomes;

    public SettlementReport(List<PayoutOutcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
    }

    public static SettlementReport empty() {
        return new SettlementReport(List.of());
    }

    @JsonIgnore
    public List<PayoutOutcome> getSuccesses() {
        return outcomes.stream().filter(PayoutOutcome::isSuccess).toList();
    }

    @JsonProperty("failures")
    public List<PayoutOutcome> getFailures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }

    /**
     * Total removed from the ledger by this batch, paid or not.
     */
    @JsonProperty("settled_total")
    public long getSettledTotal() {
        return outcomes.stream().mapToLong(PayoutOutcome::getAmount).sum();
    }

    @JsonProperty("paid_total")
    public long getPaidTotal() {
        return getSuccesses().stream().mapToLong(PayoutOutcome::getAmount).sum();
    }

    @JsonProperty("failed_total")
    public long getFailedTotal() {
        return getFailures().stream().mapToLong(PayoutOutcome::getAmount).sum();
    }

    @JsonProperty("fully_paid")
    public boolean isFullyPaid() {
        return getFailures().isEmpty();
    }
}
