package com.flagship.campaign_escrow.settlement;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Result of one attempted payout to one recipient.
 * An amount of 0 with success=true is the idempotent no-op of a repeated refund.
 */
@Value
public class PayoutOutcome {

    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("failure_reason")
    String failureReason;

    public static PayoutOutcome paid(String recipient, long amount) {
        return new PayoutOutcome(recipient, amount, true, null);
    }

    public static PayoutOutcome nothingOwed(String recipient) {
        return new PayoutOutcome(recipient, 0, true, null);
    }

    public static PayoutOutcome failed(String recipient, long amount, String reason) {
        return new PayoutOutcome(recipient, amount, false, reason);
    }
}
