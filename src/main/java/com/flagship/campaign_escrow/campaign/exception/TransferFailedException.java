package com.flagship.campaign_escrow.campaign.exception;

import lombok.Getter;

/**
 * Raised when a single-recipient transfer (withdrawal or self-service refund) fails.
 * The campaign state is left as it was before the call, so the operation can be retried.
 */
@Getter
public class TransferFailedException extends RuntimeException {

    private final String recipient;
    private final long amount;

    public TransferFailedException(String recipient, long amount, String reason) {
        super(String.format("Transfer of %d to %s failed: %s", amount, recipient, reason));
        this.recipient = recipient;
        this.amount = amount;
    }
}
