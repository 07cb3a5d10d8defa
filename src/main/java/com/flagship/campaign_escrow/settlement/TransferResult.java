package com.flagship.campaign_escrow.settlement;

import lombok.Value;

/**
 * Outcome reported by a {@link TransferCapability}.
 */
@Value
public class TransferResult {
    boolean success;
    String failureReason;

    public static TransferResult succeeded() {
        return new TransferResult(true, null);
    }

    public static TransferResult failed(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new TransferResult(false, reason);
    }
}
