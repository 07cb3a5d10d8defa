package com.flagship.campaign_escrow.ledger;

import lombok.Value;

/**
 * Cumulative totals of one contributor immediately before and after a recorded contribution.
 * Lets the caller derive how many credential units were crossed without a second lookup.
 */
@Value
public class RecordResult {
    String contributor;
    long oldTotal;
    long newTotal;

    public long getRecordedAmount() {
        return newTotal - oldTotal;
    }

    public boolean isFirstContribution() {
        return oldTotal == 0;
    }

    /**
     * Number of whole units crossed by this contribution.
     */
    public long unitsCrossed(long unit) {
        return newTotal / unit - oldTotal / unit;
    }
}
