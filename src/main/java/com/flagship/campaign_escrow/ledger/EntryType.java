package com.flagship.campaign_escrow.ledger;

/**
 * Side of a payout journal entry. Every payout posts one of each for the same amount.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
