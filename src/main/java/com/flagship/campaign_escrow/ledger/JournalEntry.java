package com.flagship.campaign_escrow.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable line of the payout journal.
 */
@Value
public class JournalEntry {
    UUID transactionId;
    String account;
    long amount;
    EntryType entryType;
    String description;
    long sequenceNumber;
    Instant postedAt;
}
