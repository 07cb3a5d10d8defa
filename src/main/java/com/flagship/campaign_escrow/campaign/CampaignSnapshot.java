package com.flagship.campaign_escrow.campaign;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time, read-only view of a campaign taken under its lock.
 *
 * {@code active} and {@code closed} are the guard predicates evaluated at
 * {@code observedAt}; they can disagree with {@code status} once the deadline has
 * passed and no operation has run since.
 */
@Value
@Builder
public class CampaignSnapshot {
    UUID id;
    String owner;
    long goalAmount;
    long raisedAmount;
    long withdrawableAmount;
    long pendingPayoutTotal;
    int contributorCount;
    CampaignStatus status;
    CloseReason closeReason;
    boolean active;
    boolean closed;
    boolean successful;
    Instant createdAt;
    Instant deadline;
    Instant closedAt;
    Instant observedAt;
}
