package com.flagship.campaign_escrow.campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A refund that failed during a batch close and waits for a retry.
 * Deleted once the retry succeeds.
 */
@Entity
@Table(
    name = "pending_payouts",
    uniqueConstraints = @UniqueConstraint(name = "uq_pending_payouts_recipient", columnNames = {"campaign_id", "recipient"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PendingPayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(nullable = false, updatable = false)
    private String recipient;

    @Column(nullable = false)
    private long amount;

    static PendingPayoutEntity create(UUID campaignId, String recipient, long amount) {
        PendingPayoutEntity entity = new PendingPayoutEntity();
        entity.id = UUID.randomUUID();
        entity.campaignId = campaignId;
        entity.recipient = recipient;
        entity.amount = amount;
        return entity;
    }

    void updateAmount(long amount) {
        this.amount = amount;
    }
}
