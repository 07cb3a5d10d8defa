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
 * One contributor of one campaign: position in the contributor index and cumulative balance.
 * Only the balance changes after insert.
 */
@Entity
@Table(
    name = "campaign_contributions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_contributions_contributor", columnNames = {"campaign_id", "contributor"}),
        @UniqueConstraint(name = "uq_contributions_join_order", columnNames = {"campaign_id", "join_order"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContributionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "campaign_id", nullable = false, updatable = false)
    private UUID campaignId;

    @Column(nullable = false, updatable = false)
    private String contributor;

    @Column(name = "join_order", nullable = false, updatable = false)
    private int joinOrder;

    @Column(nullable = false)
    private long balance;

    static ContributionEntity create(UUID campaignId, String contributor, int joinOrder, long balance) {
        ContributionEntity entity = new ContributionEntity();
        entity.id = UUID.randomUUID();
        entity.campaignId = campaignId;
        entity.contributor = contributor;
        entity.joinOrder = joinOrder;
        entity.balance = balance;
        return entity;
    }

    void updateBalance(long balance) {
        this.balance = balance;
    }
}
