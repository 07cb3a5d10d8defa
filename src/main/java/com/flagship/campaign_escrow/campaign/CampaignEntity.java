package com.flagship.campaign_escrow.campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the campaign row: terms, status and running totals.
 *
 * Contributor balances, credentials and parked payouts live in their own tables.
 * Rows are never deleted; a closed campaign stays as its audit record.
 *
 * - No setters: state only changes through {@link #updateFromState}
 * - Terms (owner, goal, deadline, minimum, unit) are not updatable
 */
@Entity
@Table(
    name = "campaigns",
    indexes = {
        @Index(name = "idx_campaigns_status_deadline", columnList = "status, deadline")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CampaignEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private String owner;

    @Column(name = "goal_amount", nullable = false, updatable = false)
    private long goalAmount;

    @Column(name = "minimum_contribution", nullable = false, updatable = false)
    private long minimumContribution;

    @Column(name = "credential_unit", nullable = false, updatable = false)
    private long credentialUnit;

    @Column(name = "raised_amount", nullable = false)
    private long raisedAmount;

    @Column(name = "withdrawable_amount", nullable = false)
    private long withdrawableAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CampaignStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", length = 30)
    private CloseReason closeReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false, updatable = false)
    private Instant deadline;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = Instant.now();
    }

    static CampaignEntity fromState(CampaignState state) {
        return new CampaignEntity(
            state.getId(),
            state.getOwner(),
            state.getGoalAmount(),
            state.getMinimumContribution(),
            state.getCredentialUnit(),
            state.getRaisedAmount(),
            state.getWithdrawableAmount(),
            state.getStatus(),
            state.getCloseReason(),
            state.getCreatedAt(),
            state.getDeadline(),
            state.getClosedAt(),
            null // updatedAt - set by @PrePersist
        );
    }

    /**
     * Copies the mutable part of the campaign: totals and status.
     */
    void updateFromState(CampaignState state) {
        if (!id.equals(state.getId())) {
            throw new IllegalArgumentException("State of campaign " + state.getId() + " applied to " + id);
        }
        this.raisedAmount = state.getRaisedAmount();
        this.withdrawableAmount = state.getWithdrawableAmount();
        this.status = state.getStatus();
        this.closeReason = state.getCloseReason();
        this.closedAt = state.getClosedAt();
    }

    /**
     * Campaign-level part of the stored state; the caller adds balances, credentials and
     * pending payouts.
     */
    CampaignState.CampaignStateBuilder toStateBuilder() {
        return CampaignState.builder()
            .id(id)
            .owner(owner)
            .goalAmount(goalAmount)
            .minimumContribution(minimumContribution)
            .credentialUnit(credentialUnit)
            .createdAt(createdAt)
            .deadline(deadline)
            .status(status)
            .closeReason(closeReason)
            .closedAt(closedAt)
            .raisedAmount(raisedAmount)
            .withdrawableAmount(withdrawableAmount);
    }
}
