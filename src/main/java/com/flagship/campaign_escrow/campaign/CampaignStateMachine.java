package com.flagship.campaign_escrow.campaign;

import com.flagship.campaign_escrow.campaign.exception.CampaignStateException;
import lombok.Getter;

import java.time.Instant;

/**
 * Goal, deadline and open/closed status of one campaign, plus the guards derived from them.
 *
 * Transitions are one-way into CLOSED:
 * - GOAL_REACHED when a contribution brings the raised amount to the goal
 * - DEADLINE_PASSED when an operation observes {@code now >= deadline}
 * - OWNER_CANCELLED when the owner closes an active campaign
 *
 * The deadline is evaluated lazily against the instant passed in by the caller;
 * nothing polls it in the background.
 */
@Getter
public class CampaignStateMachine {

    private final long goalAmount;
    private final Instant deadline;
    private CampaignStatus status = CampaignStatus.ACTIVE;
    private CloseReason closeReason;
    private Instant closedAt;
    private long raisedAmount;

    public CampaignStateMachine(long goalAmount, Instant deadline) {
        if (goalAmount < 0) {
            throw new IllegalArgumentException("Goal amount must not be negative: " + goalAmount);
        }
        if (deadline == null) {
            throw new IllegalArgumentException("Deadline is required");
        }
        this.goalAmount = goalAmount;
        this.deadline = deadline;
    }

    /**
     * Puts back the status and raised amount of a stored campaign.
     */
    void restore(CampaignStatus status, CloseReason closeReason, Instant closedAt, long raisedAmount) {
        if (status == CampaignStatus.CLOSED && closeReason == null) {
            throw new IllegalArgumentException("A closed campaign needs a close reason");
        }
        if (raisedAmount < 0) {
            throw new IllegalArgumentException("Raised amount must not be negative: " + raisedAmount);
        }
        this.status = status;
        this.closeReason = closeReason;
        this.closedAt = closedAt;
        this.raisedAmount = raisedAmount;
    }

    public boolean isActive(Instant now) {
        return status == CampaignStatus.ACTIVE && now.isBefore(deadline);
    }

    public boolean isClosed(Instant now) {
        return status == CampaignStatus.CLOSED || !now.isBefore(deadline);
    }

    public boolean isSuccessful() {
        return raisedAmount >= goalAmount;
    }

    public boolean isFailed() {
        return !isSuccessful();
    }

    /**
     * Closes the campaign with DEADLINE_PASSED if it is still ACTIVE and the deadline has passed.
     *
     * @return true if this call performed the transition
     */
    public boolean observeDeadline(Instant now) {
        if (status == CampaignStatus.ACTIVE && !now.isBefore(deadline)) {
            transitionToClosed(CloseReason.DEADLINE_PASSED, now);
            return true;
        }
        return false;
    }

    /**
     * Adds to the raised amount and closes with GOAL_REACHED once the goal is met.
     *
     * @return true if this call crossed the goal
     */
    public boolean recordRaised(long amount, Instant now) {
        requireActive(now);
        raisedAmount = Math.addExact(raisedAmount, amount);
        if (isSuccessful()) {
            transitionToClosed(CloseReason.GOAL_REACHED, now);
            return true;
        }
        return false;
    }

    public void cancel(Instant now) {
        requireActive(now);
        transitionToClosed(CloseReason.OWNER_CANCELLED, now);
    }

    public void requireActive(Instant now) {
        if (!isActive(now)) {
            throw new CampaignStateException(describe(now) + "; operation requires an active campaign");
        }
    }

    public void requireClosed(Instant now) {
        if (!isClosed(now)) {
            throw new CampaignStateException(describe(now) + "; operation requires a closed campaign");
        }
    }

    /**
     * Checks if a transition from the current status to {@code target} is allowed.
     */
    public boolean canTransitionTo(CampaignStatus target) {
        return switch (status) {
            case ACTIVE -> target == CampaignStatus.CLOSED;
            case CLOSED -> false;
        };
    }

    private void transitionToClosed(CloseReason reason, Instant now) {
        if (!canTransitionTo(CampaignStatus.CLOSED)) {
            throw new CampaignStateException(
                String.format("Cannot close campaign in %s status (closed by %s)", status, closeReason));
        }
        status = CampaignStatus.CLOSED;
        closeReason = reason;
        closedAt = now;
    }

    private String describe(Instant now) {
        if (status == CampaignStatus.CLOSED) {
            return String.format("Campaign is CLOSED (%s)", closeReason);
        }
        if (!now.isBefore(deadline)) {
            return "Campaign deadline " + deadline + " has passed";
        }
        return "Campaign is ACTIVE until " + deadline;
    }
}
