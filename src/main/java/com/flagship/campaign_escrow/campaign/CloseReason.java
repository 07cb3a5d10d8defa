package com.flagship.campaign_escrow.campaign;

/**
 * Why a campaign left ACTIVE.
 */
public enum CloseReason {
    /**
     * A contribution brought the raised amount to or above the goal.
     */
    GOAL_REACHED,

    /**
     * An operation observed that the deadline had passed before the goal was reached.
     */
    DEADLINE_PASSED,

    /**
     * The owner cancelled the campaign; every contributor is refunded.
     */
    OWNER_CANCELLED
}
