package com.flagship.campaign_escrow.settlement;

/**
 * External value-moving capability. May fail for reasons outside this service's control,
 * either by returning a failed {@link TransferResult} or by throwing.
 */
@FunctionalInterface
public interface TransferCapability {

    TransferResult transfer(String recipient, long amount);
}
