package com.flagship.campaign_escrow.support;

import com.flagship.campaign_escrow.settlement.TransferCapability;
import com.flagship.campaign_escrow.settlement.TransferResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transfer capability for unit tests: credits recipients in memory and can be told to
 * reject a recipient.
 */
public class InMemoryPayouts implements TransferCapability {

    private final Map<String, Long> received = new ConcurrentHashMap<>();
    private final Map<String, String> rejecting = new ConcurrentHashMap<>();

    @Override
    public TransferResult transfer(String recipient, long amount) {
        if (amount <= 0) {
            return TransferResult.failed("Amount must be positive");
        }
        String rejection = rejecting.get(recipient);
        if (rejection != null) {
            return TransferResult.failed(rejection);
        }
        received.merge(recipient, amount, Long::sum);
        return TransferResult.succeeded();
    }

    public void rejectPayoutsTo(String recipient, String reason) {
        rejecting.put(recipient, reason);
    }

    public void acceptPayoutsTo(String recipient) {
        rejecting.remove(recipient);
    }

    public long balanceOf(String recipient) {
        return received.getOrDefault(recipient, 0L);
    }
}
