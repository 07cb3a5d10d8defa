package com.flagship.campaign_escrow.ledger;

import com.flagship.campaign_escrow.campaign.exception.ContributionValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-campaign bookkeeping of who contributed how much.
 *
 * Holds two structures:
 * - the contribution records, contributor identity to cumulative balance
 * - the contributor index, an append-only ordered list of distinct contributors
 *
 * No value moves here. The ledger is not thread-safe on its own; the owning
 * campaign serializes every call under its lock.
 */
public class ContributionLedger {

    private final Map<String, Long> balances = new HashMap<>();
    private final List<String> contributors = new ArrayList<>();

    /**
     * Adds {@code amount} to the contributor's cumulative balance and registers the
     * contributor in the index on first contribution.
     *
     * @return old and new cumulative totals
     * @throws ContributionValidationException if the amount is negative or the total overflows
     */
    public RecordResult record(String contributor, long amount) {
        Objects.requireNonNull(contributor, "contributor");
        if (amount < 0) {
            throw new ContributionValidationException("Contribution amount must not be negative: " + amount);
        }

        long oldTotal = balances.getOrDefault(contributor, 0L);
        long newTotal;
        try {
            newTotal = Math.addExact(oldTotal, amount);
        } catch (ArithmeticException e) {
            throw new ContributionValidationException(
                String.format("Contribution of %d would overflow the balance of %s", amount, contributor));
        }

        if (!balances.containsKey(contributor)) {
            contributors.add(contributor);
        }
        balances.put(contributor, newTotal);
        return new RecordResult(contributor, oldTotal, newTotal);
    }

    /**
     * Registers a stored contributor with its balance. Contributors must be loaded in index order.
     */
    public void load(String contributor, long balance) {
        Objects.requireNonNull(contributor, "contributor");
        if (balances.containsKey(contributor)) {
            throw new IllegalArgumentException("Contributor already loaded: " + contributor);
        }
        if (balance < 0) {
            throw new IllegalArgumentException("Balance must not be negative: " + balance);
        }
        contributors.add(contributor);
        balances.put(contributor, balance);
    }

    /**
     * Undoes a {@link #record} whose contribution was aborted. A contributor that was
     * registered by that very call is removed from the index again.
     */
    public void revert(RecordResult result) {
        String contributor = result.getContributor();
        if (result.isFirstContribution() && isLastRegistered(contributor)) {
            contributors.remove(contributors.size() - 1);
            balances.remove(contributor);
        } else {
            balances.put(contributor, result.getOldTotal());
        }
    }

    /**
     * Returns the contributor's balance and zeroes it. A repeat call returns 0.
     */
    public long settle(String contributor) {
        Long balance = balances.get(contributor);
        if (balance == null || balance == 0) {
            return 0;
        }
        balances.put(contributor, 0L);
        return balance;
    }

    /**
     * Re-credits an amount previously returned by {@link #settle} whose transfer failed.
     */
    public void restore(String contributor, long amount) {
        if (!balances.containsKey(contributor)) {
            throw new IllegalArgumentException("Unknown contributor: " + contributor);
        }
        balances.merge(contributor, amount, Math::addExact);
    }

    public long balanceOf(String contributor) {
        return balances.getOrDefault(contributor, 0L);
    }

    public boolean hasContributed(String contributor) {
        return balances.containsKey(contributor);
    }

    /**
     * Contributors in order of first contribution.
     */
    public List<String> contributors() {
        return Collections.unmodifiableList(contributors);
    }

    /**
     * Contributor to balance, in index order. Settled contributors are kept with 0.
     */
    public Map<String, Long> balances() {
        Map<String, Long> ordered = new LinkedHashMap<>();
        contributors.forEach(contributor -> ordered.put(contributor, balances.get(contributor)));
        return Collections.unmodifiableMap(ordered);
    }

    public int contributorCount() {
        return contributors.size();
    }

    /**
     * Sum of all outstanding balances. O(n); diagnostic only, the running total
     * is kept on the campaign.
     */
    public long totalOutstanding() {
        return balances.values().stream()
            .mapToLong(Long::longValue)
            .sum();
    }

    private boolean isLastRegistered(String contributor) {
        return !contributors.isEmpty() && contributors.get(contributors.size() - 1).equals(contributor);
    }
}
