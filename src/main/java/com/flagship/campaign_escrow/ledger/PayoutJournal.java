package com.flagship.campaign_escrow.ledger;

import com.flagship.campaign_escrow.settlement.TransferCapability;
import com.flagship.campaign_escrow.settlement.TransferResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link TransferCapability}: a double-entry journal of value leaving escrow.
 *
 * Every accepted transfer posts a balanced pair of entries, a debit on the escrow
 * account and a credit on the recipient, in the caller's transaction. A campaign
 * operation that rolls back takes its payouts with it.
 *
 * Balances are derived from entries, never stored. Recipients can be marked as
 * rejecting, which makes their transfers fail with the given reason and post nothing.
 */
@Service
@Slf4j
public class PayoutJournal implements TransferCapability {

    public static final String ESCROW_ACCOUNT = "escrow";

    private final JournalEntryRepository repository;
    private final Clock clock;
    private final Map<String, String> rejectingRecipients = new ConcurrentHashMap<>();

    public PayoutJournal(JournalEntryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public TransferResult transfer(String recipient, long amount) {
        if (amount <= 0) {
            return TransferResult.failed("Amount must be positive");
        }
        String rejection = rejectingRecipients.get(recipient);
        if (rejection != null) {
            log.warn("Recipient rejected payout: recipient={}, amount={}, reason={}", recipient, amount, rejection);
            return TransferResult.failed(rejection);
        }

        UUID transactionId = UUID.randomUUID();
        repository.saveAll(List.of(
            JournalEntryEntity.post(transactionId, ESCROW_ACCOUNT, amount, EntryType.DEBIT,
                    "Payout to " + recipient, clock.instant()),
            JournalEntryEntity.post(transactionId, recipient, amount, EntryType.CREDIT,
                    "Payout from escrow", clock.instant())));
        log.debug("Posted payout: transactionId={}, recipient={}, amount={}", transactionId, recipient, amount);
        return TransferResult.succeeded();
    }

    /**
     * Makes every later transfer to {@code recipient} fail with {@code reason}.
     */
    public void rejectPayoutsTo(String recipient, String reason) {
        rejectingRecipients.put(recipient, reason);
    }

    public void acceptPayoutsTo(String recipient) {
        rejectingRecipients.remove(recipient);
    }

    /**
     * Total credited to an account minus total debited from it.
     */
    @Transactional(readOnly = true)
    public long balanceOf(String account) {
        return repository.balanceOf(account);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> entriesFor(String account) {
        return repository.findByAccountOrderBySequenceNumberAsc(account).stream()
            .map(JournalEntryEntity::toDomain)
            .toList();
    }

    /**
     * Debits equal credits across the whole journal.
     */
    @Transactional(readOnly = true)
    public boolean isBalanced() {
        return repository.sumByEntryType(EntryType.DEBIT) == repository.sumByEntryType(EntryType.CREDIT);
    }
}
