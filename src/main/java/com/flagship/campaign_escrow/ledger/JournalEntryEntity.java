package com.flagship.campaign_escrow.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for one journal line. Insert-only; the table rejects updates and deletes.
 */
@Entity
@Table(name = "journal_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(nullable = false, updatable = false)
    private String account;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false, length = 10)
    private EntryType entryType;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "posted_at", nullable = false, updatable = false)
    private Instant postedAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static JournalEntryEntity post(UUID transactionId, String account, long amount, EntryType entryType,
                                   String description, Instant postedAt) {
        JournalEntryEntity entity = new JournalEntryEntity();
        entity.id = UUID.randomUUID();
        entity.transactionId = transactionId;
        entity.account = account;
        entity.amount = amount;
        entity.entryType = entryType;
        entity.description = description;
        entity.postedAt = postedAt;
        // sequenceNumber is set by database
        return entity;
    }

    JournalEntry toDomain() {
        return new JournalEntry(transactionId, account, amount, entryType, description,
                sequenceNumber != null ? sequenceNumber : 0L, postedAt);
    }
}
