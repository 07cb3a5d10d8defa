package com.flagship.campaign_escrow.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntryEntity, UUID> {

    List<JournalEntryEntity> findByAccountOrderBySequenceNumberAsc(String account);

    /**
     * Credits minus debits for one account. Balances are derived, never stored.
     */
    @Query("""
        SELECT COALESCE(SUM(CASE WHEN e.entryType = com.flagship.campaign_escrow.ledger.EntryType.CREDIT
                                 THEN e.amount ELSE -e.amount END), 0)
        FROM JournalEntryEntity e
        WHERE e.account = :account
        """)
    long balanceOf(@Param("account") String account);

    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM JournalEntryEntity e WHERE e.entryType = :entryType")
    long sumByEntryType(@Param("entryType") EntryType entryType);
}
