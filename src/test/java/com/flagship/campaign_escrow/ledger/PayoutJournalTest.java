package com.flagship.campaign_escrow.ledger;

import com.flagship.campaign_escrow.settlement.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the double-entry payout journal.
 *
 * These tests verify that:
 * - Every payout posts a balanced debit/credit pair
 * - Balances are derived from entries
 * - Rejected recipients receive nothing
 * - Payouts roll back with the surrounding transaction
 * - Entries cannot be changed or deleted once written
 */
@SpringBootTest
@Testcontainers
class PayoutJournalTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("campaign_escrow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
    }

    @Autowired
    private PayoutJournal journal;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private String alice;
    private String bob;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        // The journal is append-only, so each test works on fresh accounts
        alice = "alice-" + UUID.randomUUID();
        bob = "bob-" + UUID.randomUUID();
    }

    @Test
    @DisplayName("Payout debits escrow and credits the recipient")
    void testPayoutPostsBalancedPair() {
        printTestHeader("Balanced Payout");

        long escrowBefore = journal.balanceOf(PayoutJournal.ESCROW_ACCOUNT);
        TransferResult result = journal.transfer(alice, 40);

        assertTrue(result.isSuccess());
        assertEquals(40, journal.balanceOf(alice));
        assertEquals(escrowBefore - 40, journal.balanceOf(PayoutJournal.ESCROW_ACCOUNT));
        assertTrue(journal.isBalanced());

        List<JournalEntry> aliceEntries = journal.entriesFor(alice);
        assertEquals(1, aliceEntries.size());
        JournalEntry credit = aliceEntries.get(0);
        assertEquals(EntryType.CREDIT, credit.getEntryType());
        JournalEntry debit = journal.entriesFor(PayoutJournal.ESCROW_ACCOUNT).stream()
                .filter(e -> e.getTransactionId().equals(credit.getTransactionId()))
                .findFirst()
                .orElseThrow();
        assertEquals(EntryType.DEBIT, debit.getEntryType());
        assertEquals(40, debit.getAmount());
        assertTrue(debit.getSequenceNumber() > 0);
        printSuccess("Debit and credit share a transaction id");
    }

    @Test
    @DisplayName("Rejected recipient gets a failed result and no entries")
    void testRejectedRecipient() {
        printTestHeader("Rejected Recipient");

        journal.rejectPayoutsTo(bob, "account frozen");
        TransferResult rejected = journal.transfer(bob, 10);

        assertFalse(rejected.isSuccess());
        assertEquals("account frozen", rejected.getFailureReason());
        assertEquals(0, journal.balanceOf(bob));
        assertTrue(journal.entriesFor(bob).isEmpty());

        journal.acceptPayoutsTo(bob);
        assertTrue(journal.transfer(bob, 10).isSuccess());
        assertEquals(10, journal.balanceOf(bob));
        printSuccess("Rejection is reversible");
    }

    @Test
    @DisplayName("Non-positive amounts are refused")
    void testNonPositiveAmount() {
        assertFalse(journal.transfer(alice, 0).isSuccess());
        assertFalse(journal.transfer(alice, -5).isSuccess());
        assertTrue(journal.entriesFor(alice).isEmpty());
    }

    @Test
    @DisplayName("Payout made in a transaction that rolls back leaves no entries")
    void testPayoutRollsBackWithCaller() {
        printTestHeader("Rollback With Caller");

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            assertTrue(journal.transfer(alice, 25).isSuccess());
            status.setRollbackOnly();
        });

        assertEquals(0, journal.balanceOf(alice));
        assertTrue(journal.entriesFor(alice).isEmpty());
        printSuccess("Nothing posted");
    }

    @Test
    @DisplayName("Journal entries cannot be updated or deleted")
    void testAppendOnly() {
        printTestHeader("Append Only");

        journal.transfer(alice, 5);

        DataAccessException update = assertThrows(DataAccessException.class, () ->
                jdbcTemplate.update("UPDATE journal_entries SET amount = 500 WHERE account = ?", alice));
        printExpectedException("DataAccessException", update.getMessage());
        assertThrows(DataAccessException.class, () ->
                jdbcTemplate.update("DELETE FROM journal_entries WHERE account = ?", alice));

        assertEquals(5, journal.balanceOf(alice));
        printSuccess("Entries are immutable");
    }
}
