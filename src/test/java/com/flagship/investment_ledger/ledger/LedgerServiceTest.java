package com.flagship.investment_ledger.ledger;

import com.flagship.investment_ledger.payment.gateway.PaymentGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: mutations, negative amounts, entries outside a
 * transaction. The database and the service must refuse all of them.
 *
 * Entries can never be deleted, so every test works with its own user.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("investment_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @MockBean
    private PaymentGateway paymentGateway;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(Exception e) {
        String message = e.getMessage();
        if (e.getCause() != null && e.getCause().getMessage() != null) {
            message = e.getCause().getMessage();
        }
        System.out.println("⚠ EXPECTED EXCEPTION: " + e.getClass().getSimpleName());
        System.out.println("  Message: " + message);
    }

    private UUID append(UUID userId, TransactionType type, String amount) {
        return transactionTemplate.execute(status -> ledgerService.append(LedgerPosting.builder()
            .userId(userId)
            .type(type)
            .amount(new BigDecimal(amount))
            .description(type + " entry")
            .build()));
    }

    @Test
    @DisplayName("Entries are appended in order and totals are derived from them")
    void appendAndSum() {
        printTestHeader("Append and Derive Totals");

        UUID userId = UUID.randomUUID();
        append(userId, TransactionType.INVESTMENT, "500.00");
        append(userId, TransactionType.INVESTMENT, "250.00");
        append(userId, TransactionType.REFUND, "250.00");
        transactionTemplate.executeWithoutResult(status -> ledgerService.append(LedgerPosting.builder()
            .userId(userId)
            .type(TransactionType.REFERRAL_BONUS)
            .amount(new BigDecimal("10.00"))
            .status(TransactionStatus.PENDING)
            .build()));

        List<LedgerTransaction> all = ledgerService.findByUser(userId, null);
        List<LedgerTransaction> investments = ledgerService.findByUser(userId, TransactionType.INVESTMENT);

        System.out.println("Entries: " + all.size());

        assertEquals(4, all.size());
        assertEquals(2, investments.size());
        assertTrue(all.get(0).getSequenceNumber() > all.get(1).getSequenceNumber(), "Newest entry first");
        assertEquals(0, new BigDecimal("750.00").compareTo(ledgerService.sumCompleted(userId, TransactionType.INVESTMENT)));
        assertEquals(0, new BigDecimal("250.00").compareTo(ledgerService.sumCompleted(userId, TransactionType.REFUND)));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.sumCompleted(userId, TransactionType.REFERRAL_BONUS)),
                "Pending entries do not count towards totals");
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.sumCompleted(userId, TransactionType.WITHDRAWAL)));

        printSuccess("Totals derived from completed entries only");
    }

    @Test
    @DisplayName("Appending outside a transaction is refused")
    void appendRequiresTransaction() {
        printTestHeader("Append Without Transaction");

        UUID userId = UUID.randomUUID();
        IllegalTransactionStateException e = assertThrows(IllegalTransactionStateException.class,
            () -> ledgerService.append(LedgerPosting.builder()
                .userId(userId)
                .type(TransactionType.INVESTMENT)
                .amount(new BigDecimal("100.00"))
                .build()));
        printExpectedException(e);

        assertTrue(ledgerService.findByUser(userId, null).isEmpty());
        printSuccess("No entry written without a surrounding transaction");
    }

    @Test
    @DisplayName("An entry rolls back with the transaction that wrote it")
    void entryRollsBackWithCaller() {
        printTestHeader("Rollback Removes Entry");

        UUID userId = UUID.randomUUID();
        assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            ledgerService.append(LedgerPosting.builder()
                .userId(userId)
                .type(TransactionType.WITHDRAWAL)
                .amount(new BigDecimal("80.00"))
                .build());
            throw new IllegalStateException("payout failed after posting");
        }));

        assertTrue(ledgerService.findByUser(userId, null).isEmpty());
        printSuccess("Entry disappeared with the rolled back transaction");
    }

    @Test
    @DisplayName("Zero and negative amounts are rejected by the service and the database")
    void nonPositiveAmountsRejected() {
        printTestHeader("Non-Positive Amounts");

        UUID userId = UUID.randomUUID();
        assertThrows(IllegalArgumentException.class, () -> append(userId, TransactionType.REFUND, "0.00"));
        assertThrows(IllegalArgumentException.class, () -> append(userId, TransactionType.REFUND, "-5.00"));

        DataAccessException e = assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, user_id, transaction_type, amount, status) VALUES (?, ?, ?, ?, ?)",
            UUID.randomUUID(), userId, "REFUND", new BigDecimal("-5.00"), "COMPLETED"));
        printExpectedException(e);

        assertTrue(ledgerService.findByUser(userId, null).isEmpty());
        printSuccess("Check constraint backs up service validation");
    }

    @Test
    @DisplayName("Ledger rows cannot be updated or deleted")
    void ledgerIsAppendOnly() {
        printTestHeader("Append-Only Ledger");

        UUID userId = UUID.randomUUID();
        UUID entryId = append(userId, TransactionType.INVESTMENT, "300.00");

        DataAccessException update = assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE ledger_transactions SET amount = 1 WHERE id = ?", entryId));
        printExpectedException(update);

        DataAccessException delete = assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM ledger_transactions WHERE id = ?", entryId));
        printExpectedException(delete);

        List<LedgerTransaction> entries = ledgerService.findByUser(userId, null);
        assertEquals(1, entries.size());
        assertEquals(0, new BigDecimal("300.00").compareTo(entries.get(0).getAmount()));

        printSuccess("Entry unchanged after update and delete attempts");
    }

    @Test
    @DisplayName("Incomplete postings are rejected")
    void incompletePostingsRejected() {
        printTestHeader("Incomplete Postings");

        assertThrows(IllegalArgumentException.class, () -> transactionTemplate.executeWithoutResult(status ->
            ledgerService.append(LedgerPosting.builder()
                .type(TransactionType.INVESTMENT)
                .amount(new BigDecimal("10.00"))
                .build())));
        assertThrows(IllegalArgumentException.class, () -> transactionTemplate.executeWithoutResult(status ->
            ledgerService.append(LedgerPosting.builder()
                .userId(UUID.randomUUID())
                .amount(new BigDecimal("10.00"))
                .build())));

        printSuccess("User and type are required");
    }
}
