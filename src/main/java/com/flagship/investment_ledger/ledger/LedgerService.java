package com.flagship.investment_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Append-only ledger of money movements.
 *
 * Invariants:
 * 1. Entries are immutable once written (no UPDATE or DELETE is issued; a database
 *    trigger rejects both)
 * 2. Entries are only written inside the business transaction that caused them,
 *    so a rolled-back state change never leaves a ledger row behind
 * 3. Amounts are strictly positive; the type carries the direction
 *
 * Uses JDBC directly; ordering comes from the database-assigned sequence number.
 */
@Service
@Slf4j
public class LedgerService {

    private static final String SELECT_COLUMNS =
        "SELECT id, user_id, investment_id, withdrawal_request_id, transaction_type, amount, status, " +
        "description, payment_reference, created_at, sequence_number FROM ledger_transactions ";

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends a ledger entry within the caller's transaction.
     *
     * @param posting The entry to write
     * @return The UUID of the created ledger transaction
     * @throws IllegalArgumentException if the posting is incomplete or the amount is not positive
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID append(LedgerPosting posting) {
        validate(posting);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, user_id, investment_id, withdrawal_request_id, " +
            "transaction_type, amount, status, description, payment_reference, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            posting.getUserId(),
            posting.getInvestmentId(),
            posting.getWithdrawalRequestId(),
            posting.getType().name(),
            posting.getAmount(),
            posting.getStatus().name(),
            posting.getDescription(),
            posting.getPaymentReference()
        );

        log.info("Ledger entry appended: id={}, type={}, amount={}, user={}, investment={}",
                transactionId, posting.getType(), posting.getAmount(),
                posting.getUserId(), posting.getInvestmentId());
        return transactionId;
    }

    /**
     * Lists a user's entries in posting order, optionally filtered by type.
     */
    public List<LedgerTransaction> findByUser(UUID userId, TransactionType type) {
        if (type == null) {
            return jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE user_id = ? ORDER BY sequence_number DESC",
                rowMapper(),
                userId
            );
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE user_id = ? AND transaction_type = ? ORDER BY sequence_number DESC",
            rowMapper(),
            userId,
            type.name()
        );
    }

    public List<LedgerTransaction> findByInvestment(UUID investmentId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE investment_id = ? ORDER BY sequence_number",
            rowMapper(),
            investmentId
        );
    }

    public List<LedgerTransaction> findByWithdrawal(UUID withdrawalRequestId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE withdrawal_request_id = ? ORDER BY sequence_number",
            rowMapper(),
            withdrawalRequestId
        );
    }

    /**
     * Sum of a user's completed entries of one type. Totals are derived, never stored.
     */
    public BigDecimal sumCompleted(UUID userId, TransactionType type) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions " +
            "WHERE user_id = ? AND transaction_type = ? AND status = 'COMPLETED'",
            BigDecimal.class,
            userId,
            type.name()
        );
        return total != null ? total : BigDecimal.ZERO;
    }

    private void validate(LedgerPosting posting) {
        if (posting.getUserId() == null) {
            throw new IllegalArgumentException("Ledger entry requires a user");
        }
        if (posting.getType() == null) {
            throw new IllegalArgumentException("Ledger entry requires a transaction type");
        }
        if (posting.getStatus() == null) {
            throw new IllegalArgumentException("Ledger entry requires a status");
        }
        if (posting.getAmount() == null || posting.getAmount().signum() <= 0) {
            throw new IllegalArgumentException(
                "Ledger amount must be positive, got " + posting.getAmount());
        }
    }

    private RowMapper<LedgerTransaction> rowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new LedgerTransaction(
                rs.getObject("id", UUID.class),
                rs.getObject("user_id", UUID.class),
                rs.getObject("investment_id", UUID.class),
                rs.getObject("withdrawal_request_id", UUID.class),
                TransactionType.valueOf(rs.getString("transaction_type")),
                rs.getBigDecimal("amount"),
                TransactionStatus.valueOf(rs.getString("status")),
                rs.getString("description"),
                rs.getString("payment_reference"),
                createdAt != null ? createdAt.toInstant() : null,
                rs.getLong("sequence_number")
            );
        };
    }
}
