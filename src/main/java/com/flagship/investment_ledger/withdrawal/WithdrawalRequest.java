package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.exception.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Withdrawal request domain object.
 *
 * Every admin transition appends a timestamped line to {@code adminNotes}, so the
 * notes double as the request's audit trail. Invalid transitions throw
 * {@link InvalidTransitionException} and leave the request untouched.
 */
@Value
@Builder(toBuilder = true)
public class WithdrawalRequest {
    UUID id;
    UUID userId;
    BigDecimal amount;
    WithdrawalType type;
    WithdrawalStatus status;
    Instant processedDate;
    String adminNotes;
    String paymentReference;
    List<UUID> investmentIds;
    Instant createdAt;
    Instant updatedAt;

    public static WithdrawalRequest create(UUID userId, WithdrawalType type, BigDecimal amount,
                                           List<UUID> investmentIds, Instant now) {
        if (userId == null) {
            throw new IllegalArgumentException("User is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Withdrawal type is required");
        }
        if (investmentIds == null || investmentIds.isEmpty()) {
            throw new IllegalArgumentException("A withdrawal needs at least one investment");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Nothing to withdraw: computed amount is " + amount);
        }
        return WithdrawalRequest.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .amount(amount)
            .type(type)
            .status(WithdrawalStatus.PENDING)
            .investmentIds(List.copyOf(investmentIds))
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING or FAILED → APPROVED. Assigns a fresh payout reference.
     */
    public WithdrawalRequest approve(String note, Instant now) {
        require(EnumSet.of(WithdrawalStatus.PENDING, WithdrawalStatus.FAILED), "approve");
        return toBuilder()
            .status(WithdrawalStatus.APPROVED)
            .paymentReference(payoutReference(now))
            .adminNotes(appendLine(WithdrawalAction.APPROVE, note, now))
            .updatedAt(now)
            .build();
    }

    public WithdrawalRequest reject(String note, Instant now) {
        require(EnumSet.of(WithdrawalStatus.PENDING), "reject");
        return toBuilder()
            .status(WithdrawalStatus.REJECTED)
            .adminNotes(appendLine(WithdrawalAction.REJECT, note, now))
            .updatedAt(now)
            .build();
    }

    /**
     * APPROVED → COMPLETED once the payout has been made.
     */
    public WithdrawalRequest markPaid(String note, Instant now) {
        require(EnumSet.of(WithdrawalStatus.APPROVED), "mark as paid");
        return toBuilder()
            .status(WithdrawalStatus.COMPLETED)
            .processedDate(now)
            .adminNotes(appendLine(WithdrawalAction.MARK_PAID, note, now))
            .updatedAt(now)
            .build();
    }

    /**
     * APPROVED → FAILED when the payout bounced. The request can be approved again.
     */
    public WithdrawalRequest markFailed(String note, Instant now) {
        require(EnumSet.of(WithdrawalStatus.APPROVED), "mark as failed");
        return toBuilder()
            .status(WithdrawalStatus.FAILED)
            .adminNotes(appendLine(WithdrawalAction.MARK_FAILED, note, now))
            .updatedAt(now)
            .build();
    }

    public WithdrawalRequest apply(WithdrawalAction action, String note, Instant now) {
        return switch (action) {
            case APPROVE -> approve(note, now);
            case REJECT -> reject(note, now);
            case MARK_PAID -> markPaid(note, now);
            case MARK_FAILED -> markFailed(note, now);
        };
    }

    /**
     * Adds a free-form admin note without changing status.
     */
    public WithdrawalRequest appendNote(String note, Instant now) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("Note must not be blank");
        }
        return toBuilder()
            .adminNotes(append(String.format("[%s] NOTE: %s", now, note.trim())))
            .updatedAt(now)
            .build();
    }

    private void require(Set<WithdrawalStatus> allowed, String action) {
        if (!allowed.contains(status)) {
            throw new InvalidTransitionException(String.format(
                "Cannot %s withdrawal %s in %s status (allowed from %s)", action, id, status, allowed), status);
        }
    }

    private String appendLine(WithdrawalAction action, String note, Instant now) {
        String line = String.format("[%s] %s", now, action.name());
        if (note != null && !note.isBlank()) {
            line += ": " + note.trim();
        }
        return append(line);
    }

    private String append(String line) {
        return adminNotes == null || adminNotes.isBlank() ? line : adminNotes + "\n" + line;
    }

    private String payoutReference(Instant now) {
        return "PAY-" + now.getEpochSecond() + "-" + id.toString().substring(0, 8);
    }
}
