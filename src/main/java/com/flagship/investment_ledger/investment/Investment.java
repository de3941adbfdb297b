package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.exception.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Investment domain object.
 *
 * Timestamps and dates come from the {@link Clock} passed to each transition.
 *
 * Key principles:
 * - Transitions are methods that validate the current state
 * - Invalid transitions throw {@link InvalidTransitionException} carrying the current state
 * - State changes are immutable (a new Investment is returned)
 * - ACTIVE is only ever reached through {@link #activate}, which the payment
 *   reconciliation calls after a SUCCESS payment has been recorded
 */
@Value
@Builder(toBuilder = true)
public class Investment {
    UUID id;
    UUID userId;
    UUID packageId;
    BigDecimal amount;
    int units;
    InvestmentStatus status;
    boolean slotHeld;
    LocalDate startDate;
    LocalDate endDate;
    LocalDate completedDate;
    BigDecimal actualReturn;
    UUID withdrawalRequestId;
    boolean reconciliationRequired;
    String reconciliationNote;
    String idempotencyKey;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING investment.
     *
     * @param slotHeld true when inventory was reserved at order time
     */
    public static Investment pending(UUID userId, UUID packageId, BigDecimal amount, int units,
                                     boolean slotHeld, String idempotencyKey, Clock clock) {
        if (userId == null) {
            throw new IllegalArgumentException("User is required");
        }
        if (packageId == null) {
            throw new IllegalArgumentException("Package is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Investment amount must be positive");
        }
        if (units <= 0) {
            throw new IllegalArgumentException("Units must be at least 1");
        }
        Instant now = clock.instant();
        return Investment.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .packageId(packageId)
            .amount(amount.setScale(2, RoundingMode.HALF_EVEN))
            .units(units)
            .status(InvestmentStatus.PENDING)
            .slotHeld(slotHeld)
            .idempotencyKey(idempotencyKey)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * PENDING → ACTIVE. Starts the term today and marks the slots as held.
     */
    public Investment activate(Clock clock, int durationDays) {
        requireStatus(InvestmentStatus.PENDING, "activate");
        LocalDate today = LocalDate.now(clock);
        return toBuilder()
            .status(InvestmentStatus.ACTIVE)
            .startDate(today)
            .endDate(today.plusDays(durationDays))
            .slotHeld(true)
            .reconciliationRequired(false)
            .reconciliationNote(null)
            .updatedAt(clock.instant())
            .build();
    }

    /**
     * ACTIVE → COMPLETED, once the term has ended.
     *
     * @param totalReturn principal plus return, already rounded
     */
    public Investment complete(Clock clock, BigDecimal totalReturn) {
        requireStatus(InvestmentStatus.ACTIVE, "complete");
        LocalDate today = LocalDate.now(clock);
        if (endDate != null && today.isBefore(endDate)) {
            throw new InvalidTransitionException(String.format(
                "Investment %s matures on %s and cannot be completed on %s", id, endDate, today), status);
        }
        return toBuilder()
            .status(InvestmentStatus.COMPLETED)
            .completedDate(today)
            .actualReturn(totalReturn)
            .updatedAt(clock.instant())
            .build();
    }

    /**
     * PENDING → CANCELLED. The caller must already have checked that no payment succeeded.
     */
    public Investment cancel(Clock clock) {
        requireStatus(InvestmentStatus.PENDING, "cancel");
        return toBuilder()
            .status(InvestmentStatus.CANCELLED)
            .slotHeld(false)
            .updatedAt(clock.instant())
            .build();
    }

    /**
     * Marks the investment for manual review. Notes accumulate, one per line.
     */
    public Investment flagForReconciliation(String note, Clock clock) {
        String merged = reconciliationNote == null || reconciliationNote.isBlank()
            ? note
            : reconciliationNote + "\n" + note;
        return toBuilder()
            .reconciliationRequired(true)
            .reconciliationNote(merged)
            .updatedAt(clock.instant())
            .build();
    }

    public boolean isPending() {
        return status == InvestmentStatus.PENDING;
    }

    public boolean isWithdrawable() {
        return status == InvestmentStatus.COMPLETED && withdrawalRequestId == null;
    }

    /**
     * Total return minus principal; zero until completed.
     */
    public BigDecimal profit() {
        if (actualReturn == null) {
            return BigDecimal.ZERO;
        }
        return actualReturn.subtract(amount);
    }

    private void requireStatus(InvestmentStatus expected, String action) {
        if (this.status != expected) {
            throw new InvalidTransitionException(String.format(
                "Cannot %s investment %s in %s status. Only %s investments can be %s.",
                action, id, status, expected, pastTense(action)), status);
        }
    }

    private static String pastTense(String action) {
        return switch (action) {
            case "activate" -> "activated";
            case "complete" -> "completed";
            case "cancel" -> "cancelled";
            default -> action;
        };
    }
}
