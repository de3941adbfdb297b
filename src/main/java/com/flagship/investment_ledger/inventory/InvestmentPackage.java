package com.flagship.investment_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Investment package domain object.
 *
 * Slot accounting rules:
 * - 0 <= availableSlots <= totalSlots at all times
 * - Taking slots from an inactive or exhausted package is rejected
 * - Returning slots can never push availability above the total
 *
 * State changes are immutable (a new InvestmentPackage is returned).
 */
@Value
public class InvestmentPackage {
    UUID id;
    String name;
    PackageKind kind;
    String category;
    PackageStatus status;
    int totalSlots;
    int availableSlots;
    BigDecimal minAmount;
    BigDecimal maxAmount;
    BigDecimal returnRate;
    int durationDays;
    ReservationMode reservationMode;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE package with all slots available.
     *
     * @param reservationMode may be null, in which case the kind's default applies
     */
    public static InvestmentPackage create(String name, PackageKind kind, String category,
                                           int totalSlots, BigDecimal minAmount, BigDecimal maxAmount,
                                           BigDecimal returnRate, int durationDays,
                                           ReservationMode reservationMode) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Package name is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Package kind is required");
        }
        if (totalSlots <= 0) {
            throw new IllegalArgumentException("Total slots must be positive");
        }
        if (minAmount == null || minAmount.signum() <= 0) {
            throw new IllegalArgumentException("Minimum amount must be positive");
        }
        if (maxAmount == null || maxAmount.compareTo(minAmount) < 0) {
            throw new IllegalArgumentException("Maximum amount must not be below the minimum amount");
        }
        if (returnRate == null || returnRate.signum() < 0) {
            throw new IllegalArgumentException("Return rate must not be negative");
        }
        if (durationDays <= 0) {
            throw new IllegalArgumentException("Duration must be at least one day");
        }
        Instant now = Instant.now();
        return new InvestmentPackage(
            UUID.randomUUID(),
            name,
            kind,
            category,
            PackageStatus.ACTIVE,
            totalSlots,
            totalSlots,
            minAmount,
            maxAmount,
            returnRate,
            durationDays,
            reservationMode != null ? reservationMode : kind.defaultReservationMode(),
            now,
            now
        );
    }

    /**
     * Verifies that {@code units} slots could be taken right now, without taking them.
     *
     * @throws OutOfStockException if the package is inactive or has too few slots
     */
    public void checkAvailable(int units) {
        if (units <= 0) {
            throw new IllegalArgumentException("Units must be positive");
        }
        if (status != PackageStatus.ACTIVE) {
            throw OutOfStockException.inactive(id);
        }
        if (availableSlots < units) {
            throw OutOfStockException.insufficient(id, units, availableSlots);
        }
    }

    /**
     * @return New package with {@code units} fewer available slots
     * @throws OutOfStockException if the package is inactive or has too few slots
     */
    public InvestmentPackage takeSlots(int units) {
        checkAvailable(units);
        return withAvailableSlots(availableSlots - units);
    }

    /**
     * @return New package with {@code units} more available slots
     * @throws IllegalStateException if availability would exceed the total
     */
    public InvestmentPackage returnSlots(int units) {
        if (units <= 0) {
            throw new IllegalArgumentException("Units must be positive");
        }
        if (availableSlots + units > totalSlots) {
            throw new IllegalStateException(String.format(
                "Cannot return %d slot(s) to package %s: %d of %d already available",
                units, id, availableSlots, totalSlots));
        }
        return withAvailableSlots(availableSlots + units);
    }

    public boolean acceptsAmount(BigDecimal amount) {
        return amount != null
            && amount.compareTo(minAmount) >= 0
            && amount.compareTo(maxAmount) <= 0;
    }

    public boolean reservesAtOrder() {
        return reservationMode == ReservationMode.AT_ORDER;
    }

    public LocalDate maturityDate(LocalDate startDate) {
        return startDate.plusDays(durationDays);
    }

    /**
     * Principal plus the flat term return: amount * (1 + returnRate / 100), half-even to 2 places.
     */
    public BigDecimal totalReturnFor(BigDecimal amount) {
        BigDecimal multiplier = BigDecimal.ONE.add(
            returnRate.divide(BigDecimal.valueOf(100), 10, RoundingMode.HALF_EVEN));
        return amount.multiply(multiplier).setScale(2, RoundingMode.HALF_EVEN);
    }

    public int filledSlots() {
        return totalSlots - availableSlots;
    }

    private InvestmentPackage withAvailableSlots(int newAvailable) {
        return new InvestmentPackage(
            id, name, kind, category, status,
            totalSlots, newAvailable,
            minAmount, maxAmount, returnRate, durationDays, reservationMode,
            createdAt, Instant.now()
        );
    }
}
