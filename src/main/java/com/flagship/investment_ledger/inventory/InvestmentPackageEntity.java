package com.flagship.investment_ledger.inventory;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for investment packages.
 *
 * No setters: slot counts only change through {@link #updateFromDomain},
 * which the {@link InventoryAllocator} calls while holding the row lock.
 */
@Entity
@Table(name = "investment_packages")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvestmentPackageEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PackageKind kind;

    @Column(length = 100)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PackageStatus status;

    @Column(name = "total_slots", nullable = false)
    private int totalSlots;

    @Column(name = "available_slots", nullable = false)
    private int availableSlots;

    @Column(name = "min_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal minAmount;

    @Column(name = "max_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal maxAmount;

    @Column(name = "return_rate", nullable = false, precision = 9, scale = 4)
    private BigDecimal returnRate;

    @Column(name = "duration_days", nullable = false)
    private int durationDays;

    @Enumerated(EnumType.STRING)
    @Column(name = "reservation_mode", nullable = false, length = 20)
    private ReservationMode reservationMode;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static InvestmentPackageEntity fromDomain(InvestmentPackage pkg) {
        return new InvestmentPackageEntity(
            pkg.getId(),
            pkg.getName(),
            pkg.getKind(),
            pkg.getCategory(),
            pkg.getStatus(),
            pkg.getTotalSlots(),
            pkg.getAvailableSlots(),
            pkg.getMinAmount(),
            pkg.getMaxAmount(),
            pkg.getReturnRate(),
            pkg.getDurationDays(),
            pkg.getReservationMode(),
            null, // set by @PrePersist
            null
        );
    }

    public InvestmentPackage toDomain() {
        return new InvestmentPackage(
            id,
            name,
            kind,
            category,
            status,
            totalSlots,
            availableSlots,
            minAmount,
            maxAmount,
            returnRate,
            durationDays,
            reservationMode,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the mutable slot and status fields from the domain object.
     * Pricing, kind and duration are fixed once the package exists.
     */
    void updateFromDomain(InvestmentPackage pkg) {
        this.status = pkg.getStatus();
        this.availableSlots = pkg.getAvailableSlots();
    }
}
