package com.flagship.investment_ledger.investment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for investments.
 *
 * No setters: lifecycle fields change through {@link #updateFromDomain}.
 * The withdrawal link is never written here; it is set by the guarded
 * bulk update in {@link InvestmentRepository#linkToWithdrawal}.
 */
@Entity
@Table(name = "investments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvestmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "package_id", nullable = false, updatable = false)
    private UUID packageId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false)
    private int units;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvestmentStatus status;

    @Column(name = "slot_held", nullable = false)
    private boolean slotHeld;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "completed_date")
    private LocalDate completedDate;

    @Column(name = "actual_return", precision = 19, scale = 2)
    private BigDecimal actualReturn;

    @Column(name = "withdrawal_request_id", insertable = false, updatable = false)
    private UUID withdrawalRequestId;

    @Column(name = "reconciliation_required", nullable = false)
    private boolean reconciliationRequired;

    @Column(name = "reconciliation_note", columnDefinition = "TEXT")
    private String reconciliationNote;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

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

    static InvestmentEntity fromDomain(Investment investment) {
        return new InvestmentEntity(
            investment.getId(),
            investment.getUserId(),
            investment.getPackageId(),
            investment.getAmount(),
            investment.getUnits(),
            investment.getStatus(),
            investment.isSlotHeld(),
            investment.getStartDate(),
            investment.getEndDate(),
            investment.getCompletedDate(),
            investment.getActualReturn(),
            null,
            investment.isReconciliationRequired(),
            investment.getReconciliationNote(),
            investment.getIdempotencyKey(),
            null, // set by @PrePersist
            null
        );
    }

    public Investment toDomain() {
        return Investment.builder()
            .id(id)
            .userId(userId)
            .packageId(packageId)
            .amount(amount)
            .units(units)
            .status(status)
            .slotHeld(slotHeld)
            .startDate(startDate)
            .endDate(endDate)
            .completedDate(completedDate)
            .actualReturn(actualReturn)
            .withdrawalRequestId(withdrawalRequestId)
            .reconciliationRequired(reconciliationRequired)
            .reconciliationNote(reconciliationNote)
            .idempotencyKey(idempotencyKey)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    void updateFromDomain(Investment investment) {
        this.status = investment.getStatus();
        this.slotHeld = investment.isSlotHeld();
        this.startDate = investment.getStartDate();
        this.endDate = investment.getEndDate();
        this.completedDate = investment.getCompletedDate();
        this.actualReturn = investment.getActualReturn();
        this.reconciliationRequired = investment.isReconciliationRequired();
        this.reconciliationNote = investment.getReconciliationNote();
    }
}
