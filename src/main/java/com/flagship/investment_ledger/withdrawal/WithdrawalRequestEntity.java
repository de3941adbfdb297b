package com.flagship.investment_ledger.withdrawal;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for withdrawal requests.
 *
 * The linked investments are stored in withdrawal_investments, whose unique
 * constraint on investment_id backs the guarded link on the investments table.
 */
@Entity
@Table(name = "withdrawal_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WithdrawalRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "withdrawal_type", nullable = false, updatable = false, length = 20)
    private WithdrawalType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WithdrawalStatus status;

    @Column(name = "processed_date")
    private Instant processedDate;

    @Column(name = "admin_notes", columnDefinition = "TEXT")
    private String adminNotes;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "withdrawal_investments", joinColumns = @JoinColumn(name = "withdrawal_request_id"))
    @Column(name = "investment_id", nullable = false)
    private List<UUID> investmentIds = new ArrayList<>();

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

    static WithdrawalRequestEntity fromDomain(WithdrawalRequest request) {
        return new WithdrawalRequestEntity(
            request.getId(),
            request.getUserId(),
            request.getAmount(),
            request.getType(),
            request.getStatus(),
            request.getProcessedDate(),
            request.getAdminNotes(),
            request.getPaymentReference(),
            new ArrayList<>(request.getInvestmentIds()),
            null, // set by @PrePersist
            null
        );
    }

    public WithdrawalRequest toDomain() {
        return WithdrawalRequest.builder()
            .id(id)
            .userId(userId)
            .amount(amount)
            .type(type)
            .status(status)
            .processedDate(processedDate)
            .adminNotes(adminNotes)
            .paymentReference(paymentReference)
            .investmentIds(List.copyOf(investmentIds))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Amount, type and linked investments are fixed at creation.
     */
    void updateFromDomain(WithdrawalRequest request) {
        this.status = request.getStatus();
        this.processedDate = request.getProcessedDate();
        this.adminNotes = request.getAdminNotes();
        this.paymentReference = request.getPaymentReference();
    }
}
