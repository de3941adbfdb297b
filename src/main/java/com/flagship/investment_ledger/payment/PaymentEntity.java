package com.flagship.investment_ledger.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA Entity for gateway payments.
 *
 * Key design principles:
 * - No setters: state only changes through {@link #updateFromDomain}
 * - Identity, owner, amount and reference are updatable = false
 * - The reference is unique; a partial unique index allows at most one
 *   SUCCESS payment per investment
 * - The investment link is cleared by the database when a cancelled
 *   investment is purged
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "investment_id", updatable = false)
    private UUID investmentId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(nullable = false, unique = true, updatable = false, length = 100)
    private String reference;

    @Column(name = "gateway_transaction_id", length = 100)
    private String gatewayTransactionId;

    @Column(name = "authorization_url", columnDefinition = "TEXT", updatable = false)
    private String authorizationUrl;

    @Column(name = "access_code", length = 100, updatable = false)
    private String accessCode;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

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

    /**
     * Controlled factory: the only way to create PaymentEntity instances.
     */
    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getUserId(),
            payment.getInvestmentId(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getStatus(),
            payment.getReference(),
            payment.getGatewayTransactionId(),
            payment.getAuthorizationUrl(),
            payment.getAccessCode(),
            payment.getPaidAt(),
            payment.getFailureReason(),
            copyOf(payment.getMetadata()),
            null, // set by @PrePersist
            null
        );
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .userId(userId)
            .investmentId(investmentId)
            .amount(amount)
            .currency(currency)
            .status(status)
            .reference(reference)
            .gatewayTransactionId(gatewayTransactionId)
            .authorizationUrl(authorizationUrl)
            .accessCode(accessCode)
            .paidAt(paidAt)
            .failureReason(failureReason)
            .metadata(copyOf(metadata))
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Updates the mutable fields from a domain object.
     * Identity, owner, amount and reference cannot change.
     */
    void updateFromDomain(Payment payment) {
        this.status = payment.getStatus();
        this.gatewayTransactionId = payment.getGatewayTransactionId();
        this.paidAt = payment.getPaidAt();
        this.failureReason = payment.getFailureReason();
        this.metadata = copyOf(payment.getMetadata());
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source != null ? new HashMap<>(source) : new HashMap<>();
    }
}
