package com.flagship.investment_ledger.payment;

import com.flagship.investment_ledger.exception.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Payment domain object: one gateway charge attempt for an investment.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected with {@link InvalidTransitionException}
 * - State changes are immutable (a new Payment is returned)
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID userId;
    UUID investmentId;
    BigDecimal amount;
    CurrencyCode currency;
    PaymentStatus status;
    String reference;
    String gatewayTransactionId;
    String authorizationUrl;
    String accessCode;
    Instant paidAt;
    String failureReason;
    Map<String, Object> metadata;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING payment for an opened gateway session.
     */
    public static Payment pending(UUID userId, UUID investmentId, BigDecimal amount, CurrencyCode currency,
                                  String reference, String authorizationUrl, String accessCode, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Payment reference is required");
        }
        return Payment.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .investmentId(investmentId)
            .amount(amount)
            .currency(currency)
            .status(PaymentStatus.PENDING)
            .reference(reference)
            .authorizationUrl(authorizationUrl)
            .accessCode(accessCode)
            .metadata(Map.of())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Transitions to SUCCESS. Allowed from PENDING, and from FAILED when the
     * gateway confirms a charge after an earlier failure report.
     *
     * @param paidAt gateway's payment time; {@code now} when the gateway did not report one
     * @throws InvalidTransitionException if the payment already succeeded
     */
    public Payment succeed(String gatewayTransactionId, Instant paidAt, Instant now) {
        if (this.status == PaymentStatus.SUCCESS) {
            throw new InvalidTransitionException(
                String.format("Payment %s already succeeded", reference), status);
        }
        return toBuilder()
            .status(PaymentStatus.SUCCESS)
            .gatewayTransactionId(gatewayTransactionId != null ? gatewayTransactionId : this.gatewayTransactionId)
            .paidAt(paidAt != null ? paidAt : now)
            .failureReason(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Transitions to FAILED. Only valid from PENDING.
     *
     * @throws InvalidTransitionException if the payment is not PENDING
     */
    public Payment fail(String reason, Instant now) {
        if (this.status != PaymentStatus.PENDING) {
            throw new InvalidTransitionException(
                String.format("Cannot fail payment %s in %s status. Only PENDING payments can fail.",
                    reference, status), status);
        }
        return toBuilder()
            .status(PaymentStatus.FAILED)
            .failureReason(reason)
            .updatedAt(now)
            .build();
    }

    /**
     * Returns a copy with one metadata entry added or replaced.
     */
    public Payment withMetadata(String key, Object value, Instant now) {
        Map<String, Object> merged = new HashMap<>(metadata != null ? metadata : Map.of());
        merged.put(key, value);
        return toBuilder()
            .metadata(merged)
            .updatedAt(now)
            .build();
    }

    public Payment withGatewayTransactionId(String gatewayTransactionId) {
        if (gatewayTransactionId == null) {
            return this;
        }
        return toBuilder().gatewayTransactionId(gatewayTransactionId).build();
    }

    public boolean isSuccessful() {
        return status == PaymentStatus.SUCCESS;
    }

    public boolean isPending() {
        return status == PaymentStatus.PENDING;
    }

    /**
     * Checks if a transition from the current status to the target is allowed.
     */
    public boolean canTransitionTo(PaymentStatus targetStatus) {
        return switch (this.status) {
            case PENDING -> targetStatus == PaymentStatus.SUCCESS || targetStatus == PaymentStatus.FAILED;
            case FAILED -> targetStatus == PaymentStatus.SUCCESS;
            case SUCCESS -> false;
        };
    }
}
