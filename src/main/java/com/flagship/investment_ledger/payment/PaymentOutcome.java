package com.flagship.investment_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Normalized result of a gateway interaction, whichever path delivered it.
 * Verification and webhooks both reduce to this shape before any state is touched.
 */
@Value
public class PaymentOutcome {
    String reference;
    PaymentStatus status;
    String gatewayTransactionId;
    /** Amount confirmed by the gateway in major units; null when the gateway did not report it. */
    BigDecimal amount;
    String gatewayResponse;
    Instant paidAt;
    OutcomeSource source;

    public boolean isSuccess() {
        return status == PaymentStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == PaymentStatus.FAILED;
    }
}
