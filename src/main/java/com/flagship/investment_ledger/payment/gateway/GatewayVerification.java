package com.flagship.investment_ledger.payment.gateway;

import com.flagship.investment_ledger.payment.OutcomeSource;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import com.flagship.investment_ledger.payment.PaymentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What the gateway reports for a reference when asked directly.
 */
@Value
public class GatewayVerification {
    String reference;
    PaymentStatus status;
    String gatewayTransactionId;
    BigDecimal amount;
    String gatewayResponse;
    Instant paidAt;

    public PaymentOutcome toOutcome(OutcomeSource source) {
        return new PaymentOutcome(reference, status, gatewayTransactionId, amount, gatewayResponse, paidAt, source);
    }
}
