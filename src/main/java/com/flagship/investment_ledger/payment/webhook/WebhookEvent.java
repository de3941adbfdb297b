package com.flagship.investment_ledger.payment.webhook;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Parsed Paystack webhook envelope: {@code {"event": "...", "data": {...}}}.
 */
@Value
public class WebhookEvent {
    public static final String CHARGE_SUCCESS = "charge.success";
    public static final String CHARGE_FAILED = "charge.failed";

    String event;
    String reference;
    String status;
    String gatewayTransactionId;
    BigDecimal amount;
    String gatewayResponse;
    Instant paidAt;

    public boolean isChargeEvent() {
        return CHARGE_SUCCESS.equals(event) || CHARGE_FAILED.equals(event);
    }
}
