package com.flagship.investment_ledger.investment.event;

import com.flagship.investment_ledger.investment.Investment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a pending investment is cancelled and refunded.
 */
@Value
public class InvestmentCancelledEvent implements InvestmentEvent {
    UUID eventId;
    UUID investmentId;
    UUID userId;
    BigDecimal refundedAmount;
    int slotsReleased;
    UUID ledgerTransactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvestmentCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvestmentCancelledEvent from(Investment investment, int slotsReleased,
                                                UUID ledgerTransactionId) {
        return new InvestmentCancelledEvent(
            UUID.randomUUID(),
            investment.getId(),
            investment.getUserId(),
            investment.getAmount(),
            slotsReleased,
            ledgerTransactionId,
            Instant.now()
        );
    }
}
