package com.flagship.investment_ledger.investment.event;

import com.flagship.investment_ledger.investment.Investment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a confirmed payment moves an investment from PENDING to ACTIVE.
 * Carries the ledger entry written in the same transaction.
 */
@Value
public class InvestmentActivatedEvent implements InvestmentEvent {
    UUID eventId;
    UUID investmentId;
    UUID userId;
    UUID packageId;
    BigDecimal amount;
    String paymentReference;
    UUID ledgerTransactionId;
    LocalDate startDate;
    LocalDate endDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvestmentActivated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvestmentActivatedEvent from(Investment investment, String paymentReference,
                                                UUID ledgerTransactionId) {
        return new InvestmentActivatedEvent(
            UUID.randomUUID(),
            investment.getId(),
            investment.getUserId(),
            investment.getPackageId(),
            investment.getAmount(),
            paymentReference,
            ledgerTransactionId,
            investment.getStartDate(),
            investment.getEndDate(),
            Instant.now()
        );
    }
}
