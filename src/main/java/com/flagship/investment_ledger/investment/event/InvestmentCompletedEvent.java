package com.flagship.investment_ledger.investment.event;

import com.flagship.investment_ledger.investment.Investment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when an investment matures.
 */
@Value
public class InvestmentCompletedEvent implements InvestmentEvent {
    UUID eventId;
    UUID investmentId;
    UUID userId;
    BigDecimal amount;
    BigDecimal actualReturn;
    LocalDate completedDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvestmentCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static InvestmentCompletedEvent from(Investment investment) {
        return new InvestmentCompletedEvent(
            UUID.randomUUID(),
            investment.getId(),
            investment.getUserId(),
            investment.getAmount(),
            investment.getActualReturn(),
            investment.getCompletedDate(),
            Instant.now()
        );
    }
}
