package com.flagship.investment_ledger.withdrawal.event;

import com.flagship.investment_ledger.withdrawal.WithdrawalRequest;
import com.flagship.investment_ledger.withdrawal.WithdrawalStatus;
import com.flagship.investment_ledger.withdrawal.WithdrawalType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published on creation and on every admin transition of a withdrawal request.
 */
@Value
public class WithdrawalStatusChangedEvent {
    UUID eventId;
    UUID withdrawalId;
    UUID userId;
    WithdrawalType type;
    WithdrawalStatus status;
    BigDecimal amount;
    String paymentReference;
    List<UUID> investmentIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalStatusChanged";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WithdrawalStatusChangedEvent from(WithdrawalRequest request) {
        return new WithdrawalStatusChangedEvent(
            UUID.randomUUID(),
            request.getId(),
            request.getUserId(),
            request.getType(),
            request.getStatus(),
            request.getAmount(),
            request.getPaymentReference(),
            request.getInvestmentIds(),
            Instant.now()
        );
    }
}
