package com.flagship.investment_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request to append one entry to the ledger.
 */
@Value
@Builder
public class LedgerPosting {
    UUID userId;
    UUID investmentId;
    UUID withdrawalRequestId;
    TransactionType type;
    BigDecimal amount;
    @Builder.Default
    TransactionStatus status = TransactionStatus.COMPLETED;
    String description;
    String paymentReference;
}
