package com.flagship.investment_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single money movement as recorded in the ledger.
 * Plain value object mapped by JDBC; rows are never updated or deleted.
 */
@Value
public class LedgerTransaction {
    UUID id;
    UUID userId;
    UUID investmentId;
    UUID withdrawalRequestId;
    TransactionType type;
    BigDecimal amount;
    TransactionStatus status;
    String description;
    String paymentReference;
    Instant createdAt;
    Long sequenceNumber;
}
