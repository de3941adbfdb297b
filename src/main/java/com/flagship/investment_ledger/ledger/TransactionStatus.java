package com.flagship.investment_ledger.ledger;

public enum TransactionStatus {
    PENDING,
    COMPLETED
}
