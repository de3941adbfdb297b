package com.flagship.investment_ledger.investment.update;

public enum UpdateType {
    PAYMENT_CONFIRMED,
    MATURED,
    CANCELLED,
    WITHDRAWAL_REQUESTED,
    WITHDRAWAL_PAID
}
