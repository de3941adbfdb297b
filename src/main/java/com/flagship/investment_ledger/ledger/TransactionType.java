package com.flagship.investment_ledger.ledger;

public enum TransactionType {
    INVESTMENT,
    REFUND,
    REFERRAL_BONUS,
    WITHDRAWAL
}
