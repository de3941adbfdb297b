package com.flagship.investment_ledger.withdrawal;

public enum WithdrawalType {
    /** Profit only; principal stays with the platform. */
    INTEREST,
    /** Profit only, earmarked for a new investment. */
    REINVEST,
    /** Principal plus profit. */
    FULL
}
