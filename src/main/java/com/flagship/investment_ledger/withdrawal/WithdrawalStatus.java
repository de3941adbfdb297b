package com.flagship.investment_ledger.withdrawal;

/**
 * Withdrawal request states.
 *
 * - PENDING → APPROVED | REJECTED
 * - APPROVED → COMPLETED | FAILED
 * - FAILED → APPROVED (retry)
 */
public enum WithdrawalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    COMPLETED,
    FAILED
}
