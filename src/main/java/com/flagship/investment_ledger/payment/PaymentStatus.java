package com.flagship.investment_ledger.payment;

/**
 * Payment status.
 *
 * PENDING -> SUCCESS | FAILED. A FAILED payment may still become SUCCESS when the
 * gateway confirms it late; SUCCESS is terminal.
 */
public enum PaymentStatus {
    PENDING,
    SUCCESS,
    FAILED
}
