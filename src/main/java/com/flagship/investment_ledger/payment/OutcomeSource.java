package com.flagship.investment_ledger.payment;

/**
 * Where a payment outcome came from.
 */
public enum OutcomeSource {
    /** Client-triggered verification against the gateway. */
    VERIFY,
    /** Signed gateway webhook delivery. */
    WEBHOOK,
    /** Admin-triggered re-verification of a flagged investment. */
    ADMIN_RECONCILE
}
