package com.flagship.investment_ledger.investment;

/**
 * What applying one payment outcome did.
 */
public enum ReconciliationResult {
    /** Payment confirmed and investment activated. */
    APPLIED,
    /** The payment had already reached a terminal state for this outcome; nothing changed. */
    ALREADY_PROCESSED,
    /** Gateway reported a failure; the payment is FAILED and the investment stays PENDING. */
    MARKED_FAILED,
    /** Gateway has no final answer yet. */
    PENDING,
    AMOUNT_MISMATCH,
    DUPLICATE_CHARGE,
    /** Money arrived for an investment that is no longer waiting for it. */
    INVESTMENT_NOT_PENDING,
    /** No slots left at confirmation time; flagged for manual reconciliation. */
    OUT_OF_STOCK;

    /**
     * True for outcomes that need an operator to look at the investment.
     */
    public boolean requiresReconciliation() {
        return this == AMOUNT_MISMATCH
            || this == DUPLICATE_CHARGE
            || this == INVESTMENT_NOT_PENDING
            || this == OUT_OF_STOCK;
    }
}
