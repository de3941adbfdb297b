package com.flagship.investment_ledger.investment;

/**
 * Investment lifecycle states.
 *
 * Allowed transitions:
 * - PENDING → ACTIVE (payment confirmed)
 * - PENDING → CANCELLED (cancelled before any payment succeeded)
 * - ACTIVE → COMPLETED (matured)
 *
 * COMPLETED and CANCELLED are terminal.
 */
public enum InvestmentStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    CANCELLED
}
