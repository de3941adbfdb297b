package com.flagship.investment_ledger.outbox;

/**
 * Aggregate type names written to the outbox and carried to consumers.
 */
public final class AggregateTypes {

    public static final String INVESTMENT = "Investment";
    public static final String WITHDRAWAL = "Withdrawal";

    private AggregateTypes() {
    }
}
