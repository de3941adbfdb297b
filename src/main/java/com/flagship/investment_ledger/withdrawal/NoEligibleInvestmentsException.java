package com.flagship.investment_ledger.withdrawal;

/**
 * No completed, unclaimed investment matched the withdrawal request.
 */
public class NoEligibleInvestmentsException extends RuntimeException {

    public NoEligibleInvestmentsException(String message) {
        super(message);
    }
}
