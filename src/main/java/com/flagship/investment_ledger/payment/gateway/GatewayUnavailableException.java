package com.flagship.investment_ledger.payment.gateway;

/**
 * The payment gateway could not be reached, timed out, or answered with an error.
 * No local state is written when this is raised.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
