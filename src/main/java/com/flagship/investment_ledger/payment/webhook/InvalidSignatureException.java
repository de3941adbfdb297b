package com.flagship.investment_ledger.payment.webhook;

/**
 * Webhook body did not carry a valid gateway signature.
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
