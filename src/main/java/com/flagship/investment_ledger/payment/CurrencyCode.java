package com.flagship.investment_ledger.payment;

/**
 * Currencies the payment gateway settles in.
 */
public enum CurrencyCode {
    NGN,
    GHS,
    ZAR,
    KES,
    USD;

    public static CurrencyCode fromString(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency code is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency code: " + code);
        }
    }
}
