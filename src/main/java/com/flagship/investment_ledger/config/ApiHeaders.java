package com.flagship.investment_ledger.config;

/**
 * Request headers understood by the REST API.
 * The caller identity is resolved upstream and forwarded in {@link #USER_ID}.
 */
public final class ApiHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String PAYSTACK_SIGNATURE = "X-Paystack-Signature";

    private ApiHeaders() {
    }
}
