package com.flagship.investment_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID and MDC keys shared by request handling, reconciliation and consumers.
 *
 * The correlation ID comes from the {@code X-Correlation-ID} header or is generated,
 * and is attached to every log line through MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String INVESTMENT_ID_MDC_KEY = "investmentId";
    public static final String PAYMENT_REFERENCE_MDC_KEY = "paymentReference";
    public static final String WITHDRAWAL_ID_MDC_KEY = "withdrawalId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts a value in MDC, ignoring nulls.
     */
    public static void put(String key, Object value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    /**
     * Removes the domain keys; the correlation ID is owned by the request filter.
     */
    public static void clearDomainKeys() {
        MDC.remove(INVESTMENT_ID_MDC_KEY);
        MDC.remove(PAYMENT_REFERENCE_MDC_KEY);
        MDC.remove(WITHDRAWAL_ID_MDC_KEY);
    }
}
