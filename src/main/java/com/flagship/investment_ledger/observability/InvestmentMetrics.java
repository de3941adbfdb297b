package com.flagship.investment_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for investment, payment and withdrawal operations.
 *
 * Metrics exposed:
 * - investments.created: orders placed, tagged by package kind and outcome
 * - investments.transitions: lifecycle transitions (activated, completed, cancelled)
 * - payments.outcomes: reconciled gateway outcomes, tagged by source and result
 * - webhooks.rejected: webhook calls with an invalid signature
 * - gateway.latency: gateway call latency by operation and outcome
 * - inventory.contention / inventory.out_of_stock: allocator failures
 * - withdrawals.actions: withdrawal creation and admin actions
 * - reconciliation.duration: time spent applying one payment outcome
 */
@Component
public class InvestmentMetrics {

    private final MeterRegistry registry;

    private final Counter signatureRejections;
    private final Counter slotContention;
    private final Counter outOfStock;
    private final Timer reconciliationTimer;

    public InvestmentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.signatureRejections = Counter.builder("webhooks.rejected")
                .description("Webhook deliveries rejected for an invalid signature")
                .register(registry);

        this.slotContention = Counter.builder("inventory.contention")
                .description("Inventory lock waits that timed out")
                .register(registry);

        this.outOfStock = Counter.builder("inventory.out_of_stock")
                .description("Slot requests refused for lack of availability")
                .register(registry);

        this.reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to apply a payment outcome")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordInvestmentCreated(String kind, String outcome) {
        registry.counter("investments.created",
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransition(String transition) {
        registry.counter("investments.transitions",
                "transition", sanitizeTag(transition)
        ).increment();
    }

    public void recordPaymentOutcome(String source, String result) {
        registry.counter("payments.outcomes",
                "source", sanitizeTag(source),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordSignatureRejected() {
        signatureRejections.increment();
    }

    public void recordSlotContention() {
        slotContention.increment();
    }

    public void recordOutOfStock() {
        outOfStock.increment();
    }

    public void recordGatewayCall(String operation, String outcome, long durationMs) {
        registry.timer("gateway.latency",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordWithdrawalAction(String action, String outcome) {
        registry.counter("withdrawals.actions",
                "action", sanitizeTag(action),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public <T> T timeReconciliation(Supplier<T> operation) {
        return reconciliationTimer.record(operation);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
