package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.inventory.OutOfStockException;
import com.flagship.investment_ledger.inventory.SlotContentionException;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single entry point for payment outcomes, whether they come from the verify endpoint,
 * a webhook or an admin re-check.
 *
 * Runs outside any transaction so that each attempt of
 * {@link PaymentReconciliationService#apply} commits or rolls back on its own:
 * - lock contention on the package is retried once
 * - an out-of-stock confirmation rolls back and is then recorded in a separate transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentOutcomeHandler {

    static final int MAX_ATTEMPTS = 2;

    private final PaymentReconciliationService reconciliationService;
    private final InvestmentMetrics metrics;

    public ReconciliationResult handle(PaymentOutcome outcome) {
        String source = outcome.getSource() != null ? outcome.getSource().name() : null;

        for (int attempt = 1; ; attempt++) {
            try {
                ReconciliationResult result = metrics.timeReconciliation(() -> reconciliationService.apply(outcome));
                metrics.recordPaymentOutcome(source, result.name());
                log.info("Payment outcome applied: reference={}, status={}, source={}, result={}",
                        outcome.getReference(), outcome.getStatus(), source, result);
                return result;

            } catch (SlotContentionException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    metrics.recordPaymentOutcome(source, "contention");
                    throw e;
                }
                log.warn("Inventory contention while applying {}, retrying (attempt {} of {})",
                        outcome.getReference(), attempt, MAX_ATTEMPTS);

            } catch (OutOfStockException e) {
                reconciliationService.flagOutOfStock(outcome, e.getMessage());
                metrics.recordPaymentOutcome(source, ReconciliationResult.OUT_OF_STOCK.name());
                return ReconciliationResult.OUT_OF_STOCK;
            }
        }
    }
}
