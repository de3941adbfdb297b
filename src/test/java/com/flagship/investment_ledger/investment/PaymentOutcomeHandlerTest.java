package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.inventory.OutOfStockException;
import com.flagship.investment_ledger.inventory.SlotContentionException;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.payment.OutcomeSource;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import com.flagship.investment_ledger.payment.PaymentStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentOutcomeHandlerTest {

    @Mock
    private PaymentReconciliationService reconciliationService;

    private SimpleMeterRegistry registry;
    private PaymentOutcomeHandler handler;

    private final PaymentOutcome outcome = new PaymentOutcome("INV_h_1", PaymentStatus.SUCCESS, "trx",
        new BigDecimal("100.00"), "Approved", null, OutcomeSource.VERIFY);

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        handler = new PaymentOutcomeHandler(reconciliationService, new InvestmentMetrics(registry));
    }

    private static SlotContentionException contention() {
        return new SlotContentionException(UUID.randomUUID(), new PessimisticLockingFailureException("lock timeout"));
    }

    @Test
    @DisplayName("Result of the reconciliation is returned and counted by source")
    void returnsResult() {
        when(reconciliationService.apply(outcome)).thenReturn(ReconciliationResult.APPLIED);

        assertEquals(ReconciliationResult.APPLIED, handler.handle(outcome));
        assertEquals(1.0, registry.counter("payments.outcomes", "source", "VERIFY", "result", "APPLIED").count());
    }

    @Test
    @DisplayName("Lock contention is retried once in a fresh attempt")
    void retriesContentionOnce() {
        when(reconciliationService.apply(outcome))
            .thenThrow(contention())
            .thenReturn(ReconciliationResult.APPLIED);

        assertEquals(ReconciliationResult.APPLIED, handler.handle(outcome));
        verify(reconciliationService, times(2)).apply(outcome);
    }

    @Test
    @DisplayName("Contention on the retry too is surfaced")
    void contentionTwice() {
        when(reconciliationService.apply(outcome)).thenThrow(contention(), contention());

        assertThrows(SlotContentionException.class, () -> handler.handle(outcome));
        verify(reconciliationService, times(PaymentOutcomeHandler.MAX_ATTEMPTS)).apply(outcome);
    }

    @Test
    @DisplayName("Out of stock is flagged in a separate step and reported")
    void outOfStockFlagged() {
        OutOfStockException e = OutOfStockException.insufficient(UUID.randomUUID(), 1, 0);
        when(reconciliationService.apply(outcome)).thenThrow(e);

        assertEquals(ReconciliationResult.OUT_OF_STOCK, handler.handle(outcome));
        verify(reconciliationService).flagOutOfStock(outcome, e.getMessage());
    }
}
