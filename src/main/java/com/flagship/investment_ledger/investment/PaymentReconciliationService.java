package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.inventory.InventoryAllocator;
import com.flagship.investment_ledger.inventory.InvestmentPackage;
import com.flagship.investment_ledger.investment.event.InvestmentActivatedEvent;
import com.flagship.investment_ledger.ledger.LedgerPosting;
import com.flagship.investment_ledger.ledger.LedgerService;
import com.flagship.investment_ledger.ledger.TransactionType;
import com.flagship.investment_ledger.observability.CorrelationContext;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.outbox.AggregateTypes;
import com.flagship.investment_ledger.outbox.OutboxService;
import com.flagship.investment_ledger.payment.Payment;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import com.flagship.investment_ledger.payment.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a normalized {@link PaymentOutcome} to payment, investment, inventory and ledger.
 *
 * One call is one transaction. Rows are locked payment first, then investment, then
 * package (inside the allocator), the same order every other writer uses.
 *
 * Replays are detected from current state rather than from a delivery log:
 * - payment already SUCCESS: nothing to do
 * - failure for a payment that is no longer PENDING: nothing to do
 * - a reconciliation case already recorded in the payment metadata: nothing to do
 *
 * Activation writes payment SUCCESS, the slot commit, investment ACTIVE, the INVESTMENT
 * ledger entry and the outbox event together; any failure rolls all of them back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentReconciliationService {

    static final String META_AMOUNT_MISMATCH = "amount_mismatch";
    static final String META_DUPLICATE_CHARGE = "duplicate_charge";
    static final String META_OUT_OF_STOCK = "out_of_stock";
    static final String META_LATE_PAYMENT = "late_payment";
    static final String META_GATEWAY_RESPONSE = "gateway_response";

    private final PaymentPersistenceService payments;
    private final InvestmentPersistenceService investments;
    private final InventoryAllocator allocator;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final InvestmentMetrics metrics;
    private final Clock clock;

    /**
     * @throws NotFoundException if no payment carries the outcome's reference
     * @throws com.flagship.investment_ledger.inventory.OutOfStockException if slots ran out (transaction rolled back)
     * @throws com.flagship.investment_ledger.inventory.SlotContentionException if the package lock wait timed out
     */
    @Transactional
    public ReconciliationResult apply(PaymentOutcome outcome) {
        CorrelationContext.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, outcome.getReference());

        Payment payment = payments.lockByReference(outcome.getReference())
            .orElseThrow(() -> NotFoundException.of("Payment", outcome.getReference()));
        CorrelationContext.put(CorrelationContext.INVESTMENT_ID_MDC_KEY, payment.getInvestmentId());

        if (payment.isSuccessful()) {
            log.info("Outcome replay for already successful payment: source={}", outcome.getSource());
            return ReconciliationResult.ALREADY_PROCESSED;
        }
        if (outcome.isFailure()) {
            return applyFailure(payment, outcome);
        }
        if (!outcome.isSuccess()) {
            log.debug("Gateway reports payment still pending: source={}", outcome.getSource());
            return ReconciliationResult.PENDING;
        }
        return applySuccess(payment, outcome);
    }

    /**
     * Records an out-of-stock confirmation after {@link #apply} rolled back.
     * The investment stays PENDING and is flagged for manual reconciliation.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void flagOutOfStock(PaymentOutcome outcome, String reason) {
        Optional<Payment> locked = payments.lockByReference(outcome.getReference());
        if (locked.isEmpty()) {
            return;
        }
        Payment payment = locked.get();
        if (payment.isSuccessful() || payment.getMetadata().containsKey(META_OUT_OF_STOCK)) {
            return;
        }

        payments.update(payment
            .withGatewayTransactionId(outcome.getGatewayTransactionId())
            .withMetadata(META_OUT_OF_STOCK, reason, clock.instant()));

        if (payment.getInvestmentId() != null) {
            investments.lock(payment.getInvestmentId())
                .filter(Investment::isPending)
                .ifPresent(investment -> investments.update(investment.flagForReconciliation(String.format(
                    "Payment %s confirmed but no slots were available: %s", payment.getReference(), reason), clock)));
        }
        log.warn("Payment confirmed without available slots; investment flagged for reconciliation: {}", reason);
    }

    private ReconciliationResult applyFailure(Payment payment, PaymentOutcome outcome) {
        if (!payment.isPending()) {
            return ReconciliationResult.ALREADY_PROCESSED;
        }
        String reason = outcome.getGatewayResponse() != null ? outcome.getGatewayResponse() : "Payment failed";
        payments.update(payment.withGatewayTransactionId(outcome.getGatewayTransactionId()).fail(reason, clock.instant()));
        log.info("Payment marked FAILED: reason={}", reason);
        return ReconciliationResult.MARKED_FAILED;
    }

    private ReconciliationResult applySuccess(Payment payment, PaymentOutcome outcome) {
        Optional<Investment> locked = payment.getInvestmentId() != null
            ? investments.lock(payment.getInvestmentId())
            : Optional.empty();

        if (locked.isEmpty()) {
            payments.update(payment
                .succeed(outcome.getGatewayTransactionId(), outcome.getPaidAt(), clock.instant())
                .withMetadata(META_LATE_PAYMENT, "Investment no longer exists", clock.instant()));
            log.warn("Payment succeeded for a removed investment; manual refund required");
            return ReconciliationResult.INVESTMENT_NOT_PENDING;
        }
        Investment investment = locked.get();

        if (outcome.getAmount() != null && outcome.getAmount().compareTo(payment.getAmount()) != 0) {
            return recordAmountMismatch(payment, investment, outcome);
        }
        if (payments.hasOtherSuccessfulPayment(investment.getId(), payment.getId())) {
            return recordDuplicateCharge(payment, investment, outcome);
        }
        if (!investment.isPending()) {
            payments.update(payment
                .succeed(outcome.getGatewayTransactionId(), outcome.getPaidAt(), clock.instant())
                .withMetadata(META_LATE_PAYMENT, "Investment was " + investment.getStatus(), clock.instant()));
            investments.update(investment.flagForReconciliation(String.format(
                "Payment %s succeeded while investment was %s; refund required",
                payment.getReference(), investment.getStatus()), clock));
            log.warn("Payment succeeded for a {} investment; flagged for reconciliation", investment.getStatus());
            return ReconciliationResult.INVESTMENT_NOT_PENDING;
        }

        return activate(payment, investment, outcome);
    }

    private ReconciliationResult activate(Payment payment, Investment investment, PaymentOutcome outcome) {
        InvestmentPackage pkg = allocator.commit(investment.getPackageId(), investment.getUnits(), investment.isSlotHeld());

        Payment paid = payment.succeed(outcome.getGatewayTransactionId(), outcome.getPaidAt(), clock.instant());
        if (outcome.getGatewayResponse() != null) {
            paid = paid.withMetadata(META_GATEWAY_RESPONSE, outcome.getGatewayResponse(), clock.instant());
        }
        payments.update(paid);

        Investment active = investments.update(investment.activate(clock, pkg.getDurationDays()));

        UUID ledgerTransactionId = ledgerService.append(LedgerPosting.builder()
            .userId(active.getUserId())
            .investmentId(active.getId())
            .type(TransactionType.INVESTMENT)
            .amount(active.getAmount())
            .description("Investment in " + pkg.getName())
            .paymentReference(payment.getReference())
            .build());

        outboxService.saveEvent(AggregateTypes.INVESTMENT, active.getId(),
                InvestmentActivatedEvent.EVENT_TYPE,
                InvestmentActivatedEvent.from(active, payment.getReference(), ledgerTransactionId));

        metrics.recordTransition("activated");
        log.info("Investment activated: amount={}, endDate={}, source={}",
                active.getAmount(), active.getEndDate(), outcome.getSource());
        return ReconciliationResult.APPLIED;
    }

    private ReconciliationResult recordAmountMismatch(Payment payment, Investment investment, PaymentOutcome outcome) {
        if (payment.getMetadata().containsKey(META_AMOUNT_MISMATCH)) {
            return ReconciliationResult.AMOUNT_MISMATCH;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expected", payment.getAmount().toPlainString());
        details.put("received", outcome.getAmount().toPlainString());

        payments.update(payment
            .withGatewayTransactionId(outcome.getGatewayTransactionId())
            .withMetadata(META_AMOUNT_MISMATCH, details, clock.instant()));
        investments.update(investment.flagForReconciliation(String.format(
            "Payment %s confirmed %s but %s was expected",
            payment.getReference(), outcome.getAmount(), payment.getAmount()), clock));

        log.warn("Confirmed amount {} differs from expected {}; not applied",
                outcome.getAmount(), payment.getAmount());
        return ReconciliationResult.AMOUNT_MISMATCH;
    }

    private ReconciliationResult recordDuplicateCharge(Payment payment, Investment investment, PaymentOutcome outcome) {
        if (payment.getMetadata().containsKey(META_DUPLICATE_CHARGE)) {
            return ReconciliationResult.DUPLICATE_CHARGE;
        }
        Payment recorded = payment
            .withGatewayTransactionId(outcome.getGatewayTransactionId())
            .withMetadata(META_DUPLICATE_CHARGE,
                outcome.getGatewayTransactionId() != null ? outcome.getGatewayTransactionId() : "unknown",
                clock.instant());
        if (recorded.isPending()) {
            recorded = recorded.fail("Duplicate charge for an investment that is already paid", clock.instant());
        }
        payments.update(recorded);
        investments.update(investment.flagForReconciliation(String.format(
            "Second successful charge %s for an already paid investment; refund required",
            payment.getReference()), clock));

        log.warn("Duplicate successful charge recorded; investment flagged for reconciliation");
        return ReconciliationResult.DUPLICATE_CHARGE;
    }
}
