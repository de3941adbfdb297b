package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.exception.InvalidTransitionException;
import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.inventory.InventoryAllocator;
import com.flagship.investment_ledger.inventory.InvestmentPackage;
import com.flagship.investment_ledger.inventory.OutOfStockException;
import com.flagship.investment_ledger.inventory.PackageKind;
import com.flagship.investment_ledger.inventory.PackageService;
import com.flagship.investment_ledger.inventory.PackageStatus;
import com.flagship.investment_ledger.investment.dto.CreateInvestmentRequest;
import com.flagship.investment_ledger.investment.dto.InvestmentSummary;
import com.flagship.investment_ledger.investment.event.InvestmentCancelledEvent;
import com.flagship.investment_ledger.investment.event.InvestmentCompletedEvent;
import com.flagship.investment_ledger.investment.update.InvestmentUpdate;
import com.flagship.investment_ledger.investment.update.InvestmentUpdateService;
import com.flagship.investment_ledger.ledger.LedgerPosting;
import com.flagship.investment_ledger.ledger.LedgerService;
import com.flagship.investment_ledger.ledger.TransactionType;
import com.flagship.investment_ledger.observability.CorrelationContext;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.outbox.AggregateTypes;
import com.flagship.investment_ledger.outbox.OutboxService;
import com.flagship.investment_ledger.payment.CurrencyCode;
import com.flagship.investment_ledger.payment.OutcomeSource;
import com.flagship.investment_ledger.payment.Payment;
import com.flagship.investment_ledger.payment.PaymentPersistenceService;
import com.flagship.investment_ledger.payment.PaymentReferences;
import com.flagship.investment_ledger.payment.gateway.GatewayCharge;
import com.flagship.investment_ledger.payment.gateway.GatewaySession;
import com.flagship.investment_ledger.payment.gateway.PaymentGateway;
import com.flagship.investment_ledger.payment.gateway.PaystackProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Investment lifecycle operations other than payment confirmation, which
 * goes through {@link PaymentOutcomeHandler}.
 *
 * Gateway calls are never made inside a database transaction: the checkout session is
 * opened first, then inventory, investment and payment are written in one unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestmentService {

    private final PackageService packageService;
    private final InventoryAllocator allocator;
    private final InvestmentPersistenceService investments;
    private final PaymentPersistenceService payments;
    private final IdempotencyService idempotencyService;
    private final PaymentGateway gateway;
    private final PaystackProperties gatewayProperties;
    private final PaymentOutcomeHandler outcomeHandler;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final InvestmentUpdateService updateService;
    private final InvestmentMetrics metrics;
    private final Clock clock;

    /**
     * Places an order: validates against the package, opens a gateway session and
     * stores the pending investment with its payment.
     *
     * @param idempotencyKey optional; a repeated key returns the original order
     * @throws OutOfStockException if the package cannot supply the requested slots
     */
    public Checkout create(UUID userId, CreateInvestmentRequest request, String idempotencyKey) {
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            Optional<Checkout> existing = replay(userId, idempotencyKey);
            if (existing.isPresent()) {
                return existing.get();
            }
        }

        InvestmentPackage pkg = packageService.getPackage(request.getPackageId());
        int units = resolveUnits(pkg, request.getUnits());
        validateOrder(pkg, request.getAmount(), units);

        Investment draft = Investment.pending(userId, pkg.getId(), request.getAmount(), units, false,
                keyed ? idempotencyKey : null, clock);
        CorrelationContext.put(CorrelationContext.INVESTMENT_ID_MDC_KEY, draft.getId());

        Payment payment = openPayment(draft, request.getEmail());

        Investment saved;
        try {
            saved = investments.createPending(draft, payment);
        } catch (OutOfStockException e) {
            metrics.recordInvestmentCreated(pkg.getKind().name(), "out_of_stock");
            throw e;
        } catch (DataIntegrityViolationException e) {
            if (keyed) {
                Optional<Checkout> concurrent = replay(userId, idempotencyKey);
                if (concurrent.isPresent()) {
                    log.info("Concurrent request with the same idempotency key won; returning its order");
                    return concurrent.get();
                }
            }
            throw e;
        }

        if (keyed) {
            idempotencyService.remember(idempotencyKey, saved.getId());
        }
        metrics.recordInvestmentCreated(pkg.getKind().name(), "success");
        log.info("Investment created: package={}, amount={}, units={}, slotHeld={}, reference={}",
                pkg.getId(), saved.getAmount(), units, saved.isSlotHeld(), payment.getReference());
        return new Checkout(saved, payment, false);
    }

    /**
     * Opens a fresh gateway session for a pending investment, for example after a failed charge.
     */
    public Payment newPaymentAttempt(UUID userId, UUID investmentId, String email) {
        Investment investment = getForUser(userId, investmentId);
        CorrelationContext.put(CorrelationContext.INVESTMENT_ID_MDC_KEY, investmentId);
        if (!investment.isPending()) {
            throw new InvalidTransitionException(
                "Payment attempts are only accepted for PENDING investments", investment.getStatus());
        }
        if (payments.hasSuccessfulPayment(investmentId)) {
            throw new IllegalStateException("Investment " + investmentId + " already has a successful payment");
        }

        Payment payment = investments.addPaymentAttempt(investmentId, openPayment(investment, email));
        log.info("New payment attempt opened: reference={}", payment.getReference());
        return payment;
    }

    /**
     * ACTIVE → COMPLETED once the term has ended. Computes the total return.
     */
    @Transactional
    public Investment complete(UUID userId, UUID investmentId) {
        CorrelationContext.put(CorrelationContext.INVESTMENT_ID_MDC_KEY, investmentId);

        Investment investment = lockOwned(userId, investmentId);
        InvestmentPackage pkg = packageService.getPackage(investment.getPackageId());

        Investment completed = investments.update(
            investment.complete(clock, pkg.totalReturnFor(investment.getAmount())));

        outboxService.saveEvent(AggregateTypes.INVESTMENT, completed.getId(),
                InvestmentCompletedEvent.EVENT_TYPE, InvestmentCompletedEvent.from(completed));
        metrics.recordTransition("completed");
        log.info("Investment completed: amount={}, actualReturn={}", completed.getAmount(), completed.getActualReturn());
        return completed;
    }

    /**
     * PENDING → CANCELLED while no payment has succeeded.
     *
     * Appends a REFUND entry for the full amount, releases held slots, fails open
     * payment attempts and keeps the investment as CANCELLED.
     */
    @Transactional
    public Investment cancel(UUID userId, UUID investmentId) {
        CorrelationContext.put(CorrelationContext.INVESTMENT_ID_MDC_KEY, investmentId);

        List<Payment> attempts = payments.lockForInvestment(investmentId);
        Investment investment = lockOwned(userId, investmentId);

        if (attempts.stream().anyMatch(Payment::isSuccessful)) {
            throw new InvalidTransitionException(
                "Investment " + investmentId + " has a successful payment and cannot be cancelled",
                investment.getStatus());
        }
        Investment cancelled = investment.cancel(clock);

        UUID ledgerTransactionId = ledgerService.append(LedgerPosting.builder()
            .userId(investment.getUserId())
            .investmentId(investmentId)
            .type(TransactionType.REFUND)
            .amount(investment.getAmount())
            .description("Refund for cancelled investment")
            .build());

        int released = 0;
        if (investment.isSlotHeld()) {
            allocator.release(investment.getPackageId(), investment.getUnits());
            released = investment.getUnits();
        }

        for (Payment attempt : attempts) {
            if (attempt.isPending()) {
                payments.update(attempt.fail("Investment cancelled", clock.instant()));
            }
        }

        Investment saved = investments.update(cancelled);
        outboxService.saveEvent(AggregateTypes.INVESTMENT, investmentId,
                InvestmentCancelledEvent.EVENT_TYPE, InvestmentCancelledEvent.from(saved, released, ledgerTransactionId));

        metrics.recordTransition("cancelled");
        log.info("Investment cancelled: refunded={}, slotsReleased={}", investment.getAmount(), released);
        return saved;
    }

    /**
     * Re-verifies the latest payment attempt with the gateway and applies the answer.
     */
    public ReconciliationResult reconcile(UUID investmentId) {
        CorrelationContext.put(CorrelationContext.INVESTMENT_ID_MDC_KEY, investmentId);
        investments.findById(investmentId)
            .orElseThrow(() -> NotFoundException.of("Investment", investmentId));
        Payment latest = payments.findLatestForInvestment(investmentId)
            .orElseThrow(() -> new NotFoundException("No payment attempts for investment " + investmentId));

        ReconciliationResult result = outcomeHandler.handle(
            gateway.verify(latest.getReference()).toOutcome(OutcomeSource.ADMIN_RECONCILE));
        log.info("Admin reconcile finished: reference={}, result={}", latest.getReference(), result);
        return result;
    }

    /**
     * Hard-deletes the user's cancelled investments. Ledger entries are kept.
     *
     * @return number of investments removed
     */
    public int purgeCancelled(UUID userId) {
        int removed = investments.deleteCancelled(userId);
        log.info("Purged {} cancelled investment(s) for user {}", removed, userId);
        return removed;
    }

    public Investment getForUser(UUID userId, UUID investmentId) {
        return investments.findForUser(investmentId, userId)
            .orElseThrow(() -> NotFoundException.of("Investment", investmentId));
    }

    public List<Investment> list(UUID userId, InvestmentStatus status) {
        return investments.findByUser(userId, status);
    }

    public List<Investment> withdrawable(UUID userId) {
        return investments.findWithdrawable(userId);
    }

    public Optional<Payment> latestPayment(UUID userId, UUID investmentId) {
        getForUser(userId, investmentId);
        return payments.findLatestForInvestment(investmentId);
    }

    public List<InvestmentUpdate> updates(UUID userId, UUID investmentId) {
        getForUser(userId, investmentId);
        return updateService.timeline(investmentId);
    }

    public InvestmentSummary summary(UUID userId) {
        List<Investment> all = investments.findByUser(userId, null);

        BigDecimal invested = BigDecimal.ZERO;
        BigDecimal returns = BigDecimal.ZERO;
        long pending = 0;
        long active = 0;
        long completed = 0;
        long cancelled = 0;
        for (Investment investment : all) {
            switch (investment.getStatus()) {
                case PENDING -> pending++;
                case ACTIVE -> {
                    active++;
                    invested = invested.add(investment.getAmount());
                }
                case COMPLETED -> {
                    completed++;
                    invested = invested.add(investment.getAmount());
                    returns = returns.add(investment.profit());
                }
                case CANCELLED -> cancelled++;
            }
        }

        return InvestmentSummary.builder()
            .totalInvested(invested)
            .totalReturns(returns)
            .totalPortfolioValue(invested.add(returns))
            .pendingCount(pending)
            .activeCount(active)
            .completedCount(completed)
            .cancelledCount(cancelled)
            .build();
    }

    private Investment lockOwned(UUID userId, UUID investmentId) {
        return investments.lock(investmentId)
            .filter(investment -> investment.getUserId().equals(userId))
            .orElseThrow(() -> NotFoundException.of("Investment", investmentId));
    }

    private Optional<Checkout> replay(UUID userId, String idempotencyKey) {
        Optional<UUID> existingId = idempotencyService.findInvestmentId(idempotencyKey);
        if (existingId.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }
        metrics.recordIdempotencyHit();

        Investment existing = investments.findById(existingId.get())
            .orElseThrow(() -> new IllegalStateException(
                "Investment found by idempotency key but not by ID: " + existingId.get()));
        if (!existing.getUserId().equals(userId)) {
            throw new IllegalArgumentException("Idempotency key already used by another request");
        }
        Payment payment = payments.findLatestForInvestment(existing.getId()).orElse(null);
        log.info("Idempotency key already used, returning investment {}", existing.getId());
        return Optional.of(new Checkout(existing, payment, true));
    }

    private Payment openPayment(Investment investment, String email) {
        CurrencyCode currency = CurrencyCode.fromString(gatewayProperties.getCurrency());
        String reference = PaymentReferences.forInvestment(investment.getId(), clock);
        CorrelationContext.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, reference);

        GatewaySession session = gateway.initialize(GatewayCharge.builder()
            .reference(reference)
            .amount(investment.getAmount())
            .currency(currency.name())
            .email(email)
            .metadata(Map.of(
                "investment_id", investment.getId().toString(),
                "user_id", investment.getUserId().toString()))
            .build());

        return Payment.pending(investment.getUserId(), investment.getId(), investment.getAmount(), currency,
                session.getReference() != null ? session.getReference() : reference,
                session.getAuthorizationUrl(), session.getAccessCode(), clock.instant());
    }

    private static int resolveUnits(InvestmentPackage pkg, Integer requested) {
        if (pkg.getKind() == PackageKind.DIRECT) {
            if (requested != null && requested != 1) {
                throw new IllegalArgumentException("Direct investments occupy exactly one slot");
            }
            return 1;
        }
        return requested != null ? requested : 1;
    }

    private static void validateOrder(InvestmentPackage pkg, BigDecimal amount, int units) {
        if (pkg.getStatus() != PackageStatus.ACTIVE) {
            throw OutOfStockException.inactive(pkg.getId());
        }
        if (!pkg.acceptsAmount(amount)) {
            throw new IllegalArgumentException(String.format(
                "Amount %s is outside the package range %s to %s",
                amount, pkg.getMinAmount(), pkg.getMaxAmount()));
        }
        pkg.checkAvailable(units);
    }
}
