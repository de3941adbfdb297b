package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.investment.Investment;
import com.flagship.investment_ledger.investment.InvestmentPersistenceService;
import com.flagship.investment_ledger.ledger.LedgerPosting;
import com.flagship.investment_ledger.ledger.LedgerService;
import com.flagship.investment_ledger.ledger.TransactionType;
import com.flagship.investment_ledger.observability.CorrelationContext;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.outbox.AggregateTypes;
import com.flagship.investment_ledger.outbox.OutboxService;
import com.flagship.investment_ledger.withdrawal.event.WithdrawalStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Withdrawal requests over completed investments.
 *
 * Creation locks the user's unclaimed completed investments, so two overlapping
 * requests serialize and the second sees only what the first left unclaimed.
 * The link itself is guarded on {@code withdrawal_request_id IS NULL}; a short
 * count aborts the transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private final InvestmentPersistenceService investments;
    private final WithdrawalPersistenceService withdrawals;
    private final WithdrawalAmountCalculator calculator;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final InvestmentMetrics metrics;
    private final Clock clock;

    /**
     * Creates a PENDING request over the given investments, or over every eligible
     * investment when {@code requestedIds} is empty.
     *
     * @throws NoEligibleInvestmentsException if none of the requested investments is
     *         completed and unclaimed
     */
    @Transactional
    public WithdrawalRequest create(UUID userId, WithdrawalType type, Collection<UUID> requestedIds) {
        List<Investment> eligible = investments.lockWithdrawable(userId);
        List<Investment> selected = select(eligible, requestedIds);
        if (selected.isEmpty()) {
            metrics.recordWithdrawalAction("create", "no_eligible");
            throw new NoEligibleInvestmentsException(
                "No completed, unclaimed investments available for withdrawal");
        }

        List<UUID> ids = selected.stream().map(Investment::getId).toList();
        WithdrawalRequest request = withdrawals.create(
            WithdrawalRequest.create(userId, type, calculator.calculate(type, selected), ids, Instant.now(clock)));
        CorrelationContext.put(CorrelationContext.WITHDRAWAL_ID_MDC_KEY, request.getId());

        int linked = investments.linkToWithdrawal(request.getId(), ids);
        if (linked != ids.size()) {
            throw new IllegalStateException(String.format(
                "Linked %d of %d investments to withdrawal %s; another withdrawal claimed the rest",
                linked, ids.size(), request.getId()));
        }

        publish(request);
        metrics.recordWithdrawalAction("create", "success");
        log.info("Withdrawal requested: type={}, amount={}, investments={}", type, request.getAmount(), ids.size());
        return request;
    }

    /**
     * Applies an admin action. MARK_PAID appends the WITHDRAWAL ledger entry.
     */
    @Transactional
    public WithdrawalRequest apply(UUID withdrawalId, WithdrawalAction action, String note) {
        CorrelationContext.put(CorrelationContext.WITHDRAWAL_ID_MDC_KEY, withdrawalId);
        WithdrawalRequest current = withdrawals.lock(withdrawalId)
            .orElseThrow(() -> NotFoundException.of("Withdrawal request", withdrawalId));

        WithdrawalRequest next;
        try {
            next = current.apply(action, note, Instant.now(clock));
        } catch (RuntimeException e) {
            metrics.recordWithdrawalAction(action.path(), "rejected");
            throw e;
        }

        if (action == WithdrawalAction.MARK_PAID) {
            ledgerService.append(LedgerPosting.builder()
                .userId(next.getUserId())
                .withdrawalRequestId(next.getId())
                .type(TransactionType.WITHDRAWAL)
                .amount(next.getAmount())
                .description(next.getType() + " withdrawal paid out")
                .paymentReference(next.getPaymentReference())
                .build());
        }

        WithdrawalRequest saved = withdrawals.update(next);
        publish(saved);
        metrics.recordWithdrawalAction(action.path(), "success");
        log.info("Withdrawal {}: {} -> {}", action.path(), current.getStatus(), saved.getStatus());
        return saved;
    }

    @Transactional
    public WithdrawalRequest addNote(UUID withdrawalId, String note) {
        WithdrawalRequest current = withdrawals.lock(withdrawalId)
            .orElseThrow(() -> NotFoundException.of("Withdrawal request", withdrawalId));
        return withdrawals.update(current.appendNote(note, Instant.now(clock)));
    }

    public WithdrawalRequest getForUser(UUID userId, UUID withdrawalId) {
        return withdrawals.findForUser(withdrawalId, userId)
            .orElseThrow(() -> NotFoundException.of("Withdrawal request", withdrawalId));
    }

    public WithdrawalRequest get(UUID withdrawalId) {
        return withdrawals.findById(withdrawalId)
            .orElseThrow(() -> NotFoundException.of("Withdrawal request", withdrawalId));
    }

    public List<WithdrawalRequest> list(UUID userId) {
        return withdrawals.findByUser(userId);
    }

    private static List<Investment> select(List<Investment> eligible, Collection<UUID> requestedIds) {
        if (requestedIds == null || requestedIds.isEmpty()) {
            return eligible;
        }
        Set<UUID> wanted = new HashSet<>(requestedIds);
        return eligible.stream().filter(inv -> wanted.contains(inv.getId())).toList();
    }

    private void publish(WithdrawalRequest request) {
        outboxService.saveEvent(AggregateTypes.WITHDRAWAL, request.getId(),
                WithdrawalStatusChangedEvent.EVENT_TYPE, WithdrawalStatusChangedEvent.from(request));
    }
}
