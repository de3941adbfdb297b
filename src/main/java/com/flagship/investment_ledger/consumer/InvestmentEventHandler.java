package com.flagship.investment_ledger.consumer;

import com.flagship.investment_ledger.investment.event.InvestmentActivatedEvent;
import com.flagship.investment_ledger.investment.event.InvestmentCancelledEvent;
import com.flagship.investment_ledger.investment.event.InvestmentCompletedEvent;
import com.flagship.investment_ledger.investment.update.InvestmentUpdateService;
import com.flagship.investment_ledger.investment.update.UpdateType;
import com.flagship.investment_ledger.withdrawal.WithdrawalStatus;
import com.flagship.investment_ledger.withdrawal.event.WithdrawalStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Turns lifecycle events into investment timeline entries.
 *
 * Called by {@link InvestmentEventConsumer} after the deduplication check, so
 * handlers here do not deduplicate themselves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestmentEventHandler {

    private final InvestmentUpdateService updateService;

    public void onActivated(InvestmentActivatedEvent event) {
        updateService.record(event.getInvestmentId(), UpdateType.PAYMENT_CONFIRMED,
            "Payment confirmed",
            String.format("Payment %s of %s confirmed. Your investment runs from %s to %s.",
                event.getPaymentReference(), event.getAmount(), event.getStartDate(), event.getEndDate()));
    }

    public void onCompleted(InvestmentCompletedEvent event) {
        updateService.record(event.getInvestmentId(), UpdateType.MATURED,
            "Investment matured",
            String.format("Your investment of %s matured on %s with a total return of %s.",
                event.getAmount(), event.getCompletedDate(), event.getActualReturn()));
    }

    public void onCancelled(InvestmentCancelledEvent event) {
        updateService.record(event.getInvestmentId(), UpdateType.CANCELLED,
            "Investment cancelled",
            String.format("Your investment was cancelled and %s was refunded.", event.getRefundedAmount()));
    }

    /**
     * Only creation and payout reach the timeline; intermediate admin steps stay internal.
     */
    public void onWithdrawalStatusChanged(WithdrawalStatusChangedEvent event) {
        if (event.getStatus() == WithdrawalStatus.PENDING) {
            for (UUID investmentId : event.getInvestmentIds()) {
                updateService.record(investmentId, UpdateType.WITHDRAWAL_REQUESTED,
                    "Withdrawal requested",
                    String.format("%s withdrawal of %s requested.", event.getType(), event.getAmount()));
            }
        } else if (event.getStatus() == WithdrawalStatus.COMPLETED) {
            for (UUID investmentId : event.getInvestmentIds()) {
                updateService.record(investmentId, UpdateType.WITHDRAWAL_PAID,
                    "Withdrawal paid",
                    String.format("%s withdrawal of %s paid out (reference %s).",
                        event.getType(), event.getAmount(), event.getPaymentReference()));
            }
        } else {
            log.debug("No timeline entry for withdrawal {} in status {}", event.getWithdrawalId(), event.getStatus());
        }
    }
}
