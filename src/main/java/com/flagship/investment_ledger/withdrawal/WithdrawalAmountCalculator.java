package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.investment.Investment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Withdrawal amount over a set of completed investments:
 * - INTEREST and REINVEST: sum of actual returns minus sum of principals
 * - FULL: sum of actual returns
 */
@Component
public class WithdrawalAmountCalculator {

    public BigDecimal calculate(WithdrawalType type, Collection<Investment> investments) {
        BigDecimal totalReturn = BigDecimal.ZERO;
        BigDecimal totalPrincipal = BigDecimal.ZERO;
        for (Investment investment : investments) {
            if (investment.getActualReturn() == null) {
                throw new IllegalStateException("Investment " + investment.getId() + " has no actual return");
            }
            totalReturn = totalReturn.add(investment.getActualReturn());
            totalPrincipal = totalPrincipal.add(investment.getAmount());
        }

        BigDecimal amount = switch (type) {
            case INTEREST, REINVEST -> totalReturn.subtract(totalPrincipal);
            case FULL -> totalReturn;
        };
        return amount.setScale(2, RoundingMode.HALF_EVEN);
    }
}
