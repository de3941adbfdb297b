package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.investment.Investment;
import com.flagship.investment_ledger.investment.InvestmentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WithdrawalAmountCalculatorTest {

    private final WithdrawalAmountCalculator calculator = new WithdrawalAmountCalculator();

    private static Investment completed(String amount, String actualReturn) {
        return Investment.builder()
            .id(UUID.randomUUID())
            .userId(UUID.randomUUID())
            .amount(new BigDecimal(amount))
            .actualReturn(new BigDecimal(actualReturn))
            .status(InvestmentStatus.COMPLETED)
            .units(1)
            .build();
    }

    private final List<Investment> investments = List.of(completed("100", "130"), completed("50", "55"));

    @Test
    @DisplayName("FULL withdraws principal plus profit")
    void full() {
        assertEquals(new BigDecimal("185.00"), calculator.calculate(WithdrawalType.FULL, investments));
    }

    @Test
    @DisplayName("INTEREST and REINVEST withdraw profit only")
    void interestOnly() {
        assertEquals(new BigDecimal("35.00"), calculator.calculate(WithdrawalType.INTEREST, investments));
        assertEquals(new BigDecimal("35.00"), calculator.calculate(WithdrawalType.REINVEST, investments));
    }

    @Test
    @DisplayName("Zero-rate investment has no interest to withdraw")
    void zeroInterest() {
        assertEquals(new BigDecimal("0.00"),
            calculator.calculate(WithdrawalType.INTEREST, List.of(completed("100", "100"))));
    }

    @Test
    @DisplayName("Investment without an actual return is rejected")
    void missingReturn() {
        Investment active = Investment.builder().id(UUID.randomUUID()).amount(BigDecimal.TEN).build();

        assertThrows(IllegalStateException.class,
            () -> calculator.calculate(WithdrawalType.FULL, List.of(active)));
    }
}
