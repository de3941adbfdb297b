package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.payment.dto.PaymentResponse;
import lombok.Value;

/**
 * An investment together with the gateway session the client should complete.
 */
@Value
public class CheckoutResponse {

    @JsonProperty("investment")
    InvestmentResponse investment;

    @JsonProperty("payment")
    PaymentResponse payment;
}
