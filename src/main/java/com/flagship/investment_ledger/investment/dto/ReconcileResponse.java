package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.investment.ReconciliationResult;
import com.flagship.investment_ledger.payment.dto.PaymentResponse;
import lombok.Value;

/**
 * Result of applying a verified payment outcome.
 */
@Value
public class ReconcileResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("result")
    ReconciliationResult result;

    @JsonProperty("payment")
    PaymentResponse payment;
}
