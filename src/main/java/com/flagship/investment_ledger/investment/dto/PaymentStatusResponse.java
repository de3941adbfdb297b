package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.investment.InvestmentStatus;
import com.flagship.investment_ledger.payment.dto.PaymentResponse;
import lombok.Value;

import java.util.UUID;

@Value
public class PaymentStatusResponse {

    @JsonProperty("investment_id")
    UUID investmentId;

    @JsonProperty("investment_status")
    InvestmentStatus investmentStatus;

    @JsonProperty("reconciliation_required")
    boolean reconciliationRequired;

    /** Most recent payment attempt, null if none exists. */
    @JsonProperty("latest_payment")
    PaymentResponse latestPayment;
}
