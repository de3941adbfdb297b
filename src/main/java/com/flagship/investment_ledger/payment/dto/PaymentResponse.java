package com.flagship.investment_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.payment.Payment;
import com.flagship.investment_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("investment_id")
    UUID investmentId;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("authorization_url")
    String authorizationUrl;

    @JsonProperty("access_code")
    String accessCode;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .investmentId(payment.getInvestmentId())
            .reference(payment.getReference())
            .amount(payment.getAmount())
            .currency(payment.getCurrency().name())
            .status(payment.getStatus())
            .authorizationUrl(payment.getAuthorizationUrl())
            .accessCode(payment.getAccessCode())
            .paidAt(payment.getPaidAt())
            .failureReason(payment.getFailureReason())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}
