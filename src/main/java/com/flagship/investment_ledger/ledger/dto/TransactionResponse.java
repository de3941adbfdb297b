package com.flagship.investment_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.ledger.LedgerTransaction;
import com.flagship.investment_ledger.ledger.TransactionStatus;
import com.flagship.investment_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("description")
    String description;

    @JsonProperty("investment_id")
    UUID investmentId;

    @JsonProperty("withdrawal_request_id")
    UUID withdrawalRequestId;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .type(tx.getType())
            .amount(tx.getAmount())
            .status(tx.getStatus())
            .description(tx.getDescription())
            .investmentId(tx.getInvestmentId())
            .withdrawalRequestId(tx.getWithdrawalRequestId())
            .paymentReference(tx.getPaymentReference())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}
