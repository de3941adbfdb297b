package com.flagship.investment_ledger.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.withdrawal.WithdrawalRequest;
import com.flagship.investment_ledger.withdrawal.WithdrawalStatus;
import com.flagship.investment_ledger.withdrawal.WithdrawalType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class WithdrawalResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("withdrawal_type")
    WithdrawalType type;

    @JsonProperty("status")
    WithdrawalStatus status;

    @JsonProperty("investment_ids")
    List<UUID> investmentIds;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("processed_date")
    Instant processedDate;

    @JsonProperty("admin_notes")
    String adminNotes;

    @JsonProperty("created_at")
    Instant createdAt;

    public static WithdrawalResponse from(WithdrawalRequest request) {
        return WithdrawalResponse.builder()
            .id(request.getId())
            .amount(request.getAmount())
            .type(request.getType())
            .status(request.getStatus())
            .investmentIds(request.getInvestmentIds())
            .paymentReference(request.getPaymentReference())
            .processedDate(request.getProcessedDate())
            .adminNotes(request.getAdminNotes())
            .createdAt(request.getCreatedAt())
            .build();
    }
}
