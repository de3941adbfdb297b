package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.investment.Investment;
import com.flagship.investment_ledger.investment.InvestmentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InvestmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("package_id")
    UUID packageId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("units")
    int units;

    @JsonProperty("status")
    InvestmentStatus status;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("completed_date")
    LocalDate completedDate;

    @JsonProperty("actual_return")
    BigDecimal actualReturn;

    @JsonProperty("withdrawal_request_id")
    UUID withdrawalRequestId;

    @JsonProperty("reconciliation_required")
    boolean reconciliationRequired;

    @JsonProperty("reconciliation_note")
    String reconciliationNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static InvestmentResponse from(Investment investment) {
        return InvestmentResponse.builder()
            .id(investment.getId())
            .packageId(investment.getPackageId())
            .amount(investment.getAmount())
            .units(investment.getUnits())
            .status(investment.getStatus())
            .startDate(investment.getStartDate())
            .endDate(investment.getEndDate())
            .completedDate(investment.getCompletedDate())
            .actualReturn(investment.getActualReturn())
            .withdrawalRequestId(investment.getWithdrawalRequestId())
            .reconciliationRequired(investment.isReconciliationRequired())
            .reconciliationNote(investment.getReconciliationNote())
            .createdAt(investment.getCreatedAt())
            .updatedAt(investment.getUpdatedAt())
            .build();
    }
}
