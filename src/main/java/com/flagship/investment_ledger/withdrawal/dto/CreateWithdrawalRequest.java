package com.flagship.investment_ledger.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.withdrawal.WithdrawalType;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class CreateWithdrawalRequest {

    @NotNull(message = "Withdrawal type is required")
    @JsonProperty("withdrawal_type")
    WithdrawalType type;

    /** Empty or absent means every eligible investment. */
    @JsonProperty("investment_ids")
    List<UUID> investmentIds;
}
