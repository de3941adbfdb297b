package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.investment.update.InvestmentUpdate;
import com.flagship.investment_ledger.investment.update.UpdateType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvestmentUpdateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    UpdateType type;

    @JsonProperty("title")
    String title;

    @JsonProperty("message")
    String message;

    @JsonProperty("created_at")
    Instant createdAt;

    public static InvestmentUpdateResponse from(InvestmentUpdate update) {
        return new InvestmentUpdateResponse(
            update.getId(), update.getType(), update.getTitle(), update.getMessage(), update.getCreatedAt());
    }
}
