package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Portfolio totals derived from the user's investments.
 */
@Value
@Builder
public class InvestmentSummary {

    /** Principal of ACTIVE and COMPLETED investments. */
    @JsonProperty("total_invested")
    BigDecimal totalInvested;

    /** Profit realised by COMPLETED investments. */
    @JsonProperty("total_returns")
    BigDecimal totalReturns;

    @JsonProperty("total_portfolio_value")
    BigDecimal totalPortfolioValue;

    @JsonProperty("pending_count")
    long pendingCount;

    @JsonProperty("active_count")
    long activeCount;

    @JsonProperty("completed_count")
    long completedCount;

    @JsonProperty("cancelled_count")
    long cancelledCount;
}
