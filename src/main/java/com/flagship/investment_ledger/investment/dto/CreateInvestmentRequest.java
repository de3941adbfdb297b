package com.flagship.investment_ledger.investment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreateInvestmentRequest {

    @NotNull(message = "Package is required")
    @JsonProperty("package_id")
    UUID packageId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    /** Slots to occupy: always 1 for direct packages, bag count for storage plans. */
    @Min(value = 1, message = "Units must be at least 1")
    @JsonProperty("units")
    Integer units;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    @JsonProperty("email")
    String email;
}
