package com.flagship.investment_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.inventory.PackageKind;
import com.flagship.investment_ledger.inventory.ReservationMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreatePackageRequest {

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    PackageKind kind;

    @JsonProperty("category")
    String category;

    @Min(value = 1, message = "Total slots must be at least 1")
    @JsonProperty("total_slots")
    int totalSlots;

    @NotNull(message = "Minimum amount is required")
    @DecimalMin(value = "0.01", message = "Minimum amount must be greater than 0")
    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @NotNull(message = "Maximum amount is required")
    @DecimalMin(value = "0.01", message = "Maximum amount must be greater than 0")
    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @NotNull(message = "Return rate is required")
    @DecimalMin(value = "0", message = "Return rate must not be negative")
    @JsonProperty("return_rate")
    BigDecimal returnRate;

    @Min(value = 1, message = "Duration must be at least 1 day")
    @JsonProperty("duration_days")
    int durationDays;

    @JsonProperty("reservation_mode")
    ReservationMode reservationMode;
}
