package com.flagship.investment_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.investment_ledger.inventory.InvestmentPackage;
import com.flagship.investment_ledger.inventory.PackageKind;
import com.flagship.investment_ledger.inventory.PackageStatus;
import com.flagship.investment_ledger.inventory.ReservationMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class PackageResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("kind")
    PackageKind kind;

    @JsonProperty("category")
    String category;

    @JsonProperty("status")
    PackageStatus status;

    @JsonProperty("total_slots")
    int totalSlots;

    @JsonProperty("available_slots")
    int availableSlots;

    @JsonProperty("min_amount")
    BigDecimal minAmount;

    @JsonProperty("max_amount")
    BigDecimal maxAmount;

    @JsonProperty("return_rate")
    BigDecimal returnRate;

    @JsonProperty("duration_days")
    int durationDays;

    @JsonProperty("reservation_mode")
    ReservationMode reservationMode;

    public static PackageResponse from(InvestmentPackage pkg) {
        return PackageResponse.builder()
            .id(pkg.getId())
            .name(pkg.getName())
            .kind(pkg.getKind())
            .category(pkg.getCategory())
            .status(pkg.getStatus())
            .totalSlots(pkg.getTotalSlots())
            .availableSlots(pkg.getAvailableSlots())
            .minAmount(pkg.getMinAmount())
            .maxAmount(pkg.getMaxAmount())
            .returnRate(pkg.getReturnRate())
            .durationDays(pkg.getDurationDays())
            .reservationMode(pkg.getReservationMode())
            .build();
    }
}
