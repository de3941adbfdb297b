package com.flagship.investment_ledger.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PackageStats {

    @JsonProperty("total_packages")
    long totalPackages;

    @JsonProperty("active_packages")
    long activePackages;

    @JsonProperty("total_slots")
    long totalSlots;

    @JsonProperty("available_slots")
    long availableSlots;

    @JsonProperty("filled_slots")
    long filledSlots;
}
