package com.flagship.investment_ledger.inventory;

public enum PackageStatus {
    ACTIVE,
    INACTIVE
}
