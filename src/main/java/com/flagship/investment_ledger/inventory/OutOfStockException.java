package com.flagship.investment_ledger.inventory;

import java.util.UUID;

/**
 * Raised when a package cannot supply the requested number of slots,
 * either because availability is exhausted or the package is not active.
 */
public class OutOfStockException extends RuntimeException {

    private final UUID packageId;

    public OutOfStockException(UUID packageId, String message) {
        super(message);
        this.packageId = packageId;
    }

    public static OutOfStockException insufficient(UUID packageId, int requested, int available) {
        return new OutOfStockException(packageId, String.format(
            "Package %s has %d slot(s) available, %d requested", packageId, available, requested));
    }

    public static OutOfStockException inactive(UUID packageId) {
        return new OutOfStockException(packageId, "Package " + packageId + " is not active");
    }

    public UUID getPackageId() {
        return packageId;
    }
}
