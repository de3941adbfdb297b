package com.flagship.investment_ledger.inventory;

import java.util.UUID;

/**
 * Raised when the package row lock could not be acquired within the configured wait.
 * Callers may retry the whole unit of work in a fresh transaction.
 */
public class SlotContentionException extends RuntimeException {

    public SlotContentionException(UUID packageId, Throwable cause) {
        super("Timed out waiting for inventory lock on package " + packageId, cause);
    }
}
