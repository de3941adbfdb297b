package com.flagship.investment_ledger.exception;

/**
 * Raised when a resource does not exist or is not visible to the caller.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String resource, Object id) {
        return new NotFoundException(resource + " not found: " + id);
    }
}
