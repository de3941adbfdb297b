package com.flagship.investment_ledger.exception;

/**
 * Raised when a state machine transition is not allowed from the current state.
 * Carries the current state so the API can report it back to the caller.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final String currentStatus;

    public InvalidTransitionException(String message, Enum<?> currentStatus) {
        super(message);
        this.currentStatus = currentStatus != null ? currentStatus.name() : null;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
