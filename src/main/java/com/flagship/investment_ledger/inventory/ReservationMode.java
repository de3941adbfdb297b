package com.flagship.investment_ledger.inventory;

/**
 * When a package's slots are taken out of availability.
 */
public enum ReservationMode {
    /** Slots are decremented when the order is placed and returned if it is cancelled. */
    AT_ORDER,
    /** Slots are decremented only once the payment is confirmed. */
    AT_PAYMENT
}
