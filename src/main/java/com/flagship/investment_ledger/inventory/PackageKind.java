package com.flagship.investment_ledger.inventory;

/**
 * Kind of investment instrument.
 */
public enum PackageKind {
    /** Fixed-term investment package, one slot per investment. */
    DIRECT,
    /** Physical commodity storage plan, one slot per stored unit. */
    STORAGE;

    public ReservationMode defaultReservationMode() {
        return this == STORAGE ? ReservationMode.AT_ORDER : ReservationMode.AT_PAYMENT;
    }
}
