package com.flagship.investment_ledger.inventory;

import lombok.Value;

import java.util.UUID;

/**
 * Result of an order-time reservation.
 * {@code held} tells whether slots were actually taken out of availability,
 * which is only the case for {@link ReservationMode#AT_ORDER} packages.
 */
@Value
public class ReservationToken {
    UUID packageId;
    int units;
    boolean held;

    public static ReservationToken held(UUID packageId, int units) {
        return new ReservationToken(packageId, units, true);
    }

    public static ReservationToken deferred(UUID packageId, int units) {
        return new ReservationToken(packageId, units, false);
    }
}
