package com.flagship.investment_ledger.inventory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Slot accounting and return arithmetic on the package domain object.
 */
class InvestmentPackageTest {

    private static InvestmentPackage pkg(PackageKind kind, int slots) {
        return InvestmentPackage.create("Maize Farm", kind, "agriculture", slots,
            new BigDecimal("100.00"), new BigDecimal("5000.00"), new BigDecimal("30"), 90, null);
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("New package is ACTIVE with all slots available")
        void newPackageHasAllSlots() {
            InvestmentPackage p = pkg(PackageKind.DIRECT, 5);

            assertEquals(PackageStatus.ACTIVE, p.getStatus());
            assertEquals(5, p.getTotalSlots());
            assertEquals(5, p.getAvailableSlots());
            assertEquals(0, p.filledSlots());
        }

        @Test
        @DisplayName("Reservation mode defaults from the kind")
        void reservationModeDefaultsFromKind() {
            assertEquals(ReservationMode.AT_PAYMENT, pkg(PackageKind.DIRECT, 1).getReservationMode());
            assertEquals(ReservationMode.AT_ORDER, pkg(PackageKind.STORAGE, 1).getReservationMode());
            assertTrue(pkg(PackageKind.STORAGE, 1).reservesAtOrder());
        }

        @Test
        @DisplayName("Invalid bounds are rejected")
        void invalidBoundsRejected() {
            assertThrows(IllegalArgumentException.class, () -> InvestmentPackage.create("X", PackageKind.DIRECT, null,
                0, new BigDecimal("1"), new BigDecimal("2"), BigDecimal.TEN, 30, null));
            assertThrows(IllegalArgumentException.class, () -> InvestmentPackage.create("X", PackageKind.DIRECT, null,
                1, new BigDecimal("10"), new BigDecimal("2"), BigDecimal.TEN, 30, null));
            assertThrows(IllegalArgumentException.class, () -> InvestmentPackage.create("X", PackageKind.DIRECT, null,
                1, new BigDecimal("1"), new BigDecimal("2"), BigDecimal.TEN, 0, null));
        }
    }

    @Nested
    @DisplayName("Slots")
    class Slots {

        @Test
        @DisplayName("Taking and returning slots stays within bounds")
        void takeAndReturn() {
            InvestmentPackage p = pkg(PackageKind.STORAGE, 3);

            InvestmentPackage taken = p.takeSlots(2);
            assertEquals(1, taken.getAvailableSlots());

            InvestmentPackage returned = taken.returnSlots(2);
            assertEquals(3, returned.getAvailableSlots());
            assertEquals(3, p.getAvailableSlots(), "original is unchanged");
        }

        @Test
        @DisplayName("Taking more than available throws OutOfStock")
        void overTakeThrows() {
            InvestmentPackage p = pkg(PackageKind.DIRECT, 1).takeSlots(1);

            OutOfStockException e = assertThrows(OutOfStockException.class, () -> p.takeSlots(1));
            assertEquals(p.getId(), e.getPackageId());
            assertEquals(0, p.getAvailableSlots());
        }

        @Test
        @DisplayName("Returning past the total is refused")
        void overReturnThrows() {
            InvestmentPackage p = pkg(PackageKind.DIRECT, 2);

            assertThrows(IllegalStateException.class, () -> p.returnSlots(1));
        }

        @Test
        @DisplayName("Non-positive units are rejected")
        void nonPositiveUnits() {
            InvestmentPackage p = pkg(PackageKind.DIRECT, 2);

            assertThrows(IllegalArgumentException.class, () -> p.checkAvailable(0));
            assertThrows(IllegalArgumentException.class, () -> p.returnSlots(-1));
        }
    }

    @Test
    @DisplayName("Amount range is inclusive")
    void amountRange() {
        InvestmentPackage p = pkg(PackageKind.DIRECT, 1);

        assertTrue(p.acceptsAmount(new BigDecimal("100.00")));
        assertTrue(p.acceptsAmount(new BigDecimal("5000")));
        assertFalse(p.acceptsAmount(new BigDecimal("99.99")));
        assertFalse(p.acceptsAmount(new BigDecimal("5000.01")));
        assertFalse(p.acceptsAmount(null));
    }

    @Test
    @DisplayName("Total return is principal plus flat rate, half-even to 2 places")
    void totalReturn() {
        InvestmentPackage p = pkg(PackageKind.DIRECT, 1);

        assertEquals(new BigDecimal("130.00"), p.totalReturnFor(new BigDecimal("100")));
        assertEquals(new BigDecimal("260.03"), p.totalReturnFor(new BigDecimal("200.02")));
    }
}
