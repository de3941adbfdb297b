package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Admin transitions on withdrawal requests.
 */
class WithdrawalRequestTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static WithdrawalRequest pending() {
        return WithdrawalRequest.create(UUID.randomUUID(), WithdrawalType.FULL, new BigDecimal("185.00"),
            List.of(UUID.randomUUID(), UUID.randomUUID()), NOW);
    }

    @Test
    @DisplayName("New request is PENDING and keeps its investments")
    void create() {
        WithdrawalRequest request = pending();

        assertEquals(WithdrawalStatus.PENDING, request.getStatus());
        assertEquals(2, request.getInvestmentIds().size());
        assertNull(request.getPaymentReference());
        assertEquals(NOW, request.getCreatedAt());
    }

    @Test
    @DisplayName("Nothing to withdraw is rejected")
    void zeroAmount() {
        assertThrows(IllegalArgumentException.class, () -> WithdrawalRequest.create(UUID.randomUUID(),
            WithdrawalType.INTEREST, new BigDecimal("0.00"), List.of(UUID.randomUUID()), NOW));
        assertThrows(IllegalArgumentException.class, () -> WithdrawalRequest.create(UUID.randomUUID(),
            WithdrawalType.FULL, BigDecimal.TEN, List.of(), NOW));
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        @DisplayName("approve → mark_paid completes with a payout reference and processed date")
        void approveThenPay() {
            WithdrawalRequest request = pending();

            WithdrawalRequest approved = request.approve("ok", NOW);
            assertEquals(WithdrawalStatus.APPROVED, approved.getStatus());
            assertEquals("PAY-" + NOW.getEpochSecond() + "-" + request.getId().toString().substring(0, 8),
                approved.getPaymentReference());

            WithdrawalRequest paid = approved.markPaid(null, NOW.plusSeconds(60));
            assertEquals(WithdrawalStatus.COMPLETED, paid.getStatus());
            assertEquals(NOW.plusSeconds(60), paid.getProcessedDate());
        }

        @Test
        @DisplayName("Each action appends one line to the admin notes")
        void notesAppend() {
            WithdrawalRequest paid = pending()
                .approve("checked bank details", NOW)
                .markPaid(null, NOW);

            String[] lines = paid.getAdminNotes().split("\n");
            assertEquals(2, lines.length);
            assertTrue(lines[0].endsWith("APPROVE: checked bank details"));
            assertTrue(lines[1].endsWith("MARK_PAID"));
        }

        @Test
        @DisplayName("Failed payout can be approved again with a new reference")
        void retryAfterFailure() {
            WithdrawalRequest failed = pending().approve(null, NOW).markFailed("bank bounced", NOW);
            assertEquals(WithdrawalStatus.FAILED, failed.getStatus());

            WithdrawalRequest reapproved = failed.apply(WithdrawalAction.APPROVE, "retry", NOW.plusSeconds(3600));
            assertEquals(WithdrawalStatus.APPROVED, reapproved.getStatus());
            assertNotEquals(failed.getPaymentReference(), reapproved.getPaymentReference());
        }
    }

    @Nested
    @DisplayName("Rejected transitions")
    class Rejected {

        @Test
        @DisplayName("mark_paid outside APPROVED is rejected with the current status")
        void markPaidFromPending() {
            WithdrawalRequest request = pending();

            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> request.markPaid(null, NOW));
            assertEquals("PENDING", e.getCurrentStatus());
            assertEquals(WithdrawalStatus.PENDING, request.getStatus());
            assertNull(request.getAdminNotes());
        }

        @Test
        @DisplayName("Rejected and completed requests accept no further actions")
        void terminal() {
            WithdrawalRequest rejected = pending().reject("duplicate", NOW);
            WithdrawalRequest completed = pending().approve(null, NOW).markPaid(null, NOW);

            for (WithdrawalAction action : WithdrawalAction.values()) {
                assertThrows(InvalidTransitionException.class, () -> rejected.apply(action, null, NOW));
                assertThrows(InvalidTransitionException.class, () -> completed.apply(action, null, NOW));
            }
        }

        @Test
        @DisplayName("Approved request cannot be rejected")
        void rejectApproved() {
            WithdrawalRequest approved = pending().approve(null, NOW);

            assertThrows(InvalidTransitionException.class, () -> approved.reject("late", NOW));
        }
    }

    @Test
    @DisplayName("Admin notes do not change status; blank notes are refused")
    void appendNote() {
        WithdrawalRequest noted = pending().appendNote("called the customer", NOW);

        assertEquals(WithdrawalStatus.PENDING, noted.getStatus());
        assertTrue(noted.getAdminNotes().contains("NOTE: called the customer"));
        assertThrows(IllegalArgumentException.class, () -> noted.appendNote("  ", NOW));
    }

    @Test
    @DisplayName("Action paths parse case-insensitively")
    void actionPaths() {
        assertEquals(WithdrawalAction.MARK_PAID, WithdrawalAction.fromPath("mark_paid"));
        assertEquals(WithdrawalAction.APPROVE, WithdrawalAction.fromPath("APPROVE"));
        assertThrows(IllegalArgumentException.class, () -> WithdrawalAction.fromPath("force_approve"));
    }
}
