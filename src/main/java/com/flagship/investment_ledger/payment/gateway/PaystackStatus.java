package com.flagship.investment_ledger.payment.gateway;

import com.flagship.investment_ledger.payment.PaymentStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Translation between Paystack's vocabulary and ours.
 */
public final class PaystackStatus {

    private static final int MINOR_UNIT_SCALE = 2;

    private PaystackStatus() {
    }

    /**
     * success -> SUCCESS; failed, reversed, abandoned -> FAILED; everything else -> PENDING.
     */
    public static PaymentStatus toPaymentStatus(String gatewayStatus) {
        if (gatewayStatus == null) {
            return PaymentStatus.PENDING;
        }
        return switch (gatewayStatus.toLowerCase(Locale.ROOT)) {
            case "success" -> PaymentStatus.SUCCESS;
            case "failed", "reversed", "abandoned" -> PaymentStatus.FAILED;
            default -> PaymentStatus.PENDING;
        };
    }

    /**
     * Major units to the integer minor units Paystack expects (kobo, pesewas, cents).
     */
    public static long toMinorUnits(BigDecimal amount) {
        return amount.setScale(MINOR_UNIT_SCALE, RoundingMode.HALF_EVEN)
            .movePointRight(MINOR_UNIT_SCALE)
            .longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minor) {
        return BigDecimal.valueOf(minor, MINOR_UNIT_SCALE);
    }
}
