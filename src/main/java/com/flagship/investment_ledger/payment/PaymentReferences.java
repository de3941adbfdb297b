package com.flagship.investment_ledger.payment;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates gateway payment references of the form {@code INV_<id8>_<epochMillis>_<rand4>}.
 * The random suffix keeps two attempts within the same millisecond distinct.
 */
public final class PaymentReferences {

    private static final String PREFIX = "INV_";

    private PaymentReferences() {
    }

    public static String forInvestment(UUID investmentId, Clock clock) {
        String shortId = investmentId.toString().substring(0, 8);
        String suffix = String.format("%04x", ThreadLocalRandom.current().nextInt(0x10000));
        return PREFIX + shortId + "_" + clock.millis() + "_" + suffix;
    }
}
