package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.payment.Payment;
import lombok.Value;

/**
 * A pending investment and the payment attempt the client should complete.
 * {@code replayed} is set when an idempotent retry returned an existing order.
 */
@Value
public class Checkout {
    Investment investment;
    Payment payment;
    boolean replayed;
}
