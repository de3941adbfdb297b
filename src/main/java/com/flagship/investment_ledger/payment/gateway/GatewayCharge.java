package com.flagship.investment_ledger.payment.gateway;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Parameters for opening a checkout session.
 */
@Value
@Builder
public class GatewayCharge {
    String reference;
    BigDecimal amount;
    String currency;
    String email;
    Map<String, Object> metadata;
}
