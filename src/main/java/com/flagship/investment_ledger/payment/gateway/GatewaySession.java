package com.flagship.investment_ledger.payment.gateway;

import lombok.Value;

/**
 * Checkout session opened at the gateway. The client completes payment at {@code authorizationUrl}.
 */
@Value
public class GatewaySession {
    String reference;
    String authorizationUrl;
    String accessCode;
}
