package com.flagship.investment_ledger.payment.gateway;

/**
 * Outbound port to the payment provider.
 * Implementations never touch local state; callers turn results into outcomes.
 */
public interface PaymentGateway {

    /**
     * Opens a checkout session for the given reference.
     *
     * @throws GatewayUnavailableException on timeout, I/O failure or a non-2xx answer
     */
    GatewaySession initialize(GatewayCharge charge);

    /**
     * Asks the gateway for the current state of a reference.
     *
     * @throws GatewayUnavailableException on timeout, I/O failure or a non-2xx answer
     */
    GatewayVerification verify(String reference);
}
