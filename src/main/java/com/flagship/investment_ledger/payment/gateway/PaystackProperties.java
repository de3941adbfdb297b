package com.flagship.investment_ledger.payment.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Paystack connection settings ({@code gateway.paystack.*}).
 * The secret key authenticates API calls and signs webhook deliveries.
 */
@Component
@ConfigurationProperties(prefix = "gateway.paystack")
@Getter
@Setter
public class PaystackProperties {
    private String baseUrl = "https://api.paystack.co";
    private String secretKey;
    private String callbackUrl;
    private int timeoutMs = 10000;
    private String currency = "NGN";
}
