package com.flagship.investment_ledger.config;

import com.flagship.investment_ledger.payment.gateway.PaystackProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for the payment gateway. Connect and read timeouts both come from
 * {@code gateway.paystack.timeout-ms}.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder, PaystackProperties props) {
        Duration timeout = Duration.ofMillis(props.getTimeoutMs());
        return builder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }
}
