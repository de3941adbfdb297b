package com.flagship.investment_ledger.payment.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Paystack REST client.
 *
 * - POST /transaction/initialize opens a checkout session (amount in minor units)
 * - GET /transaction/verify/{reference} reports the charge state
 *
 * Connect and read timeouts are set on the injected client
 * ({@link com.flagship.investment_ledger.config.RestTemplateConfig}).
 * Any transport error, timeout, non-2xx answer or {@code "status": false} body
 * becomes a {@link GatewayUnavailableException}.
 */
@Service
@Slf4j
public class PaystackPaymentGateway implements PaymentGateway {

    private final PaystackProperties props;
    private final ObjectMapper objectMapper;
    private final InvestmentMetrics metrics;
    private final RestTemplate restTemplate;

    public PaystackPaymentGateway(PaystackProperties props, ObjectMapper objectMapper, InvestmentMetrics metrics,
                                  RestTemplate restTemplate) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.restTemplate = restTemplate;
    }

    @Override
    public GatewaySession initialize(GatewayCharge charge) {
        Map<String, Object> body = new HashMap<>();
        body.put("email", charge.getEmail());
        body.put("amount", PaystackStatus.toMinorUnits(charge.getAmount()));
        body.put("reference", charge.getReference());
        body.put("currency", charge.getCurrency() != null ? charge.getCurrency() : props.getCurrency());
        if (props.getCallbackUrl() != null && !props.getCallbackUrl().isBlank()) {
            body.put("callback_url", props.getCallbackUrl());
        }
        if (charge.getMetadata() != null && !charge.getMetadata().isEmpty()) {
            body.put("metadata", charge.getMetadata());
        }

        log.info("Paystack initialize REQ: reference={}, amount={}, currency={}",
                charge.getReference(), charge.getAmount(), body.get("currency"));

        JsonNode data = call("initialize", HttpMethod.POST,
                props.getBaseUrl() + "/transaction/initialize", body);

        GatewaySession session = new GatewaySession(
            textOrDefault(data, "reference", charge.getReference()),
            textOrDefault(data, "authorization_url", null),
            textOrDefault(data, "access_code", null)
        );
        log.info("Paystack initialize RESP: reference={}, accessCode={}",
                session.getReference(), session.getAccessCode());
        return session;
    }

    @Override
    public GatewayVerification verify(String reference) {
        log.info("Paystack verify REQ: reference={}", reference);

        JsonNode data = call("verify", HttpMethod.GET,
                props.getBaseUrl() + "/transaction/verify/" + reference, null);

        String gatewayStatus = textOrDefault(data, "status", null);
        GatewayVerification verification = new GatewayVerification(
            textOrDefault(data, "reference", reference),
            PaystackStatus.toPaymentStatus(gatewayStatus),
            textOrDefault(data, "id", null),
            data.hasNonNull("amount") ? PaystackStatus.fromMinorUnits(data.get("amount").asLong()) : null,
            textOrDefault(data, "gateway_response", gatewayStatus),
            parseInstant(textOrDefault(data, "paid_at", null))
        );
        log.info("Paystack verify RESP: reference={}, gatewayStatus={}, mapped={}",
                reference, gatewayStatus, verification.getStatus());
        return verification;
    }

    private JsonNode call(String operation, HttpMethod method, String url, Object body) {
        long start = System.currentTimeMillis();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(props.getSecretKey() != null ? props.getSecretKey() : "");
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                url, method, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody() != null ? response.getBody() : "{}");
            if (!root.path("status").asBoolean(false)) {
                metrics.recordGatewayCall(operation, "rejected", System.currentTimeMillis() - start);
                throw new GatewayUnavailableException(String.format(
                    "Paystack %s rejected: %s", operation, root.path("message").asText("no message")));
            }

            metrics.recordGatewayCall(operation, "success", System.currentTimeMillis() - start);
            return root.path("data");

        } catch (RestClientException e) {
            metrics.recordGatewayCall(operation, "error", System.currentTimeMillis() - start);
            log.warn("Paystack {} failed: url={}, error={}", operation, url, e.getMessage());
            throw new GatewayUnavailableException("Payment gateway unavailable during " + operation, e);
        } catch (JsonProcessingException e) {
            metrics.recordGatewayCall(operation, "malformed", System.currentTimeMillis() - start);
            throw new GatewayUnavailableException("Malformed payment gateway response during " + operation, e);
        }
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable paid_at from gateway: {}", value);
            return null;
        }
    }
}
