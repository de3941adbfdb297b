package com.flagship.investment_ledger.payment.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.investment_ledger.payment.OutcomeSource;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import com.flagship.investment_ledger.payment.PaymentStatus;
import com.flagship.investment_ledger.payment.gateway.PaystackStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Reads webhook bodies into {@link WebhookEvent}s and maps charge events to outcomes.
 * Only call this after the signature has been verified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookEventParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the body is not a JSON object with an event name
     */
    public WebhookEvent parse(byte[] rawBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
        if (root == null || !root.isObject() || !root.hasNonNull("event")) {
            throw new IllegalArgumentException("Webhook body has no event name");
        }

        JsonNode data = root.path("data");
        return new WebhookEvent(
            root.get("event").asText(),
            text(data, "reference"),
            text(data, "status"),
            text(data, "id"),
            data.hasNonNull("amount") ? PaystackStatus.fromMinorUnits(data.get("amount").asLong()) : null,
            text(data, "gateway_response"),
            instant(text(data, "paid_at"))
        );
    }

    /**
     * charge.success and charge.failed become outcomes; every other event is ignored.
     */
    public Optional<PaymentOutcome> toOutcome(WebhookEvent event) {
        if (!event.isChargeEvent()) {
            return Optional.empty();
        }
        if (event.getReference() == null || event.getReference().isBlank()) {
            throw new IllegalArgumentException("Charge event without a reference");
        }
        PaymentStatus status = WebhookEvent.CHARGE_SUCCESS.equals(event.getEvent())
            ? PaymentStatus.SUCCESS
            : PaymentStatus.FAILED;
        return Optional.of(new PaymentOutcome(
            event.getReference(),
            status,
            event.getGatewayTransactionId(),
            event.getAmount(),
            event.getGatewayResponse() != null ? event.getGatewayResponse() : event.getStatus(),
            event.getPaidAt(),
            OutcomeSource.WEBHOOK
        ));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Instant instant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable paid_at '{}': {}", value, e.getMessage());
            return null;
        }
    }
}
