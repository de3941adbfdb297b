package com.flagship.investment_ledger.payment.webhook;

import com.flagship.investment_ledger.config.JacksonConfig;
import com.flagship.investment_ledger.payment.OutcomeSource;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import com.flagship.investment_ledger.payment.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WebhookEventParserTest {

    private final WebhookEventParser parser = new WebhookEventParser(new JacksonConfig().objectMapper());

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("charge.success becomes a SUCCESS outcome in major units")
    void chargeSuccess() {
        WebhookEvent event = parser.parse(json("""
            {"event":"charge.success","data":{"id":302961,"reference":"INV_ab12cd34_1700000000000",
             "status":"success","amount":5000000,"gateway_response":"Approved",
             "paid_at":"2024-05-01T10:15:30Z"}}
            """));

        PaymentOutcome outcome = parser.toOutcome(event).orElseThrow();

        assertEquals("INV_ab12cd34_1700000000000", outcome.getReference());
        assertEquals(PaymentStatus.SUCCESS, outcome.getStatus());
        assertEquals("302961", outcome.getGatewayTransactionId());
        assertEquals(new BigDecimal("50000.00"), outcome.getAmount());
        assertEquals("Approved", outcome.getGatewayResponse());
        assertEquals(Instant.parse("2024-05-01T10:15:30Z"), outcome.getPaidAt());
        assertEquals(OutcomeSource.WEBHOOK, outcome.getSource());
    }

    @Test
    @DisplayName("charge.failed becomes a FAILED outcome")
    void chargeFailed() {
        WebhookEvent event = parser.parse(json(
            "{\"event\":\"charge.failed\",\"data\":{\"reference\":\"INV_1\",\"status\":\"failed\"}}"));

        PaymentOutcome outcome = parser.toOutcome(event).orElseThrow();

        assertEquals(PaymentStatus.FAILED, outcome.getStatus());
        assertNull(outcome.getAmount());
        assertEquals("failed", outcome.getGatewayResponse());
    }

    @Test
    @DisplayName("Other events produce no outcome")
    void otherEventIgnored() {
        WebhookEvent event = parser.parse(json("{\"event\":\"transfer.success\",\"data\":{}}"));

        assertFalse(event.isChargeEvent());
        assertEquals(Optional.empty(), parser.toOutcome(event));
    }

    @Test
    @DisplayName("Unparseable paid_at is dropped, not fatal")
    void badPaidAt() {
        WebhookEvent event = parser.parse(json(
            "{\"event\":\"charge.success\",\"data\":{\"reference\":\"INV_1\",\"paid_at\":\"yesterday\"}}"));

        assertNull(event.getPaidAt());
    }

    @Test
    @DisplayName("Malformed bodies are rejected")
    void malformed() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(json("not json")));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(json("{\"data\":{}}")));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(json("[1,2]")));
    }

    @Test
    @DisplayName("Charge event without a reference is rejected")
    void chargeWithoutReference() {
        WebhookEvent event = parser.parse(json("{\"event\":\"charge.success\",\"data\":{\"status\":\"success\"}}"));

        assertThrows(IllegalArgumentException.class, () -> parser.toOutcome(event));
    }
}
