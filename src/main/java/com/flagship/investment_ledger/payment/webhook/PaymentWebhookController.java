package com.flagship.investment_ledger.payment.webhook;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.investment.PaymentOutcomeHandler;
import com.flagship.investment_ledger.investment.ReconciliationResult;
import com.flagship.investment_ledger.observability.CorrelationContext;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Paystack webhook receiver.
 *
 * The signature is checked over the raw bytes before anything is parsed. A rejected
 * delivery never reaches the reconciliation path. Replays and reconciliation cases
 * answer 200 so the gateway stops retrying; an unknown reference answers 404.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookEventParser eventParser;
    private final PaymentOutcomeHandler outcomeHandler;
    private final InvestmentMetrics metrics;

    @PostMapping("/webhook")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader(value = ApiHeaders.PAYSTACK_SIGNATURE, required = false) String signature) {

        try {
            signatureVerifier.verify(rawBody, signature);
        } catch (InvalidSignatureException e) {
            metrics.recordSignatureRejected();
            log.warn("Webhook rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "Invalid signature"));
        }

        WebhookEvent event = eventParser.parse(rawBody);
        CorrelationContext.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, event.getReference());

        Optional<PaymentOutcome> outcome = eventParser.toOutcome(event);
        if (outcome.isEmpty()) {
            log.info("Webhook event {} ignored", event.getEvent());
            return ResponseEntity.ok(ignored("Unhandled event " + event.getEvent()));
        }

        ReconciliationResult result = outcomeHandler.handle(outcome.get());
        if (result == ReconciliationResult.APPLIED || result == ReconciliationResult.MARKED_FAILED) {
            return ResponseEntity.ok(Map.of("status", "success"));
        }
        return ResponseEntity.ok(ignored(result.name()));
    }

    private static Map<String, String> ignored(String reason) {
        return Map.of("status", "ignored", "reason", reason);
    }
}
