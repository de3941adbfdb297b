package com.flagship.investment_ledger.payment.webhook;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.config.JacksonConfig;
import com.flagship.investment_ledger.exception.GlobalExceptionHandler;
import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.investment.PaymentOutcomeHandler;
import com.flagship.investment_ledger.investment.ReconciliationResult;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.payment.PaymentOutcome;
import com.flagship.investment_ledger.payment.PaymentStatus;
import com.flagship.investment_ledger.payment.gateway.PaystackProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Webhook endpoint: signature gate, event routing and response mapping.
 */
@ExtendWith(MockitoExtension.class)
class PaymentWebhookControllerTest {

    private static final String SECRET = "sk_test_secret";
    private static final String SUCCESS_BODY =
        "{\"event\":\"charge.success\",\"data\":{\"id\":99,\"reference\":\"INV_ref_1\",\"status\":\"success\",\"amount\":20000}}";

    @Mock
    private PaymentOutcomeHandler outcomeHandler;

    private SimpleMeterRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PaystackProperties props = new PaystackProperties();
        props.setSecretKey(SECRET);
        registry = new SimpleMeterRegistry();

        PaymentWebhookController controller = new PaymentWebhookController(
            new WebhookSignatureVerifier(props),
            new WebhookEventParser(new JacksonConfig().objectMapper()),
            outcomeHandler,
            new InvestmentMetrics(registry));

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static String sign(String body) {
        return WebhookSignatureVerifier.sign(body.getBytes(StandardCharsets.UTF_8), SECRET);
    }

    @Test
    @DisplayName("Valid charge.success is applied and answers success")
    void appliedWebhook() throws Exception {
        when(outcomeHandler.handle(any())).thenReturn(ReconciliationResult.APPLIED);

        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header(ApiHeaders.PAYSTACK_SIGNATURE, sign(SUCCESS_BODY))
                .content(SUCCESS_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"));

        ArgumentCaptor<PaymentOutcome> captor = ArgumentCaptor.forClass(PaymentOutcome.class);
        verify(outcomeHandler).handle(captor.capture());
        assertEquals("INV_ref_1", captor.getValue().getReference());
        assertEquals(PaymentStatus.SUCCESS, captor.getValue().getStatus());
    }

    @Test
    @DisplayName("Replay answers ignored with the reconciliation result")
    void replayIgnored() throws Exception {
        when(outcomeHandler.handle(any())).thenReturn(ReconciliationResult.ALREADY_PROCESSED);

        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header(ApiHeaders.PAYSTACK_SIGNATURE, sign(SUCCESS_BODY))
                .content(SUCCESS_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ignored"))
            .andExpect(jsonPath("$.reason").value("ALREADY_PROCESSED"));
    }

    @Test
    @DisplayName("Bad signature is a 400 and never reaches the handler")
    void badSignature() throws Exception {
        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header(ApiHeaders.PAYSTACK_SIGNATURE, sign("{}"))
                .content(SUCCESS_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid signature"));

        verifyNoInteractions(outcomeHandler);
        assertEquals(1.0, registry.counter("webhooks.rejected").count());
    }

    @Test
    @DisplayName("Missing signature header is a 400")
    void missingSignature() throws Exception {
        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUCCESS_BODY))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid signature"));

        verifyNoInteractions(outcomeHandler);
    }

    @Test
    @DisplayName("Unhandled event types are acknowledged and ignored")
    void unhandledEvent() throws Exception {
        String body = "{\"event\":\"subscription.create\",\"data\":{}}";

        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header(ApiHeaders.PAYSTACK_SIGNATURE, sign(body))
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ignored"))
            .andExpect(jsonPath("$.reason").value("Unhandled event subscription.create"));

        verifyNoInteractions(outcomeHandler);
    }

    @Test
    @DisplayName("Unknown reference is a 404")
    void unknownReference() throws Exception {
        when(outcomeHandler.handle(any())).thenThrow(NotFoundException.of("Payment", "INV_ref_1"));

        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header(ApiHeaders.PAYSTACK_SIGNATURE, sign(SUCCESS_BODY))
                .content(SUCCESS_BODY))
            .andExpect(status().isNotFound());
    }
}
