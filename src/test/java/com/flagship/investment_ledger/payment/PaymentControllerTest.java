package com.flagship.investment_ledger.payment;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.config.JacksonConfig;
import com.flagship.investment_ledger.exception.GlobalExceptionHandler;
import com.flagship.investment_ledger.investment.PaymentOutcomeHandler;
import com.flagship.investment_ledger.investment.ReconciliationResult;
import com.flagship.investment_ledger.payment.gateway.GatewayVerification;
import com.flagship.investment_ledger.payment.gateway.PaymentGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Client verify endpoint: ownership check, gateway answer and response mapping.
 */
@ExtendWith(MockitoExtension.class)
class PaymentControllerTest {

    private static final Instant NOW = Instant.parse("2024-04-10T12:00:00Z");
    private static final String REFERENCE = "INV_1a2b3c4d_1712750400000_00ff";

    @Mock
    private PaymentPersistenceService payments;
    @Mock
    private PaymentGateway gateway;
    @Mock
    private PaymentOutcomeHandler outcomeHandler;

    private MockMvc mockMvc;
    private UUID userId;
    private Payment payment;

    @BeforeEach
    void setUp() {
        PaymentController controller = new PaymentController(payments, gateway, outcomeHandler);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
            .build();

        userId = UUID.randomUUID();
        payment = Payment.pending(userId, UUID.randomUUID(), new BigDecimal("200.00"), CurrencyCode.NGN,
            REFERENCE, "https://checkout.paystack.test/x", "acc_1", NOW);
    }

    private void givenOwned(Payment after) {
        when(payments.findByReferenceForUser(REFERENCE, userId)).thenReturn(Optional.of(payment));
        when(payments.findByReference(REFERENCE)).thenReturn(Optional.of(after));
    }

    private String body() {
        return "{\"reference\":\"" + REFERENCE + "\"}";
    }

    @Test
    @DisplayName("Charge still processing at the gateway answers pending")
    void stillPending() throws Exception {
        givenOwned(payment);
        when(gateway.verify(REFERENCE)).thenReturn(new GatewayVerification(
            REFERENCE, PaymentStatus.PENDING, null, null, "ongoing", null));
        when(outcomeHandler.handle(any())).thenReturn(ReconciliationResult.PENDING);

        mockMvc.perform(post("/api/payments/verify")
                .header(ApiHeaders.USER_ID, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("pending"))
            .andExpect(jsonPath("$.result").value("PENDING"))
            .andExpect(jsonPath("$.payment.reference").value(REFERENCE));

        ArgumentCaptor<PaymentOutcome> outcome = ArgumentCaptor.forClass(PaymentOutcome.class);
        verify(outcomeHandler).handle(outcome.capture());
        assertEquals(OutcomeSource.VERIFY, outcome.getValue().getSource());
    }

    @Test
    @DisplayName("Confirmed charge answers success with the applied result")
    void confirmed() throws Exception {
        givenOwned(payment.succeed("trx_9", NOW, NOW));
        when(gateway.verify(REFERENCE)).thenReturn(new GatewayVerification(
            REFERENCE, PaymentStatus.SUCCESS, "trx_9", new BigDecimal("200.00"), "Approved", NOW));
        when(outcomeHandler.handle(any())).thenReturn(ReconciliationResult.APPLIED);

        mockMvc.perform(post("/api/payments/verify")
                .header(ApiHeaders.USER_ID, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.result").value("APPLIED"));
    }

    @Test
    @DisplayName("Declined charge answers failed")
    void declined() throws Exception {
        givenOwned(payment.fail("Declined", NOW));
        when(gateway.verify(REFERENCE)).thenReturn(new GatewayVerification(
            REFERENCE, PaymentStatus.FAILED, "trx_9", new BigDecimal("200.00"), "Declined", null));
        when(outcomeHandler.handle(any())).thenReturn(ReconciliationResult.MARKED_FAILED);

        mockMvc.perform(post("/api/payments/verify")
                .header(ApiHeaders.USER_ID, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.result").value("MARKED_FAILED"));
    }

    @Test
    @DisplayName("No slot left at confirmation is a 409")
    void outOfStock() throws Exception {
        givenOwned(payment);
        when(gateway.verify(REFERENCE)).thenReturn(new GatewayVerification(
            REFERENCE, PaymentStatus.SUCCESS, "trx_9", new BigDecimal("200.00"), "Approved", NOW));
        when(outcomeHandler.handle(any())).thenReturn(ReconciliationResult.OUT_OF_STOCK);

        mockMvc.perform(post("/api/payments/verify")
                .header(ApiHeaders.USER_ID, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.result").value("OUT_OF_STOCK"));
    }

    @Test
    @DisplayName("Another user's reference is a 404 and the gateway is not asked")
    void notOwner() throws Exception {
        when(payments.findByReferenceForUser(REFERENCE, userId)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/payments/verify")
                .header(ApiHeaders.USER_ID, userId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body()))
            .andExpect(status().isNotFound());

        verifyNoInteractions(gateway, outcomeHandler);
    }
}
