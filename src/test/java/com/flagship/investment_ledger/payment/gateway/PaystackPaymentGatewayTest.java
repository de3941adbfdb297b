package com.flagship.investment_ledger.payment.gateway;

import com.flagship.investment_ledger.config.JacksonConfig;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import com.flagship.investment_ledger.payment.PaymentStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Paystack client against a mocked HTTP server: request shape, response mapping
 * and the failures that must surface as {@link GatewayUnavailableException}.
 */
class PaystackPaymentGatewayTest {

    private static final String BASE_URL = "https://paystack.test";
    private static final String REFERENCE = "INV_1a2b3c4d_1712750400000_00ff";

    private MockRestServiceServer server;
    private SimpleMeterRegistry registry;
    private PaystackPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        PaystackProperties props = new PaystackProperties();
        props.setBaseUrl(BASE_URL);
        props.setSecretKey("sk_test_gateway");
        props.setCallbackUrl("https://app.test/payment/callback");

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        registry = new SimpleMeterRegistry();
        gateway = new PaystackPaymentGateway(props, new JacksonConfig().objectMapper(),
            new InvestmentMetrics(registry), restTemplate);
    }

    private static GatewayCharge charge() {
        return GatewayCharge.builder()
            .reference(REFERENCE)
            .amount(new BigDecimal("250.50"))
            .currency("NGN")
            .email("investor@example.com")
            .metadata(Map.of("investment_id", "inv-1"))
            .build();
    }

    @Test
    @DisplayName("initialize sends the amount in kobo and maps the checkout session")
    void initializeMapsSession() {
        server.expect(requestTo(BASE_URL + "/transaction/initialize"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk_test_gateway"))
            .andExpect(jsonPath("$.amount").value(25050))
            .andExpect(jsonPath("$.reference").value(REFERENCE))
            .andExpect(jsonPath("$.currency").value("NGN"))
            .andExpect(jsonPath("$.callback_url").value("https://app.test/payment/callback"))
            .andExpect(jsonPath("$.metadata.investment_id").value("inv-1"))
            .andRespond(withSuccess("""
                {"status":true,"message":"Authorization URL created",
                 "data":{"authorization_url":"https://checkout.paystack.com/abc","access_code":"abc","reference":"%s"}}
                """.formatted(REFERENCE), MediaType.APPLICATION_JSON));

        GatewaySession session = gateway.initialize(charge());

        server.verify();
        assertEquals(REFERENCE, session.getReference());
        assertEquals("https://checkout.paystack.com/abc", session.getAuthorizationUrl());
        assertEquals("abc", session.getAccessCode());
        assertEquals(1, registry.timer("gateway.latency", "operation", "initialize", "outcome", "success").count());
    }

    @Test
    @DisplayName("verify converts kobo back to major units and maps the charge status")
    void verifyMapsCharge() {
        server.expect(requestTo(BASE_URL + "/transaction/verify/" + REFERENCE))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("""
                {"status":true,"message":"Verification successful",
                 "data":{"id":4099260516,"status":"success","reference":"%s","amount":25050,
                         "gateway_response":"Approved","paid_at":"2024-04-10T12:00:00Z"}}
                """.formatted(REFERENCE), MediaType.APPLICATION_JSON));

        GatewayVerification verification = gateway.verify(REFERENCE);

        server.verify();
        assertEquals(PaymentStatus.SUCCESS, verification.getStatus());
        assertEquals(new BigDecimal("250.50"), verification.getAmount());
        assertEquals("4099260516", verification.getGatewayTransactionId());
        assertEquals("Approved", verification.getGatewayResponse());
        assertEquals(Instant.parse("2024-04-10T12:00:00Z"), verification.getPaidAt());
    }

    @Test
    @DisplayName("A charge the gateway is still processing verifies as PENDING")
    void verifyOngoing() {
        server.expect(requestTo(BASE_URL + "/transaction/verify/" + REFERENCE))
            .andRespond(withSuccess("""
                {"status":true,"message":"Verification successful",
                 "data":{"status":"ongoing","reference":"%s","amount":25050}}
                """.formatted(REFERENCE), MediaType.APPLICATION_JSON));

        GatewayVerification verification = gateway.verify(REFERENCE);

        assertEquals(PaymentStatus.PENDING, verification.getStatus());
        assertNull(verification.getPaidAt());
    }

    @Test
    @DisplayName("A 5xx answer is reported as gateway unavailable")
    void serverError() {
        server.expect(requestTo(BASE_URL + "/transaction/initialize"))
            .andRespond(withServerError());

        assertThrows(GatewayUnavailableException.class, () -> gateway.initialize(charge()));
        assertEquals(1, registry.timer("gateway.latency", "operation", "initialize", "outcome", "error").count());
    }

    @Test
    @DisplayName("A status:false body is reported as gateway unavailable")
    void rejectedByGateway() {
        server.expect(requestTo(BASE_URL + "/transaction/verify/" + REFERENCE))
            .andRespond(withSuccess("{\"status\":false,\"message\":\"Transaction reference not found\"}",
                MediaType.APPLICATION_JSON));

        GatewayUnavailableException e = assertThrows(GatewayUnavailableException.class,
            () -> gateway.verify(REFERENCE));
        assertTrue(e.getMessage().contains("Transaction reference not found"));
        assertEquals(1, registry.timer("gateway.latency", "operation", "verify", "outcome", "rejected").count());
    }

    @Test
    @DisplayName("A read timeout is reported as gateway unavailable")
    void readTimeout() {
        server.expect(requestTo(BASE_URL + "/transaction/initialize"))
            .andRespond(request -> {
                throw new SocketTimeoutException("Read timed out");
            });

        GatewayUnavailableException e = assertThrows(GatewayUnavailableException.class,
            () -> gateway.initialize(charge()));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("A body that is not JSON is reported as gateway unavailable")
    void malformedBody() {
        server.expect(requestTo(BASE_URL + "/transaction/verify/" + REFERENCE))
            .andRespond(withSuccess("<html>gateway maintenance</html>", MediaType.TEXT_HTML));

        assertThrows(GatewayUnavailableException.class, () -> gateway.verify(REFERENCE));
    }
}
