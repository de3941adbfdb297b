package com.flagship.investment_ledger.payment;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.investment.PaymentOutcomeHandler;
import com.flagship.investment_ledger.investment.ReconciliationResult;
import com.flagship.investment_ledger.investment.dto.ReconcileResponse;
import com.flagship.investment_ledger.observability.CorrelationContext;
import com.flagship.investment_ledger.payment.dto.PaymentResponse;
import com.flagship.investment_ledger.payment.dto.VerifyPaymentRequest;
import com.flagship.investment_ledger.payment.gateway.PaymentGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Client-driven confirmation: the caller returns from checkout and asks us to verify
 * the reference with the gateway. Only the payment's owner may verify it.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentPersistenceService payments;
    private final PaymentGateway gateway;
    private final PaymentOutcomeHandler outcomeHandler;

    /**
     * Verifies the reference with the gateway and applies the answer.
     * {@code status} is the payment's stored state afterwards: {@code success},
     * {@code failed}, or {@code pending} while the gateway has not settled the charge.
     */
    @PostMapping("/verify")
    public ResponseEntity<ReconcileResponse> verify(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                    @Valid @RequestBody VerifyPaymentRequest request) {
        String reference = request.getReference();
        CorrelationContext.put(CorrelationContext.PAYMENT_REFERENCE_MDC_KEY, reference);

        payments.findByReferenceForUser(reference, userId)
            .orElseThrow(() -> NotFoundException.of("Payment", reference));

        ReconciliationResult result = outcomeHandler.handle(
            gateway.verify(reference).toOutcome(OutcomeSource.VERIFY));

        Payment current = payments.findByReference(reference)
            .orElseThrow(() -> NotFoundException.of("Payment", reference));
        ReconcileResponse body = new ReconcileResponse(
            statusValue(current.getStatus()), result, PaymentResponse.from(current));

        HttpStatus status = result == ReconciliationResult.OUT_OF_STOCK ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    private static String statusValue(PaymentStatus status) {
        return switch (status) {
            case SUCCESS -> "success";
            case FAILED -> "failed";
            case PENDING -> "pending";
        };
    }
}
