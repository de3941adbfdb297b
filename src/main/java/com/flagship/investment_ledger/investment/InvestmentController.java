package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.investment.dto.CheckoutResponse;
import com.flagship.investment_ledger.investment.dto.CreateInvestmentRequest;
import com.flagship.investment_ledger.investment.dto.InvestmentResponse;
import com.flagship.investment_ledger.investment.dto.InvestmentSummary;
import com.flagship.investment_ledger.investment.dto.InvestmentUpdateResponse;
import com.flagship.investment_ledger.investment.dto.PaymentAttemptRequest;
import com.flagship.investment_ledger.investment.dto.PaymentStatusResponse;
import com.flagship.investment_ledger.payment.Payment;
import com.flagship.investment_ledger.payment.dto.PaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * User-facing investment endpoints. The caller is identified by {@code X-User-Id}.
 *
 * Order creation accepts an optional {@code Idempotency-Key}: a repeated key returns
 * the original order with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/investments")
@RequiredArgsConstructor
@Slf4j
public class InvestmentController {

    private final InvestmentService investmentService;

    @PostMapping
    public ResponseEntity<CheckoutResponse> create(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestHeader(value = ApiHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateInvestmentRequest request) {

        log.info("Received investment request: package={}, amount={}, idempotencyKey={}",
                request.getPackageId(), request.getAmount(), idempotencyKey);

        Checkout checkout = investmentService.create(userId, request, idempotencyKey);
        CheckoutResponse body = new CheckoutResponse(
            InvestmentResponse.from(checkout.getInvestment()),
            checkout.getPayment() != null ? PaymentResponse.from(checkout.getPayment()) : null);

        return ResponseEntity.status(checkout.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED).body(body);
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> newPaymentAttempt(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody PaymentAttemptRequest request) {
        Payment payment = investmentService.newPaymentAttempt(userId, id, request.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @PostMapping("/{id}/complete")
    public InvestmentResponse complete(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                       @PathVariable("id") UUID id) {
        return InvestmentResponse.from(investmentService.complete(userId, id));
    }

    @PostMapping("/{id}/cancel")
    public InvestmentResponse cancel(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                     @PathVariable("id") UUID id) {
        return InvestmentResponse.from(investmentService.cancel(userId, id));
    }

    @GetMapping
    public List<InvestmentResponse> list(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                         @RequestParam(value = "status", required = false) InvestmentStatus status) {
        return investmentService.list(userId, status).stream()
            .map(InvestmentResponse::from)
            .toList();
    }

    @GetMapping("/withdrawable")
    public List<InvestmentResponse> withdrawable(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return investmentService.withdrawable(userId).stream()
            .map(InvestmentResponse::from)
            .toList();
    }

    @GetMapping("/summary")
    public InvestmentSummary summary(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return investmentService.summary(userId);
    }

    @GetMapping("/{id}")
    public InvestmentResponse get(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                  @PathVariable("id") UUID id) {
        return InvestmentResponse.from(investmentService.getForUser(userId, id));
    }

    @GetMapping("/{id}/payment-status")
    public PaymentStatusResponse paymentStatus(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                               @PathVariable("id") UUID id) {
        Investment investment = investmentService.getForUser(userId, id);
        PaymentResponse latest = investmentService.latestPayment(userId, id)
            .map(PaymentResponse::from)
            .orElse(null);
        return new PaymentStatusResponse(id, investment.getStatus(), investment.isReconciliationRequired(), latest);
    }

    @GetMapping("/{id}/updates")
    public List<InvestmentUpdateResponse> updates(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                  @PathVariable("id") UUID id) {
        return investmentService.updates(userId, id).stream()
            .map(InvestmentUpdateResponse::from)
            .toList();
    }
}
