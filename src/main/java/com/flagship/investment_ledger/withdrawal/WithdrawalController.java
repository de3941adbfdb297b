package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.investment.InvestmentService;
import com.flagship.investment_ledger.investment.dto.InvestmentResponse;
import com.flagship.investment_ledger.withdrawal.dto.CreateWithdrawalRequest;
import com.flagship.investment_ledger.withdrawal.dto.WithdrawalResponse;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/withdrawals")
@RequiredArgsConstructor
@Slf4j
public class WithdrawalController {

    private final WithdrawalService withdrawalService;
    private final InvestmentService investmentService;

    @PostMapping
    public ResponseEntity<WithdrawalResponse> create(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                     @Valid @RequestBody CreateWithdrawalRequest request) {
        log.info("Received withdrawal request: type={}, investments={}", request.getType(), request.getInvestmentIds());
        WithdrawalRequest created = withdrawalService.create(userId, request.getType(), request.getInvestmentIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(WithdrawalResponse.from(created));
    }

    @GetMapping
    public List<WithdrawalResponse> list(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return withdrawalService.list(userId).stream().map(WithdrawalResponse::from).toList();
    }

    /**
     * Completed investments not yet claimed by any withdrawal.
     */
    @GetMapping("/eligible")
    public List<InvestmentResponse> eligible(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return investmentService.withdrawable(userId).stream().map(InvestmentResponse::from).toList();
    }

    @GetMapping("/{id}")
    public WithdrawalResponse get(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                  @PathVariable("id") UUID id) {
        return WithdrawalResponse.from(withdrawalService.getForUser(userId, id));
    }
}
