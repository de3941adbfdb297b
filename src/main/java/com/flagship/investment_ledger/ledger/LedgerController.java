package com.flagship.investment_ledger.ledger;

import com.flagship.investment_ledger.config.ApiHeaders;
import com.flagship.investment_ledger.ledger.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of the caller's ledger entries.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;

    @GetMapping
    public List<TransactionResponse> listTransactions(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestParam(value = "type", required = false) TransactionType type) {
        return ledgerService.findByUser(userId, type).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
