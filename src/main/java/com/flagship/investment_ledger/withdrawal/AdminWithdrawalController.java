package com.flagship.investment_ledger.withdrawal;

import com.flagship.investment_ledger.withdrawal.dto.AdminNoteRequest;
import com.flagship.investment_ledger.withdrawal.dto.WithdrawalResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Admin processing of withdrawal requests: approve, reject, mark_paid, mark_failed.
 */
@RestController
@RequestMapping("/api/admin/withdrawals")
@RequiredArgsConstructor
public class AdminWithdrawalController {

    private final WithdrawalService withdrawalService;

    @GetMapping("/{id}")
    public WithdrawalResponse get(@PathVariable("id") UUID id) {
        return WithdrawalResponse.from(withdrawalService.get(id));
    }

    @PostMapping("/{id}/notes")
    public WithdrawalResponse addNote(@PathVariable("id") UUID id,
                                      @Valid @RequestBody AdminNoteRequest.Required request) {
        return WithdrawalResponse.from(withdrawalService.addNote(id, request.getNote()));
    }

    @PostMapping("/{id}/{action}")
    public WithdrawalResponse act(@PathVariable("id") UUID id,
                                  @PathVariable("action") String action,
                                  @RequestBody(required = false) AdminNoteRequest request) {
        String note = request != null ? request.getNote() : null;
        return WithdrawalResponse.from(withdrawalService.apply(id, WithdrawalAction.fromPath(action), note));
    }
}
