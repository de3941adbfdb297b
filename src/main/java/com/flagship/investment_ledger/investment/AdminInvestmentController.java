package com.flagship.investment_ledger.investment;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Maintenance endpoints, reachable only through the upstream admin gateway.
 */
@RestController
@RequestMapping("/api/admin/investments")
@RequiredArgsConstructor
public class AdminInvestmentController {

    private final InvestmentService investmentService;

    @PostMapping("/{id}/reconcile")
    public Map<String, Object> reconcile(@PathVariable("id") UUID id) {
        ReconciliationResult result = investmentService.reconcile(id);
        return Map.of(
            "investment_id", id,
            "result", result,
            "reconciliation_required", result.requiresReconciliation());
    }

    @DeleteMapping("/cancelled")
    public Map<String, Object> purgeCancelled(@RequestParam("userId") UUID userId) {
        return Map.of("user_id", userId, "deleted", investmentService.purgeCancelled(userId));
    }
}
