package com.flagship.investment_ledger.withdrawal;

import java.util.Locale;

/**
 * Admin actions addressable as {@code /api/admin/withdrawals/{id}/{action}}.
 */
public enum WithdrawalAction {
    APPROVE("approve"),
    REJECT("reject"),
    MARK_PAID("mark_paid"),
    MARK_FAILED("mark_failed");

    private final String path;

    WithdrawalAction(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    public static WithdrawalAction fromPath(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (WithdrawalAction action : values()) {
                if (action.path.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Unknown withdrawal action: " + value);
    }
}
