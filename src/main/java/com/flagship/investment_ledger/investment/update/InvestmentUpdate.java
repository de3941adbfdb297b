package com.flagship.investment_ledger.investment.update;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry in an investment's timeline, as shown to its owner.
 */
@Value
public class InvestmentUpdate {
    UUID id;
    UUID investmentId;
    UpdateType type;
    String title;
    String message;
    Instant createdAt;

    public static InvestmentUpdate create(UUID investmentId, UpdateType type, String title, String message) {
        return new InvestmentUpdate(UUID.randomUUID(), investmentId, type, title, message, Instant.now());
    }
}
