package com.flagship.investment_ledger.investment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for investment lifecycle events.
 *
 * Every event carries its own ID so consumers can deduplicate redeliveries.
 */
public interface InvestmentEvent {

    UUID getEventId();

    UUID getInvestmentId();

    UUID getUserId();

    Instant getOccurredAt();

    /**
     * Event type name for routing.
     */
    String getEventType();
}
