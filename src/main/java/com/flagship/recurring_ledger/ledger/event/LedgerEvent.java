package com.flagship.recurring_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a change to an account's ledger, published after the change commits.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    /**
     * The account whose ledger changed. Used as the partition key.
     */
    UUID getAccountId();

    Instant getOccurredAt();

    String getEventType();
}
