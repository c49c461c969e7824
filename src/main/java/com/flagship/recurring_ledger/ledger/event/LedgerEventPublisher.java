package com.flagship.recurring_ledger.ledger.event;

/**
 * Hands ledger events to downstream consumers.
 *
 * Must be called inside the unit of work that made the change, so the event is
 * recorded if and only if the change commits.
 */
public interface LedgerEventPublisher {

    void publish(LedgerEvent event);
}
