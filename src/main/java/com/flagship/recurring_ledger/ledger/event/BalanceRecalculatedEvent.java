package com.flagship.recurring_ledger.ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an account balance was re-derived from its transaction history.
 * A non-zero {@code drift} means the incremental balance had diverged and was repaired.
 */
@Value
public class BalanceRecalculatedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    BigDecimal previousBalance;
    BigDecimal recalculatedBalance;
    BigDecimal drift;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceRecalculated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
