package com.flagship.recurring_ledger.ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a cap reduction removed previously generated transactions.
 * {@code totalAmount} is the sum of the removed amounts, already reversed from the balance.
 */
@Value
public class OccurrencesRetractedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID templateId;
    List<UUID> transactionIds;
    BigDecimal totalAmount;
    int totalOccurrences;
    int generatedCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OccurrencesRetracted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
