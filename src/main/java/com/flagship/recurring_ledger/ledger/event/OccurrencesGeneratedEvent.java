package com.flagship.recurring_ledger.ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Published when a recurring template produced one or more transactions.
 */
@Value
public class OccurrencesGeneratedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID templateId;
    int count;
    List<LocalDate> occurrenceDates;
    BigDecimal totalAmount;
    int generatedCount;
    LocalDate nextDueDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OccurrencesGenerated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
