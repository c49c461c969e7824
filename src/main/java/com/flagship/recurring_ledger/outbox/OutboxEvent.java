package com.flagship.recurring_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized ledger event waiting in the outbox table to be shipped to Kafka.
 *
 * Written in the same database transaction as the ledger change it describes and
 * published afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
