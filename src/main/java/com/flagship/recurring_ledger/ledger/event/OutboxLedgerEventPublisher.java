package com.flagship.recurring_ledger.ledger.event;

import com.flagship.recurring_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Writes ledger events to the transactional outbox; {@code OutboxPublisher} ships them to Kafka.
 */
@Component
@RequiredArgsConstructor
public class OutboxLedgerEventPublisher implements LedgerEventPublisher {

    public static final String AGGREGATE_TYPE = "Account";

    private final OutboxService outboxService;

    @Override
    public void publish(LedgerEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getAccountId(), event.getEventType(), event);
    }
}
