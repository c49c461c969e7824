package com.flagship.recurring_ledger.observability;

import com.flagship.recurring_ledger.outbox.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN once the outbox backlog shows the publisher has stalled.
 */
@Component("outboxHealth")
@RequiredArgsConstructor
public class OutboxHealthIndicator implements HealthIndicator {

    static final long BACKLOG_WARNING_THRESHOLD = 1_000;
    static final long BACKLOG_CRITICAL_THRESHOLD = 10_000;

    private final OutboxEventRepository outboxRepository;

    @Override
    public Health health() {
        try {
            long backlog = outboxRepository.countUnpublished();
            Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                ? Health.up()
                : backlog < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
            return builder
                .withDetail("backlogSize", backlog)
                .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                .build();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
