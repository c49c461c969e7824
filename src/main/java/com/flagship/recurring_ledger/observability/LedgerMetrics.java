package com.flagship.recurring_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.occurrences.generated: transactions produced by recurring templates
 * - ledger.occurrences.retracted: generated transactions removed after a cap reduction
 * - ledger.transactions: manual transaction changes, tagged by operation
 * - ledger.sync.failures: templates whose generation pass failed and was rolled back
 * - ledger.balance.drift: audits that found the incremental balance out of line
 * - ledger.balance.audit.failures: accounts the periodic audit could not repair
 * - ledger.sync.duration: time to advance all templates of a user or of the whole ledger
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter occurrencesGenerated;
    private final Counter occurrencesRetracted;
    private final Counter balanceDrift;
    private final Timer syncTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.occurrencesGenerated = Counter.builder("ledger.occurrences.generated")
                .description("Number of transactions generated from recurring templates")
                .register(registry);

        this.occurrencesRetracted = Counter.builder("ledger.occurrences.retracted")
                .description("Number of generated transactions retracted after a cap reduction")
                .register(registry);

        this.balanceDrift = Counter.builder("ledger.balance.drift")
                .description("Number of balance audits that found and repaired drift")
                .register(registry);

        this.syncTimer = Timer.builder("ledger.sync.duration")
                .description("Time taken to advance recurring templates to the reference date")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordOccurrencesGenerated(int count) {
        occurrencesGenerated.increment(count);
    }

    public void recordOccurrencesRetracted(int count) {
        occurrencesRetracted.increment(count);
    }

    public void recordBalanceDrift(BigDecimal drift) {
        balanceDrift.increment();
        registry.summary("ledger.balance.drift.amount").record(drift.abs().doubleValue());
    }

    public void recordSyncFailure(String reason) {
        registry.counter("ledger.sync.failures", "reason", sanitizeTag(reason)).increment();
    }

    public void recordBalanceAuditFailure() {
        registry.counter("ledger.balance.audit.failures").increment();
    }

    /**
     * Records a manual transaction change with its outcome.
     */
    public void recordTransaction(String operation, String status) {
        registry.counter("ledger.transactions",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSyncDuration(Duration duration) {
        syncTimer.record(duration);
    }

    /**
     * Records an idempotency cache hit (duplicate request).
     */
    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    /**
     * Records an idempotency cache miss (new request).
     */
    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
