package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.account.Account;
import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.LedgerUnitOfWork;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import com.flagship.recurring_ledger.ledger.event.LedgerEventPublisher;
import com.flagship.recurring_ledger.ledger.event.OccurrencesGeneratedEvent;
import com.flagship.recurring_ledger.observability.CorrelationContext;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Brings recurring templates up to date, typically when their owner logs in.
 *
 * Every template gets its own unit of work on its account, so a failing template is rolled
 * back alone: it is logged, counted and listed in the {@link SyncReport} while the remaining
 * templates and accounts carry on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringSyncService {

    private final LedgerStore store;
    private final LedgerUnitOfWork unitOfWork;
    private final OccurrenceGenerator generator;
    private final LedgerEventPublisher eventPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public SyncReport syncUser(UUID userId) {
        return syncUser(userId, LocalDate.now(clock));
    }

    /**
     * Generates every occurrence due on or before {@code referenceDate} on all of the user's accounts.
     */
    public SyncReport syncUser(UUID userId, LocalDate referenceDate) {
        List<UUID> accountIds = store.findAccountsByUser(userId).stream()
            .map(Account::getId)
            .toList();
        SyncReport report = sync(accountIds, referenceDate);
        log.info("Recurring sync for user {} as of {}: generated={}, failed={}",
            userId, referenceDate, report.getTotalGenerated(), report.getFailedTemplates().size());
        return report;
    }

    /**
     * Generates every due occurrence on a single account.
     *
     * @throws NotFoundException if the account does not exist
     */
    public SyncReport syncAccount(UUID accountId, LocalDate referenceDate) {
        if (store.findAccount(accountId).isEmpty()) {
            throw NotFoundException.account(accountId);
        }
        return sync(List.of(accountId), referenceDate);
    }

    /**
     * Catch-up pass over every account in the ledger.
     */
    public SyncReport syncAll(LocalDate referenceDate) {
        SyncReport report = sync(store.findAllAccountIds(), referenceDate);
        log.info("Recurring sync of all accounts as of {}: accounts={}, generated={}, failed={}",
            referenceDate, report.getGeneratedByAccount().size(), report.getTotalGenerated(),
            report.getFailedTemplates().size());
        return report;
    }

    private SyncReport sync(List<UUID> accountIds, LocalDate referenceDate) {
        long startNanos = System.nanoTime();
        Map<UUID, Integer> generatedByAccount = new LinkedHashMap<>();
        List<SyncReport.TemplateFailure> failures = new ArrayList<>();
        int total = 0;

        for (UUID accountId : accountIds) {
            try (MDC.MDCCloseable scope = CorrelationContext.forAccount(accountId)) {
                List<RecurringTemplate> templates;
                try {
                    templates = store.findTemplatesByAccount(accountId);
                } catch (RuntimeException e) {
                    log.error("Could not list templates of account {}, skipping it: error={}",
                        accountId, e.getMessage());
                    metrics.recordSyncFailure(e.getClass().getSimpleName());
                    failures.add(new SyncReport.TemplateFailure(accountId, null, e.getMessage()));
                    continue;
                }
                int generated = 0;
                for (RecurringTemplate template : templates) {
                    generated += syncTemplate(accountId, template, referenceDate, failures);
                }
                generatedByAccount.put(accountId, generated);
                total += generated;
            }
        }

        metrics.recordSyncDuration(Duration.ofNanos(System.nanoTime() - startNanos));
        return new SyncReport(referenceDate, total, Map.copyOf(generatedByAccount), List.copyOf(failures));
    }

    private int syncTemplate(UUID accountId, RecurringTemplate template, LocalDate referenceDate,
                             List<SyncReport.TemplateFailure> failures) {
        try (MDC.MDCCloseable scope = CorrelationContext.forTemplate(template.getId())) {
            GenerationResult result = unitOfWork.execute(accountId, () -> {
                GenerationResult generation = generator.generateDue(template, referenceDate);
                if (!generation.isEmpty()) {
                    RecurringTemplate advanced = generation.getTemplate();
                    eventPublisher.publish(new OccurrencesGeneratedEvent(
                        UUID.randomUUID(),
                        accountId,
                        advanced.getId(),
                        generation.getCount(),
                        generation.getOccurrenceDates(),
                        generation.getTotalAmount(),
                        advanced.getGeneratedCount(),
                        advanced.getNextDueDate(),
                        Instant.now(clock)
                    ));
                }
                return generation;
            });
            if (!result.isEmpty()) {
                metrics.recordOccurrencesGenerated(result.getCount());
                log.info("Generated {} occurrences of template {} up to {}",
                    result.getCount(), template.getId(), referenceDate);
            }
            return result.getCount();
        } catch (RuntimeException e) {
            log.error("Generation for template {} rolled back: error={}", template.getId(), e.getMessage());
            metrics.recordSyncFailure(e.getClass().getSimpleName());
            failures.add(new SyncReport.TemplateFailure(accountId, template.getId(), e.getMessage()));
            return 0;
        }
    }
}
