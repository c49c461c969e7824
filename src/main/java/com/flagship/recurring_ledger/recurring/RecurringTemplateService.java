package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.exception.ValidationException;
import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.LedgerUnitOfWork;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import com.flagship.recurring_ledger.ledger.RecurringTemplateEdit;
import com.flagship.recurring_ledger.ledger.event.LedgerEventPublisher;
import com.flagship.recurring_ledger.ledger.event.OccurrencesRetractedEvent;
import com.flagship.recurring_ledger.observability.CorrelationContext;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Lifecycle of recurring templates: create, edit, delete and preview.
 *
 * Edits that shrink the occurrence cap hand the already generated transactions to the
 * {@link RetractionEngine} within the same unit of work as the edit itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringTemplateService {

    public static final int DEFAULT_UPCOMING_LIMIT = 5;
    public static final int MAX_UPCOMING_LIMIT = 50;

    private final LedgerStore store;
    private final LedgerUnitOfWork unitOfWork;
    private final RetractionEngine retractionEngine;
    private final AccountBalanceLedger balanceLedger;
    private final LedgerEventPublisher eventPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public RecurringTemplate createTemplate(RecurringTemplate template) {
        RecurringTemplate saved = unitOfWork.execute(template.getAccountId(), () -> store.saveTemplate(template));
        log.info("Created recurring template {} on account {}: every {} days from {}, cap {}",
            saved.getId(), saved.getAccountId(), saved.getFrequencyDays(), saved.getStartDate(),
            saved.isBounded() ? saved.getTotalOccurrences() : "unbounded");
        return saved;
    }

    /**
     * Applies a field-level edit. A changed cap is reconciled against the transactions the
     * template already generated; those transactions keep their other fields as they are.
     *
     * @return the saved template and whatever the cap change retracted
     */
    public RetractionResult editTemplate(UUID templateId, RecurringTemplateEdit edit) {
        RecurringTemplate template = getTemplate(templateId);
        try (MDC.MDCCloseable scope = CorrelationContext.forTemplate(templateId)) {
            RetractionResult result = unitOfWork.execute(template.getAccountId(), () -> {
                RecurringTemplate current = getTemplate(templateId);
                RecurringTemplate saved = store.saveTemplate(current.edit(edit));
                if (!edit.changesTotalOccurrences()) {
                    return RetractionResult.none(saved);
                }
                RetractionResult retraction = retractionEngine.reconcileAfterEdit(
                    saved, current.getTotalOccurrences(), saved.getTotalOccurrences());
                if (!retraction.isEmpty()) {
                    eventPublisher.publish(new OccurrencesRetractedEvent(
                        UUID.randomUUID(),
                        saved.getAccountId(),
                        saved.getId(),
                        retraction.getTransactionIds(),
                        retraction.getTotalAmount(),
                        retraction.getTemplate().getTotalOccurrences(),
                        retraction.getTemplate().getGeneratedCount(),
                        Instant.now(clock)
                    ));
                }
                return retraction;
            });
            if (!result.isEmpty()) {
                metrics.recordOccurrencesRetracted(result.getCount());
            }
            return result;
        }
    }

    /**
     * Deletes a template. With {@code cascade} its generated transactions are deleted and
     * reversed from the balance; otherwise they are kept as manual transactions.
     *
     * @return the number of generated transactions deleted or unlinked
     */
    public int deleteTemplate(UUID templateId, boolean cascade) {
        RecurringTemplate template = getTemplate(templateId);
        int affected = unitOfWork.execute(template.getAccountId(), () -> {
            List<OneTimeTransaction> linked = store.findLinkedTransactions(templateId);
            for (OneTimeTransaction transaction : linked) {
                if (cascade) {
                    balanceLedger.reverse(transaction.getAccountId(), transaction.getAmount());
                    store.deleteTransaction(transaction.getId());
                } else {
                    store.saveTransaction(transaction.unlink());
                }
            }
            store.deleteTemplate(templateId);
            return linked.size();
        });
        log.info("Deleted recurring template {}, {} {} generated transactions",
            templateId, cascade ? "deleted" : "unlinked", affected);
        return affected;
    }

    public RecurringTemplate getTemplate(UUID templateId) {
        return store.findTemplate(templateId)
            .orElseThrow(() -> NotFoundException.template(templateId));
    }

    public List<RecurringTemplate> listTemplates(UUID accountId) {
        if (store.findAccount(accountId).isEmpty()) {
            throw NotFoundException.account(accountId);
        }
        return store.findTemplatesByAccount(accountId);
    }

    /**
     * Next dates the template would generate, never more than its cap still allows.
     *
     * @throws ValidationException if {@code limit} is outside 1..{@value #MAX_UPCOMING_LIMIT}
     */
    public List<LocalDate> upcomingDates(UUID templateId, int limit) {
        if (limit < 1 || limit > MAX_UPCOMING_LIMIT) {
            throw new ValidationException("Limit must be between 1 and " + MAX_UPCOMING_LIMIT + ", got " + limit);
        }
        return getTemplate(templateId).upcomingDates(limit);
    }
}
