package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Removes generated transactions that an edited occurrence cap no longer allows.
 *
 * With a new cap of {@code N}, the last occurrence allowed to survive is the zero-based
 * occurrence {@code N - 1}, dated {@code startDate + frequencyDays * (N - 1)} (the cutoff date).
 * Every transaction generated by the template and dated after the cutoff is reversed from the
 * balance and deleted, and {@code generatedCount} is reset to the number of surviving
 * generated transactions plus one.
 *
 * Cleanup only happens when the cap shrinks: the new cap is bounded and either the old one
 * was unbounded or larger. Raising a cap never backfills missed occurrences and
 * {@code nextDueDate} is never rewound. Manual transactions are never touched.
 *
 * Run inside {@link com.flagship.recurring_ledger.ledger.LedgerUnitOfWork} after the edited
 * template has been saved.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetractionEngine {

    private final LedgerStore store;
    private final AccountBalanceLedger balanceLedger;

    public static boolean requiresRetraction(int oldTotalOccurrences, int newTotalOccurrences) {
        if (!RecurringTemplate.isBounded(newTotalOccurrences)) {
            return false;
        }
        return !RecurringTemplate.isBounded(oldTotalOccurrences) || newTotalOccurrences < oldTotalOccurrences;
    }

    /**
     * Reconciles already generated transactions with a changed occurrence cap.
     *
     * Calling it again with the same state retracts nothing and leaves the template unchanged.
     *
     * @return the (possibly updated) template and the retracted transactions
     * @throws NotFoundException if the template no longer exists
     */
    public RetractionResult reconcileAfterEdit(RecurringTemplate template,
                                               int oldTotalOccurrences,
                                               int newTotalOccurrences) {
        if (!requiresRetraction(oldTotalOccurrences, newTotalOccurrences)) {
            log.debug("Cap change {} -> {} on template {} needs no cleanup",
                oldTotalOccurrences, newTotalOccurrences, template.getId());
            return RetractionResult.none(template);
        }
        RecurringTemplate.validateRecurrence(template.getFrequencyDays(), newTotalOccurrences);

        RecurringTemplate current = store.findTemplate(template.getId())
            .orElseThrow(() -> NotFoundException.template(template.getId()));

        LocalDate cutoffDate = current.occurrenceDate(newTotalOccurrences - 1);
        if (cutoffDate.equals(LocalDate.MAX)) {
            // Nothing can be dated after the last day of the calendar
            log.debug("Cutoff for cap {} on template {} is past the calendar, nothing to retract",
                newTotalOccurrences, current.getId());
            return new RetractionResult(current, List.of(), cutoffDate);
        }
        List<OneTimeTransaction> excess =
            store.findLinkedTransactionsOnOrAfter(current.getId(), cutoffDate.plusDays(1));

        if (excess.isEmpty()) {
            return new RetractionResult(current, List.of(), cutoffDate);
        }

        for (OneTimeTransaction transaction : excess) {
            balanceLedger.reverse(transaction.getAccountId(), transaction.getAmount());
            store.deleteTransaction(transaction.getId());
        }

        int remaining = store.findLinkedTransactions(current.getId()).size();
        RecurringTemplate reset = store.saveTemplate(current.withGeneratedCount(remaining + 1));

        log.info("Retracted {} occurrences of template {} after {} (cap {} -> {}), {} remain",
            excess.size(), current.getId(), cutoffDate, oldTotalOccurrences, newTotalOccurrences, remaining);
        return new RetractionResult(reset, List.copyOf(excess), cutoffDate);
    }
}
