package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the due occurrences of a recurring template into one-time transactions.
 *
 * Starting from the template's {@code nextDueDate}, every occurrence dated on or before the
 * reference date is generated, each one applied to the account balance and the template
 * advanced by one interval. Generation stops at the reference date or at the occurrence cap,
 * whichever comes first; due dates beyond the cap are forfeited, not deferred.
 *
 * The generator does not open its own unit of work: run it inside
 * {@link com.flagship.recurring_ledger.ledger.LedgerUnitOfWork} so a failure on any occurrence
 * discards the whole pass.
 */
@Component
@Slf4j
public class OccurrenceGenerator {

    private final LedgerStore store;
    private final AccountBalanceLedger balanceLedger;
    private final String notePrefix;

    public OccurrenceGenerator(LedgerStore store,
                               AccountBalanceLedger balanceLedger,
                               @Value("${ledger.recurring.generated-note-prefix:Auto-gen:}") String notePrefix) {
        this.store = store;
        this.balanceLedger = balanceLedger;
        this.notePrefix = notePrefix;
    }

    /**
     * Generates every occurrence of {@code template} due on or before {@code referenceDate}.
     *
     * The stored state of the template is authoritative; the argument identifies it.
     *
     * @return the advanced template and the transactions created (empty if nothing was due)
     * @throws NotFoundException if the template no longer exists
     */
    public GenerationResult generateDue(RecurringTemplate template, LocalDate referenceDate) {
        RecurringTemplate current = store.findTemplate(template.getId())
            .orElseThrow(() -> NotFoundException.template(template.getId()));
        RecurringTemplate.validateRecurrence(current.getFrequencyDays(), current.getTotalOccurrences());

        List<OneTimeTransaction> generated = new ArrayList<>();
        while (current.isDueOn(referenceDate)) {
            OneTimeTransaction transaction = OneTimeTransaction.generatedFrom(
                current, current.getNextDueDate(), noteFor(current));
            store.saveTransaction(transaction);
            balanceLedger.apply(current.getAccountId(), transaction.getAmount());
            generated.add(transaction);

            log.debug("Generated occurrence #{} of template {} on {}",
                current.getGeneratedCount() + 1, current.getId(), transaction.getOccurrenceDate());
            current = current.advance();
        }

        if (generated.isEmpty()) {
            return new GenerationResult(current, List.of());
        }

        RecurringTemplate saved = store.saveTemplate(current);
        if (saved.isExhausted()) {
            log.info("Template {} reached its cap of {} occurrences", saved.getId(), saved.getTotalOccurrences());
        }
        return new GenerationResult(saved, List.copyOf(generated));
    }

    private String noteFor(RecurringTemplate template) {
        String notes = template.getNotes();
        return notes == null || notes.isBlank() ? notePrefix : notePrefix + " " + notes;
    }
}
