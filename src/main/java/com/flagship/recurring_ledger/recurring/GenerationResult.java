package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one generation pass over a template.
 */
@Value
public class GenerationResult {
    RecurringTemplate template;
    List<OneTimeTransaction> transactions;

    /**
     * Number of transactions created by this pass.
     */
    public int getCount() {
        return transactions.size();
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    public List<LocalDate> getOccurrenceDates() {
        return transactions.stream()
            .map(OneTimeTransaction::getOccurrenceDate)
            .toList();
    }

    public BigDecimal getTotalAmount() {
        return AccountBalanceLedger.sum(transactions);
    }
}
