package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of reconciling a template's generated transactions with an edited cap.
 * {@code cutoffDate} is null when the edit did not call for any cleanup.
 */
@Value
public class RetractionResult {
    RecurringTemplate template;
    List<OneTimeTransaction> retracted;
    LocalDate cutoffDate;

    static RetractionResult none(RecurringTemplate template) {
        return new RetractionResult(template, List.of(), null);
    }

    public int getCount() {
        return retracted.size();
    }

    public boolean isEmpty() {
        return retracted.isEmpty();
    }

    public List<UUID> getTransactionIds() {
        return retracted.stream()
            .map(OneTimeTransaction::getId)
            .toList();
    }

    public BigDecimal getTotalAmount() {
        return AccountBalanceLedger.sum(retracted);
    }
}
