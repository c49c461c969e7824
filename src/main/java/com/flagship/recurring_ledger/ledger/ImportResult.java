package com.flagship.recurring_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a bulk import: the stored transactions and the recalculated balance.
 */
@Value
public class ImportResult {
    UUID accountId;
    List<OneTimeTransaction> transactions;
    BigDecimal balance;

    public int getCount() {
        return transactions.size();
    }
}
