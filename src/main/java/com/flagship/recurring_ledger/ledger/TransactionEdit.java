package com.flagship.recurring_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Field-level edit of a one-time transaction. Null fields are left unchanged.
 */
@Value
@Builder
public class TransactionEdit {
    LocalDate occurrenceDate;
    String vendor;
    String category;
    BigDecimal amount;
    String notes;
}
