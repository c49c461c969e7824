package com.flagship.recurring_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Field-level edit of a recurring template. Null fields are left unchanged.
 */
@Value
@Builder
public class RecurringTemplateEdit {
    LocalDate startDate;
    String vendor;
    String category;
    BigDecimal amount;
    String notes;
    Integer frequencyDays;
    LocalDate nextDueDate;
    Integer totalOccurrences;

    public boolean changesTotalOccurrences() {
        return totalOccurrences != null;
    }
}
