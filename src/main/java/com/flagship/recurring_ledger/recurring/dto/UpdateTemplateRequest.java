package com.flagship.recurring_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.ledger.RecurringTemplateEdit;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update; absent fields keep their value. Lowering {@code total_occurrences} below
 * what was already generated retracts the excess transactions.
 */
@Value
@Builder
@Jacksonized
public class UpdateTemplateRequest {

    @JsonProperty("start_date")
    LocalDate startDate;

    @Size(max = 100)
    @JsonProperty("vendor")
    String vendor;

    @Size(max = 50)
    @JsonProperty("category")
    String category;

    @Digits(integer = 15, fraction = 4, message = "Amount must have at most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500)
    @JsonProperty("notes")
    String notes;

    @JsonProperty("frequency_days")
    Integer frequencyDays;

    @JsonProperty("next_due_date")
    LocalDate nextDueDate;

    @JsonProperty("total_occurrences")
    Integer totalOccurrences;

    public RecurringTemplateEdit toEdit() {
        return RecurringTemplateEdit.builder()
            .startDate(startDate)
            .vendor(vendor)
            .category(category)
            .amount(amount)
            .notes(notes)
            .frequencyDays(frequencyDays)
            .nextDueDate(nextDueDate)
            .totalOccurrences(totalOccurrences)
            .build();
    }
}
