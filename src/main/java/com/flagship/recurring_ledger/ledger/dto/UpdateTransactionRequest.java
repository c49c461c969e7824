package com.flagship.recurring_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.ledger.TransactionEdit;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update; absent fields keep their value.
 */
@Value
@Builder
@Jacksonized
public class UpdateTransactionRequest {

    @JsonProperty("date")
    LocalDate date;

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

    public TransactionEdit toEdit() {
        return TransactionEdit.builder()
            .occurrenceDate(date)
            .vendor(vendor)
            .category(category)
            .amount(amount)
            .notes(notes)
            .build();
    }
}
