package com.flagship.recurring_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A manual transaction. Negative amounts are spending, positive amounts are income.
 */
@Value
@Builder
@Jacksonized
public class CreateTransactionRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotBlank(message = "Vendor is required")
    @Size(max = 100)
    @JsonProperty("vendor")
    String vendor;

    @NotBlank(message = "Category is required")
    @Size(max = 50)
    @JsonProperty("category")
    String category;

    @NotNull(message = "Amount is required")
    @Digits(integer = 15, fraction = 4, message = "Amount must have at most 15 integer digits and 4 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @Size(max = 500)
    @JsonProperty("notes")
    String notes;
}
