package com.flagship.recurring_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ImportTransactionsRequest {

    @NotEmpty(message = "At least one transaction is required")
    @Size(max = 5000, message = "At most 5000 transactions per import")
    @JsonProperty("transactions")
    List<@Valid CreateTransactionRequest> transactions;
}
