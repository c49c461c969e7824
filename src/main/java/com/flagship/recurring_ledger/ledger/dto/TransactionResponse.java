package com.flagship.recurring_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("vendor")
    String vendor;

    @JsonProperty("category")
    String category;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("source_template_id")
    UUID sourceTemplateId;

    @JsonProperty("generated")
    boolean generated;

    public static TransactionResponse from(OneTimeTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountId(transaction.getAccountId())
            .date(transaction.getOccurrenceDate())
            .vendor(transaction.getVendor())
            .category(transaction.getCategory())
            .amount(transaction.getAmount())
            .notes(transaction.getNotes())
            .sourceTemplateId(transaction.getSourceTemplateId())
            .generated(transaction.isGenerated())
            .build();
    }
}
