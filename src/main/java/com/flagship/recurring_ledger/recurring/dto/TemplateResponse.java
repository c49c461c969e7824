package com.flagship.recurring_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TemplateResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("vendor")
    String vendor;

    @JsonProperty("category")
    String category;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("frequency_days")
    int frequencyDays;

    @JsonProperty("next_due_date")
    LocalDate nextDueDate;

    @JsonProperty("total_occurrences")
    int totalOccurrences;

    @JsonProperty("generated_count")
    int generatedCount;

    @JsonProperty("exhausted")
    boolean exhausted;

    public static TemplateResponse from(RecurringTemplate template) {
        return TemplateResponse.builder()
            .id(template.getId())
            .accountId(template.getAccountId())
            .startDate(template.getStartDate())
            .vendor(template.getVendor())
            .category(template.getCategory())
            .amount(template.getAmount())
            .notes(template.getNotes())
            .frequencyDays(template.getFrequencyDays())
            .nextDueDate(template.getNextDueDate())
            .totalOccurrences(template.getTotalOccurrences())
            .generatedCount(template.getGeneratedCount())
            .exhausted(template.isExhausted())
            .build();
    }
}
