package com.flagship.recurring_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.recurring.RetractionResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TemplateEditResponse {

    @JsonProperty("template")
    TemplateResponse template;

    @JsonProperty("retracted_count")
    int retractedCount;

    @JsonProperty("retracted_transaction_ids")
    List<UUID> retractedTransactionIds;

    @JsonProperty("retracted_amount")
    BigDecimal retractedAmount;

    @JsonProperty("cutoff_date")
    LocalDate cutoffDate;

    public static TemplateEditResponse from(RetractionResult result) {
        return TemplateEditResponse.builder()
            .template(TemplateResponse.from(result.getTemplate()))
            .retractedCount(result.getCount())
            .retractedTransactionIds(result.getTransactionIds())
            .retractedAmount(result.getTotalAmount())
            .cutoffDate(result.getCutoffDate())
            .build();
    }
}
