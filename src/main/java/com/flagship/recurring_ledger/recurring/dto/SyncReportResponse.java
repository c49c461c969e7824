package com.flagship.recurring_ledger.recurring.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.recurring.SyncReport;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class SyncReportResponse {

    @JsonProperty("reference_date")
    LocalDate referenceDate;

    @JsonProperty("total_generated")
    int totalGenerated;

    @JsonProperty("generated_by_account")
    Map<UUID, Integer> generatedByAccount;

    @JsonProperty("failed_templates")
    List<FailedTemplate> failedTemplates;

    public static SyncReportResponse from(SyncReport report) {
        return SyncReportResponse.builder()
            .referenceDate(report.getReferenceDate())
            .totalGenerated(report.getTotalGenerated())
            .generatedByAccount(report.getGeneratedByAccount())
            .failedTemplates(report.getFailedTemplates().stream()
                .map(failure -> new FailedTemplate(failure.getAccountId(), failure.getTemplateId(), failure.getReason()))
                .toList())
            .build();
    }

    @Value
    public static class FailedTemplate {

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("template_id")
        UUID templateId;

        @JsonProperty("reason")
        String reason;
    }
}
