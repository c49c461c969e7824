package com.flagship.recurring_ledger.recurring;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of advancing a set of accounts' templates to a reference date.
 * Failed templates were rolled back individually; everything else committed. An account whose
 * templates could not be read is listed once with no template id.
 */
@Value
public class SyncReport {
    LocalDate referenceDate;
    int totalGenerated;
    Map<UUID, Integer> generatedByAccount;
    List<TemplateFailure> failedTemplates;

    public boolean isSuccessful() {
        return failedTemplates.isEmpty();
    }

    /**
     * A template, or a whole account when {@code templateId} is null, that was skipped.
     */
    @Value
    public static class TemplateFailure {
        UUID accountId;
        UUID templateId;
        String reason;
    }
}
