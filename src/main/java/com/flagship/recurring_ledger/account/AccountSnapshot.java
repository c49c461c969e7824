package com.flagship.recurring_ledger.account;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Portable copy of an account: its templates with their generation state and all of its
 * transactions. Ids are only meaningful inside the snapshot, where they link generated
 * transactions to their template.
 */
@Value
@Builder
@Jacksonized
public class AccountSnapshot {

    public static final int CURRENT_VERSION = 1;

    @JsonProperty("version")
    int version;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("templates")
    List<TemplateRecord> templates;

    @JsonProperty("transactions")
    List<TransactionRecord> transactions;

    @JsonProperty("exported_at")
    Instant exportedAt;

    @Value
    @Builder
    @Jacksonized
    public static class TemplateRecord {

        @JsonProperty("id")
        UUID id;

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

        public static TemplateRecord from(RecurringTemplate template) {
            return TemplateRecord.builder()
                .id(template.getId())
                .startDate(template.getStartDate())
                .vendor(template.getVendor())
                .category(template.getCategory())
                .amount(template.getAmount())
                .notes(template.getNotes())
                .frequencyDays(template.getFrequencyDays())
                .nextDueDate(template.getNextDueDate())
                .totalOccurrences(template.getTotalOccurrences())
                .generatedCount(template.getGeneratedCount())
                .build();
        }

        public RecurringTemplate toDomain(UUID accountId) {
            return new RecurringTemplate(id, accountId, startDate, vendor, category, amount, notes,
                frequencyDays, nextDueDate, totalOccurrences, generatedCount);
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class TransactionRecord {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("occurrence_date")
        LocalDate occurrenceDate;

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

        public static TransactionRecord from(OneTimeTransaction transaction) {
            return TransactionRecord.builder()
                .id(transaction.getId())
                .occurrenceDate(transaction.getOccurrenceDate())
                .vendor(transaction.getVendor())
                .category(transaction.getCategory())
                .amount(transaction.getAmount())
                .notes(transaction.getNotes())
                .sourceTemplateId(transaction.getSourceTemplateId())
                .build();
        }

        public OneTimeTransaction toDomain(UUID accountId) {
            return new OneTimeTransaction(id, accountId, occurrenceDate, vendor, category, amount, notes,
                sourceTemplateId);
        }
    }
}
