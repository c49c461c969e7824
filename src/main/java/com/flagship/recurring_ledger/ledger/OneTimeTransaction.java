package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single dated movement of money on an account.
 *
 * Transactions entered by hand carry no {@code sourceTemplateId}; transactions
 * produced by the occurrence generator point back at the template that produced them.
 * Instances are immutable: edits produce a new instance.
 */
@Value
public class OneTimeTransaction implements LedgerEntry {
    UUID id;
    UUID accountId;
    LocalDate occurrenceDate;
    String vendor;
    String category;
    BigDecimal amount;
    String notes;
    UUID sourceTemplateId;

    /**
     * Creates a manually entered transaction.
     *
     * @throws ValidationException if a required field is missing
     */
    public static OneTimeTransaction create(UUID accountId, LocalDate occurrenceDate, String vendor,
                                            String category, BigDecimal amount, String notes) {
        validate(accountId, occurrenceDate, vendor, category, amount);
        return new OneTimeTransaction(
            UUID.randomUUID(),
            accountId,
            occurrenceDate,
            vendor,
            category,
            amount,
            notes != null ? notes : "",
            null
        );
    }

    /**
     * Creates the transaction for one occurrence of a recurring template.
     */
    public static OneTimeTransaction generatedFrom(RecurringTemplate template, LocalDate occurrenceDate,
                                                   String notes) {
        return new OneTimeTransaction(
            UUID.randomUUID(),
            template.getAccountId(),
            occurrenceDate,
            template.getVendor(),
            template.getCategory(),
            template.getAmount(),
            notes,
            template.getId()
        );
    }

    @Override
    public LocalDate getDate() {
        return occurrenceDate;
    }

    @Override
    public Kind getKind() {
        return Kind.ONE_TIME;
    }

    public boolean isGenerated() {
        return sourceTemplateId != null;
    }

    public boolean isGeneratedBy(UUID templateId) {
        return templateId != null && templateId.equals(sourceTemplateId);
    }

    /**
     * Applies a field-level edit. The template link survives edits.
     *
     * @throws ValidationException if the edited transaction would be invalid
     */
    public OneTimeTransaction edit(TransactionEdit edit) {
        OneTimeTransaction edited = new OneTimeTransaction(
            id,
            accountId,
            edit.getOccurrenceDate() != null ? edit.getOccurrenceDate() : occurrenceDate,
            edit.getVendor() != null ? edit.getVendor() : vendor,
            edit.getCategory() != null ? edit.getCategory() : category,
            edit.getAmount() != null ? edit.getAmount() : amount,
            edit.getNotes() != null ? edit.getNotes() : notes,
            sourceTemplateId
        );
        validate(edited.accountId, edited.occurrenceDate, edited.vendor, edited.category, edited.amount);
        return edited;
    }

    /**
     * Drops the back-reference to the generating template, turning this into a manual entry.
     */
    public OneTimeTransaction unlink() {
        return new OneTimeTransaction(id, accountId, occurrenceDate, vendor, category, amount, notes, null);
    }

    /**
     * Copies this transaction into another account, re-pointing the template link.
     * Used when a snapshot is reloaded under fresh ids.
     */
    public OneTimeTransaction copyInto(UUID targetAccountId, UUID targetTemplateId) {
        return new OneTimeTransaction(
            UUID.randomUUID(),
            targetAccountId,
            occurrenceDate,
            vendor,
            category,
            amount,
            notes,
            targetTemplateId
        );
    }

    private static void validate(UUID accountId, LocalDate occurrenceDate, String vendor,
                                 String category, BigDecimal amount) {
        if (accountId == null) {
            throw new ValidationException("Account ID is required");
        }
        if (occurrenceDate == null) {
            throw new ValidationException("Transaction date is required");
        }
        if (vendor == null || vendor.isBlank()) {
            throw new ValidationException("Vendor is required");
        }
        if (category == null || category.isBlank()) {
            throw new ValidationException("Category is required");
        }
        if (amount == null) {
            throw new ValidationException("Amount is required");
        }
        LedgerEntry.requireStorableAmount(amount);
    }
}
