package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A rule that produces one-time transactions every {@code frequencyDays} days.
 *
 * Occurrence {@code i} (zero-based) falls on {@code startDate + frequencyDays * i}.
 * {@code nextDueDate} is the date of the next occurrence still to be generated and
 * {@code generatedCount} counts the occurrences produced so far, so in a consistent state
 * {@code nextDueDate == startDate + frequencyDays * generatedCount}.
 *
 * A cap of {@link #UNBOUNDED} lets the template generate forever; a bounded cap stops
 * generation once {@code generatedCount} reaches it.
 */
@Value
public class RecurringTemplate implements LedgerEntry {

    public static final int UNBOUNDED = -1;
    public static final int DEFAULT_FREQUENCY_DAYS = 30;

    UUID id;
    UUID accountId;
    LocalDate startDate;
    String vendor;
    String category;
    BigDecimal amount;
    String notes;
    int frequencyDays;
    LocalDate nextDueDate;
    int totalOccurrences;
    int generatedCount;

    /**
     * Creates a template that has not generated anything yet.
     *
     * @param frequencyDays    interval between occurrences, defaults to 30 when null
     * @param nextDueDate      first date to generate, defaults to {@code startDate} when null
     * @param totalOccurrences occurrence cap, defaults to {@link #UNBOUNDED} when null
     * @throws ValidationException if the parameters are invalid
     */
    public static RecurringTemplate create(UUID accountId, LocalDate startDate, String vendor, String category,
                                           BigDecimal amount, String notes, Integer frequencyDays,
                                           LocalDate nextDueDate, Integer totalOccurrences) {
        RecurringTemplate template = new RecurringTemplate(
            UUID.randomUUID(),
            accountId,
            startDate,
            vendor,
            category,
            amount,
            notes != null ? notes : "",
            frequencyDays != null ? frequencyDays : DEFAULT_FREQUENCY_DAYS,
            nextDueDate != null ? nextDueDate : startDate,
            totalOccurrences != null ? totalOccurrences : UNBOUNDED,
            0
        );
        template.validate();
        return template;
    }

    @Override
    public LocalDate getDate() {
        return nextDueDate;
    }

    @Override
    public Kind getKind() {
        return Kind.RECURRING;
    }

    public boolean isBounded() {
        return isBounded(totalOccurrences);
    }

    public static boolean isBounded(int totalOccurrences) {
        return totalOccurrences != UNBOUNDED;
    }

    /**
     * True once a bounded template has produced its full quota.
     */
    public boolean isExhausted() {
        return isBounded() && generatedCount >= totalOccurrences;
    }

    /**
     * True if the next occurrence is on or before {@code referenceDate} and the cap allows it.
     */
    public boolean isDueOn(LocalDate referenceDate) {
        return !nextDueDate.isAfter(referenceDate) && !isExhausted();
    }

    /**
     * Date of the zero-based occurrence {@code index}, counted from {@code startDate}.
     * Occurrences past the end of the calendar all land on {@link LocalDate#MAX}.
     */
    public LocalDate occurrenceDate(int index) {
        return plusDaysWithinCalendar(startDate, (long) frequencyDays * index);
    }

    /**
     * Moves past the occurrence on {@code nextDueDate}.
     */
    public RecurringTemplate advance() {
        return new RecurringTemplate(
            id, accountId, startDate, vendor, category, amount, notes, frequencyDays,
            plusDaysWithinCalendar(nextDueDate, frequencyDays),
            totalOccurrences,
            generatedCount + 1
        );
    }

    public RecurringTemplate withGeneratedCount(int newGeneratedCount) {
        return new RecurringTemplate(
            id, accountId, startDate, vendor, category, amount, notes, frequencyDays,
            nextDueDate, totalOccurrences, newGeneratedCount
        );
    }

    /**
     * Applies a field-level edit. Generation state ({@code generatedCount}) is untouched;
     * reconciling already generated transactions with a smaller cap is the retraction engine's job.
     *
     * @throws ValidationException if the edited template would be invalid
     */
    public RecurringTemplate edit(RecurringTemplateEdit edit) {
        RecurringTemplate edited = new RecurringTemplate(
            id,
            accountId,
            edit.getStartDate() != null ? edit.getStartDate() : startDate,
            edit.getVendor() != null ? edit.getVendor() : vendor,
            edit.getCategory() != null ? edit.getCategory() : category,
            edit.getAmount() != null ? edit.getAmount() : amount,
            edit.getNotes() != null ? edit.getNotes() : notes,
            edit.getFrequencyDays() != null ? edit.getFrequencyDays() : frequencyDays,
            edit.getNextDueDate() != null ? edit.getNextDueDate() : nextDueDate,
            edit.getTotalOccurrences() != null ? edit.getTotalOccurrences() : totalOccurrences,
            generatedCount
        );
        edited.validate();
        return edited;
    }

    /**
     * Upcoming occurrence dates starting at {@code nextDueDate}, at most {@code limit} of them
     * and never more than the cap still allows.
     */
    public List<LocalDate> upcomingDates(int limit) {
        int count = isBounded()
            ? Math.max(0, Math.min(totalOccurrences - generatedCount, limit))
            : limit;
        List<LocalDate> dates = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            LocalDate date = plusDaysWithinCalendar(nextDueDate, (long) frequencyDays * i);
            dates.add(date);
            if (date.equals(LocalDate.MAX)) {
                break;
            }
        }
        return dates;
    }

    /**
     * {@code from + days}, or {@link LocalDate#MAX} when that lies beyond the calendar.
     */
    static LocalDate plusDaysWithinCalendar(LocalDate from, long days) {
        try {
            return from.plusDays(days);
        } catch (DateTimeException | ArithmeticException e) {
            return LocalDate.MAX;
        }
    }

    /**
     * Copies this template into another account under a fresh id, keeping its generation state.
     */
    public RecurringTemplate copyInto(UUID targetAccountId) {
        return new RecurringTemplate(
            UUID.randomUUID(), targetAccountId, startDate, vendor, category, amount, notes,
            frequencyDays, nextDueDate, totalOccurrences, generatedCount
        );
    }

    /**
     * @throws ValidationException if the cap or interval is invalid
     */
    public static void validateRecurrence(int frequencyDays, int totalOccurrences) {
        if (frequencyDays <= 0) {
            throw new ValidationException("Frequency must be a positive number of days, got " + frequencyDays);
        }
        if (totalOccurrences != UNBOUNDED && totalOccurrences < 1) {
            throw new ValidationException(
                "Occurrence cap must be at least 1 or " + UNBOUNDED + " for unbounded, got " + totalOccurrences);
        }
    }

    private void validate() {
        if (accountId == null) {
            throw new ValidationException("Account ID is required");
        }
        if (startDate == null) {
            throw new ValidationException("Start date is required");
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
        validateRecurrence(frequencyDays, totalOccurrences);
    }
}
