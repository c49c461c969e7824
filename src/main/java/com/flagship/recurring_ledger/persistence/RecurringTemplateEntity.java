package com.flagship.recurring_ledger.persistence;

import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA entity for recurring templates.
 * {@code total_occurrences = -1} stores an unbounded cap.
 */
@Entity
@Table(
    name = "recurring_templates",
    indexes = @Index(name = "idx_recurring_templates_account", columnList = "account_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecurringTemplateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(nullable = false, length = 100)
    private String vendor;

    @Column(nullable = false, length = 50)
    private String category;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "frequency_days", nullable = false)
    private int frequencyDays;

    @Column(name = "next_due_date", nullable = false)
    private LocalDate nextDueDate;

    @Column(name = "total_occurrences", nullable = false)
    private int totalOccurrences;

    @Column(name = "generated_count", nullable = false)
    private int generatedCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static RecurringTemplateEntity fromDomain(RecurringTemplate template) {
        return new RecurringTemplateEntity(
            template.getId(),
            template.getAccountId(),
            template.getStartDate(),
            template.getVendor(),
            template.getCategory(),
            template.getAmount(),
            template.getNotes(),
            template.getFrequencyDays(),
            template.getNextDueDate(),
            template.getTotalOccurrences(),
            template.getGeneratedCount(),
            null,
            null
        );
    }

    public RecurringTemplate toDomain() {
        return new RecurringTemplate(
            id,
            accountId,
            startDate,
            vendor,
            category,
            amount,
            notes,
            frequencyDays,
            nextDueDate,
            totalOccurrences,
            generatedCount
        );
    }

    void updateFromDomain(RecurringTemplate template) {
        this.startDate = template.getStartDate();
        this.vendor = template.getVendor();
        this.category = template.getCategory();
        this.amount = template.getAmount();
        this.notes = template.getNotes();
        this.frequencyDays = template.getFrequencyDays();
        this.nextDueDate = template.getNextDueDate();
        this.totalOccurrences = template.getTotalOccurrences();
        this.generatedCount = template.getGeneratedCount();
    }
}
