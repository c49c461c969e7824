package com.flagship.recurring_ledger.persistence;

import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
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
 * JPA entity for one-time transactions.
 *
 * The idempotency key is a persistence concern: it is set once on insert for manually
 * entered transactions and never exposed by the domain object.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_account_date", columnList = "account_id, occurrence_date"),
        @Index(name = "idx_transactions_source_template", columnList = "source_template_id, occurrence_date"),
        @Index(name = "idx_transactions_idempotency_key", columnList = "idempotency_key")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "occurrence_date", nullable = false)
    private LocalDate occurrenceDate;

    @Column(nullable = false, length = 100)
    private String vendor;

    @Column(nullable = false, length = 50)
    private String category;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "source_template_id")
    private UUID sourceTemplateId;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

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

    static TransactionEntity fromDomain(OneTimeTransaction transaction, String idempotencyKey) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getAccountId(),
            transaction.getOccurrenceDate(),
            transaction.getVendor(),
            transaction.getCategory(),
            transaction.getAmount(),
            transaction.getNotes(),
            transaction.getSourceTemplateId(),
            idempotencyKey,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public OneTimeTransaction toDomain() {
        return new OneTimeTransaction(
            id,
            accountId,
            occurrenceDate,
            vendor,
            category,
            amount,
            notes,
            sourceTemplateId
        );
    }

    /**
     * Copies the editable fields. Account and idempotency key never change.
     */
    void updateFromDomain(OneTimeTransaction transaction) {
        this.occurrenceDate = transaction.getOccurrenceDate();
        this.vendor = transaction.getVendor();
        this.category = transaction.getCategory();
        this.amount = transaction.getAmount();
        this.notes = transaction.getNotes();
        this.sourceTemplateId = transaction.getSourceTemplateId();
    }
}
