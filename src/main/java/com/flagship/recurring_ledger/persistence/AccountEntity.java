package com.flagship.recurring_ledger.persistence;

import com.flagship.recurring_ledger.account.Account;
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
import java.util.UUID;

/**
 * JPA entity for accounts.
 *
 * No setters: the balance only changes through {@link #updateBalance}, which the ledger
 * store calls while the account row is locked.
 */
@Entity
@Table(
    name = "accounts",
    indexes = @Index(name = "idx_accounts_user_id", columnList = "user_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "account_number", nullable = false, length = 50)
    private String accountNumber;

    @Column(nullable = false, length = 60)
    private String name;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getUserId(),
            account.getAccountNumber(),
            account.getName(),
            account.getBalance(),
            account.getCreatedAt(),
            null // set by @PrePersist
        );
    }

    public Account toDomain() {
        return new Account(id, userId, accountNumber, name, balance, createdAt);
    }

    /**
     * Name and number are the only user-editable fields; the balance belongs to the ledger.
     */
    void updateFromDomain(Account account) {
        this.accountNumber = account.getAccountNumber();
        this.name = account.getName();
    }

    void updateBalance(BigDecimal balance) {
        this.balance = balance;
    }
}
