package com.flagship.recurring_ledger.account;

import com.flagship.recurring_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A bank account owned by a user, carrying the running balance of its ledger.
 */
@Value
public class Account {
    UUID id;
    UUID userId;
    String accountNumber;
    String name;
    BigDecimal balance;
    Instant createdAt;

    /**
     * Opens an empty account. The display name defaults to the account number.
     */
    public static Account open(UUID userId, String accountNumber, String name) {
        if (userId == null) {
            throw new ValidationException("User ID is required");
        }
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new ValidationException("Account number is required");
        }
        return new Account(
            UUID.randomUUID(),
            userId,
            accountNumber,
            name != null && !name.isBlank() ? name : accountNumber,
            BigDecimal.ZERO,
            Instant.now()
        );
    }

    public Account withBalance(BigDecimal newBalance) {
        return new Account(id, userId, accountNumber, name, newBalance, createdAt);
    }
}
