package com.flagship.recurring_ledger.exception;

import java.util.UUID;

/**
 * Thrown when an account, transaction or recurring template referenced by id does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException account(UUID accountId) {
        return new NotFoundException("Account not found: " + accountId);
    }

    public static NotFoundException transaction(UUID transactionId) {
        return new NotFoundException("Transaction not found: " + transactionId);
    }

    public static NotFoundException template(UUID templateId) {
        return new NotFoundException("Recurring template not found: " + templateId);
    }
}
