package com.flagship.recurring_ledger.exception;

/**
 * Thrown when a ledger entry or an edit carries parameters the ledger cannot accept,
 * e.g. a non-positive recurrence interval or an occurrence cap below one.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
