package com.flagship.recurring_ledger.exception;

/**
 * Thrown when the backing store fails while a unit of work is in progress.
 * The unit of work that raised it has been rolled back.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
