package com.flagship.recurring_ledger.ledger;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs a block of ledger mutations for one account atomically.
 *
 * Implementations hold the account's write lock for the duration of the block, so no two
 * units of work touch the same account concurrently. If the block throws, every change it
 * made to transactions, templates and the balance is discarded and the exception propagates.
 */
public interface LedgerUnitOfWork {

    /**
     * @throws com.flagship.recurring_ledger.exception.NotFoundException if the account does not exist
     * @throws com.flagship.recurring_ledger.exception.StorageException  if the store fails or cannot commit
     */
    <T> T execute(UUID accountId, Supplier<T> work);

    default void run(UUID accountId, Runnable work) {
        execute(accountId, () -> {
            work.run();
            return null;
        });
    }
}
