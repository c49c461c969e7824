package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.account.Account;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage boundary of the ledger engine.
 *
 * Every call either succeeds or fails as a whole; failures surface as
 * {@link com.flagship.recurring_ledger.exception.StorageException}. Callers that need several
 * calls to commit together run them inside a {@link LedgerUnitOfWork}.
 */
public interface LedgerStore {

    // Accounts

    Account saveAccount(Account account);

    Optional<Account> findAccount(UUID accountId);

    List<Account> findAccountsByUser(UUID userId);

    List<UUID> findAllAccountIds();

    default Optional<BigDecimal> findBalance(UUID accountId) {
        return findAccount(accountId).map(Account::getBalance);
    }

    void updateBalance(UUID accountId, BigDecimal balance);

    // One-time transactions

    Optional<OneTimeTransaction> findTransaction(UUID transactionId);

    /**
     * Inserts or updates a transaction.
     */
    default OneTimeTransaction saveTransaction(OneTimeTransaction transaction) {
        return saveTransaction(transaction, null);
    }

    /**
     * Inserts or updates a transaction, recording the client idempotency key on insert.
     */
    OneTimeTransaction saveTransaction(OneTimeTransaction transaction, String idempotencyKey);

    Optional<UUID> findTransactionIdByIdempotencyKey(String idempotencyKey);

    void deleteTransaction(UUID transactionId);

    List<OneTimeTransaction> findTransactionsByAccount(UUID accountId);

    List<OneTimeTransaction> findLinkedTransactions(UUID templateId);

    /**
     * Transactions generated by the template dated on or after {@code from}.
     */
    List<OneTimeTransaction> findLinkedTransactionsOnOrAfter(UUID templateId, LocalDate from);

    // Recurring templates

    Optional<RecurringTemplate> findTemplate(UUID templateId);

    RecurringTemplate saveTemplate(RecurringTemplate template);

    void deleteTemplate(UUID templateId);

    List<RecurringTemplate> findTemplatesByAccount(UUID accountId);
}
