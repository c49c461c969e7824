package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Manual transaction operations.
 *
 * Each change and its balance effect commit together in one {@link LedgerUnitOfWork}
 * on the owning account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final LedgerStore store;
    private final LedgerUnitOfWork unitOfWork;
    private final AccountBalanceLedger balanceLedger;
    private final LedgerMetrics metrics;

    public OneTimeTransaction addTransaction(OneTimeTransaction transaction) {
        return addTransaction(transaction, null);
    }

    /**
     * Saves a new transaction and applies its amount to the account balance.
     *
     * @param idempotencyKey client key recorded with the transaction, may be null
     */
    public OneTimeTransaction addTransaction(OneTimeTransaction transaction, String idempotencyKey) {
        try {
            OneTimeTransaction saved = unitOfWork.execute(transaction.getAccountId(), () -> {
                OneTimeTransaction stored = store.saveTransaction(transaction, idempotencyKey);
                balanceLedger.apply(stored.getAccountId(), stored.getAmount());
                return stored;
            });
            metrics.recordTransaction("add", "success");
            log.info("Added transaction {} of {} to account {}",
                saved.getId(), saved.getAmount(), saved.getAccountId());
            return saved;
        } catch (RuntimeException e) {
            metrics.recordTransaction("add", "error");
            throw e;
        }
    }

    /**
     * Deletes a transaction and reverses its amount from the balance.
     *
     * @return the deleted transaction
     */
    public OneTimeTransaction deleteTransaction(UUID transactionId) {
        OneTimeTransaction transaction = getTransaction(transactionId);
        try {
            OneTimeTransaction deleted = unitOfWork.execute(transaction.getAccountId(), () -> {
                OneTimeTransaction current = getTransaction(transactionId);
                balanceLedger.reverse(current.getAccountId(), current.getAmount());
                store.deleteTransaction(current.getId());
                return current;
            });
            metrics.recordTransaction("delete", "success");
            log.info("Deleted transaction {} of {} from account {}",
                deleted.getId(), deleted.getAmount(), deleted.getAccountId());
            return deleted;
        } catch (RuntimeException e) {
            metrics.recordTransaction("delete", "error");
            throw e;
        }
    }

    /**
     * Applies a field-level edit; an amount change adjusts the balance by the difference.
     * A generated transaction stays linked to its template.
     */
    public OneTimeTransaction editTransaction(UUID transactionId, TransactionEdit edit) {
        OneTimeTransaction transaction = getTransaction(transactionId);
        try {
            OneTimeTransaction edited = unitOfWork.execute(transaction.getAccountId(), () -> {
                OneTimeTransaction current = getTransaction(transactionId);
                OneTimeTransaction stored = store.saveTransaction(current.edit(edit));
                balanceLedger.adjust(stored.getAccountId(), current.getAmount(), stored.getAmount());
                return stored;
            });
            metrics.recordTransaction("edit", "success");
            return edited;
        } catch (RuntimeException e) {
            metrics.recordTransaction("edit", "error");
            throw e;
        }
    }

    public OneTimeTransaction getTransaction(UUID transactionId) {
        return store.findTransaction(transactionId)
            .orElseThrow(() -> NotFoundException.transaction(transactionId));
    }

    /**
     * All transactions of the account, newest first.
     */
    public List<OneTimeTransaction> listTransactions(UUID accountId) {
        if (store.findAccount(accountId).isEmpty()) {
            throw NotFoundException.account(accountId);
        }
        return store.findTransactionsByAccount(accountId);
    }

    /**
     * Adds a batch of transactions, then re-derives the balance from the full history.
     * The batch commits as a whole or not at all.
     */
    public ImportResult importTransactions(UUID accountId, List<OneTimeTransaction> transactions) {
        ImportResult result = unitOfWork.execute(accountId, () -> {
            List<OneTimeTransaction> imported = new ArrayList<>(transactions.size());
            for (OneTimeTransaction transaction : transactions) {
                imported.add(store.saveTransaction(transaction));
            }
            BigDecimal balance = balanceLedger.recalculate(accountId, store.findTransactionsByAccount(accountId));
            return new ImportResult(accountId, List.copyOf(imported), balance);
        });
        metrics.recordTransaction("import", "success");
        log.info("Imported {} transactions into account {}, balance now {}",
            result.getCount(), accountId, result.getBalance());
        return result;
    }
}
