package com.flagship.recurring_ledger.persistence;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.exception.StorageException;
import com.flagship.recurring_ledger.ledger.LedgerUnitOfWork;
import com.flagship.recurring_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link LedgerUnitOfWork} as a database transaction holding the account row lock.
 *
 * {@code SELECT ... FOR UPDATE} on the account serializes every writer of that account
 * until commit. Any runtime exception thrown by the work rolls the transaction back;
 * persistence and commit failures are rethrown as {@link StorageException}.
 */
@Component
@Slf4j
public class TransactionalLedgerUnitOfWork implements LedgerUnitOfWork {

    private final TransactionTemplate transactionTemplate;
    private final AccountRepository accountRepository;

    public TransactionalLedgerUnitOfWork(PlatformTransactionManager transactionManager,
                                         AccountRepository accountRepository) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.accountRepository = accountRepository;
    }

    @Override
    public <T> T execute(UUID accountId, Supplier<T> work) {
        try (MDC.MDCCloseable scope = CorrelationContext.forAccount(accountId)) {
            return transactionTemplate.execute(status -> {
                accountRepository.findByIdForUpdate(accountId)
                    .orElseThrow(() -> NotFoundException.account(accountId));
                return work.get();
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Ledger unit of work rolled back: error={}", e.getMessage());
            throw new StorageException("Ledger update for account " + accountId + " failed", e);
        }
    }
}
