package com.flagship.recurring_ledger.persistence;

import com.flagship.recurring_ledger.account.Account;
import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.exception.StorageException;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link LedgerStore} backed by Spring Data JPA.
 *
 * Bridges the domain objects and their entities the same way for every aggregate:
 * {@code fromDomain} on insert, {@code updateFromDomain} on update, {@code toDomain} on read.
 * Writes join the caller's transaction, normally the one opened by
 * {@link TransactionalLedgerUnitOfWork}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaLedgerStore implements LedgerStore {

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final RecurringTemplateRepository templateRepository;

    @Override
    public Account saveAccount(Account account) {
        return translate("save account " + account.getId(), () -> {
            AccountEntity entity = accountRepository.findById(account.getId())
                .map(existing -> {
                    existing.updateFromDomain(account);
                    return existing;
                })
                .orElseGet(() -> AccountEntity.fromDomain(account));
            return accountRepository.save(entity).toDomain();
        });
    }

    @Override
    public Optional<Account> findAccount(UUID accountId) {
        return translate("load account " + accountId,
            () -> accountRepository.findById(accountId).map(AccountEntity::toDomain));
    }

    @Override
    public List<Account> findAccountsByUser(UUID userId) {
        return translate("list accounts of user " + userId,
            () -> accountRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
                .map(AccountEntity::toDomain)
                .toList());
    }

    @Override
    public List<UUID> findAllAccountIds() {
        return translate("list accounts", accountRepository::findAllIds);
    }

    @Override
    public void updateBalance(UUID accountId, BigDecimal balance) {
        translate("update balance of account " + accountId, () -> {
            AccountEntity entity = accountRepository.findById(accountId)
                .orElseThrow(() -> NotFoundException.account(accountId));
            entity.updateBalance(balance);
            return accountRepository.save(entity);
        });
    }

    @Override
    public Optional<OneTimeTransaction> findTransaction(UUID transactionId) {
        return translate("load transaction " + transactionId,
            () -> transactionRepository.findById(transactionId).map(TransactionEntity::toDomain));
    }

    @Override
    public OneTimeTransaction saveTransaction(OneTimeTransaction transaction, String idempotencyKey) {
        return translate("save transaction " + transaction.getId(), () -> {
            TransactionEntity entity = transactionRepository.findById(transaction.getId())
                .map(existing -> {
                    existing.updateFromDomain(transaction);
                    return existing;
                })
                .orElseGet(() -> TransactionEntity.fromDomain(transaction, idempotencyKey));
            TransactionEntity saved = transactionRepository.save(entity);
            log.debug("Saved transaction {} on account {}", saved.getId(), saved.getAccountId());
            return saved.toDomain();
        });
    }

    @Override
    public Optional<UUID> findTransactionIdByIdempotencyKey(String idempotencyKey) {
        return translate("look up idempotency key",
            () -> transactionRepository.findByIdempotencyKey(idempotencyKey).map(TransactionEntity::getId));
    }

    @Override
    public void deleteTransaction(UUID transactionId) {
        translate("delete transaction " + transactionId, () -> {
            transactionRepository.deleteById(transactionId);
            return null;
        });
    }

    @Override
    public List<OneTimeTransaction> findTransactionsByAccount(UUID accountId) {
        return translate("list transactions of account " + accountId,
            () -> transactionRepository.findByAccountIdOrderByOccurrenceDateDesc(accountId).stream()
                .map(TransactionEntity::toDomain)
                .toList());
    }

    @Override
    public List<OneTimeTransaction> findLinkedTransactions(UUID templateId) {
        return translate("list transactions of template " + templateId,
            () -> transactionRepository.findBySourceTemplateIdOrderByOccurrenceDateAsc(templateId).stream()
                .map(TransactionEntity::toDomain)
                .toList());
    }

    @Override
    public List<OneTimeTransaction> findLinkedTransactionsOnOrAfter(UUID templateId, LocalDate from) {
        return translate("list transactions of template " + templateId + " from " + from,
            () -> transactionRepository.findLinkedOnOrAfter(templateId, from).stream()
                .map(TransactionEntity::toDomain)
                .toList());
    }

    @Override
    public Optional<RecurringTemplate> findTemplate(UUID templateId) {
        return translate("load template " + templateId,
            () -> templateRepository.findById(templateId).map(RecurringTemplateEntity::toDomain));
    }

    @Override
    public RecurringTemplate saveTemplate(RecurringTemplate template) {
        return translate("save template " + template.getId(), () -> {
            RecurringTemplateEntity entity = templateRepository.findById(template.getId())
                .map(existing -> {
                    existing.updateFromDomain(template);
                    return existing;
                })
                .orElseGet(() -> RecurringTemplateEntity.fromDomain(template));
            return templateRepository.save(entity).toDomain();
        });
    }

    @Override
    public void deleteTemplate(UUID templateId) {
        translate("delete template " + templateId, () -> {
            templateRepository.deleteById(templateId);
            return null;
        });
    }

    @Override
    public List<RecurringTemplate> findTemplatesByAccount(UUID accountId) {
        return translate("list templates of account " + accountId,
            () -> templateRepository.findByAccountIdOrderByStartDateAsc(accountId).stream()
                .map(RecurringTemplateEntity::toDomain)
                .toList());
    }

    private <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }
}
