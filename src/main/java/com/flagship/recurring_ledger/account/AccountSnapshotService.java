package com.flagship.recurring_ledger.account;

import com.flagship.recurring_ledger.exception.ValidationException;
import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.LedgerEntry;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.LedgerUnitOfWork;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Exports an account to an {@link AccountSnapshot} and loads a snapshot back as a new account.
 *
 * Loading assigns fresh ids everywhere, re-points generated transactions at the copies of
 * their templates and re-derives the balance from the loaded transactions. Template generation
 * state is carried over as is, so the copy generates exactly what the original would have.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountSnapshotService {

    private final LedgerStore store;
    private final LedgerUnitOfWork unitOfWork;
    private final AccountBalanceLedger balanceLedger;
    private final AccountService accountService;
    private final Clock clock;

    public AccountSnapshot exportSnapshot(UUID accountId) {
        Account account = accountService.getAccount(accountId);
        List<AccountSnapshot.TemplateRecord> templates = store.findTemplatesByAccount(accountId).stream()
            .map(AccountSnapshot.TemplateRecord::from)
            .toList();
        List<AccountSnapshot.TransactionRecord> transactions = store.findTransactionsByAccount(accountId).stream()
            .map(AccountSnapshot.TransactionRecord::from)
            .toList();

        log.info("Exported account {}: {} templates, {} transactions",
            accountId, templates.size(), transactions.size());
        return AccountSnapshot.builder()
            .version(AccountSnapshot.CURRENT_VERSION)
            .sourceAccountId(accountId)
            .accountNumber(account.getAccountNumber())
            .name(account.getName())
            .balance(account.getBalance())
            .templates(templates)
            .transactions(transactions)
            .exportedAt(Instant.now(clock))
            .build();
    }

    /**
     * Creates a new account for {@code userId} holding a copy of the snapshot.
     *
     * The new account and its contents commit together.
     *
     * @throws ValidationException if the snapshot is malformed
     */
    @Transactional
    public SnapshotImport importSnapshot(UUID userId, AccountSnapshot snapshot) {
        validate(snapshot);
        Account account = accountService.openAccount(userId, snapshot.getAccountNumber(), snapshot.getName());
        UUID accountId = account.getId();

        SnapshotImport result = unitOfWork.execute(accountId, () -> {
            Map<UUID, UUID> templateIds = new HashMap<>();
            for (AccountSnapshot.TemplateRecord record : snapshot.getTemplates()) {
                RecurringTemplate original = record.toDomain(snapshot.getSourceAccountId());
                RecurringTemplate.validateRecurrence(original.getFrequencyDays(), original.getTotalOccurrences());
                LedgerEntry.requireStorableAmount(original.getAmount());
                RecurringTemplate copy = store.saveTemplate(original.copyInto(accountId));
                templateIds.put(record.getId(), copy.getId());
            }

            for (AccountSnapshot.TransactionRecord record : snapshot.getTransactions()) {
                OneTimeTransaction original = record.toDomain(snapshot.getSourceAccountId());
                LedgerEntry.requireStorableAmount(original.getAmount());
                UUID templateId = original.isGenerated() ? templateIds.get(original.getSourceTemplateId()) : null;
                store.saveTransaction(original.copyInto(accountId, templateId));
            }

            BigDecimal balance = balanceLedger.recalculate(accountId, store.findTransactionsByAccount(accountId));
            return new SnapshotImport(
                account.withBalance(balance),
                snapshot.getTemplates().size(),
                snapshot.getTransactions().size(),
                snapshot.getBalance() == null || snapshot.getBalance().compareTo(balance) == 0
            );
        });

        if (!result.isBalanceMatched()) {
            log.warn("Snapshot of account {} recorded balance {} but its transactions sum to {}",
                snapshot.getSourceAccountId(), snapshot.getBalance(), result.getAccount().getBalance());
        }
        log.info("Imported snapshot of account {} as account {}: {} templates, {} transactions",
            snapshot.getSourceAccountId(), accountId, result.getTemplates(), result.getTransactions());
        return result;
    }

    private static void validate(AccountSnapshot snapshot) {
        if (snapshot == null) {
            throw new ValidationException("Snapshot is required");
        }
        if (snapshot.getVersion() != AccountSnapshot.CURRENT_VERSION) {
            throw new ValidationException("Unsupported snapshot version " + snapshot.getVersion());
        }
        if (snapshot.getTemplates() == null || snapshot.getTransactions() == null) {
            throw new ValidationException("Snapshot must list templates and transactions");
        }
    }

    @Value
    public static class SnapshotImport {
        Account account;
        int templates;
        int transactions;
        boolean balanceMatched;
    }
}
