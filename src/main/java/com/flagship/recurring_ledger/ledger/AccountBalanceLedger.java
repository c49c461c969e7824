package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.UUID;

/**
 * Authoritative running balance of an account.
 *
 * Invariant: {@code balance == sum(amount of every transaction on the account)}.
 * The balance is kept incrementally by {@link #apply}, {@link #reverse} and {@link #adjust};
 * {@link #recalculate} re-derives it from the full transaction set and is the repair path
 * when the two disagree. Amounts are {@link BigDecimal}, so the incremental and recalculated
 * values agree exactly regardless of order.
 *
 * Callers must invoke these methods inside a {@link LedgerUnitOfWork} together with the
 * transaction change they account for.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountBalanceLedger {

    private final LedgerStore store;

    public BigDecimal currentBalance(UUID accountId) {
        return store.findBalance(accountId)
            .orElseThrow(() -> NotFoundException.account(accountId));
    }

    /**
     * Adds a newly created transaction's amount.
     */
    public BigDecimal apply(UUID accountId, BigDecimal amount) {
        BigDecimal updated = currentBalance(accountId).add(amount);
        store.updateBalance(accountId, updated);
        log.debug("Applied {} to account {}, balance now {}", amount, accountId, updated);
        return updated;
    }

    /**
     * Removes a deleted transaction's amount.
     */
    public BigDecimal reverse(UUID accountId, BigDecimal amount) {
        BigDecimal updated = currentBalance(accountId).subtract(amount);
        store.updateBalance(accountId, updated);
        log.debug("Reversed {} on account {}, balance now {}", amount, accountId, updated);
        return updated;
    }

    /**
     * Accounts for an edited transaction amount.
     */
    public BigDecimal adjust(UUID accountId, BigDecimal oldAmount, BigDecimal newAmount) {
        BigDecimal delta = newAmount.subtract(oldAmount);
        if (delta.signum() == 0) {
            return currentBalance(accountId);
        }
        BigDecimal updated = currentBalance(accountId).add(delta);
        store.updateBalance(accountId, updated);
        log.debug("Adjusted account {} by {}, balance now {}", accountId, delta, updated);
        return updated;
    }

    /**
     * Replaces the stored balance with the sum of {@code transactions}.
     *
     * @return the recalculated balance
     */
    public BigDecimal recalculate(UUID accountId, Collection<OneTimeTransaction> transactions) {
        if (store.findBalance(accountId).isEmpty()) {
            throw NotFoundException.account(accountId);
        }
        BigDecimal total = sum(transactions);
        store.updateBalance(accountId, total);
        return total;
    }

    public static BigDecimal sum(Collection<? extends LedgerEntry> entries) {
        return entries.stream()
            .map(LedgerEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
