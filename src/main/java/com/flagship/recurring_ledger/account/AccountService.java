package com.flagship.recurring_ledger.account;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final LedgerStore store;

    public Account openAccount(UUID userId, String accountNumber, String name) {
        Account account = store.saveAccount(Account.open(userId, accountNumber, name));
        log.info("Opened account {} ({}) for user {}", account.getId(), account.getAccountNumber(), userId);
        return account;
    }

    public Account getAccount(UUID accountId) {
        return store.findAccount(accountId)
            .orElseThrow(() -> NotFoundException.account(accountId));
    }

    public List<Account> listAccounts(UUID userId) {
        return store.findAccountsByUser(userId);
    }

    /**
     * Sum of the balances of all the user's accounts.
     */
    public BigDecimal totalBalance(List<Account> accounts) {
        return accounts.stream()
            .map(Account::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
