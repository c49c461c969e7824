package com.flagship.recurring_ledger.account;

import com.flagship.recurring_ledger.account.dto.AccountListResponse;
import com.flagship.recurring_ledger.account.dto.AccountResponse;
import com.flagship.recurring_ledger.account.dto.BalanceAuditResponse;
import com.flagship.recurring_ledger.account.dto.CreateAccountRequest;
import com.flagship.recurring_ledger.account.dto.SnapshotImportResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final BalanceAuditService auditService;
    private final AccountSnapshotService snapshotService;

    @PostMapping("/accounts")
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.openAccount(request.getUserId(), request.getAccountNumber(), request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/accounts/{accountId}")
    public AccountResponse getAccount(@PathVariable("accountId") UUID accountId) {
        return AccountResponse.from(accountService.getAccount(accountId));
    }

    @GetMapping("/users/{userId}/accounts")
    public AccountListResponse listAccounts(@PathVariable("userId") UUID userId) {
        List<Account> accounts = accountService.listAccounts(userId);
        return new AccountListResponse(
            userId,
            accounts.stream().map(AccountResponse::from).toList(),
            accountService.totalBalance(accounts)
        );
    }

    /**
     * Re-derives the balance from the transaction history, repairing any drift.
     */
    @PostMapping("/accounts/{accountId}/recalculate")
    public BalanceAuditResponse recalculate(@PathVariable("accountId") UUID accountId) {
        return BalanceAuditResponse.from(auditService.recalculate(accountId));
    }

    @GetMapping("/accounts/{accountId}/snapshot")
    public AccountSnapshot exportSnapshot(@PathVariable("accountId") UUID accountId) {
        return snapshotService.exportSnapshot(accountId);
    }

    @PostMapping("/users/{userId}/snapshots")
    public ResponseEntity<SnapshotImportResponse> importSnapshot(@PathVariable("userId") UUID userId,
                                                                 @RequestBody AccountSnapshot snapshot) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SnapshotImportResponse.from(snapshotService.importSnapshot(userId, snapshot)));
    }
}
