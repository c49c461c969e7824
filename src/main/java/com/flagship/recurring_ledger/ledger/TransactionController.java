package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.ledger.dto.CreateTransactionRequest;
import com.flagship.recurring_ledger.ledger.dto.ImportResponse;
import com.flagship.recurring_ledger.ledger.dto.ImportTransactionsRequest;
import com.flagship.recurring_ledger.ledger.dto.TransactionResponse;
import com.flagship.recurring_ledger.ledger.dto.UpdateTransactionRequest;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Manual transactions.
 *
 * Creating a transaction is idempotent on the {@code Idempotency-Key} header: a repeated key
 * returns the transaction created the first time with 200 instead of 201.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionService transactionService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping("/accounts/{accountId}/transactions")
    public ResponseEntity<TransactionResponse> addTransaction(
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody CreateTransactionRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        Optional<UUID> existingId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingId.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning transaction {}", existingId.get());
            OneTimeTransaction existing = transactionService.getTransaction(existingId.get());
            return ResponseEntity.ok(TransactionResponse.from(existing));
        }
        metrics.recordIdempotencyMiss();

        OneTimeTransaction transaction = OneTimeTransaction.create(accountId, request.getDate(),
            request.getVendor(), request.getCategory(), request.getAmount(), request.getNotes());
        OneTimeTransaction saved = transactionService.addTransaction(transaction, idempotencyKey);
        idempotencyService.storeIdempotencyKey(idempotencyKey, saved.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(saved));
    }

    @GetMapping("/accounts/{accountId}/transactions")
    public List<TransactionResponse> listTransactions(@PathVariable("accountId") UUID accountId) {
        return transactionService.listTransactions(accountId).stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @PostMapping("/accounts/{accountId}/transactions/import")
    public ResponseEntity<ImportResponse> importTransactions(
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody ImportTransactionsRequest request) {

        List<OneTimeTransaction> transactions = request.getTransactions().stream()
            .map(row -> OneTimeTransaction.create(accountId, row.getDate(), row.getVendor(),
                row.getCategory(), row.getAmount(), row.getNotes()))
            .toList();
        ImportResult result = transactionService.importTransactions(accountId, transactions);
        return ResponseEntity.status(HttpStatus.CREATED).body(ImportResponse.from(result));
    }

    @PatchMapping("/transactions/{transactionId}")
    public TransactionResponse editTransaction(@PathVariable("transactionId") UUID transactionId,
                                               @Valid @RequestBody UpdateTransactionRequest request) {
        return TransactionResponse.from(transactionService.editTransaction(transactionId, request.toEdit()));
    }

    @DeleteMapping("/transactions/{transactionId}")
    public ResponseEntity<Void> deleteTransaction(@PathVariable("transactionId") UUID transactionId) {
        transactionService.deleteTransaction(transactionId);
        return ResponseEntity.noContent().build();
    }
}
