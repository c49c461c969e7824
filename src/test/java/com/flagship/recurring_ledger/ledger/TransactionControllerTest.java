package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.exception.StorageException;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer of manual transactions: idempotency header, request validation and error mapping.
 */
@WebMvcTest(TransactionController.class)
class TransactionControllerTest {

    private static final UUID ACCOUNT_ID = UUID.fromString("3f1c7d0e-5a7b-4c1e-9d55-1c2b3a4d5e6f");

    private static final String COFFEE = """
        {"date": "2025-02-03", "vendor": "Corner Cafe", "category": "Food", "amount": -4.50, "notes": "flat white"}
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TransactionService transactionService;

    @MockBean
    private IdempotencyService idempotencyService;

    @MockBean
    private LedgerMetrics metrics;

    private static OneTimeTransaction coffee() {
        return OneTimeTransaction.create(ACCOUNT_ID, LocalDate.of(2025, 2, 3), "Corner Cafe", "Food",
            new BigDecimal("-4.50"), "flat white");
    }

    @Test
    @DisplayName("POST with a new idempotency key creates the transaction")
    void createsTransaction() throws Exception {
        OneTimeTransaction saved = coffee();
        when(idempotencyService.checkIdempotencyKey("key-1")).thenReturn(Optional.empty());
        when(transactionService.addTransaction(any(OneTimeTransaction.class), eq("key-1"))).thenReturn(saved);

        mockMvc.perform(post("/api/accounts/{accountId}/transactions", ACCOUNT_ID)
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(COFFEE))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(saved.getId().toString()))
            .andExpect(jsonPath("$.account_id").value(ACCOUNT_ID.toString()))
            .andExpect(jsonPath("$.date").value("2025-02-03"))
            .andExpect(jsonPath("$.amount").value(-4.50))
            .andExpect(jsonPath("$.generated").value(false))
            .andExpect(header().exists("X-Correlation-ID"));

        verify(idempotencyService).storeIdempotencyKey("key-1", saved.getId());
        verify(metrics).recordIdempotencyMiss();
    }

    @Test
    @DisplayName("POST with a used idempotency key returns the original transaction with 200")
    void duplicateKeyReturnsExisting() throws Exception {
        OneTimeTransaction existing = coffee();
        when(idempotencyService.checkIdempotencyKey("key-1")).thenReturn(Optional.of(existing.getId()));
        when(transactionService.getTransaction(existing.getId())).thenReturn(existing);

        mockMvc.perform(post("/api/accounts/{accountId}/transactions", ACCOUNT_ID)
                .header("Idempotency-Key", "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(COFFEE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(existing.getId().toString()));

        verify(transactionService, never()).addTransaction(any(OneTimeTransaction.class), any());
        verify(metrics).recordIdempotencyHit();
    }

    @Test
    @DisplayName("POST without the idempotency header is rejected")
    void missingIdempotencyKey() throws Exception {
        mockMvc.perform(post("/api/accounts/{accountId}/transactions", ACCOUNT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(COFFEE))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("POST with missing fields reports each invalid field")
    void invalidBody() throws Exception {
        mockMvc.perform(post("/api/accounts/{accountId}/transactions", ACCOUNT_ID)
                .header("Idempotency-Key", "key-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vendor\": \"\", \"category\": \"Food\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.vendor").exists())
            .andExpect(jsonPath("$.details.date").exists())
            .andExpect(jsonPath("$.details.amount").exists());
    }

    @Test
    @DisplayName("POST with an amount finer than 4 decimal places is rejected")
    void rejectsFineAmount() throws Exception {
        mockMvc.perform(post("/api/accounts/{accountId}/transactions", ACCOUNT_ID)
                .header("Idempotency-Key", "key-3")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\": \"2025-02-03\", \"vendor\": \"Corner Cafe\", \"category\": \"Food\", \"amount\": 0.00005}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amount")
                .value("Amount must have at most 15 integer digits and 4 decimal places"));
    }

    @Test
    @DisplayName("POST to an unknown account maps to 404")
    void unknownAccount() throws Exception {
        when(idempotencyService.checkIdempotencyKey("key-3")).thenReturn(Optional.empty());
        when(transactionService.addTransaction(any(OneTimeTransaction.class), eq("key-3")))
            .thenThrow(NotFoundException.account(ACCOUNT_ID));

        mockMvc.perform(post("/api/accounts/{accountId}/transactions", ACCOUNT_ID)
                .header("Idempotency-Key", "key-3")
                .contentType(MediaType.APPLICATION_JSON)
                .content(COFFEE))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Account not found: " + ACCOUNT_ID));
    }

    @Test
    @DisplayName("A storage failure maps to 503")
    void storageFailure() throws Exception {
        when(transactionService.listTransactions(ACCOUNT_ID))
            .thenThrow(new StorageException("Failed to load transactions", new RuntimeException("timeout")));

        mockMvc.perform(get("/api/accounts/{accountId}/transactions", ACCOUNT_ID))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Storage Unavailable"));
    }

    @Test
    @DisplayName("GET lists the account's transactions")
    void listsTransactions() throws Exception {
        when(transactionService.listTransactions(ACCOUNT_ID)).thenReturn(List.of(coffee(), coffee()));

        mockMvc.perform(get("/api/accounts/{accountId}/transactions", ACCOUNT_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].vendor").value("Corner Cafe"));
    }

    @Test
    @DisplayName("POST import creates the batch and returns the new balance")
    void importsBatch() throws Exception {
        when(transactionService.importTransactions(eq(ACCOUNT_ID), any()))
            .thenReturn(new ImportResult(ACCOUNT_ID, List.of(coffee(), coffee()), new BigDecimal("-9.00")));

        mockMvc.perform(post("/api/accounts/{accountId}/transactions/import", ACCOUNT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"transactions\": [" + COFFEE + "," + COFFEE + "]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.imported").value(2))
            .andExpect(jsonPath("$.balance").value(-9.00));
    }

    @Test
    @DisplayName("POST import of an empty batch is rejected")
    void emptyImport() throws Exception {
        mockMvc.perform(post("/api/accounts/{accountId}/transactions/import", ACCOUNT_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"transactions\": []}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PATCH edits and DELETE removes a transaction")
    void editAndDelete() throws Exception {
        OneTimeTransaction edited = coffee().edit(TransactionEdit.builder().amount(new BigDecimal("-5.00")).build());
        when(transactionService.editTransaction(eq(edited.getId()), any(TransactionEdit.class))).thenReturn(edited);

        mockMvc.perform(patch("/api/transactions/{transactionId}", edited.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": -5.00}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amount").value(-5.00));

        mockMvc.perform(delete("/api/transactions/{transactionId}", edited.getId()))
            .andExpect(status().isNoContent());
        verify(transactionService).deleteTransaction(edited.getId());
    }

    @Test
    @DisplayName("A malformed id maps to 400")
    void malformedId() throws Exception {
        mockMvc.perform(delete("/api/transactions/{transactionId}", "not-a-uuid"))
            .andExpect(status().isBadRequest());
    }
}
