package com.flagship.recurring_ledger.support;

import com.flagship.recurring_ledger.account.Account;
import com.flagship.recurring_ledger.account.AccountService;
import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.OneTimeTransaction;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import com.flagship.recurring_ledger.ledger.TransactionService;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import com.flagship.recurring_ledger.recurring.OccurrenceGenerator;
import com.flagship.recurring_ledger.recurring.RecurringSyncService;
import com.flagship.recurring_ledger.recurring.RecurringTemplateService;
import com.flagship.recurring_ledger.recurring.RetractionEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * The ledger engine wired by hand over {@link InMemoryLedgerStore}, with a clock fixed at {@link #TODAY}.
 */
public class LedgerFixture {

    public static final LocalDate TODAY = LocalDate.of(2025, 3, 2);
    public static final String NOTE_PREFIX = "Auto-gen:";

    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final LedgerMetrics metrics = new LedgerMetrics(meterRegistry);
    public final Clock clock = Clock.fixed(TODAY.atTime(9, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    public final AccountBalanceLedger balanceLedger = new AccountBalanceLedger(store);
    public final OccurrenceGenerator generator = new OccurrenceGenerator(store, balanceLedger, NOTE_PREFIX);
    public final RetractionEngine retractionEngine = new RetractionEngine(store, balanceLedger);
    public final AccountService accountService = new AccountService(store);
    public final TransactionService transactionService =
        new TransactionService(store, store, balanceLedger, metrics);
    public final RecurringTemplateService templateService =
        new RecurringTemplateService(store, store, retractionEngine, balanceLedger, events, metrics, clock);
    public final RecurringSyncService syncService =
        new RecurringSyncService(store, store, generator, events, metrics, clock);

    public Account openAccount(UUID userId) {
        return accountService.openAccount(userId, "StarBank " + (store.findAllAccountIds().size() + 101), null);
    }

    public Account openAccount() {
        return openAccount(UUID.randomUUID());
    }

    public BigDecimal balanceOf(UUID accountId) {
        return balanceLedger.currentBalance(accountId);
    }

    /**
     * Rent template repeating every 30 days from {@code startDate}, stored and not yet generated.
     * A null cap means unbounded.
     */
    public RecurringTemplate storeTemplate(UUID accountId, LocalDate startDate, String amount, Integer totalOccurrences) {
        return store.saveTemplate(RecurringTemplate.create(accountId, startDate, "Landlord", "Rent",
            new BigDecimal(amount), "Rent", 30, null, totalOccurrences));
    }

    public OneTimeTransaction manual(UUID accountId, LocalDate date, String amount) {
        return OneTimeTransaction.create(accountId, date, "Corner Cafe", "Food", new BigDecimal(amount), "");
    }
}
