package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.ledger.RecurringTemplate;
import com.flagship.recurring_ledger.ledger.event.OccurrencesGeneratedEvent;
import com.flagship.recurring_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.recurring_ledger.support.TestOutput.printInput;
import static com.flagship.recurring_ledger.support.TestOutput.printOutput;
import static com.flagship.recurring_ledger.support.TestOutput.printSuccess;
import static com.flagship.recurring_ledger.support.TestOutput.printTestHeader;
import static org.junit.jupiter.api.Assertions.*;

class RecurringSyncServiceTest {

    private static final LocalDate JAN_1 = LocalDate.of(2025, 1, 1);

    private LedgerFixture ledger;
    private UUID userId;
    private UUID checking;
    private UUID savings;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        userId = UUID.randomUUID();
        checking = ledger.openAccount(userId).getId();
        savings = ledger.openAccount(userId).getId();
    }

    @Test
    @DisplayName("syncUser generates due occurrences on every account of the user as of today")
    void syncUserUsesClock() {
        printTestHeader("Sync on login");
        ledger.storeTemplate(checking, JAN_1, "-1200", null);
        ledger.storeTemplate(savings, LocalDate.of(2025, 1, 31), "250", null);
        UUID otherUsersAccount = ledger.openAccount().getId();
        ledger.storeTemplate(otherUsersAccount, JAN_1, "-1", null);
        printInput("Today", LedgerFixture.TODAY);

        SyncReport report = ledger.syncService.syncUser(userId);

        printOutput("Generated by account", report.getGeneratedByAccount());
        assertEquals(LedgerFixture.TODAY, report.getReferenceDate());
        assertEquals(3, report.getGeneratedByAccount().get(checking));
        assertEquals(2, report.getGeneratedByAccount().get(savings));
        assertEquals(5, report.getTotalGenerated());
        assertTrue(report.isSuccessful());
        assertFalse(report.getGeneratedByAccount().containsKey(otherUsersAccount));
        assertEquals(0, ledger.store.findTransactionsByAccount(otherUsersAccount).size());
        assertEquals(0, new BigDecimal("-3600").compareTo(ledger.balanceOf(checking)));
        assertEquals(0, new BigDecimal("500").compareTo(ledger.balanceOf(savings)));
        assertEquals(5.0, ledger.meterRegistry.get("ledger.occurrences.generated").counter().count());
        printSuccess("Both accounts brought up to date");
    }

    @Test
    @DisplayName("Each template that generated something publishes one event")
    void publishesEventPerTemplate() {
        RecurringTemplate rent = ledger.storeTemplate(checking, JAN_1, "-1200", null);
        ledger.storeTemplate(checking, LocalDate.of(2025, 6, 1), "-10", null);

        ledger.syncService.syncUser(userId, LocalDate.of(2025, 3, 2));

        List<OccurrencesGeneratedEvent> events = ledger.events.eventsOfType(OccurrencesGeneratedEvent.class);
        assertEquals(1, events.size());
        OccurrencesGeneratedEvent event = events.get(0);
        assertEquals(checking, event.getAccountId());
        assertEquals(rent.getId(), event.getTemplateId());
        assertEquals(3, event.getCount());
        assertEquals(List.of(JAN_1, LocalDate.of(2025, 1, 31), LocalDate.of(2025, 3, 2)), event.getOccurrenceDates());
        assertEquals(0, new BigDecimal("-3600").compareTo(event.getTotalAmount()));
        assertEquals(LocalDate.of(2025, 4, 1), event.getNextDueDate());
    }

    @Test
    @DisplayName("Syncing twice with the same date generates nothing the second time")
    void syncIsRepeatable() {
        ledger.storeTemplate(checking, JAN_1, "-1200", null);

        ledger.syncService.syncUser(userId, LedgerFixture.TODAY);
        SyncReport second = ledger.syncService.syncUser(userId, LedgerFixture.TODAY);

        assertEquals(0, second.getTotalGenerated());
        assertEquals(3, ledger.store.transactionCount());
        assertEquals(1, ledger.events.eventsOfType(OccurrencesGeneratedEvent.class).size());
    }

    @Test
    @DisplayName("A failing template is rolled back and reported while the others commit")
    void failureIsIsolated() {
        printTestHeader("Failure isolation");
        RecurringTemplate good = ledger.storeTemplate(checking, JAN_1, "-1200", null);
        RecurringTemplate broken = ledger.store.saveTemplate(new RecurringTemplate(UUID.randomUUID(), savings,
            JAN_1, "Gym", "Health", new BigDecimal("-30"), "", 0, JAN_1, RecurringTemplate.UNBOUNDED, 0));

        SyncReport report = ledger.syncService.syncUser(userId, LedgerFixture.TODAY);

        printOutput("Failures", report.getFailedTemplates());
        assertFalse(report.isSuccessful());
        assertEquals(1, report.getFailedTemplates().size());
        SyncReport.TemplateFailure failure = report.getFailedTemplates().get(0);
        assertEquals(savings, failure.getAccountId());
        assertEquals(broken.getId(), failure.getTemplateId());
        assertEquals(3, ledger.store.findLinkedTransactions(good.getId()).size());
        assertEquals(0, ledger.store.findLinkedTransactions(broken.getId()).size());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.balanceOf(savings)));
        assertEquals(1.0, ledger.meterRegistry.get("ledger.sync.failures")
            .tag("reason", "ValidationException").counter().count());
        printSuccess("Healthy template committed despite the failure");
    }

    @Test
    @DisplayName("A storage failure mid-template leaves that template as it was")
    void storageFailureRollsBackTemplate() {
        RecurringTemplate template = ledger.storeTemplate(checking, JAN_1, "-1200", null);
        ledger.store.failTransactionSavesAfter(1);

        SyncReport report = ledger.syncService.syncAccount(checking, LedgerFixture.TODAY);

        assertEquals(1, report.getFailedTemplates().size());
        assertEquals(0, report.getTotalGenerated());
        assertEquals(template, ledger.store.findTemplate(template.getId()).orElseThrow());
        assertEquals(0, ledger.store.transactionCount());
        assertTrue(ledger.events.all().isEmpty());

        ledger.store.clearFailure();
        assertEquals(3, ledger.syncService.syncAccount(checking, LedgerFixture.TODAY).getTotalGenerated());
    }

    @Test
    @DisplayName("An account whose templates cannot be read is reported while the other accounts sync")
    void unreadableAccountIsIsolated() {
        printTestHeader("Account-level failure isolation");
        ledger.storeTemplate(checking, JAN_1, "-1200", null);
        ledger.storeTemplate(savings, LocalDate.of(2025, 1, 31), "250", null);
        ledger.store.failTemplateListingFor(checking);

        SyncReport report = ledger.syncService.syncUser(userId, LedgerFixture.TODAY);

        printOutput("Failures", report.getFailedTemplates());
        assertEquals(1, report.getFailedTemplates().size());
        SyncReport.TemplateFailure failure = report.getFailedTemplates().get(0);
        assertEquals(checking, failure.getAccountId());
        assertNull(failure.getTemplateId());
        assertFalse(report.getGeneratedByAccount().containsKey(checking));
        assertEquals(2, report.getGeneratedByAccount().get(savings));
        assertEquals(2, report.getTotalGenerated());
        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.balanceOf(checking)));
        assertEquals(0, new BigDecimal("500").compareTo(ledger.balanceOf(savings)));
        assertEquals(1.0, ledger.meterRegistry.get("ledger.sync.failures")
            .tag("reason", "StorageException").counter().count());
        printSuccess("Savings synced despite checking being unreadable");
    }

    @Test
    @DisplayName("syncAll covers accounts of every user")
    void syncAll() {
        ledger.storeTemplate(checking, JAN_1, "-1", null);
        UUID stranger = ledger.openAccount().getId();
        ledger.storeTemplate(stranger, JAN_1, "-1", 2);

        SyncReport report = ledger.syncService.syncAll(LedgerFixture.TODAY);

        assertEquals(5, report.getTotalGenerated());
        assertEquals(3, report.getGeneratedByAccount().size());
        assertEquals(0, report.getGeneratedByAccount().get(savings));
    }

    @Test
    @DisplayName("syncAccount on an unknown account fails with NotFoundException")
    void syncUnknownAccount() {
        assertThrows(NotFoundException.class,
            () -> ledger.syncService.syncAccount(UUID.randomUUID(), LedgerFixture.TODAY));
    }

    @Test
    @DisplayName("A user without accounts gets an empty report")
    void userWithoutAccounts() {
        SyncReport report = ledger.syncService.syncUser(UUID.randomUUID(), LedgerFixture.TODAY);

        assertEquals(0, report.getTotalGenerated());
        assertTrue(report.getGeneratedByAccount().isEmpty());
        assertTrue(report.isSuccessful());
    }
}
