package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.NotFoundException;
import com.flagship.recurring_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static com.flagship.recurring_ledger.support.TestOutput.printInput;
import static com.flagship.recurring_ledger.support.TestOutput.printOutput;
import static com.flagship.recurring_ledger.support.TestOutput.printSuccess;
import static com.flagship.recurring_ledger.support.TestOutput.printTestHeader;
import static org.junit.jupiter.api.Assertions.*;

class AccountBalanceLedgerTest {

    private LedgerFixture ledger;
    private UUID accountId;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        accountId = ledger.openAccount().getId();
    }

    @Test
    @DisplayName("Deleting a -45.00 transaction from a 500.00 balance yields 545.00")
    void deleteReversesAmount() {
        printTestHeader("Balance after deleting a transaction");
        ledger.transactionService.addTransaction(ledger.manual(accountId, LocalDate.of(2025, 2, 1), "545.00"));
        OneTimeTransaction coffee = ledger.transactionService.addTransaction(
            ledger.manual(accountId, LocalDate.of(2025, 2, 3), "-45.00"));
        assertEquals(0, new BigDecimal("500.00").compareTo(ledger.balanceOf(accountId)));
        printInput("Balance before delete", ledger.balanceOf(accountId));

        ledger.transactionService.deleteTransaction(coffee.getId());

        printOutput("Balance after delete", ledger.balanceOf(accountId));
        assertEquals(0, new BigDecimal("545.00").compareTo(ledger.balanceOf(accountId)));
        assertTrue(ledger.store.findTransaction(coffee.getId()).isEmpty());
        printSuccess("Deleted amount reversed");
    }

    @Test
    @DisplayName("apply and reverse move the stored balance by the amount")
    void applyAndReverse() {
        assertEquals(0, new BigDecimal("12.50").compareTo(ledger.balanceLedger.apply(accountId, new BigDecimal("12.50"))));
        assertEquals(0, new BigDecimal("2.50").compareTo(ledger.balanceLedger.apply(accountId, new BigDecimal("-10"))));
        assertEquals(0, new BigDecimal("12.50").compareTo(ledger.balanceLedger.reverse(accountId, new BigDecimal("-10"))));
        assertEquals(0, new BigDecimal("12.50").compareTo(ledger.balanceOf(accountId)));
    }

    @Test
    @DisplayName("adjust applies only the difference between old and new amount")
    void adjustAppliesDelta() {
        ledger.balanceLedger.apply(accountId, new BigDecimal("100"));

        BigDecimal balance = ledger.balanceLedger.adjust(accountId, new BigDecimal("-20"), new BigDecimal("-35"));

        assertEquals(0, new BigDecimal("85").compareTo(balance));
        assertEquals(0, new BigDecimal("85").compareTo(
            ledger.balanceLedger.adjust(accountId, new BigDecimal("5"), new BigDecimal("5.00"))));
    }

    @Test
    @DisplayName("recalculate replaces a drifted balance with the sum of transactions")
    void recalculateRepairsDrift() {
        ledger.transactionService.addTransaction(ledger.manual(accountId, LocalDate.of(2025, 1, 5), "-19.99"));
        ledger.transactionService.addTransaction(ledger.manual(accountId, LocalDate.of(2025, 1, 6), "250"));
        ledger.store.updateBalance(accountId, new BigDecimal("9999"));

        BigDecimal recalculated = ledger.balanceLedger.recalculate(
            accountId, ledger.store.findTransactionsByAccount(accountId));

        assertEquals(0, new BigDecimal("230.01").compareTo(recalculated));
        assertEquals(0, recalculated.compareTo(ledger.balanceOf(accountId)));
    }

    @Test
    @DisplayName("Incremental balance equals the recalculated sum for any order of operations")
    void incrementalMatchesRecalculated() {
        List<BigDecimal> amounts = new ArrayList<>();
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            amounts.add(BigDecimal.valueOf(random.nextInt(2_000_000) - 1_000_000, 2));
        }
        Collections.shuffle(amounts, random);

        List<OneTimeTransaction> added = new ArrayList<>();
        for (BigDecimal amount : amounts) {
            added.add(ledger.transactionService.addTransaction(OneTimeTransaction.create(
                accountId, LocalDate.of(2025, 1, 1), "Vendor", "Misc", amount, null)));
        }
        for (int i = 0; i < added.size(); i += 3) {
            ledger.transactionService.deleteTransaction(added.get(i).getId());
        }
        for (int i = 1; i < added.size(); i += 7) {
            if (i % 3 == 0) {
                continue;
            }
            ledger.transactionService.editTransaction(added.get(i).getId(),
                TransactionEdit.builder().amount(new BigDecimal("1.01")).build());
        }

        BigDecimal incremental = ledger.balanceOf(accountId);
        BigDecimal recalculated = AccountBalanceLedger.sum(ledger.store.findTransactionsByAccount(accountId));
        assertEquals(0, recalculated.compareTo(incremental));
    }

    @Test
    @DisplayName("sum of no entries is zero")
    void sumOfNothing() {
        assertEquals(BigDecimal.ZERO, AccountBalanceLedger.sum(List.of()));
    }

    @Test
    @DisplayName("Unknown account fails with NotFoundException")
    void unknownAccount() {
        UUID unknown = UUID.randomUUID();

        assertThrows(NotFoundException.class, () -> ledger.balanceLedger.currentBalance(unknown));
        assertThrows(NotFoundException.class, () -> ledger.balanceLedger.apply(unknown, BigDecimal.ONE));
        assertThrows(NotFoundException.class, () -> ledger.balanceLedger.recalculate(unknown, List.of()));
    }
}
