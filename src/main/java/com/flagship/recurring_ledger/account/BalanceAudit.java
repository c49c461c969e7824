package com.flagship.recurring_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of re-deriving an account balance from its transactions.
 * {@code drift} is the stored balance minus the recalculated one.
 */
@Value
public class BalanceAudit {
    UUID accountId;
    BigDecimal previousBalance;
    BigDecimal recalculatedBalance;
    BigDecimal drift;

    public static BalanceAudit of(UUID accountId, BigDecimal previousBalance, BigDecimal recalculatedBalance) {
        return new BalanceAudit(accountId, previousBalance, recalculatedBalance,
            previousBalance.subtract(recalculatedBalance));
    }

    public boolean isDriftDetected() {
        return drift.signum() != 0;
    }
}
