package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Capabilities shared by everything that lives in an account's ledger.
 *
 * A one-time transaction is dated by when it occurred; a recurring template
 * is dated by its next not-yet-generated occurrence.
 *
 * Amounts are stored as DECIMAL(19,4). Anything finer would be rounded row by row and
 * the stored balance would stop matching the stored transactions, so it is rejected.
 */
public sealed interface LedgerEntry permits OneTimeTransaction, RecurringTemplate {

    int AMOUNT_INTEGER_DIGITS = 15;
    int AMOUNT_FRACTION_DIGITS = 4;

    UUID getId();

    UUID getAccountId();

    BigDecimal getAmount();

    LocalDate getDate();

    Kind getKind();

    /**
     * @throws ValidationException if {@code amount} does not fit DECIMAL(19,4) exactly
     */
    static void requireStorableAmount(BigDecimal amount) {
        BigDecimal stripped = amount.stripTrailingZeros();
        int fractionDigits = Math.max(0, stripped.scale());
        int integerDigits = stripped.precision() - stripped.scale();
        if (fractionDigits > AMOUNT_FRACTION_DIGITS) {
            throw new ValidationException("Amount must have at most " + AMOUNT_FRACTION_DIGITS
                + " decimal places, got " + amount.toPlainString());
        }
        if (integerDigits > AMOUNT_INTEGER_DIGITS) {
            throw new ValidationException("Amount must have at most " + AMOUNT_INTEGER_DIGITS
                + " integer digits, got " + amount.toPlainString());
        }
    }

    enum Kind {
        ONE_TIME,
        RECURRING
    }
}
