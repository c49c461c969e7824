package com.flagship.recurring_ledger.persistence;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Set-based balance check in plain SQL: compares each stored balance with the sum of its
 * account's transactions without loading any rows into the persistence context.
 */
@Repository
@RequiredArgsConstructor
public class BalanceDriftRepository {

    private static final String DRIFT_QUERY = """
        SELECT a.id, a.balance, COALESCE(SUM(t.amount), 0) AS derived_balance
        FROM accounts a
        LEFT JOIN transactions t ON t.account_id = a.id
        GROUP BY a.id, a.balance
        HAVING a.balance <> COALESCE(SUM(t.amount), 0)
        ORDER BY a.id
        """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Accounts whose stored balance differs from the sum of their transactions.
     */
    public List<BalanceDrift> findDriftedAccounts() {
        return jdbcTemplate.query(DRIFT_QUERY, driftRowMapper());
    }

    public BigDecimal derivedBalance(UUID accountId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM transactions WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        return sum != null ? sum : BigDecimal.ZERO;
    }

    private RowMapper<BalanceDrift> driftRowMapper() {
        return (rs, rowNum) -> new BalanceDrift(
            UUID.fromString(rs.getString("id")),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("derived_balance")
        );
    }

    @Value
    public static class BalanceDrift {
        UUID accountId;
        BigDecimal storedBalance;
        BigDecimal derivedBalance;
    }
}
