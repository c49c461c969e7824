package com.flagship.recurring_ledger.account;

import com.flagship.recurring_ledger.ledger.AccountBalanceLedger;
import com.flagship.recurring_ledger.ledger.LedgerStore;
import com.flagship.recurring_ledger.ledger.LedgerUnitOfWork;
import com.flagship.recurring_ledger.ledger.event.BalanceRecalculatedEvent;
import com.flagship.recurring_ledger.ledger.event.LedgerEventPublisher;
import com.flagship.recurring_ledger.observability.LedgerMetrics;
import com.flagship.recurring_ledger.persistence.BalanceDriftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Detects and repairs balance drift.
 *
 * Drift is a repair signal, not an error: the recalculated balance replaces the stored one
 * and the difference is logged, counted and published.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAuditService {

    private final LedgerStore store;
    private final LedgerUnitOfWork unitOfWork;
    private final AccountBalanceLedger balanceLedger;
    private final BalanceDriftRepository driftRepository;
    private final LedgerEventPublisher eventPublisher;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Replaces the account balance with the sum of its transactions.
     */
    public BalanceAudit recalculate(UUID accountId) {
        BalanceAudit audit = unitOfWork.execute(accountId, () -> {
            BigDecimal previous = balanceLedger.currentBalance(accountId);
            BigDecimal recalculated = balanceLedger.recalculate(accountId, store.findTransactionsByAccount(accountId));
            BalanceAudit result = BalanceAudit.of(accountId, previous, recalculated);
            eventPublisher.publish(new BalanceRecalculatedEvent(
                UUID.randomUUID(),
                accountId,
                result.getPreviousBalance(),
                result.getRecalculatedBalance(),
                result.getDrift(),
                Instant.now(clock)
            ));
            return result;
        });

        if (audit.isDriftDetected()) {
            metrics.recordBalanceDrift(audit.getDrift());
            log.warn("Balance drift repaired on account {}: stored={}, recalculated={}, drift={}",
                accountId, audit.getPreviousBalance(), audit.getRecalculatedBalance(), audit.getDrift());
        } else {
            log.debug("Balance of account {} verified at {}", accountId, audit.getRecalculatedBalance());
        }
        return audit;
    }

    /**
     * Repairs every account the SQL drift check flags. Accounts that fail are skipped and retried
     * on the next run.
     *
     * @return the audits that were carried out
     */
    public List<BalanceAudit> auditAll() {
        List<BalanceDriftRepository.BalanceDrift> drifted = driftRepository.findDriftedAccounts();
        if (drifted.isEmpty()) {
            return List.of();
        }
        log.warn("Balance check flagged {} accounts", drifted.size());

        List<BalanceAudit> audits = new ArrayList<>(drifted.size());
        for (BalanceDriftRepository.BalanceDrift drift : drifted) {
            try {
                audits.add(recalculate(drift.getAccountId()));
            } catch (RuntimeException e) {
                log.error("Balance repair failed for account {}: error={}", drift.getAccountId(), e.getMessage());
                metrics.recordBalanceAuditFailure();
            }
        }
        return audits;
    }
}
