package com.flagship.recurring_ledger.account;

import com.flagship.recurring_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic balance drift audit.
 */
@Component
@ConditionalOnProperty(name = "ledger.audit.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BalanceAuditScheduler {

    private final BalanceAuditService auditService;

    @Scheduled(fixedDelayString = "${ledger.audit.interval-ms:3600000}",
               initialDelayString = "${ledger.audit.interval-ms:3600000}")
    public void auditBalances() {
        CorrelationContext.beginJob("audit");
        try {
            auditService.auditAll();
        } catch (RuntimeException e) {
            log.error("Balance audit run failed", e);
        } finally {
            CorrelationContext.end();
        }
    }
}
