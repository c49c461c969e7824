package com.flagship.recurring_ledger.recurring;

import com.flagship.recurring_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly catch-up for accounts whose owners have not logged in.
 */
@Component
@ConditionalOnProperty(name = "ledger.recurring.sync.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RecurringSyncScheduler {

    private final RecurringSyncService syncService;
    private final Clock clock;

    @Scheduled(cron = "${ledger.recurring.sync.cron:0 15 0 * * *}")
    public void syncAllAccounts() {
        CorrelationContext.beginJob("sync");
        try {
            SyncReport report = syncService.syncAll(LocalDate.now(clock));
            if (!report.isSuccessful()) {
                log.warn("Scheduled recurring sync left {} templates behind", report.getFailedTemplates().size());
            }
        } catch (RuntimeException e) {
            log.error("Scheduled recurring sync failed", e);
        } finally {
            CorrelationContext.end();
        }
    }
}
