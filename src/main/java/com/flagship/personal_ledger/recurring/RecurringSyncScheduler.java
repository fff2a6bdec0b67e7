package com.flagship.personal_ledger.recurring;

import com.flagship.personal_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Daily sync of every owner with due templates.
 *
 * Delivery is at-least-once at best (missed runs, restarts, several
 * instances); sync idempotence makes a repeated run harmless.
 */
@Component
@ConditionalOnProperty(name = "ledger.recurring.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RecurringSyncScheduler {

    private final RecurringSyncService syncService;
    private final RecurringTemplateRepository templateRepository;
    private final Clock clock;

    @Scheduled(cron = "${ledger.recurring.sync-cron:0 15 0 * * *}")
    public void syncDueTemplates() {
        LocalDate today = LocalDate.now(clock);
        List<UUID> owners = templateRepository.findOwnersWithDueTemplates(today);
        if (owners.isEmpty()) {
            log.debug("No recurring templates due as of {}", today);
            return;
        }

        int materialized = 0;
        int failures = 0;
        for (UUID ownerId : owners) {
            MDC.put(CorrelationContext.OWNER_ID_MDC_KEY, ownerId.toString());
            try {
                SyncResult result = syncService.sync(ownerId, today);
                materialized += result.getTransactionsMaterialized();
                failures += result.getFailures().size();
            } catch (Exception e) {
                failures++;
                log.error("Scheduled sync failed for owner: error={}", e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.OWNER_ID_MDC_KEY);
            }
        }
        log.info("Scheduled recurring sync finished: asOf={}, owners={}, materialized={}, failures={}",
            today, owners.size(), materialized, failures);
    }
}
