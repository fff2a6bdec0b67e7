package com.flagship.personal_ledger.reconcile;

import com.flagship.personal_ledger.account.AccountRepository;
import com.flagship.personal_ledger.budget.BudgetRepository;
import com.flagship.personal_ledger.observability.CorrelationContext;
import com.flagship.personal_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Periodic full recompute of every cached aggregate.
 *
 * Heals drift left by bugs, migrations or manual edits. Each owner is
 * reconciled in its own transaction, so one failing owner does not block the
 * others.
 */
@Component
@ConditionalOnProperty(name = "ledger.reconciliation.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSweeper {

    private final CacheReconciler cacheReconciler;
    private final AccountRepository accountRepository;
    private final BudgetRepository budgetRepository;
    private final LedgerMetrics ledgerMetrics;

    @Scheduled(fixedDelayString = "${ledger.reconciliation.sweep-interval-ms:3600000}",
               initialDelayString = "${ledger.reconciliation.initial-delay-ms:60000}")
    public void sweep() {
        long startTime = System.currentTimeMillis();
        Set<UUID> owners = new LinkedHashSet<>(accountRepository.findOwnerIds());
        owners.addAll(budgetRepository.findOwnerIds());

        int corrections = 0;
        int failures = 0;
        for (UUID ownerId : owners) {
            MDC.put(CorrelationContext.OWNER_ID_MDC_KEY, ownerId.toString());
            try {
                corrections += cacheReconciler.reconcileOwner(ownerId).getCorrections();
            } catch (Exception e) {
                failures++;
                log.error("Reconciliation failed for owner: error={}", e.getMessage(), e);
            } finally {
                MDC.remove(CorrelationContext.OWNER_ID_MDC_KEY);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        ledgerMetrics.recordSweepDuration(duration);
        log.info("Reconciliation sweep finished: owners={}, corrections={}, failures={}, duration={}ms",
            owners.size(), corrections, failures, duration);
    }
}
