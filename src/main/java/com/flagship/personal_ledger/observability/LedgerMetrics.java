package com.flagship.personal_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transfers: transfer operations by operation and status
 * - ledger.recurring.materialized: transactions written by recurring sync
 * - ledger.recurring.failures: templates that failed during a sync
 * - ledger.recurring.sync.duration: time per sync call
 * - ledger.reconcile.corrections: cached values the sweep found stale
 * - ledger.reconcile.sweep.duration: time per full sweep
 * - ledger.deletions: coordinated deletions by entity and strategy
 * - idempotency.cache: transfer idempotency lookups by result
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter materializedTransactions;
    private final Counter syncFailures;
    private final Timer syncTimer;
    private final Timer sweepTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.materializedTransactions = Counter.builder("ledger.recurring.materialized")
                .description("Transactions materialized from recurring templates")
                .register(registry);

        this.syncFailures = Counter.builder("ledger.recurring.failures")
                .description("Templates skipped by a sync because of an error")
                .register(registry);

        this.syncTimer = Timer.builder("ledger.recurring.sync.duration")
                .description("Time taken by one recurring sync call")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.sweepTimer = Timer.builder("ledger.reconcile.sweep.duration")
                .description("Time taken by a full cache reconciliation sweep")
                .register(registry);
    }

    public void recordTransfer(String operation, String status) {
        registry.counter("ledger.transfers",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordMaterialized(int count) {
        materializedTransactions.increment(count);
    }

    public void recordSyncFailure() {
        syncFailures.increment();
    }

    public void recordSyncDuration(long durationMs) {
        syncTimer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Records a cached aggregate that did not match its recomputed value.
     */
    public void recordCorrection(String kind) {
        registry.counter("ledger.reconcile.corrections", "kind", sanitizeTag(kind)).increment();
    }

    public void recordSweepDuration(long durationMs) {
        sweepTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordDeletion(String entity, String strategy) {
        registry.counter("ledger.deletions",
                "entity", sanitizeTag(entity),
                "strategy", sanitizeTag(strategy)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
