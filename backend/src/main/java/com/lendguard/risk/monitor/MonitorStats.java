package com.lendguard.risk.monitor;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cumulative monitor counters since start or the last {@link #reset()}.
 */
public class MonitorStats {

    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong positionsChecked = new AtomicLong();
    private final AtomicLong warningsIssued = new AtomicLong();
    private final AtomicLong criticalAlertsIssued = new AtomicLong();
    private final AtomicLong liquidationAlertsIssued = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong lastCycleDurationMs = new AtomicLong();
    private final AtomicReference<Instant> lastRunAt = new AtomicReference<>();

    void recordCycle(MonitorCycleResult result) {
        totalRuns.incrementAndGet();
        positionsChecked.addAndGet(result.positionsChecked());
        errors.addAndGet(result.errors());
        lastCycleDurationMs.set(result.duration().toMillis());
        lastRunAt.set(result.startedAt());
    }

    void recordWarning() {
        warningsIssued.incrementAndGet();
    }

    void recordCritical() {
        criticalAlertsIssued.incrementAndGet();
    }

    void recordLiquidationAlert() {
        liquidationAlertsIssued.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                totalRuns.get(),
                positionsChecked.get(),
                warningsIssued.get(),
                criticalAlertsIssued.get(),
                liquidationAlertsIssued.get(),
                errors.get(),
                lastRunAt.get(),
                lastCycleDurationMs.get());
    }

    public void reset() {
        totalRuns.set(0);
        positionsChecked.set(0);
        warningsIssued.set(0);
        criticalAlertsIssued.set(0);
        liquidationAlertsIssued.set(0);
        errors.set(0);
        lastCycleDurationMs.set(0);
        lastRunAt.set(null);
    }

    public record Snapshot(
            long totalRuns,
            long positionsChecked,
            long warningsIssued,
            long criticalAlertsIssued,
            long liquidationAlertsIssued,
            long errors,
            Instant lastRunAt,
            long lastCycleDurationMs
    ) {
    }
}
