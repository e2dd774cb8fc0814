package com.lendguard.risk.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one monitor cycle.
 */
public record MonitorCycleResult(
        Instant startedAt,
        Duration duration,
        int positionsChecked,
        int healthy,
        int warnings,
        int critical,
        int liquidatable,
        List<String> failedPositionIds
) {

    public int errors() {
        return failedPositionIds.size();
    }
}
