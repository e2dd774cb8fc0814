package com.lendguard.api.dto;

import com.lendguard.risk.monitor.MonitorCycleResult;

import java.time.Instant;
import java.util.List;

public record MonitorCycleResponse(
        Instant startedAt,
        long durationMs,
        int positionsChecked,
        int healthy,
        int warnings,
        int critical,
        int liquidatable,
        int errors,
        List<String> failedPositionIds
) {

    public static MonitorCycleResponse from(MonitorCycleResult r) {
        return new MonitorCycleResponse(r.startedAt(), r.duration().toMillis(), r.positionsChecked(), r.healthy(),
                r.warnings(), r.critical(), r.liquidatable(), r.errors(), r.failedPositionIds());
    }
}
