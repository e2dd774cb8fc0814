package com.lendguard.api.dto;

import com.lendguard.risk.monitor.MonitorState;
import com.lendguard.risk.monitor.MonitorStats;

/**
 * GET /api/v1/risk/monitor. Lifecycle flags plus cumulative statistics.
 */
public record MonitorStatusResponse(boolean running, MonitorState state, MonitorStats.Snapshot stats) {
}
