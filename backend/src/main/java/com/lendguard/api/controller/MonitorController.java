package com.lendguard.api.controller;

import com.lendguard.api.dto.MonitorCycleResponse;
import com.lendguard.api.dto.MonitorStatusResponse;
import com.lendguard.risk.monitor.PositionMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Position monitor lifecycle and statistics.
 */
@RestController
@RequestMapping("/api/v1/risk/monitor")
@RequiredArgsConstructor
public class MonitorController {

    private final PositionMonitor positionMonitor;

    @GetMapping
    public MonitorStatusResponse status() {
        return currentStatus();
    }

    /** Runs one cycle now; waits for any cycle in progress. */
    @PostMapping("/run")
    public Mono<MonitorCycleResponse> run() {
        return Blocking.call(() -> MonitorCycleResponse.from(positionMonitor.runCycle()));
    }

    @PostMapping("/start")
    public ResponseEntity<MonitorStatusResponse> start() {
        positionMonitor.start();
        return ResponseEntity.accepted().body(currentStatus());
    }

    @PostMapping("/stop")
    public MonitorStatusResponse stop() {
        positionMonitor.stop();
        return currentStatus();
    }

    @PostMapping("/stats/reset")
    public MonitorStatusResponse resetStats() {
        positionMonitor.resetStats();
        return currentStatus();
    }

    private MonitorStatusResponse currentStatus() {
        return new MonitorStatusResponse(positionMonitor.isRunning(), positionMonitor.getState(), positionMonitor.getStats());
    }
}
