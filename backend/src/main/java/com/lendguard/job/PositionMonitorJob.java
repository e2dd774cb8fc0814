package com.lendguard.job;

import com.lendguard.risk.config.RiskProperties;
import com.lendguard.risk.monitor.PositionMonitor;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Starts the position monitor once the application is ready (after pools are loaded) when
 * lendguard.risk.monitor.enabled is set, and stops it on shutdown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PositionMonitorJob {

    private final PositionMonitor positionMonitor;
    private final RiskProperties riskProperties;

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!riskProperties.getMonitor().isEnabled()) {
            log.info("Position monitor disabled (lendguard.risk.monitor.enabled=false)");
            return;
        }
        positionMonitor.start();
    }

    @PreDestroy
    public void shutdown() {
        positionMonitor.stop();
    }
}
