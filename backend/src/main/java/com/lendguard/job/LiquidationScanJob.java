package com.lendguard.job;

import com.lendguard.risk.config.RiskProperties;
import com.lendguard.risk.liquidation.LiquidationOpportunitiesFoundEvent;
import com.lendguard.risk.liquidation.LiquidationOpportunity;
import com.lendguard.risk.liquidation.LiquidationScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Periodic liquidation scan. Found opportunities are published as {@link LiquidationOpportunitiesFoundEvent}.
 * Disabled unless lendguard.risk.liquidation.scan-enabled is set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LiquidationScanJob {

    private final LiquidationScanner liquidationScanner;
    private final ApplicationEventPublisher eventPublisher;
    private final RiskProperties riskProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${lendguard.risk.liquidation.scan-interval-ms:120000}")
    public void scan() {
        if (!riskProperties.getLiquidation().isScanEnabled()) {
            return;
        }
        try {
            List<LiquidationOpportunity> found = liquidationScanner.findLiquidatablePositions();
            if (!found.isEmpty()) {
                eventPublisher.publishEvent(new LiquidationOpportunitiesFoundEvent(found, clock.instant()));
            }
        } catch (RuntimeException e) {
            log.error("Liquidation scan failed", e);
        }
    }
}
