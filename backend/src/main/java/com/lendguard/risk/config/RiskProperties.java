package com.lendguard.risk.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Risk engine configuration. Documented in application.yml under lendguard.risk.
 */
@ConfigurationProperties(prefix = "lendguard.risk")
@Validated
@Getter
@Setter
public class RiskProperties {

    /**
     * Significant digits carried through divisions (at least 36).
     */
    @Min(36)
    private int precision = 36;

    /**
     * Decimal places of persisted and displayed ratios.
     */
    @Min(0)
    private int outputScale = 18;

    @Valid
    private MonitorProperties monitor = new MonitorProperties();

    @Valid
    private LiquidationProperties liquidation = new LiquidationProperties();

    @Getter
    @Setter
    public static class MonitorProperties {
        /** Start the monitor loop when the application is ready. */
        private boolean enabled = false;
        /** Delay between the end of one cycle and the start of the next. */
        @Min(1)
        private long intervalMs = 60_000;
        private BigDecimal warningThreshold = new BigDecimal("1.2");
        private BigDecimal criticalThreshold = new BigDecimal("1.05");
        private BigDecimal liquidationThreshold = BigDecimal.ONE;
    }

    @Getter
    @Setter
    public static class LiquidationProperties {
        /** Publish liquidation opportunities on a schedule. */
        private boolean scanEnabled = false;
        @Min(1)
        private long scanIntervalMs = 120_000;
    }
}
