package com.lendguard.risk;

import com.lendguard.domain.AlertPriority;
import com.lendguard.domain.HealthStatus;

import java.math.BigDecimal;

/**
 * Maps a health factor onto a severity bucket. Bounds are exclusive: a value equal to a threshold falls into
 * the safer bucket.
 */
public class HealthClassifier {

    private final BigDecimal warning;
    private final BigDecimal critical;
    private final BigDecimal liquidation;

    public HealthClassifier(BigDecimal warning, BigDecimal critical, BigDecimal liquidation) {
        if (!(warning.compareTo(critical) > 0 && critical.compareTo(liquidation) > 0 && liquidation.signum() > 0)) {
            throw new IllegalArgumentException(
                    "thresholds must satisfy warning > critical > liquidation > 0, got "
                            + warning + " / " + critical + " / " + liquidation);
        }
        this.warning = warning;
        this.critical = critical;
        this.liquidation = liquidation;
    }

    public static HealthClassifier defaults() {
        return new HealthClassifier(new BigDecimal("1.2"), new BigDecimal("1.05"), BigDecimal.ONE);
    }

    public HealthStatus classify(HealthFactor healthFactor) {
        if (healthFactor.isBelow(liquidation)) {
            return HealthStatus.LIQUIDATABLE;
        }
        if (healthFactor.isBelow(critical)) {
            return HealthStatus.CRITICAL;
        }
        if (healthFactor.isBelow(warning)) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Threshold crossed to enter the given status; null for HEALTHY.
     */
    public BigDecimal thresholdFor(HealthStatus status) {
        return switch (status) {
            case WARNING -> warning;
            case CRITICAL -> critical;
            case LIQUIDATABLE -> liquidation;
            case HEALTHY -> null;
        };
    }

    public static AlertPriority priorityFor(HealthStatus status) {
        return status == HealthStatus.WARNING ? AlertPriority.MEDIUM : AlertPriority.CRITICAL;
    }
}
