package com.lendguard.risk;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Health factor of a position: (collateral value × liquidation threshold) / debt value, or {@link #INFINITE}
 * when the position carries no debt. Only a finite value below 1.0 is liquidation-eligible.
 */
public final class HealthFactor implements Comparable<HealthFactor> {

    public static final HealthFactor INFINITE = new HealthFactor(null);

    private final BigDecimal value;

    private HealthFactor(BigDecimal value) {
        this.value = value;
    }

    public static HealthFactor of(BigDecimal value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("health factor cannot be negative: " + value);
        }
        return new HealthFactor(value);
    }

    /**
     * Inverse of {@link #toPersisted()}: a stored null means no debt.
     */
    public static HealthFactor fromPersisted(BigDecimal stored) {
        return stored == null ? INFINITE : of(stored);
    }

    public boolean isInfinite() {
        return value == null;
    }

    /**
     * @return the finite value, or null for {@link #INFINITE}
     */
    public BigDecimal value() {
        return value;
    }

    public BigDecimal toPersisted() {
        return value;
    }

    public boolean isLiquidatable() {
        return isBelow(BigDecimal.ONE);
    }

    public boolean isBelow(BigDecimal threshold) {
        return value != null && value.compareTo(threshold) < 0;
    }

    @Override
    public int compareTo(HealthFactor other) {
        if (isInfinite()) {
            return other.isInfinite() ? 0 : 1;
        }
        if (other.isInfinite()) {
            return -1;
        }
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HealthFactor other)) {
            return false;
        }
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value == null ? "INFINITE" : value.toPlainString();
    }
}
