package com.lendguard.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-point arithmetic settings for all risk computations. Products of {@link BigDecimal}s are exact;
 * every division goes through this context with an explicit rounding direction so that no ambient,
 * process-wide precision state is involved.
 */
public final class DecimalContext {

    /** Minimum number of significant digits carried through divisions. */
    public static final int MIN_PRECISION = 36;

    private final int precision;
    private final RoundingMode defaultRounding;
    private final int outputScale;

    public DecimalContext(int precision, RoundingMode defaultRounding, int outputScale) {
        if (precision < MIN_PRECISION) {
            throw new IllegalArgumentException("precision must be >= " + MIN_PRECISION + ", got " + precision);
        }
        if (outputScale < 0) {
            throw new IllegalArgumentException("outputScale must be non-negative");
        }
        this.precision = precision;
        this.defaultRounding = Objects.requireNonNull(defaultRounding, "defaultRounding");
        this.outputScale = outputScale;
    }

    /**
     * 36 significant digits, HALF_EVEN, 18 decimal places on output.
     */
    public static DecimalContext standard() {
        return new DecimalContext(MIN_PRECISION, RoundingMode.HALF_EVEN, 18);
    }

    public BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return divide(dividend, divisor, defaultRounding);
    }

    public BigDecimal divide(BigDecimal dividend, BigDecimal divisor, RoundingMode rounding) {
        return dividend.divide(divisor, mathContext(rounding));
    }

    public BigDecimal multiply(BigDecimal left, BigDecimal right, RoundingMode rounding) {
        return left.multiply(right, mathContext(rounding));
    }

    /**
     * Reduces a value to the configured output scale, e.g. for persistence or display.
     */
    public BigDecimal toOutput(BigDecimal value, RoundingMode rounding) {
        return value.setScale(outputScale, rounding);
    }

    public MathContext mathContext(RoundingMode rounding) {
        return new MathContext(precision, rounding);
    }

    public int getPrecision() {
        return precision;
    }

    public RoundingMode getDefaultRounding() {
        return defaultRounding;
    }

    public int getOutputScale() {
        return outputScale;
    }
}
