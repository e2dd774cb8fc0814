package com.lendguard.risk;

import com.lendguard.common.DecimalContext;
import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LendingPosition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Stateless fixed-point risk functions. Products are exact; every division rounds in the direction that
 * understates safety: health factor and max-borrowable down, LTV and required collateral up, share and asset
 * conversions down.
 */
public class RiskMath {

    private final DecimalContext ctx;

    public RiskMath(DecimalContext ctx) {
        this.ctx = ctx;
    }

    public DecimalContext context() {
        return ctx;
    }

    public BigDecimal collateralValue(LendingPosition position, PriceSnapshot prices) {
        BigDecimal amount = nonNegative(position.collateralOrZero(), "collateralAmount");
        if (amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return amount.multiply(prices.priceOf(position.getCollateralAsset()));
    }

    public BigDecimal debtValue(LendingPosition position, PriceSnapshot prices) {
        BigDecimal amount = nonNegative(position.debtOrZero(), "debtAmount");
        if (amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return amount.multiply(prices.priceOf(position.getDebtAsset()));
    }

    /**
     * debtValue / collateralValue, 0 when there is no collateral value.
     */
    public BigDecimal ltv(LendingPosition position, PriceSnapshot prices) {
        return ltv(collateralValue(position, prices), debtValue(position, prices));
    }

    public BigDecimal ltv(BigDecimal collateralValue, BigDecimal debtValue) {
        nonNegative(collateralValue, "collateralValue");
        nonNegative(debtValue, "debtValue");
        if (collateralValue.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return ctx.divide(debtValue, collateralValue, RoundingMode.CEILING);
    }

    public HealthFactor healthFactor(LendingPosition position, PriceSnapshot prices, BigDecimal liquidationThreshold) {
        if (!position.hasDebt()) {
            nonNegative(position.debtOrZero(), "debtAmount");
            return HealthFactor.INFINITE;
        }
        return healthFactor(collateralValue(position, prices), debtValue(position, prices), liquidationThreshold);
    }

    public HealthFactor healthFactor(BigDecimal collateralValue, BigDecimal debtValue, BigDecimal liquidationThreshold) {
        nonNegative(collateralValue, "collateralValue");
        nonNegative(debtValue, "debtValue");
        positiveRatio(liquidationThreshold, "liquidationThreshold");
        if (debtValue.signum() == 0) {
            return HealthFactor.INFINITE;
        }
        BigDecimal weighted = collateralValue.multiply(liquidationThreshold);
        return HealthFactor.of(ctx.divide(weighted, debtValue, RoundingMode.DOWN));
    }

    /**
     * Total debt the collateral can back at maxLtv, in debt-asset units. A maxLtv of 0 allows no borrowing.
     */
    public BigDecimal maxBorrowable(BigDecimal collateralAmount, BigDecimal collateralPrice,
                                    BigDecimal debtPrice, BigDecimal maxLtv) {
        nonNegative(collateralAmount, "collateralAmount");
        positivePrice(collateralPrice, "collateralPrice");
        positivePrice(debtPrice, "debtPrice");
        nonNegative(maxLtv, "maxLtv");
        if (maxLtv.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal capacity = collateralAmount.multiply(collateralPrice).multiply(maxLtv);
        BigDecimal result = ctx.divide(capacity, debtPrice, RoundingMode.DOWN);
        return result.signum() < 0 ? BigDecimal.ZERO : result;
    }

    /**
     * Additional debt the position can take on at maxLtv, never negative.
     */
    public BigDecimal remainingBorrowable(LendingPosition position, PriceSnapshot prices, BigDecimal maxLtv) {
        BigDecimal total = maxBorrowable(position.collateralOrZero(),
                prices.priceOf(position.getCollateralAsset()),
                prices.priceOf(position.getDebtAsset()),
                maxLtv);
        BigDecimal remaining = total.subtract(position.debtOrZero());
        return remaining.signum() < 0 ? BigDecimal.ZERO : remaining;
    }

    /**
     * Largest collateral withdrawal that keeps the health factor at or above 1.0. The minimum collateral is
     * rounded up at full precision and the result is not reduced to the output scale, so withdrawing exactly
     * this amount leaves a health factor of at least 1.0.
     */
    public BigDecimal maxWithdrawable(LendingPosition position, PriceSnapshot prices, BigDecimal liquidationThreshold) {
        BigDecimal collateral = nonNegative(position.collateralOrZero(), "collateralAmount");
        if (!position.hasDebt()) {
            nonNegative(position.debtOrZero(), "debtAmount");
            return collateral;
        }
        positiveRatio(liquidationThreshold, "liquidationThreshold");
        BigDecimal debtValue = debtValue(position, prices);
        BigDecimal collateralPrice = prices.priceOf(position.getCollateralAsset());
        BigDecimal minCollateral = ctx.divide(debtValue, liquidationThreshold.multiply(collateralPrice),
                RoundingMode.CEILING);
        BigDecimal available = collateral.subtract(minCollateral);
        return available.signum() < 0 ? BigDecimal.ZERO : available;
    }

    /**
     * Shares minted for a deposit of {@code assets}; rounds down.
     */
    public BigDecimal sharesForAssets(BigDecimal assets, BigDecimal exchangeRate) {
        nonNegative(assets, "assets");
        positiveRate(exchangeRate);
        return ctx.divide(assets, exchangeRate, RoundingMode.DOWN);
    }

    /**
     * Assets redeemable for {@code shares}; rounds down.
     */
    public BigDecimal assetsForShares(BigDecimal shares, BigDecimal exchangeRate) {
        nonNegative(shares, "shares");
        positiveRate(exchangeRate);
        return ctx.multiply(shares, exchangeRate, RoundingMode.DOWN);
    }

    private static BigDecimal nonNegative(BigDecimal value, String field) {
        if (value == null || value.signum() < 0) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " must be non-negative",
                    Map.of("field", field, "value", String.valueOf(value)));
        }
        return value;
    }

    private static void positivePrice(BigDecimal price, String field) {
        if (price == null || price.signum() <= 0) {
            throw new RiskEngineException(ErrorCode.ZERO_PRICE, field + " must be positive",
                    Map.of("field", field, "value", String.valueOf(price)));
        }
    }

    private static void positiveRatio(BigDecimal ratio, String field) {
        if (ratio == null || ratio.signum() <= 0) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " must be positive",
                    Map.of("field", field, "value", String.valueOf(ratio)));
        }
    }

    private static void positiveRate(BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, "exchange rate must be positive",
                    Map.of("exchangeRate", String.valueOf(rate)));
        }
    }
}
