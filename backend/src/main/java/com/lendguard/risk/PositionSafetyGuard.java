package com.lendguard.risk;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.InputValidator;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LendingPool;
import com.lendguard.domain.LendingPosition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Pre-operation checks for borrow and withdraw. Each check either passes, returning the projected health factor,
 * or throws a SAFETY (or VALIDATION) {@link RiskEngineException}.
 */
@Component
@RequiredArgsConstructor
public class PositionSafetyGuard {

    private final RiskMath riskMath;

    public HealthFactor checkBorrow(LendingPosition position, LendingPool pool, BigDecimal amount, PriceSnapshot prices) {
        InputValidator.requirePositive(amount, "amount");
        BigDecimal available = pool.availableLiquidity();
        if (amount.compareTo(available) > 0) {
            throw new RiskEngineException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    "Borrow of " + amount.toPlainString() + " exceeds available liquidity " + available.toPlainString(),
                    Map.of("amount", amount.toPlainString(), "available", available.toPlainString()));
        }
        BigDecimal collateralValue = riskMath.collateralValue(position, prices);
        BigDecimal newDebtValue = position.debtOrZero().add(amount).multiply(prices.priceOf(position.getDebtAsset()));
        if (collateralValue.signum() == 0) {
            throw new RiskEngineException(ErrorCode.LTV_EXCEEDED, "Position has no collateral to borrow against",
                    Map.of("positionId", String.valueOf(position.getId())));
        }
        BigDecimal newLtv = riskMath.ltv(collateralValue, newDebtValue);
        if (newLtv.compareTo(pool.getMaxLtv()) > 0) {
            throw new RiskEngineException(ErrorCode.LTV_EXCEEDED,
                    "Resulting LTV " + newLtv.toPlainString() + " exceeds max " + pool.getMaxLtv().toPlainString(),
                    Map.of("ltv", newLtv.toPlainString(), "maxLtv", pool.getMaxLtv().toPlainString()));
        }
        HealthFactor projected = riskMath.healthFactor(collateralValue, newDebtValue, pool.getLiquidationThreshold());
        if (projected.isLiquidatable()) {
            throw new RiskEngineException(ErrorCode.HEALTH_FACTOR_BELOW_ONE,
                    "Resulting health factor " + projected + " is below 1.0",
                    Map.of("healthFactor", projected.toString()));
        }
        return projected;
    }

    public HealthFactor checkWithdraw(LendingPosition position, LendingPool pool, BigDecimal amount, PriceSnapshot prices) {
        InputValidator.requirePositive(amount, "amount");
        BigDecimal collateral = position.collateralOrZero();
        if (amount.compareTo(collateral) > 0) {
            throw new RiskEngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Withdrawal of " + amount.toPlainString() + " exceeds collateral " + collateral.toPlainString(),
                    Map.of("amount", amount.toPlainString(), "collateral", collateral.toPlainString()));
        }
        BigDecimal max = riskMath.maxWithdrawable(position, prices, pool.getLiquidationThreshold());
        if (amount.compareTo(max) > 0) {
            throw new RiskEngineException(ErrorCode.HEALTH_FACTOR_BELOW_ONE,
                    "Withdrawal of " + amount.toPlainString() + " would push health factor below 1.0",
                    Map.of("amount", amount.toPlainString(), "maxWithdrawable", max.toPlainString()));
        }
        if (!position.hasDebt()) {
            return HealthFactor.INFINITE;
        }
        BigDecimal remainingValue = collateral.subtract(amount).multiply(prices.priceOf(position.getCollateralAsset()));
        return riskMath.healthFactor(remainingValue, riskMath.debtValue(position, prices), pool.getLiquidationThreshold());
    }
}
