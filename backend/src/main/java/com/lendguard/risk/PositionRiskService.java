package com.lendguard.risk;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LendingPool;
import com.lendguard.domain.LendingPosition;
import com.lendguard.domain.LendingPositionRepository;
import com.lendguard.pool.PoolRegistry;
import com.lendguard.pool.VaultReader;
import com.lendguard.pricing.PriceBatchResult;
import com.lendguard.pricing.PriceOracleClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * On-demand risk evaluation of a single position: health, LTV, borrow and withdraw headroom, and the collateral
 * backing its vToken balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionRiskService {

    private final LendingPositionRepository positionRepository;
    private final PoolRegistry poolRegistry;
    private final PriceOracleClient priceOracleClient;
    private final VaultReader vaultReader;
    private final RiskMath riskMath;
    private final HealthClassifier healthClassifier;
    private final PositionSafetyGuard safetyGuard;
    private final Clock clock;

    public PositionRiskReport evaluate(String positionId) {
        return evaluate(load(positionId));
    }

    /**
     * Projected health factor after borrowing {@code amount} more debt; throws when the borrow is unsafe.
     */
    public HealthFactor checkBorrow(String positionId, BigDecimal amount) {
        LendingPosition position = load(positionId);
        LendingPool pool = poolRegistry.require(position.getPoolAddress());
        return safetyGuard.checkBorrow(position, pool, amount, PriceSnapshot.of(fetchPrices(position).prices()));
    }

    /**
     * Projected health factor after withdrawing {@code amount} collateral; throws when the withdrawal is unsafe.
     */
    public HealthFactor checkWithdraw(String positionId, BigDecimal amount) {
        LendingPosition position = load(positionId);
        LendingPool pool = poolRegistry.require(position.getPoolAddress());
        return safetyGuard.checkWithdraw(position, pool, amount, PriceSnapshot.of(fetchPrices(position).prices()));
    }

    public PositionRiskReport evaluate(LendingPosition position) {
        LendingPool pool = poolRegistry.require(position.getPoolAddress());
        PriceBatchResult batch = fetchPrices(position);
        PriceSnapshot prices = PriceSnapshot.of(batch.prices());
        boolean degraded = batch.getQuotes().values().stream().anyMatch(q -> q.degraded());

        HealthFactor hf = riskMath.healthFactor(position, prices, pool.getLiquidationThreshold());
        BigDecimal collateralValue = riskMath.collateralValue(position, prices);
        BigDecimal debtValue = riskMath.debtValue(position, prices);
        RoundingMode down = RoundingMode.DOWN;
        return new PositionRiskReport(
                position.getId(),
                position.getPoolAddress(),
                position.getCollateralAsset(),
                position.collateralOrZero(),
                collateralValue,
                position.getDebtAsset(),
                position.debtOrZero(),
                debtValue,
                hf.isInfinite() ? hf : HealthFactor.of(riskMath.context().toOutput(hf.value(), down)),
                healthClassifier.classify(hf),
                riskMath.context().toOutput(riskMath.ltv(collateralValue, debtValue), RoundingMode.CEILING),
                pool.getMaxLtv(),
                pool.getLiquidationThreshold(),
                riskMath.context().toOutput(riskMath.remainingBorrowable(position, prices, pool.getMaxLtv()), down),
                riskMath.maxWithdrawable(position, prices, pool.getLiquidationThreshold()),
                suppliedAssets(position, pool),
                degraded,
                clock.instant());
    }

    private LendingPosition load(String positionId) {
        return positionRepository.findById(positionId)
                .orElseThrow(() -> new RiskEngineException(ErrorCode.POSITION_NOT_FOUND,
                        "Position not found: " + positionId, Map.of("positionId", String.valueOf(positionId))));
    }

    private PriceBatchResult fetchPrices(LendingPosition position) {
        PriceBatchResult batch = priceOracleClient.getPrices(
                List.of(position.getCollateralAsset(), position.getDebtAsset()));
        if (!batch.isComplete()) {
            throw batch.getErrors().values().iterator().next();
        }
        return batch;
    }

    private BigDecimal suppliedAssets(LendingPosition position, LendingPool pool) {
        if (pool.getVaultAddress() == null || position.getVtokenBalance() == null
                || position.getVtokenBalance().signum() == 0) {
            return null;
        }
        try {
            BigDecimal rate = vaultReader.readVaultExchangeRate(pool.getVaultAddress());
            return riskMath.assetsForShares(position.getVtokenBalance(), rate);
        } catch (RiskEngineException e) {
            log.warn("Vault rate unavailable for pool {} ({}); omitting supplied assets", pool.getPoolKey(), e.getCode());
            return null;
        }
    }
}
