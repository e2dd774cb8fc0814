package com.lendguard.risk.liquidation;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.InputValidator;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LendingPool;
import com.lendguard.domain.LendingPosition;
import com.lendguard.domain.LendingPositionRepository;
import com.lendguard.domain.PositionStatus;
import com.lendguard.pool.PoolRegistry;
import com.lendguard.pricing.PriceBatchResult;
import com.lendguard.pricing.PriceOracleClient;
import com.lendguard.risk.HealthFactor;
import com.lendguard.risk.PriceSnapshot;
import com.lendguard.risk.RiskMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds liquidation-eligible positions and computes seizure amounts. Never mutates positions; execution belongs
 * to an external transaction submitter.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidationScanner {

    private final LendingPositionRepository positionRepository;
    private final PoolRegistry poolRegistry;
    private final PriceOracleClient priceOracleClient;
    private final RiskMath riskMath;
    private final Clock clock;

    /**
     * Active positions with debt whose freshly computed health factor is below 1.0, most profitable first.
     * Positions with an unavailable price or pool are skipped.
     */
    public List<LiquidationOpportunity> findLiquidatablePositions() {
        List<LendingPosition> candidates = positionRepository.findByStatus(PositionStatus.ACTIVE).stream()
                .filter(LendingPosition::hasDebt)
                .toList();
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<String> assets = new LinkedHashSet<>();
        for (LendingPosition p : candidates) {
            assets.add(p.getCollateralAsset());
            assets.add(p.getDebtAsset());
        }
        PriceBatchResult batch = priceOracleClient.getPrices(assets);
        PriceSnapshot prices = PriceSnapshot.of(batch.prices());

        List<LiquidationOpportunity> found = new ArrayList<>();
        for (LendingPosition position : candidates) {
            try {
                LendingPool pool = poolRegistry.require(position.getPoolAddress());
                HealthFactor hf = riskMath.healthFactor(position, prices, pool.getLiquidationThreshold());
                if (hf.isLiquidatable()) {
                    found.add(toOpportunity(position, pool, prices, hf));
                }
            } catch (RiskEngineException e) {
                log.warn("Skipping position {} in liquidation scan ({}): {}", position.getId(), e.getCode(), e.getMessage());
            }
        }
        found.sort(Comparator.comparing(LiquidationOpportunity::potentialProfitUsd).reversed());
        log.info("Liquidation scan: {} candidates, {} liquidatable", candidates.size(), found.size());
        return found;
    }

    /**
     * base = debtToCover × debtPrice / collateralPrice, bonus = base × liquidationBonus, total = base + bonus.
     */
    public SeizureQuote computeSeizure(BigDecimal debtToCover, BigDecimal collateralPrice, BigDecimal debtPrice,
                                       BigDecimal liquidationBonus) {
        InputValidator.requireNonNegative(debtToCover, "debtToCover");
        InputValidator.requireNonNegative(liquidationBonus, "liquidationBonus");
        if (collateralPrice == null || collateralPrice.signum() <= 0 || debtPrice == null || debtPrice.signum() <= 0) {
            throw new RiskEngineException(ErrorCode.ZERO_PRICE, "Seizure needs positive prices");
        }
        BigDecimal base = riskMath.context().divide(debtToCover.multiply(debtPrice), collateralPrice, RoundingMode.DOWN);
        BigDecimal bonus = base.multiply(liquidationBonus);
        return new SeizureQuote(base, bonus, base.add(bonus));
    }

    /**
     * Largest debt repayment whose seizure still fits in the position's collateral, capped at the outstanding debt.
     */
    public BigDecimal maxCoverableDebt(LendingPosition position, PriceSnapshot prices, BigDecimal liquidationBonus) {
        BigDecimal collateralPrice = prices.priceOf(position.getCollateralAsset());
        BigDecimal debtPrice = prices.priceOf(position.getDebtAsset());
        BigDecimal byCollateral = riskMath.context().divide(
                position.collateralOrZero().multiply(collateralPrice),
                debtPrice.multiply(BigDecimal.ONE.add(liquidationBonus)),
                RoundingMode.DOWN);
        return byCollateral.min(position.debtOrZero());
    }

    public LiquidationProposal propose(String positionId, BigDecimal debtToCover) {
        LendingPosition position = positionRepository.findById(positionId)
                .orElseThrow(() -> new RiskEngineException(ErrorCode.POSITION_NOT_FOUND,
                        "Position not found: " + positionId, Map.of("positionId", String.valueOf(positionId))));
        return propose(position, debtToCover);
    }

    public LiquidationProposal propose(LendingPosition position, BigDecimal debtToCover) {
        LendingPool pool = poolRegistry.require(position.getPoolAddress());
        PriceBatchResult batch = priceOracleClient.getPrices(List.of(position.getCollateralAsset(), position.getDebtAsset()));
        if (!batch.isComplete()) {
            throw batch.getErrors().values().iterator().next();
        }
        return propose(position, pool, PriceSnapshot.of(batch.prices()), debtToCover);
    }

    /**
     * @param debtToCover debt to repay, or null for the full outstanding debt
     */
    public LiquidationProposal propose(LendingPosition position, LendingPool pool, PriceSnapshot prices,
                                       BigDecimal debtToCover) {
        if (!position.isActive()) {
            throw new RiskEngineException(ErrorCode.POSITION_NOT_LIQUIDATABLE,
                    "Position " + position.getId() + " is " + position.getStatus(),
                    Map.of("positionId", String.valueOf(position.getId()), "status", String.valueOf(position.getStatus())));
        }
        HealthFactor hf = riskMath.healthFactor(position, prices, pool.getLiquidationThreshold());
        if (!hf.isLiquidatable()) {
            throw new RiskEngineException(ErrorCode.POSITION_NOT_LIQUIDATABLE,
                    "Position " + position.getId() + " has health factor " + hf,
                    Map.of("positionId", String.valueOf(position.getId()), "healthFactor", hf.toString()));
        }
        BigDecimal outstanding = position.debtOrZero();
        BigDecimal amount = debtToCover != null ? InputValidator.requirePositive(debtToCover, "debtToCover") : outstanding;
        if (amount.compareTo(outstanding) > 0) {
            throw new RiskEngineException(ErrorCode.DEBT_TO_COVER_EXCEEDS_DEBT,
                    "debtToCover " + amount.toPlainString() + " exceeds outstanding debt " + outstanding.toPlainString(),
                    Map.of("debtToCover", amount.toPlainString(), "totalDebt", outstanding.toPlainString()));
        }
        BigDecimal collateralPrice = prices.priceOf(position.getCollateralAsset());
        BigDecimal debtPrice = prices.priceOf(position.getDebtAsset());
        SeizureQuote seizure = computeSeizure(amount, collateralPrice, debtPrice, pool.getLiquidationBonus());
        if (seizure.totalCollateral().compareTo(position.collateralOrZero()) > 0) {
            throw new RiskEngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Seizure of " + seizure.totalCollateral().toPlainString() + " exceeds collateral "
                            + position.collateralOrZero().toPlainString(),
                    Map.of("collateralToSeize", seizure.totalCollateral().toPlainString(),
                            "collateral", position.collateralOrZero().toPlainString()));
        }
        return new LiquidationProposal(
                position.getId(),
                position.getPoolAddress(),
                position.getCollateralAsset(),
                position.getDebtAsset(),
                amount,
                seizure.totalCollateral(),
                seizure.bonusCollateral(),
                collateralPrice,
                debtPrice,
                hf,
                amount.compareTo(outstanding) == 0,
                clock.instant());
    }

    private LiquidationOpportunity toOpportunity(LendingPosition position, LendingPool pool, PriceSnapshot prices,
                                                 HealthFactor hf) {
        BigDecimal collateralPrice = prices.priceOf(position.getCollateralAsset());
        BigDecimal debtPrice = prices.priceOf(position.getDebtAsset());
        BigDecimal maxDebt = maxCoverableDebt(position, prices, pool.getLiquidationBonus());
        SeizureQuote seizure = computeSeizure(maxDebt, collateralPrice, debtPrice, pool.getLiquidationBonus());
        return new LiquidationOpportunity(
                position.getId(),
                position.getUserId(),
                position.getPoolAddress(),
                position.getCollateralAsset(),
                position.getDebtAsset(),
                position.collateralOrZero(),
                position.debtOrZero(),
                riskMath.collateralValue(position, prices),
                riskMath.debtValue(position, prices),
                hf,
                maxDebt,
                seizure,
                seizure.bonusCollateral().multiply(collateralPrice));
    }
}
