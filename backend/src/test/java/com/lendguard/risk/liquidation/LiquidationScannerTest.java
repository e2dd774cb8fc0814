package com.lendguard.risk.liquidation;

import com.lendguard.common.DecimalContext;
import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LendingPool;
import com.lendguard.domain.LendingPosition;
import com.lendguard.domain.LendingPositionRepository;
import com.lendguard.domain.PositionStatus;
import com.lendguard.pool.PoolRegistry;
import com.lendguard.pricing.AggregationMode;
import com.lendguard.pricing.PriceBatchResult;
import com.lendguard.pricing.PriceOracleClient;
import com.lendguard.pricing.PriceQuote;
import com.lendguard.risk.PriceSnapshot;
import com.lendguard.risk.RiskMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LiquidationScannerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    LendingPositionRepository positionRepository;
    @Mock
    PoolRegistry poolRegistry;
    @Mock
    PriceOracleClient priceOracleClient;

    private LiquidationScanner scanner;
    private LendingPool pool;

    @BeforeEach
    void setUp() {
        scanner = new LiquidationScanner(positionRepository, poolRegistry, priceOracleClient,
                new RiskMath(DecimalContext.standard()), Clock.fixed(NOW, ZoneOffset.UTC));
        pool = new LendingPool();
        pool.setPoolAddress("0x01");
        pool.setPoolKey("ETH-USDC");
        pool.setMaxLtv(new BigDecimal("0.75"));
        pool.setLiquidationThreshold(new BigDecimal("0.80"));
        pool.setLiquidationBonus(new BigDecimal("0.05"));
        pool.setActive(true);
    }

    @Test
    @DisplayName("seizure: base = debt × debtPrice / collateralPrice, bonus = base × 5%, total = base + bonus")
    void seizureIdentity() {
        SeizureQuote quote = scanner.computeSeizure(new BigDecimal("1000"), new BigDecimal("2000"), BigDecimal.ONE,
                new BigDecimal("0.05"));

        assertThat(quote.baseCollateral()).isEqualByComparingTo("0.5");
        assertThat(quote.bonusCollateral()).isEqualByComparingTo("0.025");
        assertThat(quote.totalCollateral()).isEqualByComparingTo("0.525");
        assertThat(quote.totalCollateral())
                .isEqualByComparingTo(quote.baseCollateral().add(quote.bonusCollateral()));
    }

    @Test
    @DisplayName("seized collateral equals debt value in collateral times (1 + bonus) within 1e-4 relative")
    void seizureIdentityAcrossInputs() {
        Random random = new Random(17);
        BigDecimal tolerance = new BigDecimal("1e-4");
        for (int i = 0; i < 1000; i++) {
            BigDecimal debt = BigDecimal.valueOf(1 + random.nextInt(100_000_000), 2);
            BigDecimal collateralPrice = BigDecimal.valueOf(1 + random.nextInt(10_000_000), 3);
            BigDecimal debtPrice = BigDecimal.valueOf(1 + random.nextInt(10_000_000), 4);
            BigDecimal bonus = BigDecimal.valueOf(random.nextInt(2_001), 4);

            SeizureQuote quote = scanner.computeSeizure(debt, collateralPrice, debtPrice, bonus);
            BigDecimal expected = debt.multiply(debtPrice).multiply(BigDecimal.ONE.add(bonus))
                    .divide(collateralPrice, MathContext.DECIMAL128);
            BigDecimal relativeError = quote.totalCollateral().subtract(expected).abs()
                    .divide(expected, MathContext.DECIMAL128);

            assertThat(quote.totalCollateral())
                    .isEqualByComparingTo(quote.baseCollateral().add(quote.bonusCollateral()));
            assertThat(relativeError).as("trial %d", i).isLessThanOrEqualTo(tolerance);
        }
    }

    @Test
    @DisplayName("seizure with zero price is ZERO_PRICE")
    void seizureZeroPrice() {
        assertThatThrownBy(() -> scanner.computeSeizure(BigDecimal.TEN, BigDecimal.ZERO, BigDecimal.ONE, BigDecimal.ZERO))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.ZERO_PRICE);
    }

    @Test
    @DisplayName("max coverable debt is capped by outstanding debt or by collateral with bonus")
    void maxCoverableDebt() {
        BigDecimal bonus = new BigDecimal("0.05");

        assertThat(scanner.maxCoverableDebt(position("p1", "1", "1700"), prices("2000"), bonus))
                .isEqualByComparingTo("1700");

        BigDecimal capped = scanner.maxCoverableDebt(position("p2", "1", "1000"), prices("1000"), bonus);
        assertThat(capped.doubleValue()).isCloseTo(952.38, offset(0.01));
        assertThat(scanner.computeSeizure(capped, new BigDecimal("1000"), BigDecimal.ONE, bonus).totalCollateral())
                .isLessThanOrEqualTo(BigDecimal.ONE);
    }

    @Test
    @DisplayName("full liquidation of an underwater position")
    void proposeFullLiquidation() {
        LiquidationProposal proposal = scanner.propose(position("p1", "1", "1700"), pool, prices("2000"), null);

        assertThat(proposal.debtToCover()).isEqualByComparingTo("1700");
        assertThat(proposal.collateralToSeize()).isEqualByComparingTo("0.8925");
        assertThat(proposal.bonusCollateral()).isEqualByComparingTo("0.0425");
        assertThat(proposal.fullLiquidation()).isTrue();
        assertThat(proposal.healthFactor().isLiquidatable()).isTrue();
        assertThat(proposal.proposedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("partial liquidation covers the requested amount")
    void proposePartialLiquidation() {
        LiquidationProposal proposal = scanner.propose(position("p1", "1", "1700"), pool, prices("2000"),
                new BigDecimal("1000"));

        assertThat(proposal.debtToCover()).isEqualByComparingTo("1000");
        assertThat(proposal.collateralToSeize()).isEqualByComparingTo("0.525");
        assertThat(proposal.fullLiquidation()).isFalse();
    }

    @Test
    @DisplayName("covering more than the outstanding debt is rejected")
    void debtToCoverAboveDebt() {
        assertThatThrownBy(() -> scanner.propose(position("p1", "1", "1700"), pool, prices("2000"), new BigDecimal("1800")))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.DEBT_TO_COVER_EXCEEDS_DEBT);
    }

    @Test
    @DisplayName("healthy or inactive positions are not liquidatable")
    void notLiquidatable() {
        assertThatThrownBy(() -> scanner.propose(position("p1", "1.5", "1000"), pool, prices("2500"), null))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.POSITION_NOT_LIQUIDATABLE);

        LendingPosition closed = position("p2", "1", "1700");
        closed.setStatus(PositionStatus.LIQUIDATED);
        assertThatThrownBy(() -> scanner.propose(closed, pool, prices("2000"), null))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.POSITION_NOT_LIQUIDATABLE);
    }

    @Test
    @DisplayName("seizure larger than the collateral is INSUFFICIENT_COLLATERAL")
    void seizureExceedsCollateral() {
        assertThatThrownBy(() -> scanner.propose(position("p1", "1", "1000"), pool, prices("1000"), null))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INSUFFICIENT_COLLATERAL);
    }

    @Test
    @DisplayName("propose by id loads the position and fails with POSITION_NOT_FOUND when absent")
    void proposeUnknownPosition() {
        when(positionRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> scanner.propose("missing", null))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.POSITION_NOT_FOUND);
        verify(priceOracleClient, never()).getPrices(any());
    }

    @Test
    @DisplayName("propose by id surfaces the price error when a price is missing")
    void proposeWithPriceFailure() {
        when(positionRepository.findById("p1")).thenReturn(Optional.of(position("p1", "1", "1700")));
        when(poolRegistry.require("0x01")).thenReturn(pool);
        RiskEngineException stale = new RiskEngineException(ErrorCode.STALE_PRICE, "stale");
        when(priceOracleClient.getPrices(any())).thenReturn(
                new PriceBatchResult(Map.of("USDC", quote("USDC", "1")), Map.of("ETH", stale)));

        assertThatThrownBy(() -> scanner.propose("p1", null)).isSameAs(stale);
    }

    @Test
    @DisplayName("scan returns liquidatable positions ordered by profit and skips unpriceable ones")
    void scanOrdersByProfit() {
        LendingPosition small = position("small", "1", "1700");
        LendingPosition large = position("large", "10", "17000");
        LendingPosition healthy = position("healthy", "1.5", "1000");
        LendingPosition noDebt = position("no-debt", "1", "0");
        LendingPosition unpriced = position("unpriced", "100", "1000");
        unpriced.setCollateralAsset("STRK");
        when(positionRepository.findByStatus(PositionStatus.ACTIVE))
                .thenReturn(List.of(small, healthy, large, noDebt, unpriced));
        when(poolRegistry.require(anyString())).thenReturn(pool);
        when(priceOracleClient.getPrices(any())).thenReturn(new PriceBatchResult(
                Map.of("ETH", quote("ETH", "2000"), "USDC", quote("USDC", "1")),
                Map.of("STRK", new RiskEngineException(ErrorCode.STALE_PRICE, "stale"))));

        List<LiquidationOpportunity> found = scanner.findLiquidatablePositions();

        assertThat(found).extracting(LiquidationOpportunity::positionId).containsExactly("large", "small");
        LiquidationOpportunity top = found.get(0);
        assertThat(top.maxDebtToCover()).isEqualByComparingTo("17000");
        assertThat(top.seizure().totalCollateral()).isEqualByComparingTo("8.925");
        assertThat(top.potentialProfitUsd()).isEqualByComparingTo("850");
    }

    @Test
    @DisplayName("scan without indebted positions does not fetch prices")
    void scanWithoutCandidates() {
        when(positionRepository.findByStatus(PositionStatus.ACTIVE)).thenReturn(List.of(position("p", "1", "0")));

        assertThat(scanner.findLiquidatablePositions()).isEmpty();
        verify(priceOracleClient, never()).getPrices(any());
    }

    private static LendingPosition position(String id, String collateral, String debt) {
        LendingPosition p = new LendingPosition();
        p.setId(id);
        p.setUserId("user-" + id);
        p.setPoolAddress("0x01");
        p.setCollateralAsset("ETH");
        p.setCollateralAmount(new BigDecimal(collateral));
        p.setDebtAsset("USDC");
        p.setDebtAmount(new BigDecimal(debt));
        return p;
    }

    private static PriceSnapshot prices(String eth) {
        return PriceSnapshot.of("ETH", new BigDecimal(eth), "USDC", BigDecimal.ONE);
    }

    private static PriceQuote quote(String asset, String price) {
        BigDecimal p = new BigDecimal(price);
        return new PriceQuote(asset, p, p.movePointRight(8).toBigInteger(), 8, NOW, 5, null,
                AggregationMode.MEDIAN, false, false);
    }
}
