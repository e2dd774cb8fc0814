package com.lendguard.risk;

import com.lendguard.common.DecimalContext;
import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LendingPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RiskMathTest {

    private static final BigDecimal THRESHOLD = new BigDecimal("0.80");

    private final RiskMath riskMath = new RiskMath(DecimalContext.standard());

    @Test
    @DisplayName("1.5 ETH at 2500 against 1000 USDC: HF 3.0, LTV 0.2667")
    void healthFactorAndLtvForSimplePosition() {
        LendingPosition position = position("1.5", "1000");
        PriceSnapshot prices = prices("2500", "1");

        HealthFactor hf = riskMath.healthFactor(position, prices, THRESHOLD);

        assertThat(hf.value()).isEqualByComparingTo("3");
        assertThat(riskMath.collateralValue(position, prices)).isEqualByComparingTo("3750");
        assertThat(riskMath.debtValue(position, prices)).isEqualByComparingTo("1000");
        assertThat(riskMath.ltv(position, prices).doubleValue()).isCloseTo(0.2667, within(0.0001));
    }

    @Test
    @DisplayName("HF exactly 1.0 is not liquidatable")
    void healthFactorOfOneIsNotLiquidatable() {
        HealthFactor hf = riskMath.healthFactor(position("1.5", "3000"), prices("2500", "1"), THRESHOLD);

        assertThat(hf.value()).isEqualByComparingTo("1");
        assertThat(hf.isLiquidatable()).isFalse();
    }

    @Test
    @DisplayName("position without debt has an infinite health factor")
    void noDebtIsInfinite() {
        HealthFactor hf = riskMath.healthFactor(position("1.5", "0"), prices("2500", "1"), THRESHOLD);

        assertThat(hf.isInfinite()).isTrue();
        assertThat(hf.isLiquidatable()).isFalse();
    }

    @Test
    @DisplayName("HF rounds down and LTV rounds up on non-terminating divisions")
    void roundingDirections() {
        BigDecimal hf = riskMath.healthFactor(new BigDecimal("2"), new BigDecimal("3"), BigDecimal.ONE).value();
        BigDecimal ltv = riskMath.ltv(new BigDecimal("3"), new BigDecimal("2"));

        assertThat(hf.toPlainString()).endsWith("6666");
        assertThat(ltv.toPlainString()).endsWith("6667");
        assertThat(hf.precision()).isEqualTo(36);
    }

    @Test
    @DisplayName("LTV is zero when there is no collateral value")
    void ltvWithoutCollateral() {
        assertThat(riskMath.ltv(BigDecimal.ZERO, new BigDecimal("100"))).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("HF rises with collateral amount and price, falls with debt")
    void healthFactorMonotonicity() {
        Random random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            BigDecimal collateral = BigDecimal.valueOf(1 + random.nextInt(1_000_000), 3);
            BigDecimal debt = BigDecimal.valueOf(1 + random.nextInt(1_000_000), 2);
            BigDecimal price = BigDecimal.valueOf(1 + random.nextInt(500_000), 2);
            BigDecimal bump = BigDecimal.valueOf(1 + random.nextInt(10_000), 2);
            PriceSnapshot prices = prices(price, BigDecimal.ONE);

            HealthFactor base = riskMath.healthFactor(position(collateral, debt), prices, THRESHOLD);
            HealthFactor moreCollateral = riskMath.healthFactor(position(collateral.add(bump), debt), prices, THRESHOLD);
            HealthFactor higherPrice = riskMath.healthFactor(position(collateral, debt),
                    prices(price.add(bump), BigDecimal.ONE), THRESHOLD);
            HealthFactor moreDebt = riskMath.healthFactor(position(collateral, debt.add(bump)), prices, THRESHOLD);

            assertThat(moreCollateral.compareTo(base)).isGreaterThanOrEqualTo(0);
            assertThat(higherPrice.compareTo(base)).isGreaterThanOrEqualTo(0);
            assertThat(moreDebt.compareTo(base)).isLessThanOrEqualTo(0);
        }
    }

    @Test
    @DisplayName("LTV rises with debt and falls with collateral")
    void ltvMonotonicity() {
        Random random = new Random(7);
        for (int i = 0; i < 1000; i++) {
            BigDecimal collateral = BigDecimal.valueOf(1 + random.nextInt(1_000_000), 3);
            BigDecimal debt = BigDecimal.valueOf(random.nextInt(1_000_000), 2);
            BigDecimal bump = BigDecimal.valueOf(1 + random.nextInt(10_000), 3);
            PriceSnapshot prices = prices(BigDecimal.valueOf(1 + random.nextInt(500_000), 2),
                    BigDecimal.valueOf(90 + random.nextInt(20), 2));

            BigDecimal base = riskMath.ltv(position(collateral, debt), prices);
            BigDecimal moreDebt = riskMath.ltv(position(collateral, debt.add(bump)), prices);
            BigDecimal moreCollateral = riskMath.ltv(position(collateral.add(bump), debt), prices);

            assertThat(moreDebt).isGreaterThanOrEqualTo(base);
            assertThat(moreCollateral).isLessThanOrEqualTo(base);
        }
    }

    @Test
    @DisplayName("max withdrawable rises with collateral and falls with debt")
    void maxWithdrawableMonotonicity() {
        Random random = new Random(11);
        for (int i = 0; i < 1000; i++) {
            BigDecimal collateral = BigDecimal.valueOf(1 + random.nextInt(1_000_000), 3);
            BigDecimal debt = BigDecimal.valueOf(random.nextInt(1_000_000), 2);
            BigDecimal bump = BigDecimal.valueOf(1 + random.nextInt(10_000), 3);
            BigDecimal threshold = BigDecimal.valueOf(50 + random.nextInt(46), 2);
            PriceSnapshot prices = prices(BigDecimal.valueOf(1 + random.nextInt(500_000), 2), BigDecimal.ONE);

            BigDecimal base = riskMath.maxWithdrawable(position(collateral, debt), prices, threshold);
            BigDecimal moreCollateral = riskMath.maxWithdrawable(position(collateral.add(bump), debt), prices, threshold);
            BigDecimal moreDebt = riskMath.maxWithdrawable(position(collateral, debt.add(bump)), prices, threshold);

            assertThat(moreCollateral).isGreaterThanOrEqualTo(base);
            assertThat(moreDebt).isLessThanOrEqualTo(base);
            assertThat(base).isBetween(BigDecimal.ZERO, collateral);
        }
    }

    @Test
    @DisplayName("max borrowable = collateral × price × maxLtv / debt price")
    void maxBorrowable() {
        BigDecimal max = riskMath.maxBorrowable(new BigDecimal("1.5"), new BigDecimal("2500"), BigDecimal.ONE,
                new BigDecimal("0.75"));

        assertThat(max).isEqualByComparingTo("2812.5");
    }

    @Test
    @DisplayName("max borrowable is zero when maxLtv is zero")
    void maxBorrowableWithZeroMaxLtv() {
        assertThat(riskMath.maxBorrowable(new BigDecimal("1.5"), new BigDecimal("2500"), BigDecimal.ONE,
                BigDecimal.ZERO)).isEqualByComparingTo("0");
        assertThat(riskMath.remainingBorrowable(position("1.5", "0"), prices("2500", "1"), BigDecimal.ZERO))
                .isEqualByComparingTo("0");
        assertThatThrownBy(() -> riskMath.maxBorrowable(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE,
                new BigDecimal("-0.1")))
                .isInstanceOf(RiskEngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_AMOUNT);
    }

    @Test
    @DisplayName("remaining borrowable subtracts existing debt and never goes negative")
    void remainingBorrowable() {
        BigDecimal maxLtv = new BigDecimal("0.75");

        assertThat(riskMath.remainingBorrowable(position("1.5", "1000"), prices("2500", "1"), maxLtv))
                .isEqualByComparingTo("1812.5");
        assertThat(riskMath.remainingBorrowable(position("1.5", "5000"), prices("2500", "1"), maxLtv))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("withdrawing exactly max-withdrawable keeps HF >= 1, one unit more does not")
    void maxWithdrawableIsSafe() {
        LendingPosition position = position("1.5", "1000");
        PriceSnapshot prices = prices("3000", "1");

        BigDecimal max = riskMath.maxWithdrawable(position, prices, THRESHOLD);
        BigDecimal debtValue = riskMath.debtValue(position, prices);

        HealthFactor atMax = riskMath.healthFactor(
                position.getCollateralAmount().subtract(max).multiply(new BigDecimal("3000")), debtValue, THRESHOLD);
        HealthFactor beyondMax = riskMath.healthFactor(
                position.getCollateralAmount().subtract(max.add(new BigDecimal("1e-18"))).multiply(new BigDecimal("3000")),
                debtValue, THRESHOLD);

        assertThat(atMax.isLiquidatable()).isFalse();
        assertThat(beyondMax.isLiquidatable()).isTrue();
    }

    @Test
    @DisplayName("withdrawing max-withdrawable never drops HF below 1, withdrawing 1e-18 more always does")
    void maxWithdrawableIsSafeAcrossPositions() {
        Random random = new Random(23);
        BigDecimal epsilon = new BigDecimal("1e-18");
        for (int i = 0; i < 1000; i++) {
            BigDecimal debt = BigDecimal.valueOf(1 + random.nextInt(1_000_000), 2);
            BigDecimal collateralPrice = BigDecimal.valueOf(1 + random.nextInt(500_000), 2);
            BigDecimal debtPrice = BigDecimal.valueOf(90 + random.nextInt(20), 2);
            BigDecimal threshold = BigDecimal.valueOf(50 + random.nextInt(46), 2);
            BigDecimal needed = debt.multiply(debtPrice)
                    .divide(threshold.multiply(collateralPrice), 18, RoundingMode.CEILING);
            BigDecimal headroom = BigDecimal.valueOf(101 + random.nextInt(400), 2);
            BigDecimal collateral = needed.multiply(headroom).setScale(18, RoundingMode.UP);
            LendingPosition position = position(collateral, debt);
            PriceSnapshot prices = prices(collateralPrice, debtPrice);

            BigDecimal max = riskMath.maxWithdrawable(position, prices, threshold);
            BigDecimal debtValue = riskMath.debtValue(position, prices);
            HealthFactor atMax = riskMath.healthFactor(
                    collateral.subtract(max).multiply(collateralPrice), debtValue, threshold);
            HealthFactor beyondMax = riskMath.healthFactor(
                    collateral.subtract(max.add(epsilon)).multiply(collateralPrice), debtValue, threshold);

            assertThat(max.signum()).isPositive();
            assertThat(atMax.isLiquidatable()).as("trial %d at max", i).isFalse();
            assertThat(beyondMax.isLiquidatable()).as("trial %d beyond max", i).isTrue();
        }
    }

    @Test
    @DisplayName("max withdrawable is the whole collateral without debt and zero when already underwater")
    void maxWithdrawableEdges() {
        assertThat(riskMath.maxWithdrawable(position("1.5", "0"), prices("2500", "1"), THRESHOLD))
                .isEqualByComparingTo("1.5");
        assertThat(riskMath.maxWithdrawable(position("1", "5000"), prices("2500", "1"), THRESHOLD))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("shares to assets round trip loses less than 1e-6 and never gains")
    void shareRoundTrip() {
        BigDecimal rate = new BigDecimal("1.0734291857");
        BigDecimal assets = new BigDecimal("1234.567891");

        BigDecimal shares = riskMath.sharesForAssets(assets, rate);
        BigDecimal back = riskMath.assetsForShares(shares, rate);

        assertThat(back).isLessThanOrEqualTo(assets);
        assertThat(assets.subtract(back)).isLessThan(new BigDecimal("1e-6"));
    }

    @Test
    @DisplayName("share round trip stays within 1e-6 across amounts and rates")
    void shareRoundTripAcrossRates() {
        Random random = new Random(31);
        for (int i = 0; i < 1000; i++) {
            BigDecimal assets = BigDecimal.valueOf(1 + (long) random.nextInt(Integer.MAX_VALUE) * 1000L, 6);
            BigDecimal rate = BigDecimal.valueOf(5_000_000_000L + (long) (random.nextDouble() * 25_000_000_000L), 10);

            BigDecimal back = riskMath.assetsForShares(riskMath.sharesForAssets(assets, rate), rate);

            assertThat(back).isLessThanOrEqualTo(assets);
            assertThat(assets.subtract(back)).isLessThan(new BigDecimal("1e-6"));
        }
    }

    @Test
    @DisplayName("non-positive exchange rate is rejected")
    void invalidExchangeRate() {
        assertThatThrownBy(() -> riskMath.sharesForAssets(BigDecimal.TEN, BigDecimal.ZERO))
                .isInstanceOf(RiskEngineException.class)
                .extracting(e -> ((RiskEngineException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_AMOUNT);
    }

    @Test
    @DisplayName("negative amounts are INVALID_AMOUNT")
    void negativeAmount() {
        assertThatThrownBy(() -> riskMath.healthFactor(position("-1", "100"), prices("2500", "1"), THRESHOLD))
                .isInstanceOf(RiskEngineException.class)
                .extracting(e -> ((RiskEngineException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_AMOUNT);
    }

    @Test
    @DisplayName("zero price is ZERO_PRICE, absent price is MISSING_PRICE")
    void priceErrors() {
        assertThatThrownBy(() -> riskMath.healthFactor(position("1", "100"), prices("0", "1"), THRESHOLD))
                .isInstanceOf(RiskEngineException.class)
                .extracting(e -> ((RiskEngineException) e).getCode())
                .isEqualTo(ErrorCode.ZERO_PRICE);

        PriceSnapshot onlyEth = PriceSnapshot.of(Map.of("ETH", new BigDecimal("2500")));
        assertThatThrownBy(() -> riskMath.healthFactor(position("1", "100"), onlyEth, THRESHOLD))
                .isInstanceOf(RiskEngineException.class)
                .extracting(e -> ((RiskEngineException) e).getCode())
                .isEqualTo(ErrorCode.MISSING_PRICE);
    }

    static LendingPosition position(String collateral, String debt) {
        return position(new BigDecimal(collateral), new BigDecimal(debt));
    }

    static LendingPosition position(BigDecimal collateral, BigDecimal debt) {
        LendingPosition p = new LendingPosition();
        p.setId("pos-1");
        p.setPoolAddress("0x01");
        p.setCollateralAsset("ETH");
        p.setCollateralAmount(collateral);
        p.setDebtAsset("USDC");
        p.setDebtAmount(debt);
        return p;
    }

    static PriceSnapshot prices(String eth, String usdc) {
        return prices(new BigDecimal(eth), new BigDecimal(usdc));
    }

    static PriceSnapshot prices(BigDecimal eth, BigDecimal usdc) {
        return PriceSnapshot.of("ETH", eth, "USDC", usdc);
    }
}
