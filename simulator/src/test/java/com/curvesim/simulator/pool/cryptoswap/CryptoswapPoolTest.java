// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.cryptoswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.pool.AmountWithFee;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Cryptoswap engine tests.
 *
 * 2-coin expectations are contract outputs for a pool at price scale 1500 holding D = 3M.
 */
@DisplayName("Cryptoswap Pool Tests")
class CryptoswapPoolTest {

    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final long START = 1_700_000_000L;

    private static BigInteger big(String value) {
        return new BigInteger(value);
    }

    static CryptoswapPool.Builder twoCoinBuilder() {
        return CryptoswapPool.builder()
                .coins(2)
                .amplification(BigInteger.valueOf(400_000))
                .gamma(big("145000000000000"))
                .midFee(BigInteger.valueOf(26_000_000))
                .outFee(BigInteger.valueOf(45_000_000))
                .allowedExtraProfit(big("2000000000000"))
                .feeGamma(big("230000000000000"))
                .adjustmentStep(big("146000000000000"))
                .maHalfTime(600)
                .priceScale(List.of(big("1500000000000000000000")))
                .blockTimestamp(START);
    }

    static CryptoswapPool.Builder threeCoinBuilder() {
        return CryptoswapPool.builder()
                .coins(3)
                .amplification(BigInteger.valueOf(1_707_629))
                .gamma(big("11809167828997"))
                .midFee(BigInteger.valueOf(3_000_000))
                .outFee(BigInteger.valueOf(30_000_000))
                .allowedExtraProfit(big("2000000000000"))
                .feeGamma(big("500000000000000"))
                .adjustmentStep(big("490000000000000"))
                .maHalfTime(600)
                .priceScale(List.of(big("30000000000000000000000"), big("2000000000000000000000")))
                .blockTimestamp(START);
    }

    @Test
    @DisplayName("D is converted to balanced coin amounts at the price scale")
    void testBalancesFromD() {
        // Arrange & Act
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();

        // Assert
        assertThat(pool.balances()).containsExactly(big("1500000000000000000000000"), big("1000000000000000000000"));
        assertThat(pool.tokens()).isEqualTo(big("38729833462074168851792"));
        assertThat(pool.virtualPrice()).isEqualTo(E18);
    }

    @Test
    @DisplayName("Exchange output, fee and invariant growth")
    void testExchangeTwoCoins() {
        // Arrange
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();
        BigInteger quoted = pool.getDy(0, 1, big("1000000000000000000000"));

        // Act
        AmountWithFee out = pool.exchange(0, 1, big("1000000000000000000000"));

        // Assert
        assertThat(quoted).isEqualTo(big("664909664810470817"));
        assertThat(out.amount()).isEqualTo(quoted);
        assertThat(out.fee()).isEqualTo(big("1735720724412373"));
        assertThat(pool.balances()).containsExactly(big("1501000000000000000000000"), big("999335090335189529183"));
        assertThat(pool.invariant()).isEqualTo(big("3000002603664631435609096"));
        assertThat(pool.virtualPrice()).isEqualTo(big("1000000867888210478"));
        assertThat(pool.xcpProfit()).isEqualTo(big("1000000867888210478"));
    }

    @Test
    @DisplayName("Price oracle moves toward last trade price after time passes")
    void testOracleUpdate() {
        // Arrange
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();
        pool.exchange(0, 1, big("1000000000000000000000"));
        pool.incrementTimestamp(50);

        // Act
        AmountWithFee out = pool.exchange(1, 0, E18);

        // Assert
        assertThat(out.amount()).isEqualTo(big("1496122402752858233638"));
        assertThat(out.fee()).isEqualTo(big("3901445477393878252"));
        assertThat(pool.priceOracle()).containsExactly(big("1501981850260098874800"));
        assertThat(pool.lastPrices()).containsExactly(big("1496122402752858233638"));
        assertThat(pool.priceScale()).containsExactly(big("1500000000000000000000"));
        assertThat(pool.virtualPrice()).isEqualTo(big("1000002168390754437"));
    }

    @Test
    @DisplayName("First deposit into an empty pool sets virtual price to 1")
    void testFirstDeposit() {
        // Arrange
        CryptoswapPool pool = twoCoinBuilder().d(BigInteger.ZERO).tokens(BigInteger.ZERO).build();

        // Act
        BigInteger minted = pool.addLiquidity(List.of(big("1000000000000000000000000"),
                big("666666666666666666666")));

        // Assert
        assertTrue(minted.signum() > 0, "first deposit must mint LP tokens");
        assertThat(pool.tokens()).isEqualTo(minted);
        assertEquals(E18, pool.virtualPrice());
        assertEquals(E18, pool.xcpProfit());
        assertThat(pool.invariant()).isPositive();
    }

    @Test
    @DisplayName("Virtual price never decreases over a sequence of trades")
    void testVirtualPriceNonDecreasing() {
        // Arrange
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();
        BigInteger previous = pool.virtualPrice();

        for (int k = 0; k < 10; k++) {
            // Act
            pool.incrementTimestamp(5);
            if (k % 2 == 0) {
                pool.exchange(0, 1, big("20000000000000000000000"));
            } else {
                pool.exchange(1, 0, big("10000000000000000000"));
            }

            // Assert
            assertThat(pool.virtualPrice()).isGreaterThanOrEqualTo(previous);
            previous = pool.virtualPrice();
        }
    }

    @Test
    @DisplayName("3-coin exchange output and fee")
    void testExchangeThreeCoins() {
        // Arrange
        CryptoswapPool pool = threeCoinBuilder().d(big("30000000000000000000000000")).build();
        BigInteger vpBefore = pool.virtualPrice();

        // Act
        AmountWithFee out = pool.exchange(0, 2, big("10000000000000000000000"));

        // Assert
        assertThat(pool.balances().get(0)).isEqualTo(big("10010000000000000000000000"));
        assertThat(out.amount()).isEqualTo(big("4998372145209654327"));
        assertThat(out.fee()).isEqualTo(big("1526914673988711"));
        assertThat(pool.balances().get(2)).isEqualTo(big("5000000000000000000000").subtract(out.amount()));
        assertThat(pool.virtualPrice()).isGreaterThanOrEqualTo(vpBefore);
    }

    @Test
    @DisplayName("Spot price on a balanced pool reflects the price scale")
    void testBalancedPrice() {
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();

        double price = pool.price(1, 0, false);

        assertThat(price).isCloseTo(1500.0, within(1e-3));
    }

    @Test
    @DisplayName("Snapshot restores every mutable field")
    void testSnapshotRestore() {
        // Arrange
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();
        CryptoswapPool.Snapshot snapshot = pool.snapshot();
        List<BigInteger> balances = pool.balances();

        // Act
        pool.incrementTimestamp(10);
        pool.exchange(0, 1, big("50000000000000000000000"));
        pool.restore(snapshot);

        // Assert
        assertThat(pool.balances()).isEqualTo(balances);
        assertThat(pool.virtualPrice()).isEqualTo(E18);
        assertThat(pool.blockTimestamp()).isEqualTo(START);
    }

    @Test
    @DisplayName("Reject amplification outside the safe range")
    void testRejectUnsafeAmplification() {
        CryptoswapPool pool = twoCoinBuilder().d(big("3000000000000000000000000")).build();

        assertThrows(SafetyBoundError.class, () -> pool.reshape(BigInteger.ONE, pool.gamma()));
    }

    @Test
    @DisplayName("Reject price scale of the wrong length")
    void testRejectPriceScaleLength() {
        assertThrows(InvalidConfigurationError.class, () -> twoCoinBuilder()
                .priceScale(List.of(E18, E18))
                .d(big("3000000000000000000000000"))
                .build());
    }

    @Test
    @DisplayName("Reject a pool with neither balances nor D")
    void testRejectMissingState() {
        assertThrows(InvalidConfigurationError.class, () -> twoCoinBuilder().build());
    }

    @Test
    @DisplayName("Reject a pool built without a block timestamp")
    void testRejectMissingBlockTimestamp() {
        // Arrange
        CryptoswapPool.Builder builder = CryptoswapPool.builder()
                .coins(2)
                .amplification(BigInteger.valueOf(400_000))
                .gamma(big("145000000000000"))
                .midFee(BigInteger.valueOf(26_000_000))
                .outFee(BigInteger.valueOf(45_000_000))
                .allowedExtraProfit(big("2000000000000"))
                .feeGamma(big("230000000000000"))
                .adjustmentStep(big("146000000000000"))
                .maHalfTime(600)
                .priceScale(List.of(big("1500000000000000000000")))
                .d(big("3000000000000000000000000"));

        // Act
        InvalidConfigurationError error = assertThrows(InvalidConfigurationError.class, builder::build);

        // Assert
        assertThat(error.getMessage()).contains("blockTimestamp is required");
    }
}
