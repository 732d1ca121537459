// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.stableswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.AmountWithFee;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Stableswap engine against known contract outputs.
 */
@DisplayName("Stableswap Pool Tests")
class StableswapPoolTest {

    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private static BigInteger big(String value) {
        return new BigInteger(value);
    }

    private static StableswapPool threeCoinPool() {
        return StableswapPool.builder()
                .coins(3)
                .amplification(100)
                .totalValue(big("3000000000000000000000000"))
                .build();
    }

    @Test
    @DisplayName("Balanced pool splits D evenly and keeps D as its invariant")
    void testBalancedPoolInvariant() {
        // Arrange
        StableswapPool pool = threeCoinPool();

        // Act
        BigInteger d = pool.invariant();

        // Assert
        assertThat(pool.balances()).containsOnly(big("1000000000000000000000000"));
        assertThat(d).isEqualTo(big("3000000000000000000000000"));
        assertThat(pool.tokens()).isEqualTo(d);
        assertThat(pool.virtualPrice()).isEqualTo(E18);
    }

    @Test
    @DisplayName("6-decimal coins trade in native units through their rates")
    void testExchangeWithRates() {
        // Arrange - two 6-decimal coins, 1M each
        BigInteger rate = BigInteger.TEN.pow(30);
        StableswapPool pool = StableswapPool.builder()
                .coins(2)
                .amplification(250)
                .totalValue(big("2000000000000000000000000"))
                .rates(List.of(rate, rate))
                .build();

        // Act
        AmountWithFee out = pool.exchange(0, 1, BigInteger.valueOf(150_000_000L));

        // Assert
        assertThat(out.amount()).isEqualTo(BigInteger.valueOf(149_939_910L));
        assertThat(out.fee()).isEqualTo(BigInteger.valueOf(59_999L));
        assertThat(pool.balances()).containsExactly(big("1000150000000"), big("999850060090"));
    }

    @Test
    @DisplayName("Half-million-per-coin pool returns the contract's output and fee for a 150 coin swap")
    void testExchangeSmallerPoolExactOutput() {
        // Arrange - two 6-decimal coins, 500k each
        BigInteger rate = BigInteger.TEN.pow(30);
        StableswapPool pool = StableswapPool.builder()
                .coins(2)
                .amplification(250)
                .totalValue(big("1000000000000000000000000"))
                .rates(List.of(rate, rate))
                .build();

        // Act
        AmountWithFee out = pool.exchange(0, 1, BigInteger.valueOf(150_000_000L));

        // Assert
        assertThat(out.amount()).isEqualTo(BigInteger.valueOf(149_939_820L));
        assertThat(out.fee()).isEqualTo(BigInteger.valueOf(59_999L));
        assertThat(pool.balances()).containsExactly(big("500150000000"), big("499850060180"));
    }

    @Test
    @DisplayName("Exchange output and fee on a 3-coin pool")
    void testExchangeThreeCoins() {
        // Arrange
        StableswapPool pool = threeCoinPool();

        // Act
        AmountWithFee out = pool.exchange(0, 2, big("10000000000000000000000"));

        // Assert
        assertThat(out.amount()).isEqualTo(big("9995010298009604960885"));
        assertThat(out.fee()).isEqualTo(big("3999603960788157247"));
        assertThat(pool.balances()).containsExactly(
                big("1010000000000000000000000"),
                big("1000000000000000000000000"),
                big("990004989701990395039115"));
        assertThat(pool.dydx(0, 2, false)).isCloseTo(0.9998020109304268, within(1e-12));
        assertThat(pool.dydx(2, 0, false)).isCloseTo(1.0001980282770075, within(1e-12));
    }

    @Test
    @DisplayName("Spot price on a balanced pool is 1, net of the static fee with useFee")
    void testDydxBalanced() {
        StableswapPool pool = threeCoinPool();

        assertThat(pool.dydx(0, 1, false)).isCloseTo(1.0, within(1e-15));
        assertThat(pool.dydx(0, 1, true)).isCloseTo(0.9996, within(1e-15));
    }

    @Test
    @DisplayName("Dynamic fee multiplier raises the fee on imbalanced trades")
    void testDynamicFee() {
        // Arrange
        StableswapPool pool = StableswapPool.builder()
                .coins(3)
                .amplification(100)
                .totalValue(big("3000000000000000000000000"))
                .feeMultiplier(big("20000000000"))
                .build();

        // Act
        AmountWithFee out = pool.exchange(0, 2, big("100000000000000000000000"));

        // Assert
        assertThat(out.amount()).isEqualTo(big("99860100860367167834592"));
        assertThat(out.fee()).isEqualTo(big("40010004391346871615"));
    }

    @Test
    @DisplayName("Imbalanced deposit, quote and single-coin withdrawal")
    void testLiquidityRoundTrip() {
        // Arrange
        StableswapPool pool = threeCoinPool();
        pool.exchange(0, 2, big("10000000000000000000000"));

        // Act
        BigInteger minted = pool.addLiquidity(List.of(big("1000000000000000000000"), big("2000000000000000000000"),
                BigInteger.ZERO));
        AmountWithFee quote = pool.calcWithdrawOneCoin(big("1000000000000000000000"), 1, true);
        AmountWithFee withdrawn = pool.removeLiquidityOneCoin(big("1000000000000000000000"), 1);

        // Assert
        assertThat(minted).isEqualTo(big("2999587118107239394541"));
        assertThat(quote.amount()).isEqualTo(big("999808470201387788548"));
        assertThat(quote.fee()).isEqualTo(big("199902103887244947"));
        assertThat(withdrawn).isEqualTo(quote);
        assertThat(pool.balances().get(1)).isEqualTo(big("1001000191529798612211452"));
        assertThat(pool.virtualPrice()).isEqualTo(big("1000001499826952082"));
    }

    @Test
    @DisplayName("Copies and snapshots are independent of later trades")
    void testCopyAndSnapshot() {
        // Arrange
        StableswapPool pool = threeCoinPool();
        StableswapPool copy = pool.copy();
        StableswapPool.Snapshot snapshot = pool.snapshot();

        // Act
        pool.exchange(0, 1, big("5000000000000000000000"));

        // Assert
        assertThat(copy.balances()).containsOnly(big("1000000000000000000000000"));
        pool.restore(snapshot);
        assertThat(pool.balances()).isEqualTo(copy.balances());
    }

    @Test
    @DisplayName("Reject mismatched rate count")
    void testRejectRateCount() {
        assertThrows(InvalidConfigurationError.class, () -> StableswapPool.builder()
                .coins(3)
                .amplification(100)
                .totalValue(big("3000000000000000000000000"))
                .rates(List.of(E18, E18))
                .build());
    }

    @Test
    @DisplayName("Resetting total value rebalances the pool")
    void testResetTotalValue() {
        // Arrange
        StableswapPool pool = threeCoinPool();
        pool.exchange(0, 1, big("5000000000000000000000"));

        // Act
        pool.resetTotalValue(big("6000000000000000000000000"));

        // Assert
        assertThat(pool.balances()).containsOnly(big("2000000000000000000000000"));
    }
}
