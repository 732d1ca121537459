// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.stableswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.AmountWithFee;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Meta-Pool Tests")
class MetaPoolTest {

    private static BigInteger big(String value) {
        return new BigInteger(value);
    }

    private StableswapPool basePool;
    private MetaPool metaPool;

    @BeforeEach
    void setUp() {
        basePool = StableswapPool.builder()
                .coins(3)
                .amplification(200)
                .totalValue(big("3000000000000000000000000"))
                .build();
        metaPool = MetaPool.builder()
                .coins(2)
                .basePool(basePool)
                .amplification(100)
                .totalValue(big("2000000000000000000000000"))
                .build();
    }

    @Test
    @DisplayName("Base LP token is valued at the base pool's virtual price")
    void testRatesUseBaseVirtualPrice() {
        assertThat(metaPool.rates()).containsExactly(BigInteger.TEN.pow(18), basePool.virtualPrice());
        assertThat(metaPool.maxCoin()).isEqualTo(1);
        assertThat(metaPool.totalCoinCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Primary exchange against the base LP token")
    void testPrimaryExchange() {
        // Act
        AmountWithFee out = metaPool.exchange(0, 1, big("1000000000000000000000"));

        // Assert
        assertThat(out.amount()).isEqualTo(big("999590103058584712249"));
        assertThat(out.fee()).isEqualTo(big("399996039639289600"));
    }

    @Test
    @DisplayName("Primary coin to base coin routes through a base withdrawal")
    void testExchangeUnderlyingToBase() {
        // Act
        AmountWithFee out = metaPool.exchangeUnderlying(0, 2, big("1000000000000000000000"));

        // Assert
        assertThat(out.amount()).isEqualTo(big("999388527852849440240"));
        assertThat(metaPool.balances()).containsExactly(
                big("1001000000000000000000000"), big("999000409896941415287751"));
        assertThat(basePool.balances()).containsExactly(
                big("1000000000000000000000000"),
                big("999000611472147150559760"),
                big("1000000000000000000000000"));
    }

    @Test
    @DisplayName("Base coin to primary coin deposits into the base pool first")
    void testExchangeUnderlyingFromBase() {
        // Arrange
        metaPool.exchangeUnderlying(0, 2, big("1000000000000000000000"));

        // Act
        AmountWithFee out = metaPool.exchangeUnderlying(3, 0, big("1000000000000000000000"));

        // Assert
        assertThat(out.amount()).isEqualTo(big("999406692554402083285"));
        assertThat(out.fee()).isEqualTo(big("399922646080192910"));
        assertThat(metaPool.balances()).containsExactly(
                big("1000000593307445597916715"), big("1000000206549213637066620"));
        assertThat(basePool.balances().get(2)).isEqualTo(big("1001000000000000000000000"));
    }

    @Test
    @DisplayName("Two base coins trade directly in the base pool")
    void testBaseToBase() {
        // Arrange
        List<BigInteger> metaBefore = metaPool.balances();

        // Act
        AmountWithFee out = metaPool.exchangeUnderlying(1, 2, big("1000000000000000000000"));

        // Assert
        assertThat(out.amount()).isEqualTo(big("999595026885489775669"));
        assertThat(metaPool.balances()).isEqualTo(metaBefore);
        assertThat(basePool.balances()).containsExactly(
                big("1001000000000000000000000"),
                big("999000404973114510224331"),
                big("1000000000000000000000000"));
    }

    @Test
    @DisplayName("Underlying spot prices on a balanced meta-pool")
    void testUnderlyingPrices() {
        assertThat(metaPool.dydx(0, 1, false)).isCloseTo(1.0, within(1e-9));
        assertThat(metaPool.dydx(0, 2, false)).isCloseTo(1.0, within(1e-9));
        assertThat(metaPool.primaryPrice(0, 1, false)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Copy is independent of the original, base pool included")
    void testCopyIsDeep() {
        // Arrange
        MetaPool copy = metaPool.copy();

        // Act
        metaPool.exchangeUnderlying(0, 2, big("1000000000000000000000"));

        // Assert
        assertThat(copy.balances()).containsOnly(big("1000000000000000000000000"));
        assertThat(copy.basePool().balances()).containsOnly(big("1000000000000000000000000"));
    }

    @Test
    @DisplayName("Reject base pools with fewer than 6 decimals")
    void testRejectLowDecimalBase() {
        StableswapPool lowDecimals = StableswapPool.builder()
                .coins(2)
                .amplification(100)
                .totalValue(big("2000000000000000000000000"))
                .rates(List.of(BigInteger.TEN.pow(31), BigInteger.TEN.pow(18)))
                .build();

        assertThrows(InvalidConfigurationError.class, () -> MetaPool.builder()
                .coins(2)
                .basePool(lowDecimals)
                .amplification(100)
                .totalValue(big("2000000000000000000000000"))
                .build());
    }
}
