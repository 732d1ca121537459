// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.simulation;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.cryptoswap.CryptoswapPool;
import com.curvesim.simulator.pool.sim.SimCryptoswapPool;
import com.curvesim.simulator.pool.sim.SimMetaPool;
import com.curvesim.simulator.pool.sim.SimStableswapPool;
import com.curvesim.simulator.pool.stableswap.MetaPool;
import com.curvesim.simulator.pool.stableswap.StableswapPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.withinPercentage;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

@DisplayName("Parameter Grid Tests")
class ParameterGridTest {

    private static BigInteger big(String value) {
        return new BigInteger(value);
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    private static SimStableswapPool stableswap() {
        return new SimStableswapPool(List.of("DAI", "USDC", "USDT"), StableswapPool.builder()
                .coins(3)
                .amplification(100)
                .totalValue(big("3000000000000000000000000"))
                .build());
    }

    private static SimMetaPool metaPool() {
        StableswapPool basePool = StableswapPool.builder()
                .coins(3)
                .amplification(200)
                .totalValue(big("3000000000000000000000000"))
                .build();
        return new SimMetaPool(List.of("GUSD", "3CRV"), List.of("DAI", "USDC", "USDT"), MetaPool.builder()
                .coins(2)
                .basePool(basePool)
                .amplification(100)
                .totalValue(big("2000000000000000000000000"))
                .build());
    }

    private static SimCryptoswapPool cryptoswap() {
        return new SimCryptoswapPool(List.of("USDC", "WETH"), CryptoswapPool.builder()
                .coins(2)
                .amplification(big(400_000))
                .gamma(big("145000000000000"))
                .midFee(big(26_000_000))
                .outFee(big(45_000_000))
                .allowedExtraProfit(big("2000000000000"))
                .feeGamma(big("230000000000000"))
                .adjustmentStep(big("146000000000000"))
                .maHalfTime(600)
                .priceScale(List.of(big("1500000000000000000000")))
                .d(big("3000000000000000000000000"))
                .blockTimestamp(1_700_000_000L)
                .build());
    }

    @Test
    @DisplayName("One combination per element of the Cartesian product, in row-major order")
    void testCombinations() {
        // Arrange
        Map<String, List<BigInteger>> variable = new LinkedHashMap<>();
        variable.put("A", List.of(big(50), big(100), big(200)));
        variable.put("fee", List.of(big(1_000_000), big(4_000_000)));

        // Act
        ParameterGrid grid = new ParameterGrid(stableswap(), variable);

        // Assert
        assertEquals(6, grid.size());
        assertThat(grid.combinations().get(0)).containsExactly(Map.entry("A", big(50)), Map.entry("fee", big(1_000_000)));
        assertThat(grid.combinations().get(1)).containsExactly(Map.entry("A", big(50)), Map.entry("fee", big(4_000_000)));
        assertThat(grid.combinations().get(5)).containsExactly(Map.entry("A", big(200)), Map.entry("fee", big(4_000_000)));
    }

    @Test
    @DisplayName("Each combination gets an independent pool; the template is untouched")
    void testPoolsAreIndependent() {
        // Arrange
        SimStableswapPool template = stableswap();
        ParameterGrid grid = new ParameterGrid(template, Map.of("fee", big(1_000_000)),
                Map.of("A", List.of(big(50), big(200))));

        // Act
        SimStableswapPool first = (SimStableswapPool) grid.poolFor(grid.combinations().get(0));
        SimStableswapPool second = (SimStableswapPool) grid.poolFor(grid.combinations().get(1));
        first.trade("DAI", "USDC", big("1000000000000000000000"));

        // Assert
        assertNotSame(first.pool(), second.pool());
        assertEquals(big(50), first.pool().amplification());
        assertEquals(big(200), second.pool().amplification());
        assertEquals(big(1_000_000), second.pool().fee());
        assertEquals(second.assetBalances().get(0), second.assetBalances().get(1));
        assertEquals(big(100), template.pool().amplification());
        assertEquals(big(4_000_000), template.pool().fee());
    }

    @Test
    @DisplayName("Fixed parameters alone yield a single combination")
    void testFixedOnly() {
        // Act
        ParameterGrid grid = new ParameterGrid(stableswap(), Map.of("A", big(300)), Map.of());

        // Assert
        assertEquals(1, grid.size());
        SimStableswapPool pool = (SimStableswapPool) grid.poolFor(grid.combinations().get(0));
        assertEquals(big(300), pool.pool().amplification());
    }

    @Test
    @DisplayName("Meta-pool parameters with the _base suffix go to the base pool")
    void testMetaPoolBaseParameters() {
        // Arrange
        Map<String, List<BigInteger>> variable = new LinkedHashMap<>();
        variable.put("A", List.of(big(50)));
        variable.put("A_base", List.of(big(500)));
        variable.put("fee_base", List.of(big(2_000_000)));

        // Act
        ParameterGrid grid = new ParameterGrid(metaPool(), variable);
        SimMetaPool pool = (SimMetaPool) grid.poolFor(grid.combinations().get(0));

        // Assert
        assertEquals(big(50), pool.pool().amplification());
        assertEquals(big(500), pool.pool().basePool().amplification());
        assertEquals(big(2_000_000), pool.pool().basePool().fee());
    }

    @Test
    @DisplayName("Cryptoswap A and gamma re-solve the invariant for the current balances")
    void testCryptoswapReshape() {
        // Arrange
        Map<String, List<BigInteger>> variable = new LinkedHashMap<>();
        variable.put("A", List.of(big(500_000)));
        variable.put("mid_fee", List.of(big(5_000_000)));
        variable.put("ma_half_time", List.of(big(1200)));

        // Act
        ParameterGrid grid = new ParameterGrid(cryptoswap(), variable);
        CryptoswapPool pool = ((SimCryptoswapPool) grid.poolFor(grid.combinations().get(0))).pool();

        // Assert
        assertEquals(big(500_000), pool.amplification());
        assertEquals(big(5_000_000), pool.midFee());
        assertThat(pool.invariant()).isCloseTo(big("3000000000000000000000000"),
                withinPercentage(0.0001));
    }

    @Test
    @DisplayName("Unsupported parameter names are rejected up front")
    void testUnknownParameter() {
        assertThatThrownBy(() -> new ParameterGrid(stableswap(), Map.of("gamma", List.of(big(1)))))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("Parameter gamma is not supported for pool type stableswap");
        assertThatThrownBy(() -> new ParameterGrid(cryptoswap(), Map.of("fee_mul", List.of(big(1)))))
                .isInstanceOf(InvalidConfigurationError.class);
        assertThatThrownBy(() -> new ParameterGrid(stableswap(), Map.of("A_base", List.of(big(1)))))
                .isInstanceOf(InvalidConfigurationError.class);
    }

    @Test
    @DisplayName("Empty value lists are rejected")
    void testEmptyValues() {
        assertThatThrownBy(() -> new ParameterGrid(stableswap(), Map.of("A", List.of())))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessage("No values given for parameter A");
    }
}
