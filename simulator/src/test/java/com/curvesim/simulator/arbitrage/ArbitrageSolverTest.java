// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import com.curvesim.simulator.config.SolverProperties;
import com.curvesim.simulator.metrics.ArbitrageMetrics;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.pool.sim.SimStableswapPool;
import com.curvesim.simulator.pool.stableswap.StableswapPool;
import com.curvesim.simulator.util.Result;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Arbitrage Solver Tests")
class ArbitrageSolverTest {

    private static final CoinPair DAI_USDC = CoinPair.of("DAI", "USDC");
    private static final CoinPair DAI_USDT = CoinPair.of("DAI", "USDT");
    private static final CoinPair USDC_USDT = CoinPair.of("USDC", "USDT");

    private SimpleMeterRegistry registry;
    private ArbitrageSolver solver;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        solver = new ArbitrageSolver(new SolverProperties(), new ArbitrageMetrics(registry));
    }

    private static SimStableswapPool twoCoinPool() {
        return new SimStableswapPool(List.of("DAI", "USDC"), StableswapPool.builder()
                .coins(2)
                .amplification(250)
                .totalValue(new BigInteger("2000000000000000000000000"))
                .build());
    }

    private static SimStableswapPool threeCoinPool() {
        return new SimStableswapPool(List.of("DAI", "USDC", "USDT"), StableswapPool.builder()
                .coins(3)
                .amplification(100)
                .totalValue(new BigInteger("3000000000000000000000000"))
                .build());
    }

    private static double errorAfter(SimPool pool, ArbTrade trade) {
        pool.trade(trade.coinIn(), trade.coinOut(), trade.amountIn());
        return pool.price(trade.coinIn(), trade.coinOut()) - trade.priceTarget();
    }

    // ========================================
    // SINGLE PAIR
    // ========================================

    @Test
    @DisplayName("Pool price above target: sells the first coin until the price meets the target")
    void testOptArbSellsFirstCoin() {
        // Arrange
        SimStableswapPool pool = twoCoinPool();
        List<BigInteger> before = pool.assetBalances();

        // Act
        ArbTrade trade = solver.optArb(pool, DAI_USDC, 0.98);

        // Assert
        assertThat(trade.coinIn()).isEqualTo("DAI");
        assertThat(trade.coinOut()).isEqualTo("USDC");
        assertThat(trade.priceTarget()).isEqualTo(0.98);
        assertThat(trade.amountIn()).isPositive();
        assertThat(pool.assetBalances()).as("solving never mutates the pool").isEqualTo(before);
        assertThat(errorAfter(pool, trade)).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("Pool price below target: trades the reverse direction against the inverted target")
    void testOptArbReversesDirection() {
        // Arrange
        SimStableswapPool pool = twoCoinPool();

        // Act
        ArbTrade trade = solver.optArb(pool, DAI_USDC, 1.02);

        // Assert
        assertThat(trade.coinIn()).isEqualTo("USDC");
        assertThat(trade.coinOut()).isEqualTo("DAI");
        assertThat(trade.priceTarget()).isCloseTo(1 / 1.02, within(1e-15));
        assertThat(errorAfter(pool, trade)).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("Target inside the fee band: zero-size trade in the pair's own orientation")
    void testOptArbNoTradeInsideFeeBand() {
        // Arrange
        SimStableswapPool pool = twoCoinPool();

        // Act
        ArbTrade trade = solver.optArb(pool, DAI_USDC, 1.0);

        // Assert
        assertEquals(BigInteger.ZERO, trade.amountIn());
        assertEquals("DAI", trade.coinIn());
        assertEquals("USDC", trade.coinOut());
    }

    @Test
    @DisplayName("Single-pair trades are sized independently, one per priced pair")
    void testGetArbTradesOnePerPair() {
        // Arrange
        SimStableswapPool pool = threeCoinPool();
        Map<CoinPair, Double> prices = new LinkedHashMap<>();
        prices.put(DAI_USDC, 0.99);
        prices.put(USDC_USDT, 1.0);

        // Act
        List<ArbTrade> trades = solver.getArbTrades(pool, prices);

        // Assert
        assertThat(trades).hasSize(2);
        assertThat(trades.get(0).amountIn()).isPositive();
        assertThat(trades.get(1).amountIn()).isZero();
    }

    // ========================================
    // MULTI PAIR
    // ========================================

    @Test
    @DisplayName("Only the mispriced pair trades; priced-in pairs report unarbitraged errors")
    void testOptArbMultiTradesOnlyMispricedPair() {
        // Arrange
        SimStableswapPool pool = threeCoinPool();
        Map<CoinPair, Double> prices = new LinkedHashMap<>();
        prices.put(DAI_USDC, 1.0);
        prices.put(DAI_USDT, 1.0);
        prices.put(USDC_USDT, 0.99);
        Map<CoinPair, Double> limits = Map.of(DAI_USDC, 1e6, DAI_USDT, 1e6, USDC_USDT, 1e6);

        // Act
        Result<ArbitrageOutcome> result = solver.optArbMulti(pool, prices, limits);

        // Assert
        assertTrue(result.isOk());
        ArbitrageOutcome outcome = result.value();
        assertThat(outcome.trades()).hasSize(1);
        assertThat(outcome.trades().get(0).pair()).isEqualTo(USDC_USDT);
        assertThat(outcome.priceErrors().get(USDC_USDT)).isCloseTo(0.0, within(1e-6));
        assertThat(outcome.priceErrors().get(DAI_USDC)).isCloseTo(-0.0004, within(1e-6));
        assertThat(outcome.priceErrors().get(DAI_USDT)).isCloseTo(-0.0004, within(1e-6));
        assertThat(registry.get("curvesim.arb.solves.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Volume limit caps the trade and leaves a residual price error")
    void testOptArbMultiRespectsVolumeLimit() {
        // Arrange
        SimStableswapPool pool = threeCoinPool();
        Map<CoinPair, Double> prices = Map.of(USDC_USDT, 0.99);
        Map<CoinPair, Double> limits = Map.of(USDC_USDT, 1000.0);

        // Act
        Result<ArbitrageOutcome> result = solver.optArbMulti(pool, prices, limits);

        // Assert
        assertTrue(result.isOk());
        ArbTrade trade = result.value().trades().get(0);
        assertThat(trade.amountIn()).isPositive()
                .isLessThanOrEqualTo(new BigInteger("1000000000000000000000"));
        assertThat(result.value().priceErrors().get(USDC_USDT)).isPositive();
    }

    @Test
    @DisplayName("Zero volume limit excludes the pair from the solve")
    void testOptArbMultiZeroLimitExcludesPair() {
        // Arrange
        SimStableswapPool pool = threeCoinPool();

        // Act
        Result<ArbitrageOutcome> result = solver.optArbMulti(pool, Map.of(USDC_USDT, 0.99),
                Map.of(USDC_USDT, 0.0));

        // Assert
        assertTrue(result.isOk());
        assertThat(result.value().trades()).isEmpty();
        assertThat(result.value().priceErrors().get(USDC_USDT)).isCloseTo((0.9996 - 0.99) / 0.99, within(1e-6));
    }

    @Test
    @DisplayName("Optimizer failure degrades to unarbitraged errors instead of throwing")
    void testOptArbMultiDegradesOnOptimizerFailure() {
        // Arrange
        SolverProperties properties = new SolverProperties();
        properties.setLeastSquaresMaxEvaluations(1);
        ArbitrageSolver starved = new ArbitrageSolver(properties, new ArbitrageMetrics(registry));
        SimStableswapPool pool = threeCoinPool();
        List<BigInteger> before = pool.assetBalances();
        Map<CoinPair, Double> prices = new LinkedHashMap<>();
        prices.put(DAI_USDC, 0.99);
        prices.put(DAI_USDT, 0.99);
        Map<CoinPair, Double> limits = Map.of(DAI_USDC, 1e6, DAI_USDT, 1e6);

        // Act
        Result<ArbitrageOutcome> result = starved.optArbMulti(pool, prices, limits);

        // Assert
        assertTrue(result.isDegraded());
        assertFalse(result.isOk());
        Result.Degraded<ArbitrageOutcome> degraded = (Result.Degraded<ArbitrageOutcome>) result;
        assertEquals(ArbitrageSolver.SOLVER_DEGRADED, degraded.code());
        assertThat(degraded.value().trades()).isEmpty();
        assertThat(degraded.value().priceErrors()).containsOnlyKeys(DAI_USDC, DAI_USDT);
        assertThat(degraded.value().priceErrors().get(DAI_USDC)).isCloseTo((0.9996 - 0.99) / 0.99, within(1e-6));
        assertThat(pool.assetBalances()).isEqualTo(before);
        assertThat(registry.get("curvesim.arb.degraded.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Stableswap pools use the default max-trade fraction")
    void testMaxTradeFractionByPoolType() {
        // Assert
        assertThat(solver.maxTradeFraction(threeCoinPool())).isEqualTo(0.01);
    }
}
