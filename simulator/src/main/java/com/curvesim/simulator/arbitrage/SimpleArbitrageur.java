// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import com.curvesim.simulator.metrics.ArbitrageMetrics;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.pool.sim.SnapshotScope;
import com.curvesim.simulator.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Makes the single most profitable arbitrage trade per sample, without volume limits.
 */
public class SimpleArbitrageur extends Trader {

    private static final Logger logger = LoggerFactory.getLogger(SimpleArbitrageur.class);

    private final ArbitrageSolver solver;

    public SimpleArbitrageur(SimPool pool, ArbitrageSolver solver, ArbitrageMetrics metrics) {
        super(pool, metrics);
        this.solver = solver;
    }

    public Result<ArbitrageOutcome> computeTrades(Map<CoinPair, Double> prices) {
        return computeTrades(prices, Map.of());
    }

    /**
     * Sizes every pair independently, then keeps the trade with the largest positive profit
     * {@code amountOut - amountIn * target}. No trade when none is profitable.
     */
    @Override
    protected Result<ArbitrageOutcome> computeTrades(Map<CoinPair, Double> prices,
                                                     Map<CoinPair, Double> volumeLimits) {
        List<ArbTrade> candidates = solver.getArbTrades(pool, prices);
        BigDecimal maxProfit = BigDecimal.ZERO;
        ArbTrade best = null;
        double priceError = 0;
        for (ArbTrade candidate : candidates) {
            if (candidate.amountIn().compareTo(pool.getMinTradeSize(candidate.coinIn())) <= 0) {
                continue;
            }
            try (SnapshotScope ignored = pool.snapshot()) {
                AmountWithFee out = pool.trade(candidate.coinIn(), candidate.coinOut(), candidate.amountIn());
                BigDecimal profit = new BigDecimal(out.amount())
                        .subtract(new BigDecimal(candidate.amountIn()).multiply(BigDecimal.valueOf(candidate.priceTarget())));
                if (profit.compareTo(maxProfit) > 0) {
                    maxProfit = profit;
                    best = candidate;
                    double price = pool.price(candidate.coinIn(), candidate.coinOut());
                    priceError = (price - candidate.priceTarget()) / candidate.priceTarget();
                }
            }
        }

        if (best == null) {
            logger.debug("No profitable trade among {} candidates", candidates.size());
            return Result.ok(ArbitrageOutcome.empty());
        }
        logger.debug("Best trade {} -> {} size={} profit={}", best.coinIn(), best.coinOut(), best.amountIn(), maxProfit);
        metrics.recordPriceErrors(List.of(priceError));
        return Result.ok(new ArbitrageOutcome(List.of(best), Map.of(best.pair(), priceError)));
    }
}
