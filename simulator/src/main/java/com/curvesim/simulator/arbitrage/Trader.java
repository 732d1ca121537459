// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import com.curvesim.simulator.metrics.ArbitrageMetrics;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Trades against one pool, one price sample at a time.
 *
 * Subclasses decide which trades to make; execution and bookkeeping live here.
 */
public abstract class Trader {

    private static final Logger logger = LoggerFactory.getLogger(Trader.class);

    protected final SimPool pool;
    protected final ArbitrageMetrics metrics;

    protected Trader(SimPool pool, ArbitrageMetrics metrics) {
        this.pool = checkNotNull(pool, "pool");
        this.metrics = checkNotNull(metrics, "metrics");
    }

    /**
     * Chooses trades for one sample without changing the pool.
     *
     * @param volumeLimits per-pair caps; ignored by traders that do not use them
     */
    protected abstract Result<ArbitrageOutcome> computeTrades(Map<CoinPair, Double> prices,
                                                              Map<CoinPair, Double> volumeLimits);

    /**
     * Executes trades in order against the pool.
     */
    public List<TradeResult> doTrades(List<Trade> trades) {
        List<TradeResult> results = new ArrayList<>(trades.size());
        for (Trade trade : trades) {
            TradeResult result = TradeResult.from(trade);
            AmountWithFee out = pool.trade(trade.coinIn(), trade.coinOut(), trade.amountIn());
            result.setAmountOut(out.amount());
            result.setFee(out.fee());
            logger.debug("Executed {}", result);
            results.add(result);
        }
        metrics.recordTrades(results.size());
        return results;
    }

    /**
     * Computes trades for the sample, executes them and reports what was done.
     */
    public TimeSampleResult processTimeSample(Map<CoinPair, Double> prices, Map<CoinPair, Double> volumeLimits) {
        Result<ArbitrageOutcome> decision = computeTrades(prices, volumeLimits);
        List<Trade> trades = decision.value().trades().stream().map(ArbTrade::toTrade).toList();
        List<TradeResult> executed = doTrades(trades);
        return new TimeSampleResult(executed, decision.value().priceErrors(), decision.isDegraded());
    }

    public SimPool pool() {
        return pool;
    }
}
