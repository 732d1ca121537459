// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import com.curvesim.simulator.metrics.ArbitrageMetrics;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.util.Result;

import java.util.Map;

/**
 * Arbitrages every priced pair at once, each capped by its volume limit.
 */
public class VolumeLimitedArbitrageur extends Trader {

    private final ArbitrageSolver solver;

    public VolumeLimitedArbitrageur(SimPool pool, ArbitrageSolver solver, ArbitrageMetrics metrics) {
        super(pool, metrics);
        this.solver = solver;
    }

    @Override
    public Result<ArbitrageOutcome> computeTrades(Map<CoinPair, Double> prices, Map<CoinPair, Double> volumeLimits) {
        return solver.optArbMulti(pool, prices, volumeLimits);
    }
}
