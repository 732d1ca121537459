// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.simulation;

import com.curvesim.simulator.arbitrage.ArbitrageSolver;
import com.curvesim.simulator.arbitrage.SimpleArbitrageur;
import com.curvesim.simulator.arbitrage.TimeSampleResult;
import com.curvesim.simulator.arbitrage.Trader;
import com.curvesim.simulator.arbitrage.VolumeLimitedArbitrageur;
import com.curvesim.simulator.metrics.ArbitrageMetrics;
import com.curvesim.simulator.pool.sim.SimPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs price samples through a trader, one step at a time, on a single thread.
 *
 * Each step: advance the pool clock, let the trader arbitrage against the sample,
 * record the trades, remaining price errors and balances.
 */
@Service
public class SimulationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SimulationRunner.class);

    private final ArbitrageSolver solver;
    private final ArbitrageMetrics metrics;

    public SimulationRunner(ArbitrageSolver solver, ArbitrageMetrics metrics) {
        this.solver = solver;
        this.metrics = metrics;
    }

    public SimulationRun run(SimPool pool, TraderKind kind, List<PriceSample> samples) {
        return run(pool, kind, samples, Map.of());
    }

    /**
     * Simulates {@code samples} in order against {@code pool}, which is mutated.
     *
     * @param parameters the combination {@code pool} was configured with, carried into the result
     */
    public SimulationRun run(SimPool pool, TraderKind kind, List<PriceSample> samples,
                             Map<String, BigInteger> parameters) {
        checkNotNull(pool, "pool");
        checkNotNull(kind, "kind");
        Trader trader = newTrader(pool, kind);
        logger.info("Starting {} run on {} pool {} over {} samples, parameters={}",
                kind, pool.poolType(), pool.assetNames(), samples.size(), parameters);

        List<StepRecord> steps = new ArrayList<>(samples.size());
        for (PriceSample sample : samples) {
            pool.prepareForTrades(sample.timestamp());
            TimeSampleResult result = trader.processTimeSample(sample.prices(), sample.volumeLimits());
            StepRecord step = new StepRecord(sample.timestamp(), result.trades(), result.priceErrors(),
                    pool.assetBalances(), result.degraded());
            logger.debug("Step t={} trades={} errors={} degraded={}",
                    step.timestamp(), step.trades().size(), step.priceErrors(), step.degraded());
            steps.add(step);
        }

        SimulationRun run = new SimulationRun(parameters, steps);
        logger.info("Finished run: {} steps, {} trades, {} degraded steps",
                run.steps().size(), run.tradeCount(), run.degradedSteps());
        return run;
    }

    /**
     * One run per grid combination, each on its own pool, in grid order.
     */
    public List<SimulationRun> runGrid(ParameterGrid grid, TraderKind kind, List<PriceSample> samples) {
        logger.info("Running parameter grid of {} combinations", grid.size());
        List<SimulationRun> runs = new ArrayList<>(grid.size());
        for (Map<String, BigInteger> parameters : grid.combinations()) {
            runs.add(run(grid.poolFor(parameters), kind, samples, parameters));
        }
        return runs;
    }

    private Trader newTrader(SimPool pool, TraderKind kind) {
        return switch (kind) {
            case SIMPLE -> new SimpleArbitrageur(pool, solver, metrics);
            case VOLUME_LIMITED -> new VolumeLimitedArbitrageur(pool, solver, metrics);
        };
    }
}
