// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for arbitrage solves.
 *
 * Provides Micrometer metrics for:
 * - Solve counters (total, degraded)
 * - Executed trade counter
 * - Absolute relative price error distribution
 * - Solve time tracking
 *
 * Nothing here feeds back into the solver.
 */
@Component
public class ArbitrageMetrics {

    private final Counter solves;
    private final Counter degradedSolves;
    private final Counter trades;
    private final DistributionSummary priceErrors;
    private final Timer solveTime;

    public ArbitrageMetrics(MeterRegistry meterRegistry) {
        this.solves = Counter.builder("curvesim.arb.solves.total")
            .description("Total number of arbitrage solves")
            .register(meterRegistry);

        this.degradedSolves = Counter.builder("curvesim.arb.degraded.total")
            .description("Multi-pair solves that fell back to unarbitraged price errors")
            .register(meterRegistry);

        this.trades = Counter.builder("curvesim.arb.trades.total")
            .description("Total number of trades executed by traders")
            .register(meterRegistry);

        this.priceErrors = DistributionSummary.builder("curvesim.arb.price.error")
            .description("Absolute relative price error left after arbitrage")
            .register(meterRegistry);

        this.solveTime = Timer.builder("curvesim.arb.solve.time")
            .description("Time taken by an arbitrage solve")
            .register(meterRegistry);
    }

    /**
     * Metrics bound to a private registry, for use outside a Spring context.
     */
    public static ArbitrageMetrics standalone() {
        return new ArbitrageMetrics(new SimpleMeterRegistry());
    }

    public void recordSolve(long elapsedNanos, boolean degraded) {
        solves.increment();
        if (degraded) {
            degradedSolves.increment();
        }
        solveTime.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordPriceErrors(Collection<Double> errors) {
        for (Double error : errors) {
            if (error != null && !error.isNaN()) {
                priceErrors.record(Math.abs(error));
            }
        }
    }

    public void recordTrades(int count) {
        trades.increment(count);
    }
}
