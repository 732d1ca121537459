// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Arbitrage Metrics Tests")
class ArbitrageMetricsTest {

    private SimpleMeterRegistry registry;
    private ArbitrageMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ArbitrageMetrics(registry);
    }

    @Test
    @DisplayName("Solves are counted, degraded ones separately, and timed")
    void testRecordSolve() {
        // Act
        metrics.recordSolve(TimeUnit.MILLISECONDS.toNanos(5), false);
        metrics.recordSolve(TimeUnit.MILLISECONDS.toNanos(7), true);

        // Assert
        assertThat(registry.get("curvesim.arb.solves.total").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("curvesim.arb.degraded.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("curvesim.arb.solve.time").timer().count()).isEqualTo(2);
        assertThat(registry.get("curvesim.arb.solve.time").timer().totalTime(TimeUnit.MILLISECONDS))
                .isCloseTo(12.0, within(1e-9));
    }

    @Test
    @DisplayName("Price errors are recorded as absolute values; NaN and null are skipped")
    void testRecordPriceErrors() {
        // Act
        metrics.recordPriceErrors(Arrays.asList(-0.01, 0.03, Double.NaN, null));

        // Assert
        DistributionSummary summary = registry.get("curvesim.arb.price.error").summary();
        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isCloseTo(0.04, within(1e-12));
        assertThat(summary.max()).isCloseTo(0.03, within(1e-12));
    }

    @Test
    @DisplayName("Executed trades accumulate")
    void testRecordTrades() {
        // Act
        metrics.recordTrades(3);
        metrics.recordTrades(0);
        metrics.recordPriceErrors(List.of());

        // Assert
        assertThat(registry.get("curvesim.arb.trades.total").counter().count()).isEqualTo(3.0);
    }
}
