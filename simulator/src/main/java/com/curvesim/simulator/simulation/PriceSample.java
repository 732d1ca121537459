package com.curvesim.simulator.simulation;

import com.curvesim.simulator.arbitrage.CoinPair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Market state at one timestep: pair prices and, for volume-limited runs, pair volume caps.
 *
 * @param timestamp    epoch seconds
 * @param volumeLimits caps in whole coins of the pair's input side; empty when unused
 */
public record PriceSample(long timestamp, Map<CoinPair, Double> prices, Map<CoinPair, Double> volumeLimits) {

    public PriceSample {
        prices = Collections.unmodifiableMap(new LinkedHashMap<>(prices));
        volumeLimits = Collections.unmodifiableMap(new LinkedHashMap<>(volumeLimits));
    }

    public PriceSample(long timestamp, Map<CoinPair, Double> prices) {
        this(timestamp, prices, Map.of());
    }
}
