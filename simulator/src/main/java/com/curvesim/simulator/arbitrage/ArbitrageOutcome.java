package com.curvesim.simulator.arbitrage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trades chosen by a solve and the relative price error left on each pair, keyed by
 * the direction the pair was arbitraged in.
 */
public record ArbitrageOutcome(List<ArbTrade> trades, Map<CoinPair, Double> priceErrors) {

    public ArbitrageOutcome {
        trades = List.copyOf(trades);
        priceErrors = Collections.unmodifiableMap(new LinkedHashMap<>(priceErrors));
    }

    public static ArbitrageOutcome empty() {
        return new ArbitrageOutcome(List.of(), Map.of());
    }
}
