package com.curvesim.simulator.arbitrage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a trader did with one price sample.
 *
 * @param degraded true when the solve fell back to unarbitraged price errors
 */
public record TimeSampleResult(List<TradeResult> trades, Map<CoinPair, Double> priceErrors, boolean degraded) {

    public TimeSampleResult {
        trades = List.copyOf(trades);
        priceErrors = Collections.unmodifiableMap(new LinkedHashMap<>(priceErrors));
    }
}
