package com.curvesim.simulator.simulation;

import com.curvesim.simulator.arbitrage.CoinPair;
import com.curvesim.simulator.arbitrage.TradeResult;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State recorded after one simulation step.
 *
 * @param balances normalized pool balances after the step's trades
 */
public record StepRecord(long timestamp, List<TradeResult> trades, Map<CoinPair, Double> priceErrors,
                         List<BigInteger> balances, boolean degraded) {

    public StepRecord {
        trades = List.copyOf(trades);
        priceErrors = Collections.unmodifiableMap(new LinkedHashMap<>(priceErrors));
        balances = List.copyOf(balances);
    }
}
