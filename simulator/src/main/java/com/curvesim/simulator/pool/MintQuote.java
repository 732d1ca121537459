package com.curvesim.simulator.pool;

import java.math.BigInteger;
import java.util.List;

/**
 * LP tokens minted for a deposit and the per-coin imbalance fees charged on it.
 */
public record MintQuote(BigInteger amount, List<BigInteger> fees) {

    public MintQuote {
        fees = List.copyOf(fees);
    }
}
