package com.curvesim.simulator.arbitrage;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A swap to be executed: {@code amountIn} of {@code coinIn} for {@code coinOut}.
 */
public record Trade(String coinIn, String coinOut, BigInteger amountIn) {

    public Trade {
        Objects.requireNonNull(coinIn, "coinIn");
        Objects.requireNonNull(coinOut, "coinOut");
        Objects.requireNonNull(amountIn, "amountIn");
    }

    public CoinPair pair() {
        return new CoinPair(coinIn, coinOut);
    }
}
