package com.curvesim.simulator.arbitrage;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A candidate arbitrage trade together with the price it aims the pool at.
 */
public record ArbTrade(String coinIn, String coinOut, BigInteger amountIn, double priceTarget) {

    public ArbTrade {
        Objects.requireNonNull(coinIn, "coinIn");
        Objects.requireNonNull(coinOut, "coinOut");
        Objects.requireNonNull(amountIn, "amountIn");
    }

    public ArbTrade replaceAmountIn(BigInteger amount) {
        return new ArbTrade(coinIn, coinOut, amount, priceTarget);
    }

    public CoinPair pair() {
        return new CoinPair(coinIn, coinOut);
    }

    public Trade toTrade() {
        return new Trade(coinIn, coinOut, amountIn);
    }
}
