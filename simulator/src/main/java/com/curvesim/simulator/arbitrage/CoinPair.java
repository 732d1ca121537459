package com.curvesim.simulator.arbitrage;

import java.util.Objects;

/**
 * Ordered pair of coin names. A price keyed by a pair is the price of {@code first} in {@code second}.
 */
public record CoinPair(String first, String second) {

    public CoinPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    public static CoinPair of(String first, String second) {
        return new CoinPair(first, second);
    }

    public CoinPair inverse() {
        return new CoinPair(second, first);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
