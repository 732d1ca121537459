package com.curvesim.simulator.arbitrage;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Outcome of an executed trade. Output and fee are filled in once, after execution.
 */
public final class TradeResult {

    private final String coinIn;
    private final String coinOut;
    private final BigInteger amountIn;
    private BigInteger amountOut;
    private BigInteger fee;

    public TradeResult(String coinIn, String coinOut, BigInteger amountIn) {
        this.coinIn = Objects.requireNonNull(coinIn, "coinIn");
        this.coinOut = Objects.requireNonNull(coinOut, "coinOut");
        this.amountIn = Objects.requireNonNull(amountIn, "amountIn");
    }

    public static TradeResult from(Trade trade) {
        return new TradeResult(trade.coinIn(), trade.coinOut(), trade.amountIn());
    }

    public String coinIn() {
        return coinIn;
    }

    public String coinOut() {
        return coinOut;
    }

    public BigInteger amountIn() {
        return amountIn;
    }

    public BigInteger amountOut() {
        return amountOut;
    }

    public BigInteger fee() {
        return fee;
    }

    public boolean isExecuted() {
        return amountOut != null;
    }

    /**
     * @throws IllegalStateException if the output was already set
     */
    public void setAmountOut(BigInteger amountOut) {
        if (this.amountOut != null) {
            throw new IllegalStateException("amountOut already set for " + coinIn + " -> " + coinOut);
        }
        this.amountOut = Objects.requireNonNull(amountOut, "amountOut");
    }

    /**
     * @throws IllegalStateException if the fee was already set
     */
    public void setFee(BigInteger fee) {
        if (this.fee != null) {
            throw new IllegalStateException("fee already set for " + coinIn + " -> " + coinOut);
        }
        this.fee = Objects.requireNonNull(fee, "fee");
    }

    @Override
    public String toString() {
        return "TradeResult{" + coinIn + " -> " + coinOut + ", amountIn=" + amountIn
                + ", amountOut=" + amountOut + ", fee=" + fee + "}";
    }
}
