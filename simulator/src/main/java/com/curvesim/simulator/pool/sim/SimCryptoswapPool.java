// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.sim;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.SnapshotError;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.cryptoswap.CryptoswapPool;
import com.curvesim.simulator.util.FixedPointMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Cryptoswap pool (2 or 3 coins) on the simulation surface. All coins must use 18 decimals.
 */
public final class SimCryptoswapPool implements SimPool {

    private static final Logger logger = LoggerFactory.getLogger(SimCryptoswapPool.class);

    private final CryptoswapPool pool;
    private final AssetIndices indices;

    public SimCryptoswapPool(List<String> coinNames, CryptoswapPool pool) {
        this.pool = checkNotNull(pool, "pool");
        for (BigInteger precision : pool.precisions()) {
            if (!BigInteger.ONE.equals(precision)) {
                throw new InvalidConfigurationError("SimPool must have 18 decimals (precision 1) for each coin.");
            }
        }
        if (coinNames.size() != pool.coinCount()) {
            throw new InvalidConfigurationError("expected " + pool.coinCount() + " coin names, got " + coinNames);
        }
        this.indices = new AssetIndices(coinNames);
    }

    public CryptoswapPool pool() {
        return pool;
    }

    @Override
    public List<String> assetNames() {
        return indices.names();
    }

    @Override
    public List<BigInteger> assetBalances() {
        return pool.balances();
    }

    @Override
    public double price(String coinIn, String coinOut, boolean useFee) {
        int[] ij = indices.indicesOf(coinIn, coinOut);
        return pool.price(ij[0], ij[1], useFee);
    }

    @Override
    public AmountWithFee trade(String coinIn, String coinOut, BigInteger amountIn) {
        checkArgument(amountIn.signum() >= 0, "amountIn must not be negative, got %s", amountIn);
        int[] ij = indices.indicesOf(coinIn, coinOut);
        return pool.exchange(ij[0], ij[1], amountIn);
    }

    /**
     * Solves the invariant for the input balance that leaves the output coin at the given
     * fraction, then converts the difference back to native units of the input coin.
     */
    @Override
    public BigInteger getMaxTradeSize(String coinIn, String coinOut, double outBalanceFraction) {
        int[] ij = indices.indicesOf(coinIn, coinOut);
        int i = ij[0];
        int j = ij[1];
        List<BigInteger> xp = pool.xp();
        List<BigInteger> shifted = new ArrayList<>(xp);
        shifted.set(j, FixedPointMath.scale(xp.get(j), outBalanceFraction));
        BigInteger y = pool.calculator()
                .getY(pool.amplification(), pool.gamma(), shifted, pool.invariant(), i)
                .y();
        BigInteger inXp = y.subtract(xp.get(i));
        if (i == 0) {
            return inXp;
        }
        return floorDiv(inXp.multiply(PRECISION), pool.priceScale().get(i - 1));
    }

    @Override
    public void prepareForTrades(long timestamp) {
        logger.debug("Setting block timestamp to {}", timestamp);
        pool.setBlockTimestamp(timestamp);
    }

    @Override
    public PoolSnapshot captureSnapshot() {
        return new PoolSnapshot(this, pool.snapshot());
    }

    @Override
    public void restoreSnapshot(PoolSnapshot snapshot) {
        if (snapshot.owner() != this) {
            throw new SnapshotError("Snapshot was taken from a different pool");
        }
        if (!(snapshot.state() instanceof CryptoswapPool.Snapshot state)) {
            throw new SnapshotError("Unexpected snapshot state: " + snapshot.state().getClass().getSimpleName());
        }
        pool.restore(state);
    }

    @Override
    public SimCryptoswapPool copy() {
        return new SimCryptoswapPool(indices.names(), pool.copy());
    }

    @Override
    public String poolType() {
        return "cryptoswap";
    }
}
