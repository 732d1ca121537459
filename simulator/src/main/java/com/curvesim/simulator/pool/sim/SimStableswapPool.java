// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.sim;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.SnapshotError;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.stableswap.StableswapPool;
import com.curvesim.simulator.util.FixedPointMath;

import java.math.BigInteger;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Plain stableswap pool on the simulation surface.
 */
public final class SimStableswapPool implements SimPool {

    private final StableswapPool pool;
    private final AssetIndices indices;

    public SimStableswapPool(List<String> coinNames, StableswapPool pool) {
        this.pool = checkNotNull(pool, "pool");
        if (coinNames.size() != pool.coinCount()) {
            throw new InvalidConfigurationError("expected " + pool.coinCount() + " coin names, got " + coinNames);
        }
        this.indices = new AssetIndices(coinNames);
    }

    public StableswapPool pool() {
        return pool;
    }

    @Override
    public List<String> assetNames() {
        return indices.names();
    }

    @Override
    public List<BigInteger> assetBalances() {
        return pool.xp();
    }

    @Override
    public double price(String coinIn, String coinOut, boolean useFee) {
        int[] ij = indices.indicesOf(coinIn, coinOut);
        return pool.dydx(ij[0], ij[1], useFee);
    }

    @Override
    public AmountWithFee trade(String coinIn, String coinOut, BigInteger amountIn) {
        checkArgument(amountIn.signum() >= 0, "amountIn must not be negative, got %s", amountIn);
        int[] ij = indices.indicesOf(coinIn, coinOut);
        List<BigInteger> rates = pool.rates();
        BigInteger dx = floorDiv(amountIn.multiply(PRECISION), rates.get(ij[0]));
        AmountWithFee result = pool.exchange(ij[0], ij[1], dx);
        BigInteger rateOut = rates.get(ij[1]);
        return new AmountWithFee(floorDiv(result.amount().multiply(rateOut), PRECISION),
                floorDiv(result.fee().multiply(rateOut), PRECISION));
    }

    @Override
    public BigInteger getMaxTradeSize(String coinIn, String coinOut, double outBalanceFraction) {
        int[] ij = indices.indicesOf(coinIn, coinOut);
        List<BigInteger> xp = pool.xp();
        BigInteger xpOut = FixedPointMath.scale(xp.get(ij[1]), outBalanceFraction);
        return pool.getY(ij[1], ij[0], xpOut, xp).subtract(xp.get(ij[0]));
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
        if (!(snapshot.state() instanceof StableswapPool.Snapshot state)) {
            throw new SnapshotError("Unexpected snapshot state: " + snapshot.state().getClass().getSimpleName());
        }
        pool.restore(state);
    }

    @Override
    public SimStableswapPool copy() {
        return new SimStableswapPool(indices.names(), pool.copy());
    }

    @Override
    public String poolType() {
        return "stableswap";
    }
}
