// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.sim;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.SnapshotError;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.stableswap.MetaPool;
import com.curvesim.simulator.pool.stableswap.StableswapPool;
import com.curvesim.simulator.util.FixedPointMath;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Meta-pool on the simulation surface.
 *
 * <p>Tradable coins are the primary coins followed by the base pool's coins; trades between
 * them route through the base pool as needed. The base LP token is not tradable here but can
 * be priced against primary coins, either by its own name or as {@value #LP_TOKEN_ALIAS}.
 */
public final class SimMetaPool implements SimPool {

    public static final String LP_TOKEN_ALIAS = "bp_token";

    private static final int LP_TOKEN_INDEX = -1;

    private final MetaPool pool;
    private final List<String> primaryNames;
    private final List<String> baseNames;
    private final AssetIndices indices;

    /**
     * @param primaryNames the meta-pool's own coins, the base LP token last
     * @param baseNames    the base pool's coins
     */
    public SimMetaPool(List<String> primaryNames, List<String> baseNames, MetaPool pool) {
        this.pool = checkNotNull(pool, "pool");
        if (primaryNames.size() != pool.coinCount()) {
            throw new InvalidConfigurationError("expected " + pool.coinCount() + " primary coin names, got "
                    + primaryNames);
        }
        if (baseNames.size() != pool.basePool().coinCount()) {
            throw new InvalidConfigurationError("expected " + pool.basePool().coinCount()
                    + " base coin names, got " + baseNames);
        }
        this.primaryNames = List.copyOf(primaryNames);
        this.baseNames = List.copyOf(baseNames);

        List<String> flattened = new ArrayList<>(primaryNames.subList(0, pool.maxCoin()));
        flattened.addAll(baseNames);
        String lpTokenName = primaryNames.get(pool.maxCoin());
        this.indices = new AssetIndices(flattened, Map.of(lpTokenName, LP_TOKEN_INDEX, LP_TOKEN_ALIAS, LP_TOKEN_INDEX));
    }

    public MetaPool pool() {
        return pool;
    }

    public List<String> primaryNames() {
        return primaryNames;
    }

    public List<String> baseNames() {
        return baseNames;
    }

    @Override
    public List<String> assetNames() {
        return indices.names();
    }

    @Override
    public List<BigInteger> assetBalances() {
        List<BigInteger> balances = new ArrayList<>(pool.xp().subList(0, pool.maxCoin()));
        balances.addAll(pool.basePool().xp());
        return balances;
    }

    @Override
    public double price(String coinIn, String coinOut, boolean useFee) {
        int[] ij = indices.indicesOf(coinIn, coinOut);
        int i = ij[0];
        int j = ij[1];
        if (i != LP_TOKEN_INDEX && j != LP_TOKEN_INDEX) {
            return pool.dydx(i, j, useFee);
        }
        int maxCoin = pool.maxCoin();
        int other = i == LP_TOKEN_INDEX ? j : i;
        checkArgument(other < maxCoin, "the base LP token can only be priced against primary coins, got %s",
                i == LP_TOKEN_INDEX ? coinOut : coinIn);
        return pool.primaryPrice(i == LP_TOKEN_INDEX ? maxCoin : i, j == LP_TOKEN_INDEX ? maxCoin : j, useFee);
    }

    @Override
    public AmountWithFee trade(String coinIn, String coinOut, BigInteger amountIn) {
        checkArgument(amountIn.signum() >= 0, "amountIn must not be negative, got %s", amountIn);
        int[] ij = indices.indicesOf(coinIn, coinOut);
        checkArgument(ij[0] != LP_TOKEN_INDEX && ij[1] != LP_TOKEN_INDEX,
                "the base LP token is not tradable on a meta-pool: %s -> %s", coinIn, coinOut);
        BigInteger dx = floorDiv(amountIn.multiply(PRECISION), rate(ij[0]));
        AmountWithFee result = pool.exchangeUnderlying(ij[0], ij[1], dx);
        BigInteger rateOut = rate(ij[1]);
        return new AmountWithFee(floorDiv(result.amount().multiply(rateOut), PRECISION),
                floorDiv(result.fee().multiply(rateOut), PRECISION));
    }

    /**
     * Bound taken in the pool that holds the output coin: the meta-pool when either side is a
     * primary coin, the base pool when both are base coins.
     */
    @Override
    public BigInteger getMaxTradeSize(String coinIn, String coinOut, double outBalanceFraction) {
        int[] ij = indices.indicesOf(coinIn, coinOut);
        checkArgument(ij[0] != LP_TOKEN_INDEX && ij[1] != LP_TOKEN_INDEX,
                "the base LP token is not tradable on a meta-pool: %s -> %s", coinIn, coinOut);
        int maxCoin = pool.maxCoin();
        int baseI = ij[0] - maxCoin;
        int baseJ = ij[1] - maxCoin;
        if (baseI < 0 || baseJ < 0) {
            int metaI = baseI < 0 ? ij[0] : maxCoin;
            int metaJ = baseJ < 0 ? ij[1] : maxCoin;
            List<BigInteger> xp = pool.xp();
            BigInteger xpOut = FixedPointMath.scale(xp.get(metaJ), outBalanceFraction);
            return pool.getY(metaJ, metaI, xpOut, xp).subtract(xp.get(metaI));
        }
        StableswapPool basePool = pool.basePool();
        List<BigInteger> xp = basePool.xp();
        BigInteger xpOut = FixedPointMath.scale(xp.get(baseJ), outBalanceFraction);
        return basePool.getY(baseJ, baseI, xpOut, xp).subtract(xp.get(baseI));
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
        if (!(snapshot.state() instanceof MetaPool.Snapshot state)) {
            throw new SnapshotError("Unexpected snapshot state: " + snapshot.state().getClass().getSimpleName());
        }
        pool.restore(state);
    }

    @Override
    public SimMetaPool copy() {
        return new SimMetaPool(primaryNames, baseNames, pool.copy());
    }

    @Override
    public String poolType() {
        return "metapool";
    }

    private BigInteger rate(int index) {
        int maxCoin = pool.maxCoin();
        if (index < maxCoin) {
            return pool.precisions().get(index);
        }
        return pool.basePool().rates().get(index - maxCoin);
    }
}
