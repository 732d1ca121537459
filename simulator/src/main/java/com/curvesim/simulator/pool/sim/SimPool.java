// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.sim;

import com.curvesim.simulator.pool.AmountWithFee;

import java.math.BigInteger;
import java.util.List;

/**
 * Trading surface the arbitrage solver and the simulation runner work against.
 *
 * <p>Coins are addressed by name. Amounts on this surface are 18-decimal normalized
 * amounts; adapters convert to and from the pool's native units with its rates.
 * Instances are single-owner and not thread-safe.
 */
public sealed interface SimPool permits SimStableswapPool, SimMetaPool, SimCryptoswapPool {

    /**
     * Tradable coins in index order.
     */
    List<String> assetNames();

    /**
     * Balances of the tradable coins, normalized, in {@link #assetNames()} order.
     */
    List<BigInteger> assetBalances();

    /**
     * Marginal price of {@code coinIn} in units of {@code coinOut}.
     *
     * @param useFee net of the fee a trade at the current state would pay
     */
    double price(String coinIn, String coinOut, boolean useFee);

    default double price(String coinIn, String coinOut) {
        return price(coinIn, coinOut, true);
    }

    /**
     * Executes a swap. Both the output and the fee are in {@code coinOut} units.
     */
    AmountWithFee trade(String coinIn, String coinOut, BigInteger amountIn);

    /**
     * Input size that would leave {@code coinOut} at {@code outBalanceFraction} of its balance.
     */
    BigInteger getMaxTradeSize(String coinIn, String coinOut, double outBalanceFraction);

    /**
     * Smallest input worth trading; trades at or below it are skipped.
     */
    default BigInteger getMinTradeSize(String coinIn) {
        return BigInteger.ZERO;
    }

    /**
     * Called once per price sample before any trade of that sample.
     *
     * @param timestamp epoch seconds of the sample
     */
    default void prepareForTrades(long timestamp) {
    }

    PoolSnapshot captureSnapshot();

    /**
     * @throws com.curvesim.simulator.common.errors.SnapshotError if the snapshot belongs to another pool
     */
    void restoreSnapshot(PoolSnapshot snapshot);

    /**
     * Opens a trial block that reverts this pool on close.
     */
    default SnapshotScope snapshot() {
        return new SnapshotScope(this, captureSnapshot());
    }

    /**
     * Deep copy with independent state.
     */
    SimPool copy();

    String poolType();
}
