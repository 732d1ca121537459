// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.cryptoswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;

import java.math.BigInteger;
import java.util.List;

/**
 * Coin-count specific half of the cryptoswap engine.
 *
 * <p>The 2-coin variant follows the factory crypto pool (Newton solves, half-pow EMA);
 * the 3-coin variant follows tricrypto-ng (cubic {@code get_y}, K0-seeded {@code newton_D},
 * exponential EMA and closed-form last prices). Chosen once, when the pool is built.
 */
public sealed interface CryptoswapCalculator permits TwoCoinCalculator, ThreeCoinCalculator {

    static CryptoswapCalculator forCoins(int n) {
        if (n == 2) {
            return TwoCoinCalculator.INSTANCE;
        }
        if (n == 3) {
            return ThreeCoinCalculator.INSTANCE;
        }
        throw new InvalidConfigurationError("Only 2 or 3-coin crypto pools are supported, got " + n);
    }

    int coinCount();

    /**
     * @throws com.curvesim.simulator.common.errors.SafetyBoundError if A or gamma is outside the validated range
     */
    void checkParameters(BigInteger ann, BigInteger gamma);

    /**
     * Invariant D for scaled balances.
     *
     * @param k0Prev K0 left by the preceding {@link #getY} call, or zero
     */
    BigInteger newtonD(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger k0Prev);

    /**
     * Balance of coin i consistent with D, plus the K0 the solve ended on (zero when unknown).
     */
    YSolution getY(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger d, int i);

    /**
     * Plain Newton solve for the balance of coin i.
     */
    BigInteger newtonY(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger d, int i);

    BigInteger geometricMean(List<BigInteger> values);

    /**
     * EMA weight kept by the old oracle value after {@code elapsed} seconds.
     */
    BigInteger alpha(long maHalfTime, long elapsed);

    /**
     * Last price fed into the EMA for one coin.
     */
    BigInteger emaInput(BigInteger lastPrice, BigInteger priceScale);

    /**
     * Whether last prices are re-derived from the curve after every state change
     * rather than from the executed trade.
     */
    boolean derivesLastPricesFromCurve();

    BigInteger lpPrice(BigInteger virtualPrice, List<BigInteger> priceOracle);

    /**
     * Result of a balance solve.
     */
    record YSolution(BigInteger y, BigInteger k0) {
    }
}
