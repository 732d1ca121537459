// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.cryptoswap;

import com.curvesim.simulator.common.errors.ConvergenceError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.util.FixedPointMath;

import java.math.BigInteger;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.A_MULTIPLIER;
import static com.curvesim.simulator.constants.CurveConstants.MAX_D;
import static com.curvesim.simulator.constants.CurveConstants.MAX_FRAC;
import static com.curvesim.simulator.constants.CurveConstants.MAX_ITERATIONS;
import static com.curvesim.simulator.constants.CurveConstants.MIN_FRAC;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;

/**
 * Two-coin repegging invariant (factory crypto pool).
 */
public final class TwoCoinCalculator implements CryptoswapCalculator {

    static final TwoCoinCalculator INSTANCE = new TwoCoinCalculator();

    private static final BigInteger N_COINS = BigInteger.TWO;
    private static final BigInteger MIN_GAMMA = BigInteger.TEN.pow(10);
    private static final BigInteger MAX_GAMMA = BigInteger.TWO.multiply(BigInteger.TEN.pow(16));
    private static final BigInteger MIN_A = BigInteger.valueOf(4).multiply(A_MULTIPLIER).divide(BigInteger.TEN);
    private static final BigInteger MAX_A = BigInteger.valueOf(4).multiply(A_MULTIPLIER).multiply(BigInteger.valueOf(100_000));
    private static final BigInteger MIN_X0 = BigInteger.TEN.pow(9);
    private static final BigInteger MIN_RATIO = BigInteger.TEN.pow(11);
    private static final BigInteger E14 = BigInteger.TEN.pow(14);
    private static final BigInteger E16 = BigInteger.TEN.pow(16);

    private TwoCoinCalculator() {
    }

    @Override
    public int coinCount() {
        return 2;
    }

    @Override
    public void checkParameters(BigInteger ann, BigInteger gamma) {
        if (ann.compareTo(MIN_A) < 0 || ann.compareTo(MAX_A) > 0) {
            throw new SafetyBoundError("Unsafe value for A: " + ann);
        }
        if (gamma.compareTo(MIN_GAMMA) < 0 || gamma.compareTo(MAX_GAMMA) > 0) {
            throw new SafetyBoundError("Unsafe value for gamma: " + gamma);
        }
    }

    @Override
    public BigInteger newtonD(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger k0Prev) {
        checkParameters(ann, gamma);
        List<BigInteger> x = CryptoswapMath.sortedDescending(xp);
        BigInteger x0 = x.get(0);
        BigInteger x1 = x.get(1);
        if (x0.compareTo(MIN_X0) < 0 || x0.compareTo(MAX_D) > 0) {
            throw new SafetyBoundError("Unsafe value for x[0]: " + x0);
        }
        if (floorDiv(x1.multiply(PRECISION), x0).compareTo(MIN_RATIO) < 0) {
            throw new SafetyBoundError("Unsafe balance ratio: " + xp);
        }

        BigInteger d = N_COINS.multiply(FixedPointMath.geometricMean2(x, false));
        BigInteger s = x0.add(x1);
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            BigInteger dPrev = d;
            BigInteger k0 = floorDiv(floorDiv(PRECISION.multiply(BigInteger.valueOf(4)).multiply(x0), d).multiply(x1), d);
            BigInteger g1k0 = CryptoswapMath.g1k0(gamma, k0);
            BigInteger mul1 = CryptoswapMath.mul1(d, gamma, g1k0, ann);
            BigInteger mul2 = floorDiv(PRECISION.shiftLeft(1).multiply(N_COINS).multiply(k0), g1k0);

            BigInteger negFprime = s.add(floorDiv(s.multiply(mul2), PRECISION))
                    .add(floorDiv(mul1.multiply(N_COINS), k0))
                    .subtract(floorDiv(mul2.multiply(d), PRECISION));
            BigInteger dPlus = floorDiv(d.multiply(negFprime.add(s)), negFprime);
            BigInteger dMinus = floorDiv(d.multiply(d), negFprime);
            BigInteger correction = floorDiv(d.multiply(floorDiv(mul1, negFprime)), PRECISION);
            if (PRECISION.compareTo(k0) > 0) {
                dMinus = dMinus.add(floorDiv(correction.multiply(PRECISION.subtract(k0)), k0));
            } else {
                dMinus = dMinus.subtract(floorDiv(correction.multiply(k0.subtract(PRECISION)), k0));
            }

            d = dPlus.compareTo(dMinus) > 0 ? dPlus.subtract(dMinus) : floorDiv(dMinus.subtract(dPlus), 2);

            BigInteger diff = d.subtract(dPrev).abs();
            if (diff.multiply(E14).compareTo(E16.max(d)) < 0) {
                for (BigInteger value : x) {
                    BigInteger frac = floorDiv(value.multiply(PRECISION), d);
                    if (frac.compareTo(MIN_FRAC) < 0 || frac.compareTo(MAX_FRAC) > 0) {
                        throw new SafetyBoundError("Unsafe value for x[i]: " + value + " (D=" + d + ")");
                    }
                }
                return d;
            }
        }
        throw new ConvergenceError("newton_D did not converge: xp=" + xp + ", A=" + ann + ", gamma=" + gamma);
    }

    @Override
    public YSolution getY(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger d, int i) {
        return new YSolution(newtonY(ann, gamma, xp, d, i), BigInteger.ZERO);
    }

    @Override
    public BigInteger newtonY(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger d, int i) {
        checkParameters(ann, gamma);
        return CryptoswapMath.newtonY(ann, gamma, xp, d, i);
    }

    @Override
    public BigInteger geometricMean(List<BigInteger> values) {
        return FixedPointMath.geometricMean2(values, true);
    }

    @Override
    public BigInteger alpha(long maHalfTime, long elapsed) {
        return FixedPointMath.halfPow(floorDiv(BigInteger.valueOf(elapsed).multiply(PRECISION), maHalfTime));
    }

    @Override
    public BigInteger emaInput(BigInteger lastPrice, BigInteger priceScale) {
        return lastPrice;
    }

    @Override
    public boolean derivesLastPricesFromCurve() {
        return false;
    }

    @Override
    public BigInteger lpPrice(BigInteger virtualPrice, List<BigInteger> priceOracle) {
        return floorDiv(BigInteger.TWO.multiply(virtualPrice).multiply(FixedPointMath.sqrtScaled(priceOracle.get(0))),
                PRECISION);
    }
}
