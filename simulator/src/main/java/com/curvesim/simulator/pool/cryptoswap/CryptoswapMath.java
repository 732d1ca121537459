// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.cryptoswap;

import com.curvesim.simulator.common.errors.ConvergenceError;
import com.curvesim.simulator.common.errors.SafetyBoundError;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.A_MULTIPLIER;
import static com.curvesim.simulator.constants.CurveConstants.MAX_D;
import static com.curvesim.simulator.constants.CurveConstants.MAX_FRAC;
import static com.curvesim.simulator.constants.CurveConstants.MAX_ITERATIONS;
import static com.curvesim.simulator.constants.CurveConstants.MIN_D;
import static com.curvesim.simulator.constants.CurveConstants.MIN_FRAC;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;

/**
 * Pieces of the repegging invariant math that do not depend on the coin count.
 */
final class CryptoswapMath {

    private static final BigInteger E14 = BigInteger.TEN.pow(14);
    private static final BigInteger E36 = BigInteger.TEN.pow(36);
    private static final BigInteger TWO_PRECISION = PRECISION.shiftLeft(1);
    private static final BigInteger THREE_PRECISION = PRECISION.multiply(BigInteger.valueOf(3));
    private static final BigInteger MIN_CONVERGENCE_LIMIT = BigInteger.valueOf(100);

    private CryptoswapMath() {
        // Utility class
    }

    static void checkD(BigInteger d) {
        if (d.compareTo(MIN_D) < 0 || d.compareTo(MAX_D) > 0) {
            throw new SafetyBoundError("Unsafe value for D: " + d);
        }
    }

    static void checkFraction(BigInteger value, BigInteger d, String name) {
        BigInteger frac = floorDiv(value.multiply(PRECISION), d);
        if (frac.compareTo(MIN_FRAC) < 0 || frac.compareTo(MAX_FRAC) > 0) {
            throw new SafetyBoundError("Unsafe value for " + name + ": " + value + " (D=" + d + ")");
        }
    }

    static List<BigInteger> sortedDescending(List<BigInteger> values) {
        List<BigInteger> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.reverseOrder());
        return sorted;
    }

    // |gamma + 1 - K0| + 1
    static BigInteger g1k0(BigInteger gamma, BigInteger k0) {
        return gamma.add(PRECISION).subtract(k0).abs().add(BigInteger.ONE);
    }

    static BigInteger mul1(BigInteger d, BigInteger gamma, BigInteger g1k0, BigInteger ann) {
        return floorDiv(floorDiv(floorDiv(PRECISION.multiply(d), gamma).multiply(g1k0), gamma)
                .multiply(g1k0).multiply(A_MULTIPLIER), ann);
    }

    /**
     * Newton solve for the balance of coin i given D and the other balances.
     *
     * <p>Overshoots are damped by halving the previous estimate. Parameter ranges are the
     * caller's responsibility; D and the other balances are checked here.
     */
    static BigInteger newtonY(BigInteger ann, BigInteger gamma, List<BigInteger> x, BigInteger d, int i) {
        int n = x.size();
        BigInteger nCoins = BigInteger.valueOf(n);
        checkD(d);
        for (int k = 0; k < n; k++) {
            if (k != i) {
                checkFraction(x.get(k), d, "x[" + k + "]");
            }
        }

        BigInteger y = d.divide(nCoins);
        BigInteger k0i = PRECISION;
        BigInteger si = BigInteger.ZERO;
        List<BigInteger> sorted = new ArrayList<>(x);
        sorted.set(i, BigInteger.ZERO);
        sorted = sortedDescending(sorted);
        BigInteger convergenceLimit = sorted.get(0).divide(E14).max(d.divide(E14)).max(MIN_CONVERGENCE_LIMIT);

        if (n == 2) {
            si = x.get(1 - i);
            y = floorDiv(d.multiply(d), si.multiply(BigInteger.valueOf(4)));
            k0i = floorDiv(PRECISION.multiply(nCoins).multiply(si), d);
        } else {
            for (int j = 2; j <= n; j++) {
                BigInteger xj = sorted.get(n - j);
                y = floorDiv(y.multiply(d), xj.multiply(nCoins));
                si = si.add(xj);
            }
            for (int j = 0; j < n - 1; j++) {
                k0i = floorDiv(k0i.multiply(sorted.get(j)).multiply(nCoins), d);
            }
        }

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            BigInteger yPrev = y;
            BigInteger k0 = floorDiv(k0i.multiply(y).multiply(nCoins), d);
            BigInteger s = si.add(y);
            BigInteger g1k0 = g1k0(gamma, k0);
            BigInteger mul1 = mul1(d, gamma, g1k0, ann);
            BigInteger mul2 = PRECISION.add(floorDiv(TWO_PRECISION.multiply(k0), g1k0));

            BigInteger yfprime = PRECISION.multiply(y).add(s.multiply(mul2)).add(mul1);
            BigInteger dyfprime = d.multiply(mul2);
            if (yfprime.compareTo(dyfprime) < 0) {
                y = floorDiv(yPrev, 2);
                continue;
            }
            yfprime = yfprime.subtract(dyfprime);
            BigInteger fprime = floorDiv(yfprime, y);

            BigInteger yMinus = floorDiv(mul1, fprime);
            BigInteger yPlus = floorDiv(yfprime.add(PRECISION.multiply(d)), fprime)
                    .add(floorDiv(yMinus.multiply(PRECISION), k0));
            yMinus = yMinus.add(floorDiv(PRECISION.multiply(s), fprime));

            y = yPlus.compareTo(yMinus) < 0 ? floorDiv(yPrev, 2) : yPlus.subtract(yMinus);

            BigInteger diff = y.subtract(yPrev).abs();
            if (diff.compareTo(convergenceLimit.max(y.divide(E14))) < 0) {
                checkFraction(y, d, "y");
                return y;
            }
        }
        throw new ConvergenceError("newton_y did not converge: x=" + x + ", D=" + d + ", i=" + i
                + ", A=" + ann + ", gamma=" + gamma);
    }

    /**
     * Closed-form marginal prices of coins 1..n-1 in coin 0, in price-scaled units.
     */
    static List<BigInteger> curvePrices(List<BigInteger> xp, BigInteger d, BigInteger ann, BigInteger gamma) {
        checkD(d);
        int n = xp.size();
        BigInteger nn = BigInteger.valueOf(n).pow(n);
        BigInteger x0 = xp.get(0);

        BigInteger k0 = nn.multiply(x0).multiply(xp.get(1));
        for (int k = 2; k < n; k++) {
            k0 = floorDiv(k0, d).multiply(xp.get(k));
        }
        k0 = floorDiv(floorDiv(k0, d).multiply(E36), d);

        BigInteger k0Squared = floorDiv(k0.multiply(k0), E36);
        BigInteger gk0 = floorDiv(floorDiv(k0.multiply(k0).shiftLeft(1), E36).multiply(k0), E36)
                .add(gamma.add(PRECISION).pow(2))
                .subtract(floorDiv(k0Squared.multiply(gamma.shiftLeft(1).add(THREE_PRECISION)), PRECISION));
        BigInteger nnag2 = floorDiv(ann.multiply(gamma.multiply(gamma)), A_MULTIPLIER);
        BigInteger denominator = gk0.add(floorDiv(floorDiv(nnag2.multiply(x0), d).multiply(k0), E36));

        List<BigInteger> prices = new ArrayList<>(n - 1);
        for (int k = 1; k < n; k++) {
            BigInteger xk = xp.get(k);
            BigInteger numerator = gk0.add(floorDiv(floorDiv(nnag2.multiply(xk), d).multiply(k0), E36));
            prices.add(floorDiv(floorDiv(x0.multiply(numerator), xk).multiply(PRECISION), denominator));
        }
        return prices;
    }
}
