// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.stableswap;

import com.curvesim.simulator.common.errors.ConvergenceError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.util.FixedPointMath;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.FEE_DENOMINATOR;
import static com.curvesim.simulator.constants.CurveConstants.MAX_ITERATIONS;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;

/**
 * Stateless stableswap invariant math shared by {@link StableswapPool} and {@link MetaPool}.
 *
 * <p>The amplification coefficient is the contract value {@code A * n**(n-1)}, so
 * {@code Ann = A * n}. Balances passed in are "xp" values, i.e. already multiplied by
 * their rates and expressed in units of D.
 */
public final class StableswapInvariant {

    private StableswapInvariant() {
        // Utility class
    }

    /**
     * Solve {@code A n^n sum(x) + D = A n^n D + D^(n+1) / (n^n prod(x))} for D.
     *
     * @param xp balances in units of D
     * @param a  amplification coefficient
     * @return the invariant D, zero for an empty pool
     * @throws SafetyBoundError if a balance is not positive while the pool is not empty
     * @throws ConvergenceError if successive values still differ by more than 1 after 255 steps
     */
    public static BigInteger getD(List<BigInteger> xp, BigInteger a) {
        int n = xp.size();
        BigInteger nn = BigInteger.valueOf(n);
        BigInteger s = FixedPointMath.sum(xp);
        if (s.signum() == 0) {
            return BigInteger.ZERO;
        }
        for (BigInteger x : xp) {
            if (x.signum() <= 0) {
                throw new SafetyBoundError("get_D needs every balance positive: xp=" + xp + ", A=" + a);
            }
        }
        BigInteger ann = a.multiply(nn);

        BigInteger d = s;
        BigInteger dPrev = BigInteger.ZERO;
        for (int k = 0; k < MAX_ITERATIONS; k++) {
            if (d.subtract(dPrev).abs().compareTo(BigInteger.ONE) <= 0) {
                return d;
            }
            BigInteger dP = d;
            for (BigInteger x : xp) {
                dP = floorDiv(dP.multiply(d), nn.multiply(x));
            }
            dPrev = d;
            BigInteger numerator = ann.multiply(s).add(dP.multiply(nn)).multiply(d);
            BigInteger denominator = ann.subtract(BigInteger.ONE).multiply(d)
                    .add(nn.add(BigInteger.ONE).multiply(dP));
            d = floorDiv(numerator, denominator);
        }
        if (d.subtract(dPrev).abs().compareTo(BigInteger.ONE) <= 0) {
            return d;
        }
        throw new ConvergenceError("get_D did not converge: xp=" + xp + ", A=" + a);
    }

    /**
     * Balance of coin j that keeps D constant when coin i is set to {@code x}.
     *
     * @param i  index of the coin whose balance is changed
     * @param j  index of the coin to solve for
     * @param x  new balance of coin i in units of D
     * @param xp current balances in units of D
     * @param a  amplification coefficient
     * @return balance of coin j in units of D
     */
    public static BigInteger getY(int i, int j, BigInteger x, List<BigInteger> xp, BigInteger a) {
        int n = xp.size();
        BigInteger d = getD(xp, a);
        List<BigInteger> xx = new ArrayList<>(xp);
        xx.set(i, x);
        List<BigInteger> others = new ArrayList<>(n - 1);
        for (int k = 0; k < n; k++) {
            if (k != j) {
                others.add(xx.get(k));
            }
        }
        BigInteger ann = a.multiply(BigInteger.valueOf(n));
        BigInteger b = FixedPointMath.sum(others).add(floorDiv(d, ann)).subtract(d);
        return solveQuadratic(others, d, ann, b, BigInteger.ZERO, "get_y");
    }

    /**
     * Balance of coin i that yields invariant {@code d} given the other balances.
     *
     * @param a  amplification coefficient
     * @param i  index of the coin to solve for
     * @param xp balances in units of D (entry i is ignored)
     * @param d  target invariant
     * @return balance of coin i in units of D
     */
    public static BigInteger getYD(BigInteger a, int i, List<BigInteger> xp, BigInteger d) {
        int n = xp.size();
        List<BigInteger> others = new ArrayList<>(n - 1);
        for (int k = 0; k < n; k++) {
            if (k != i) {
                others.add(xp.get(k));
            }
        }
        BigInteger ann = a.multiply(BigInteger.valueOf(n));
        BigInteger b = FixedPointMath.sum(others).add(floorDiv(d, ann));
        return solveQuadratic(others, d, ann, b, d, "get_y_D");
    }

    // y := (y^2 + c) / (2y + b - bOffset)
    private static BigInteger solveQuadratic(List<BigInteger> others, BigInteger d, BigInteger ann,
                                             BigInteger b, BigInteger bOffset, String routine) {
        BigInteger nn = BigInteger.valueOf(others.size() + 1L);
        BigInteger c = d;
        for (BigInteger y : others) {
            c = floorDiv(c.multiply(d), y.multiply(nn));
        }
        c = floorDiv(c.multiply(d), nn.multiply(ann));

        BigInteger y = d;
        BigInteger yPrev = BigInteger.ZERO;
        for (int k = 0; k < MAX_ITERATIONS; k++) {
            if (y.subtract(yPrev).abs().compareTo(BigInteger.ONE) <= 0) {
                return y;
            }
            yPrev = y;
            y = floorDiv(y.multiply(y).add(c), y.shiftLeft(1).add(b).subtract(bOffset));
        }
        if (y.subtract(yPrev).abs().compareTo(BigInteger.ONE) <= 0) {
            return y;
        }
        throw new ConvergenceError(routine + " did not converge: balances=" + others + ", D=" + d);
    }

    /**
     * Dynamic fee: the base fee scaled up by {@code feeMul} as the pair becomes imbalanced.
     */
    public static BigInteger dynamicFee(BigInteger xpi, BigInteger xpj, BigInteger fee, BigInteger feeMul) {
        BigInteger xps2 = xpi.add(xpj);
        xps2 = xps2.multiply(xps2);
        BigInteger imbalance = floorDiv(feeMul.subtract(FEE_DENOMINATOR).multiply(BigInteger.valueOf(4))
                .multiply(xpi).multiply(xpj), xps2);
        return floorDiv(feeMul.multiply(fee), imbalance.add(FEE_DENOMINATOR));
    }

    /**
     * Closed-form derivative dy/dx of the invariant at {@code xp}, without fees.
     */
    public static double dydx(int i, int j, List<BigInteger> xp, BigInteger a, BigInteger d) {
        int n = xp.size();
        BigInteger xi = xp.get(i);
        BigInteger xj = xp.get(j);
        BigInteger dPow = d.pow(n + 1);
        BigInteger xProd = FixedPointMath.product(xp);
        BigInteger aPow = a.multiply(BigInteger.valueOf(n).pow(n + 1));

        BigInteger numerator = xj.multiply(xi.multiply(aPow).multiply(xProd).add(dPow));
        BigInteger denominator = xi.multiply(xj.multiply(aPow).multiply(xProd).add(dPow));
        return FixedPointMath.ratio(numerator, denominator);
    }

    /**
     * Balances in units of D: {@code x * rate / 10**18}.
     */
    public static List<BigInteger> xp(List<BigInteger> balances, List<BigInteger> rates) {
        List<BigInteger> xp = new ArrayList<>(balances.size());
        for (int k = 0; k < balances.size(); k++) {
            xp.add(floorDiv(balances.get(k).multiply(rates.get(k)), PRECISION));
        }
        return xp;
    }
}
