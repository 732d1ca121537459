// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.cryptoswap;

import com.curvesim.simulator.common.errors.ConvergenceError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.util.FixedPointMath;

import java.math.BigInteger;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.A_MULTIPLIER;
import static com.curvesim.simulator.constants.CurveConstants.MAX_ITERATIONS;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;

/**
 * Three-coin repegging invariant (tricrypto-ng).
 *
 * <p>{@link #getY} solves the cubic in K0 directly and only falls back to Newton when the
 * discriminant is not positive.
 */
public final class ThreeCoinCalculator implements CryptoswapCalculator {

    static final ThreeCoinCalculator INSTANCE = new ThreeCoinCalculator();

    private static final BigInteger N_COINS = BigInteger.valueOf(3);
    private static final BigInteger NN = BigInteger.valueOf(27);
    private static final BigInteger MIN_GAMMA = BigInteger.TEN.pow(10);
    private static final BigInteger MAX_GAMMA = BigInteger.valueOf(5).multiply(BigInteger.TEN.pow(16));
    private static final BigInteger MIN_A = NN.multiply(A_MULTIPLIER).divide(BigInteger.valueOf(100));
    private static final BigInteger MAX_A = NN.multiply(A_MULTIPLIER).multiply(BigInteger.valueOf(1000));
    private static final BigInteger MAX_X0 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE)
            .divide(PRECISION).multiply(NN);

    private static final BigInteger E12 = BigInteger.TEN.pow(12);
    private static final BigInteger E14 = BigInteger.TEN.pow(14);
    private static final BigInteger E16 = BigInteger.TEN.pow(16);
    private static final BigInteger E24 = BigInteger.TEN.pow(24);
    private static final BigInteger E36 = BigInteger.TEN.pow(36);

    private static final BigInteger[] DIVIDER_THRESHOLDS = {
            BigInteger.TEN.pow(48), BigInteger.TEN.pow(44), BigInteger.TEN.pow(40), BigInteger.TEN.pow(36),
            BigInteger.TEN.pow(32), BigInteger.TEN.pow(28), BigInteger.TEN.pow(24), BigInteger.TEN.pow(20)
    };
    private static final BigInteger[] DIVIDERS = {
            BigInteger.TEN.pow(30), BigInteger.TEN.pow(26), BigInteger.TEN.pow(22), BigInteger.TEN.pow(18),
            BigInteger.TEN.pow(14), BigInteger.TEN.pow(10), BigInteger.TEN.pow(6), BigInteger.TEN.pow(2)
    };

    private ThreeCoinCalculator() {
    }

    @Override
    public int coinCount() {
        return 3;
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
        BigInteger x2 = x.get(2);
        if (x0.signum() <= 0 || x0.compareTo(MAX_X0) >= 0) {
            throw new SafetyBoundError("Unsafe value for x[0]: " + x0);
        }

        BigInteger s = FixedPointMath.sum(x);
        BigInteger d;
        if (k0Prev.signum() == 0) {
            d = N_COINS.multiply(FixedPointMath.geometricMean3(x));
        } else if (s.compareTo(E36) > 0) {
            d = FixedPointMath.cbrt(floorDiv(floorDiv(x0.multiply(x1), E36).multiply(x2), k0Prev)
                    .multiply(NN).multiply(E12));
        } else if (s.compareTo(E24) > 0) {
            d = FixedPointMath.cbrt(floorDiv(floorDiv(x0.multiply(x1), E24).multiply(x2), k0Prev)
                    .multiply(NN).multiply(BigInteger.TEN.pow(6)));
        } else {
            d = FixedPointMath.cbrt(floorDiv(floorDiv(x0.multiply(x1), PRECISION).multiply(x2), k0Prev)
                    .multiply(NN));
        }

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            BigInteger dPrev = d;
            BigInteger k0 = floorDiv(PRECISION.multiply(x0).multiply(N_COINS), d);
            k0 = floorDiv(k0.multiply(x1).multiply(N_COINS), d);
            k0 = floorDiv(k0.multiply(x2).multiply(N_COINS), d);

            BigInteger g1k0 = CryptoswapMath.g1k0(gamma, k0);
            BigInteger mul1 = CryptoswapMath.mul1(d, gamma, g1k0, ann);
            BigInteger mul2 = floorDiv(PRECISION.shiftLeft(1).multiply(N_COINS).multiply(k0), g1k0);

            BigInteger negFprime = s.add(floorDiv(s.multiply(mul2), PRECISION))
                    .add(floorDiv(mul1.multiply(N_COINS), k0))
                    .subtract(floorDiv(mul2.multiply(d), PRECISION));
            BigInteger dPlus = floorDiv(d.multiply(negFprime.add(s)), negFprime);
            BigInteger dMinus = floorDiv(d.multiply(d), negFprime);
            if (PRECISION.compareTo(k0) > 0) {
                BigInteger correction = floorDiv(d.multiply(floorDiv(mul1, negFprime)), PRECISION);
                dMinus = dMinus.add(floorDiv(correction.multiply(PRECISION.subtract(k0)), k0));
            } else {
                BigInteger correction = floorDiv(floorDiv(d.multiply(mul1), negFprime), PRECISION);
                dMinus = dMinus.subtract(floorDiv(correction.multiply(k0.subtract(PRECISION)), k0));
            }

            d = dPlus.compareTo(dMinus) > 0 ? dPlus.subtract(dMinus) : floorDiv(dMinus.subtract(dPlus), 2);

            BigInteger diff = d.subtract(dPrev).abs();
            if (diff.multiply(E14).compareTo(E16.max(d)) < 0) {
                for (BigInteger value : x) {
                    CryptoswapMath.checkFraction(value, d, "x[i]");
                }
                return d;
            }
        }
        throw new ConvergenceError("newton_D did not converge: xp=" + xp + ", A=" + ann + ", gamma=" + gamma);
    }

    @Override
    public YSolution getY(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger d, int i) {
        checkParameters(ann, gamma);
        CryptoswapMath.checkD(d);
        for (int k = 0; k < 3; k++) {
            if (k != i) {
                CryptoswapMath.checkFraction(xp.get(k), d, "x[" + k + "]");
            }
        }

        int j = i == 0 ? 1 : 0;
        int k = i == 2 ? 1 : 2;
        BigInteger xj = xp.get(j);
        BigInteger xk = xp.get(k);
        BigInteger gamma2 = gamma.multiply(gamma);

        BigInteger a = E36.divide(NN);
        BigInteger b = E36.divide(BigInteger.valueOf(9))
                .add(floorDiv(PRECISION.shiftLeft(1).multiply(gamma), NN))
                .subtract(floorDiv(floorDiv(floorDiv(floorDiv(d.multiply(d), xj).multiply(gamma2).multiply(ann),
                        NN.multiply(NN)), A_MULTIPLIER), xk));
        boolean bIsNeg = b.signum() < 0;

        BigInteger c = E36.divide(BigInteger.valueOf(9))
                .add(floorDiv(gamma.multiply(gamma.add(PRECISION.shiftLeft(2))), NN));
        BigInteger cNeg = xj.add(xk).subtract(d);
        if (cNeg.signum() < 0) {
            c = c.subtract(floorDiv(floorDiv(floorDiv(gamma2.multiply(cNeg.negate()), d).multiply(ann), NN), A_MULTIPLIER));
        } else {
            c = c.add(floorDiv(floorDiv(floorDiv(gamma2.multiply(cNeg), d).multiply(ann), NN), A_MULTIPLIER));
        }
        boolean cIsNeg = c.signum() < 0;

        BigInteger dd = floorDiv(PRECISION.add(gamma).pow(2), NN);
        BigInteger d0 = floorDiv(BigInteger.valueOf(3).multiply(a).multiply(c), b).subtract(b).abs();
        BigInteger divider = BigInteger.ONE;
        for (int t = 0; t < DIVIDER_THRESHOLDS.length; t++) {
            if (d0.compareTo(DIVIDER_THRESHOLDS[t]) > 0) {
                divider = DIVIDERS[t];
                break;
            }
        }

        if (bIsNeg) {
            b = b.negate();
        }
        if (cIsNeg) {
            c = c.negate();
        }
        if (a.abs().compareTo(b.abs()) > 0) {
            BigInteger additionalPrec = floorDiv(a, b).abs();
            a = floorDiv(a.multiply(additionalPrec), divider);
            b = floorDiv(b.multiply(additionalPrec), divider);
            c = floorDiv(c.multiply(additionalPrec), divider);
            dd = floorDiv(dd.multiply(additionalPrec), divider);
        } else {
            BigInteger additionalPrec = floorDiv(b, a).abs();
            a = floorDiv(floorDiv(a, additionalPrec), divider);
            b = floorDiv(floorDiv(b, additionalPrec), divider);
            c = floorDiv(floorDiv(c, additionalPrec), divider);
            dd = floorDiv(floorDiv(dd, additionalPrec), divider);
        }
        if (bIsNeg) {
            b = b.negate();
        }
        if (cIsNeg) {
            c = c.negate();
        }

        BigInteger threeAc = BigInteger.valueOf(3).multiply(a).multiply(c);
        BigInteger delta0;
        BigInteger delta1;
        if (sign(threeAc) != sign(b)) {
            delta0 = floorDiv(threeAc, b.negate()).negate().subtract(b);
            delta1 = floorDiv(BigInteger.valueOf(3).multiply(threeAc), b.negate()).negate().subtract(b.shiftLeft(1));
        } else {
            delta0 = floorDiv(threeAc, b).subtract(b);
            delta1 = floorDiv(BigInteger.valueOf(3).multiply(threeAc), b).subtract(b.shiftLeft(1));
        }
        BigInteger twentySevenASquared = NN.multiply(a.multiply(a));
        BigInteger sqrtArg;
        if (bIsNeg) {
            delta1 = delta1.subtract(floorDiv(floorDiv(twentySevenASquared, b.negate()).multiply(dd), b.negate()));
            sqrtArg = delta1.multiply(delta1)
                    .subtract(floorDiv(BigInteger.valueOf(4).multiply(delta0).multiply(delta0), b.negate()).multiply(delta0));
        } else {
            delta1 = delta1.subtract(floorDiv(floorDiv(twentySevenASquared, b).multiply(dd), b));
            sqrtArg = delta1.multiply(delta1)
                    .add(floorDiv(BigInteger.valueOf(4).multiply(delta0).multiply(delta0), b).multiply(delta0));
        }

        if (sqrtArg.signum() <= 0) {
            return new YSolution(CryptoswapMath.newtonY(ann, gamma, xp, d, i), BigInteger.ZERO);
        }
        BigInteger sqrtVal = FixedPointMath.isqrt(sqrtArg);

        BigInteger bCbrt = b.signum() >= 0 ? FixedPointMath.cbrt(b) : FixedPointMath.cbrt(b.negate()).negate();
        BigInteger secondCbrt = delta1.signum() > 0
                ? FixedPointMath.cbrt(floorDiv(delta1.add(sqrtVal), 2))
                : FixedPointMath.cbrt(floorDiv(delta1.subtract(sqrtVal).negate(), 2)).negate();

        BigInteger bCbrtSquared = floorDiv(bCbrt.multiply(bCbrt), PRECISION);
        BigInteger c1 = secondCbrt.signum() < 0
                ? floorDiv(bCbrtSquared.multiply(secondCbrt.negate()), PRECISION).negate()
                : floorDiv(bCbrtSquared.multiply(secondCbrt), PRECISION);

        BigInteger bDelta0 = b.multiply(delta0);
        BigInteger rootK0;
        if (sign(bDelta0) != sign(c1)) {
            rootK0 = floorDiv(b.add(floorDiv(bDelta0, c1.negate()).negate()).subtract(c1), 3);
        } else {
            rootK0 = floorDiv(b.add(floorDiv(bDelta0, c1)).subtract(c1), 3);
        }

        BigInteger root = floorDiv(floorDiv(floorDiv(floorDiv(d.multiply(d), NN), xk).multiply(d), xj).multiply(rootK0), a);
        CryptoswapMath.checkFraction(root, d, "y");
        return new YSolution(root, floorDiv(PRECISION.multiply(rootK0), a));
    }

    @Override
    public BigInteger newtonY(BigInteger ann, BigInteger gamma, List<BigInteger> xp, BigInteger d, int i) {
        checkParameters(ann, gamma);
        return CryptoswapMath.newtonY(ann, gamma, xp, d, i);
    }

    @Override
    public BigInteger geometricMean(List<BigInteger> values) {
        return FixedPointMath.geometricMean3(values);
    }

    @Override
    public BigInteger alpha(long maHalfTime, long elapsed) {
        // half-life expressed as an e-folding time
        long emaTime = (maHalfTime * 1000 + 693) / 694;
        BigInteger exponent = floorDiv(BigInteger.valueOf(elapsed).multiply(PRECISION), emaTime);
        return FixedPointMath.wadExp(exponent.negate());
    }

    @Override
    public BigInteger emaInput(BigInteger lastPrice, BigInteger priceScale) {
        return lastPrice.min(priceScale.shiftLeft(1));
    }

    @Override
    public boolean derivesLastPricesFromCurve() {
        return true;
    }

    @Override
    public BigInteger lpPrice(BigInteger virtualPrice, List<BigInteger> priceOracle) {
        BigInteger root = FixedPointMath.cbrt(priceOracle.get(0).multiply(priceOracle.get(1)));
        return floorDiv(N_COINS.multiply(virtualPrice).multiply(root), E24);
    }

    private static int sign(BigInteger value) {
        return value.signum() < 0 ? -1 : 1;
    }
}
