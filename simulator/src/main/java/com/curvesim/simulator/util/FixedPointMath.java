package com.curvesim.simulator.util;

import com.curvesim.simulator.common.errors.ConvergenceError;
import com.curvesim.simulator.common.errors.SafetyBoundError;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.EXP_PRECISION;
import static com.curvesim.simulator.constants.CurveConstants.MAX_ITERATIONS;
import static com.curvesim.simulator.constants.CurveConstants.MAX_SERIES_ITERATIONS;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;

/**
 * Fixed-point integer helpers shared by the pool engines.
 *
 * Every division rounds toward negative infinity so that results agree with the
 * reference integer arithmetic; no floating point is used except in {@link #ratio}.
 */
public final class FixedPointMath {

    private static final BigInteger TWO = BigInteger.TWO;
    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final BigInteger E36 = BigInteger.TEN.pow(36);
    private static final BigInteger HALF = BigInteger.valueOf(5).multiply(BigInteger.TEN.pow(17));

    /** Above this, cube roots are taken without the 10**36 pre-scaling. */
    private static final BigInteger CBRT_SCALE_LIMIT = new BigInteger("115792089237316195423570985008687907853269");

    private static final BigInteger WAD_EXP_MIN = new BigInteger("-42139678854452767551");
    private static final BigInteger WAD_EXP_MAX = new BigInteger("135305999368893231589");
    private static final BigInteger LN2_SCALED = new BigInteger("54916777467707473351141471128");
    private static final BigInteger FIVE_POW_18 = BigInteger.valueOf(5).pow(18);

    private FixedPointMath() {
        // Utility class
    }

    /**
     * Integer division rounding toward negative infinity.
     *
     * @param a dividend
     * @param b divisor, non-zero
     * @return floor(a / b)
     */
    public static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && a.signum() * b.signum() < 0) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    public static BigInteger floorDiv(BigInteger a, long b) {
        return floorDiv(a, BigInteger.valueOf(b));
    }

    public static BigInteger sum(List<BigInteger> values) {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger v : values) {
            total = total.add(v);
        }
        return total;
    }

    public static BigInteger product(List<BigInteger> values) {
        BigInteger total = BigInteger.ONE;
        for (BigInteger v : values) {
            total = total.multiply(v);
        }
        return total;
    }

    /**
     * Ratio of two integers as a double, rounded once at the end.
     */
    public static double ratio(BigInteger numerator, BigInteger denominator) {
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL128).doubleValue();
    }

    /**
     * Scale a floating-point amount by a fraction and truncate toward zero.
     */
    public static BigInteger scale(BigInteger amount, double fraction) {
        return new BigDecimal(amount).multiply(BigDecimal.valueOf(fraction)).toBigInteger();
    }

    /**
     * Geometric mean of two values by Newton iteration.
     *
     * @param values exactly two positive values
     * @param sort   sort descending before iterating (the seed is the first value)
     * @return integer geometric mean
     * @throws ConvergenceError if the iteration cap is reached
     */
    public static BigInteger geometricMean2(List<BigInteger> values, boolean sort) {
        BigInteger x0 = values.get(0);
        BigInteger x1 = values.get(1);
        if (sort && x1.compareTo(x0) > 0) {
            BigInteger tmp = x0;
            x0 = x1;
            x1 = tmp;
        }
        BigInteger d = x0;
        for (int k = 0; k < MAX_ITERATIONS; k++) {
            BigInteger prev = d;
            d = floorDiv(d.add(floorDiv(x0.multiply(x1), d)), TWO);
            BigInteger diff = prev.subtract(d).abs();
            if (diff.compareTo(BigInteger.ONE) <= 0 || diff.multiply(PRECISION).compareTo(d) < 0) {
                return d;
            }
        }
        throw new ConvergenceError("geometric_mean did not converge for " + values);
    }

    /**
     * Geometric mean of three 10**18-scaled values via a cube root.
     */
    public static BigInteger geometricMean3(List<BigInteger> values) {
        BigInteger prod = floorDiv(floorDiv(values.get(0).multiply(values.get(1)), PRECISION)
                .multiply(values.get(2)), PRECISION);
        if (prod.signum() == 0) {
            return BigInteger.ZERO;
        }
        return cbrt(prod);
    }

    /**
     * Cube root of a 10**18-scaled value, result also 10**18-scaled.
     *
     * Uses a log2-based seed and seven Newton steps.
     */
    public static BigInteger cbrt(BigInteger x) {
        BigInteger xx;
        if (x.compareTo(CBRT_SCALE_LIMIT.multiply(PRECISION)) >= 0) {
            xx = x;
        } else if (x.compareTo(CBRT_SCALE_LIMIT) >= 0) {
            xx = x.multiply(PRECISION);
        } else {
            xx = x.multiply(E36);
        }

        int log2x = log2(xx, false);
        int remainder = log2x % 3;
        BigInteger a = TWO.pow(log2x / 3)
                .multiply(BigInteger.valueOf(1260).pow(remainder))
                .divide(BigInteger.valueOf(1000).pow(remainder));

        for (int step = 0; step < 7; step++) {
            a = a.multiply(TWO).add(xx.divide(a.multiply(a))).divide(THREE);
        }

        if (x.compareTo(CBRT_SCALE_LIMIT.multiply(PRECISION)) >= 0) {
            a = a.multiply(BigInteger.TEN.pow(12));
        } else if (x.compareTo(CBRT_SCALE_LIMIT) >= 0) {
            a = a.multiply(BigInteger.TEN.pow(6));
        }
        return a;
    }

    /**
     * Integer base-2 logarithm by binary search over shifts.
     *
     * @param x       positive value
     * @param roundUp round up when x is not a power of two
     */
    public static int log2(BigInteger x, boolean roundUp) {
        BigInteger value = x;
        int result = 0;
        for (int shift : new int[] {128, 64, 32, 16, 8, 4, 2}) {
            if (value.shiftRight(shift).signum() != 0) {
                value = value.shiftRight(shift);
                result += shift;
            }
        }
        if (value.shiftRight(1).signum() != 0) {
            result += 1;
        }
        if (roundUp && BigInteger.ONE.shiftLeft(result).compareTo(x) < 0) {
            result += 1;
        }
        return result;
    }

    /**
     * Plain integer square root (floor).
     */
    public static BigInteger isqrt(BigInteger x) {
        return x.sqrt();
    }

    /**
     * Square root of a 10**18-scaled value, result also 10**18-scaled.
     *
     * @throws ConvergenceError if the iteration cap is reached
     */
    public static BigInteger sqrtScaled(BigInteger x) {
        if (x.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger z = x.add(PRECISION).divide(TWO);
        BigInteger y = x;
        for (int k = 0; k < MAX_SERIES_ITERATIONS; k++) {
            if (z.equals(y)) {
                return y;
            }
            y = z;
            z = x.multiply(PRECISION).divide(z).add(z).divide(TWO);
        }
        throw new ConvergenceError("sqrt did not converge for " + x);
    }

    /**
     * Fixed-point decay factor {@code 10**18 * 0.5 ** (power / 10**18)}.
     *
     * @param power non-negative exponent scaled by 10**18
     * @return decay factor scaled by 10**18
     * @throws ConvergenceError if the series does not settle below 10**10
     */
    public static BigInteger halfPow(BigInteger power) {
        BigInteger intPow = power.divide(PRECISION);
        BigInteger otherPow = power.subtract(intPow.multiply(PRECISION));
        if (intPow.compareTo(BigInteger.valueOf(59)) > 0) {
            return BigInteger.ZERO;
        }
        BigInteger result = PRECISION.divide(TWO.pow(intPow.intValue()));
        if (otherPow.signum() == 0) {
            return result;
        }

        BigInteger term = PRECISION;
        BigInteger s = PRECISION;
        boolean neg = false;
        for (int i = 1; i < MAX_SERIES_ITERATIONS; i++) {
            BigInteger k = BigInteger.valueOf(i).multiply(PRECISION);
            BigInteger c = k.subtract(PRECISION);
            if (otherPow.compareTo(c) > 0) {
                c = otherPow.subtract(c);
                neg = !neg;
            } else {
                c = c.subtract(otherPow);
            }
            term = term.multiply(c.multiply(HALF).divide(PRECISION)).divide(k);
            s = neg ? s.subtract(term) : s.add(term);
            if (term.compareTo(EXP_PRECISION) < 0) {
                return floorDiv(result.multiply(s), PRECISION);
            }
        }
        throw new ConvergenceError("halfpow did not converge for power " + power);
    }

    /**
     * Natural exponential of a 10**18-scaled signed value, 10**18-scaled.
     *
     * @throws SafetyBoundError if the result would overflow 256 bits
     */
    public static BigInteger wadExp(BigInteger x) {
        if (x.compareTo(WAD_EXP_MIN) <= 0) {
            return BigInteger.ZERO;
        }
        if (x.compareTo(WAD_EXP_MAX) >= 0) {
            throw new SafetyBoundError("wad_exp overflow for " + x);
        }

        BigInteger value = floorDiv(x.shiftLeft(78), FIVE_POW_18);
        BigInteger k = floorDiv(value.shiftLeft(96), LN2_SCALED).add(TWO.pow(95)).shiftRight(96);
        value = value.subtract(k.multiply(LN2_SCALED));

        BigInteger y = value.add(new BigInteger("1346386616545796478920950773328")).multiply(value).shiftRight(96)
                .add(new BigInteger("57155421227552351082224309758442"));
        BigInteger p = y.add(value).subtract(new BigInteger("94201549194550492254356042504812"))
                .multiply(y).shiftRight(96)
                .add(new BigInteger("28719021644029726153956944680412240"))
                .multiply(value)
                .add(new BigInteger("4385272521454847904659076985693276").shiftLeft(96));

        BigInteger q = value.subtract(new BigInteger("2855989394907223263936484059900")).multiply(value).shiftRight(96)
                .add(new BigInteger("50020603652535783019961831881945"));
        q = q.multiply(value).shiftRight(96).subtract(new BigInteger("533845033583426703283633433725380"));
        q = q.multiply(value).shiftRight(96).add(new BigInteger("3604857256930695427073651918091429"));
        q = q.multiply(value).shiftRight(96).subtract(new BigInteger("14423608567350463180887372962807573"));
        q = q.multiply(value).shiftRight(96).add(new BigInteger("26449188498355588339934803723976023"));

        BigInteger r = floorDiv(p, q);
        return r.multiply(new BigInteger("3822833074963236453042738258902158003155416615667"))
                .shiftRight(195 - k.intValueExact());
    }
}
