// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.cryptoswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.PoolLossError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.util.FixedPointMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.DEFAULT_CRYPTO_ADMIN_FEE;
import static com.curvesim.simulator.constants.CurveConstants.FEE_DENOMINATOR;
import static com.curvesim.simulator.constants.CurveConstants.MIN_PRICE_UPDATE_SIZE;
import static com.curvesim.simulator.constants.CurveConstants.NOISE_FEE;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.constants.CurveConstants.SECONDS_PER_BLOCK;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Cryptoswap (repegging) pool for 2 or 3 coins.
 *
 * <p>Coin 0 is the numeraire; {@code priceScale[k-1]} is the internal price of coin k in
 * coin 0. Every state change ends in {@link #tweakPrice}, which moves the EMA oracle,
 * books profit and, when enough profit has accrued, repegs the price scale toward the oracle.
 *
 * <p>The amplification stored here is the contract's {@code A * n**n * 10000}.
 */
public class CryptoswapPool {

    private static final Logger logger = LoggerFactory.getLogger(CryptoswapPool.class);

    private static final BigInteger E6 = BigInteger.TEN.pow(6);
    private static final BigInteger E36 = BigInteger.TEN.pow(36);

    private final CryptoswapCalculator calculator;
    private final int n;
    private final List<BigInteger> precisions;

    private BigInteger amplification;
    private BigInteger gamma;
    private BigInteger midFee;
    private BigInteger outFee;
    private BigInteger allowedExtraProfit;
    private BigInteger feeGamma;
    private BigInteger adjustmentStep;
    private BigInteger adminFee;
    private long maHalfTime;

    private List<BigInteger> priceScale;
    private List<BigInteger> priceOracle;
    private List<BigInteger> lastPrices;
    private long lastPricesTimestamp;
    private long blockTimestamp;

    private List<BigInteger> balances;
    private BigInteger d;
    private BigInteger virtualPrice;
    private BigInteger tokens;
    private BigInteger xcpProfit;
    private BigInteger xcpProfitA;
    private boolean notAdjusted;

    CryptoswapPool(Builder builder) {
        this.calculator = CryptoswapCalculator.forCoins(builder.coins);
        this.n = builder.coins;
        this.precisions = builder.precisions != null
                ? List.copyOf(builder.precisions)
                : Collections.nCopies(n, BigInteger.ONE);
        if (precisions.size() != n) {
            throw new InvalidConfigurationError("expected " + n + " precisions, got " + precisions.size());
        }
        this.amplification = checkNotNull(builder.amplification, "amplification");
        this.gamma = checkNotNull(builder.gamma, "gamma");
        this.midFee = checkNotNull(builder.midFee, "midFee");
        this.outFee = checkNotNull(builder.outFee, "outFee");
        this.allowedExtraProfit = checkNotNull(builder.allowedExtraProfit, "allowedExtraProfit");
        this.feeGamma = checkNotNull(builder.feeGamma, "feeGamma");
        this.adjustmentStep = checkNotNull(builder.adjustmentStep, "adjustmentStep");
        this.adminFee = builder.adminFee;
        this.maHalfTime = builder.maHalfTime;
        checkArgument(maHalfTime > 0, "maHalfTime must be positive, got %s", maHalfTime);

        checkNotNull(builder.priceScale, "priceScale");
        if (builder.priceScale.size() != n - 1) {
            throw new InvalidConfigurationError("expected " + (n - 1) + " price scale entries, got "
                    + builder.priceScale.size());
        }
        this.priceScale = new ArrayList<>(builder.priceScale);
        this.priceOracle = new ArrayList<>(builder.priceOracle != null ? builder.priceOracle : builder.priceScale);
        this.lastPrices = new ArrayList<>(builder.lastPrices != null ? builder.lastPrices : builder.priceScale);
        if (builder.blockTimestamp == null) {
            throw new InvalidConfigurationError("blockTimestamp is required");
        }
        this.blockTimestamp = builder.blockTimestamp;
        this.lastPricesTimestamp = blockTimestamp;
        this.xcpProfit = builder.xcpProfit;
        this.xcpProfitA = builder.xcpProfitA;

        if (builder.balances == null && builder.d == null) {
            throw new InvalidConfigurationError("Must provide at least one of balances or D");
        }
        if (builder.balances != null) {
            if (builder.balances.size() != n) {
                throw new InvalidConfigurationError("expected " + n + " balances, got " + builder.balances.size());
            }
            this.balances = new ArrayList<>(builder.balances);
        }
        if (builder.d != null) {
            this.d = builder.d;
            if (builder.balances == null) {
                this.balances = convertDToBalances(builder.d);
            } else {
                logger.warn("Both D and balances were provided; inconsistent values may cause solver failures");
            }
        } else {
            this.d = calculator.newtonD(amplification, gamma, xp(), BigInteger.ZERO);
        }

        BigInteger xcp = getXcp(d);
        this.tokens = builder.tokens != null ? builder.tokens : xcp;
        this.virtualPrice = tokens.signum() == 0 ? BigInteger.ZERO : floorDiv(PRECISION.multiply(xcp), tokens);
    }

    private CryptoswapPool(CryptoswapPool other) {
        this.calculator = other.calculator;
        this.n = other.n;
        this.precisions = other.precisions;
        this.amplification = other.amplification;
        this.gamma = other.gamma;
        this.midFee = other.midFee;
        this.outFee = other.outFee;
        this.allowedExtraProfit = other.allowedExtraProfit;
        this.feeGamma = other.feeGamma;
        this.adjustmentStep = other.adjustmentStep;
        this.adminFee = other.adminFee;
        this.maHalfTime = other.maHalfTime;
        restore(other.snapshot());
    }

    public static Builder builder() {
        return new Builder();
    }

    public CryptoswapPool copy() {
        return new CryptoswapPool(this);
    }

    // ========================================
    // SCALED BALANCES
    // ========================================

    private List<BigInteger> convertDToBalances(BigInteger value) {
        BigInteger nCoins = BigInteger.valueOf(n);
        List<BigInteger> converted = new ArrayList<>(n);
        converted.add(value.divide(nCoins).divide(precisions.get(0)));
        for (int k = 1; k < n; k++) {
            converted.add(floorDiv(floorDiv(value.multiply(PRECISION), priceScale.get(k - 1).multiply(nCoins)),
                    precisions.get(k)));
        }
        return converted;
    }

    public List<BigInteger> xp() {
        return xpMem(balances);
    }

    /**
     * Native balances expressed in coin-0 units at the current price scale.
     */
    public List<BigInteger> xpMem(List<BigInteger> nativeBalances) {
        List<BigInteger> xp = new ArrayList<>(n);
        xp.add(nativeBalances.get(0).multiply(precisions.get(0)));
        for (int k = 1; k < n; k++) {
            xp.add(floorDiv(nativeBalances.get(k).multiply(precisions.get(k)).multiply(priceScale.get(k - 1)),
                    PRECISION));
        }
        return xp;
    }

    private List<BigInteger> balancedXp(BigInteger value, List<BigInteger> prices) {
        BigInteger nCoins = BigInteger.valueOf(n);
        List<BigInteger> x = new ArrayList<>(n);
        x.add(value.divide(nCoins));
        for (BigInteger price : prices) {
            x.add(floorDiv(value.multiply(PRECISION), price.multiply(nCoins)));
        }
        return x;
    }

    /**
     * Value of the pool at the current price scale if it were perfectly balanced.
     */
    BigInteger getXcp(BigInteger value) {
        if (value.signum() == 0) {
            return BigInteger.ZERO;
        }
        return calculator.geometricMean(balancedXp(value, priceScale));
    }

    // ========================================
    // FEES
    // ========================================

    /**
     * Dynamic fee: {@code mid_fee} at perfect balance, approaching {@code out_fee} as the
     * pool moves away from it.
     */
    public BigInteger fee(List<BigInteger> xp) {
        BigInteger k;
        if (n == 2) {
            BigInteger f = xp.get(0).add(xp.get(1));
            k = floorDiv(floorDiv(PRECISION.multiply(BigInteger.valueOf(4)).multiply(xp.get(0)), f).multiply(xp.get(1)), f);
        } else {
            BigInteger sum = FixedPointMath.sum(xp);
            k = PRECISION;
            for (BigInteger x : xp) {
                k = floorDiv(k.multiply(BigInteger.valueOf(n)).multiply(x), sum);
            }
        }
        BigInteger f = floorDiv(feeGamma.multiply(PRECISION), feeGamma.add(PRECISION).subtract(k));
        return floorDiv(midFee.multiply(f).add(outFee.multiply(PRECISION.subtract(f))), PRECISION);
    }

    private BigInteger calcTokenFee(List<BigInteger> amounts, List<BigInteger> xp) {
        BigInteger fee = floorDiv(fee(xp).multiply(BigInteger.valueOf(n)), 4L * (n - 1));
        BigInteger s = FixedPointMath.sum(amounts);
        BigInteger avg = floorDiv(s, n);
        BigInteger sDiff = BigInteger.ZERO;
        for (BigInteger amount : amounts) {
            sDiff = sDiff.add(amount.subtract(avg).abs());
        }
        return floorDiv(fee.multiply(sDiff), s).add(NOISE_FEE);
    }

    // ========================================
    // TRADING
    // ========================================

    /**
     * Swap {@code dx} of coin i for coin j and update the price state.
     *
     * @return amount of coin j received and the fee charged, both in native units of j
     */
    public AmountWithFee exchange(int i, int j, BigInteger dx) {
        checkArgument(i != j, "coin indices must differ");
        checkArgument(i >= 0 && i < n && j >= 0 && j < n, "coin index out of range: %s, %s", i, j);
        checkArgument(dx.signum() > 0, "dx must be positive, got %s", dx);

        List<BigInteger> newBalances = new ArrayList<>(balances);
        newBalances.set(i, newBalances.get(i).add(dx));
        List<BigInteger> xp = xpMem(newBalances);

        CryptoswapCalculator.YSolution solution = calculator.getY(amplification, gamma, xp, d, j);
        BigInteger dy = xp.get(j).subtract(solution.y());
        xp.set(j, xp.get(j).subtract(dy));
        dy = dy.subtract(BigInteger.ONE);

        BigInteger precI = precisions.get(i);
        BigInteger precJ = precisions.get(j);
        if (j > 0) {
            dy = floorDiv(dy.multiply(PRECISION), priceScale.get(j - 1));
        }
        dy = floorDiv(dy, precJ);
        BigInteger fee = floorDiv(fee(xp).multiply(dy), FEE_DENOMINATOR);
        dy = dy.subtract(fee);
        if (dy.signum() < 0) {
            throw new SafetyBoundError("exchange(" + i + ", " + j + ", " + dx + ") produced negative output " + dy);
        }

        BigInteger y = balances.get(j).subtract(dy);
        newBalances.set(j, y);
        this.balances = newBalances;
        BigInteger scaledY = y.multiply(precJ);
        if (j > 0) {
            scaledY = floorDiv(scaledY.multiply(priceScale.get(j - 1)), PRECISION);
        }
        xp.set(j, scaledY);

        int ix = j;
        BigInteger p = BigInteger.ZERO;
        if (dx.compareTo(MIN_PRICE_UPDATE_SIZE) > 0 && dy.compareTo(MIN_PRICE_UPDATE_SIZE) > 0) {
            BigInteger scaledDx = dx.multiply(precI);
            BigInteger scaledDy = dy.multiply(precJ);
            if (i != 0 && j != 0) {
                p = floorDiv(lastPrices.get(i - 1).multiply(scaledDx), scaledDy);
            } else if (i == 0) {
                p = floorDiv(scaledDx.multiply(PRECISION), scaledDy);
            } else {
                p = floorDiv(scaledDy.multiply(PRECISION), scaledDx);
                ix = i;
            }
        }
        tweakPrice(xp, ix, p, BigInteger.ZERO, solution.k0());
        return new AmountWithFee(dy, fee);
    }

    /**
     * Output of swapping {@code dx} of coin i for coin j, net of the fee, without state changes.
     */
    public BigInteger getDy(int i, int j, BigInteger dx) {
        checkArgument(i != j, "coin indices must differ");
        checkArgument(i >= 0 && i < n && j >= 0 && j < n, "coin index out of range: %s, %s", i, j);

        List<BigInteger> newBalances = new ArrayList<>(balances);
        newBalances.set(i, newBalances.get(i).add(dx));
        List<BigInteger> xp = xpMem(newBalances);
        BigInteger y = calculator.getY(amplification, gamma, xp, d, j).y();
        BigInteger dy = xp.get(j).subtract(y).subtract(BigInteger.ONE);
        xp.set(j, y);
        if (j > 0) {
            dy = floorDiv(dy.multiply(PRECISION), priceScale.get(j - 1).multiply(precisions.get(j)));
        } else {
            dy = floorDiv(dy, precisions.get(0));
        }
        return dy.subtract(floorDiv(fee(xp).multiply(dy), FEE_DENOMINATOR));
    }

    // ========================================
    // PRICE STATE MACHINE
    // ========================================

    /**
     * Advance the oracle, book profit and possibly repeg the price scale.
     *
     * @param xp      scaled balances after the state change
     * @param i       index the trade price refers to, or -1
     * @param pI      trade price, or zero to derive last prices from a small reference trade
     * @param newD    invariant after the change, or zero to recompute it
     * @param k0Prev  K0 left by the preceding balance solve, or zero
     * @throws PoolLossError if the virtual price would decrease
     */
    void tweakPrice(List<BigInteger> xp, int i, BigInteger pI, BigInteger newD, BigInteger k0Prev) {
        if (lastPricesTimestamp < blockTimestamp) {
            priceOracle = movedOracle();
            lastPricesTimestamp = blockTimestamp;
        }

        BigInteger dUnadjusted = newD.signum() == 0
                ? calculator.newtonD(amplification, gamma, xp, k0Prev)
                : newD;

        updateLastPrices(xp, i, pI, dUnadjusted);

        BigInteger oldXcpProfit = xcpProfit;
        BigInteger oldVirtualPrice = virtualPrice;
        BigInteger newXcpProfit = PRECISION;
        BigInteger newVirtualPrice = PRECISION;
        if (oldVirtualPrice.signum() > 0) {
            BigInteger xcp = calculator.geometricMean(balancedXp(dUnadjusted, priceScale));
            newVirtualPrice = floorDiv(PRECISION.multiply(xcp), tokens);
            if (newVirtualPrice.compareTo(oldVirtualPrice) < 0) {
                throw new PoolLossError("virtual price fell from " + oldVirtualPrice + " to " + newVirtualPrice
                        + " (balances=" + balances + ", A=" + amplification + ", gamma=" + gamma + ")");
            }
            newXcpProfit = floorDiv(oldXcpProfit.multiply(newVirtualPrice), oldVirtualPrice);
        }
        this.xcpProfit = newXcpProfit;

        BigInteger norm = BigInteger.ZERO;
        for (int k = 0; k < n - 1; k++) {
            BigInteger ratio = floorDiv(priceOracle.get(k).multiply(PRECISION), priceScale.get(k))
                    .subtract(PRECISION).abs();
            norm = norm.add(ratio.multiply(ratio));
        }
        norm = FixedPointMath.isqrt(norm);
        BigInteger step = adjustmentStep.max(norm.divide(BigInteger.valueOf(5)));

        boolean needsAdjustment = notAdjusted;
        if (!needsAdjustment
                && newVirtualPrice.shiftLeft(1).subtract(PRECISION)
                        .compareTo(newXcpProfit.add(allowedExtraProfit.shiftLeft(1))) > 0
                && norm.compareTo(step) > 0
                && oldVirtualPrice.signum() > 0) {
            needsAdjustment = true;
            notAdjusted = true;
        }

        if (needsAdjustment && norm.compareTo(step) > 0 && oldVirtualPrice.signum() > 0) {
            List<BigInteger> newPrices = new ArrayList<>(n - 1);
            for (int k = 0; k < n - 1; k++) {
                newPrices.add(floorDiv(priceScale.get(k).multiply(norm.subtract(step))
                        .add(step.multiply(priceOracle.get(k))), norm));
            }
            List<BigInteger> rescaled = new ArrayList<>(n);
            rescaled.add(xp.get(0));
            for (int k = 1; k < n; k++) {
                rescaled.add(floorDiv(xp.get(k).multiply(newPrices.get(k - 1)), priceScale.get(k - 1)));
            }
            BigInteger adjustedD = calculator.newtonD(amplification, gamma, rescaled, BigInteger.ZERO);
            BigInteger adjustedVirtualPrice = floorDiv(
                    PRECISION.multiply(calculator.geometricMean(balancedXp(adjustedD, newPrices))), tokens);
            if (adjustedVirtualPrice.compareTo(PRECISION) > 0
                    && adjustedVirtualPrice.shiftLeft(1).subtract(PRECISION).compareTo(newXcpProfit) > 0) {
                logger.debug("Price scale moved from {} to {}", priceScale, newPrices);
                this.priceScale = newPrices;
                this.d = adjustedD;
                this.virtualPrice = adjustedVirtualPrice;
                return;
            }
        }

        this.d = dUnadjusted;
        this.virtualPrice = newVirtualPrice;
        if (needsAdjustment) {
            notAdjusted = false;
            claimAdminFees();
        }
    }

    private void updateLastPrices(List<BigInteger> xp, int i, BigInteger pI, BigInteger dUnadjusted) {
        if (calculator.derivesLastPricesFromCurve()) {
            List<BigInteger> curve = CryptoswapMath.curvePrices(xp, dUnadjusted, amplification, gamma);
            List<BigInteger> updated = new ArrayList<>(n - 1);
            for (int k = 0; k < n - 1; k++) {
                updated.add(floorDiv(curve.get(k).multiply(priceScale.get(k)), PRECISION));
            }
            this.lastPrices = updated;
        } else if (pI.signum() > 0) {
            List<BigInteger> updated = new ArrayList<>(lastPrices);
            if (i > 0) {
                updated.set(i - 1, pI);
            } else {
                for (int k = 0; k < n - 1; k++) {
                    updated.set(k, floorDiv(updated.get(k).multiply(PRECISION), pI));
                }
            }
            this.lastPrices = updated;
        } else {
            List<BigInteger> nudged = new ArrayList<>(xp);
            BigInteger dxPrice = nudged.get(0).divide(E6);
            nudged.set(0, nudged.get(0).add(dxPrice));
            List<BigInteger> updated = new ArrayList<>(n - 1);
            for (int k = 1; k < n; k++) {
                BigInteger y = calculator.newtonY(amplification, gamma, nudged, dUnadjusted, k);
                updated.add(floorDiv(priceScale.get(k - 1).multiply(dxPrice), nudged.get(k).subtract(y)));
            }
            this.lastPrices = updated;
        }
    }

    private List<BigInteger> movedOracle() {
        BigInteger alpha = calculator.alpha(maHalfTime, blockTimestamp - lastPricesTimestamp);
        List<BigInteger> moved = new ArrayList<>(n - 1);
        for (int k = 0; k < n - 1; k++) {
            BigInteger last = calculator.emaInput(lastPrices.get(k), priceScale.get(k));
            moved.add(floorDiv(last.multiply(PRECISION.subtract(alpha)).add(priceOracle.get(k).multiply(alpha)),
                    PRECISION));
        }
        return moved;
    }

    /**
     * Mint the admin's share of profit accrued since the last claim as new LP tokens.
     */
    public void claimAdminFees() {
        BigInteger profit = xcpProfit;
        if (profit.compareTo(xcpProfitA) > 0) {
            BigInteger fees = floorDiv(profit.subtract(xcpProfitA).multiply(adminFee), FEE_DENOMINATOR.shiftLeft(1));
            if (fees.signum() > 0) {
                BigInteger frac = floorDiv(virtualPrice.multiply(PRECISION), virtualPrice.subtract(fees))
                        .subtract(PRECISION);
                tokens = tokens.add(floorDiv(tokens.multiply(frac), PRECISION));
                profit = profit.subtract(fees.shiftLeft(1));
                xcpProfit = profit;
            }
        }
        d = calculator.newtonD(amplification, gamma, xp(), BigInteger.ZERO);
        virtualPrice = floorDiv(PRECISION.multiply(getXcp(d)), tokens);
        if (profit.compareTo(xcpProfitA) > 0) {
            xcpProfitA = profit;
        }
    }

    // ========================================
    // LIQUIDITY
    // ========================================

    /**
     * Deposit coins and mint LP tokens. The first deposit into an empty pool sets the
     * virtual price and profit counter to exactly 10**18.
     */
    public BigInteger addLiquidity(List<BigInteger> amounts) {
        checkArgument(amounts.size() == n, "expected %s amounts, got %s", n, amounts.size());
        checkArgument(amounts.stream().anyMatch(a -> a.signum() > 0), "at least one amount must be positive");

        List<BigInteger> xpOld = xpMem(balances);
        List<BigInteger> newBalances = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            newBalances.add(balances.get(k).add(amounts.get(k)));
        }
        List<BigInteger> xp = xpMem(newBalances);
        List<BigInteger> amountsp = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            amountsp.add(xp.get(k).subtract(xpOld.get(k)));
        }

        BigInteger oldD = d;
        BigInteger newD = calculator.newtonD(amplification, gamma, xp, BigInteger.ZERO);
        BigInteger dToken = oldD.signum() > 0
                ? floorDiv(tokens.multiply(newD), oldD).subtract(tokens)
                : getXcp(newD);
        if (dToken.signum() <= 0) {
            throw new SafetyBoundError("deposit " + amounts + " mints no LP tokens");
        }
        this.balances = newBalances;

        if (oldD.signum() > 0) {
            BigInteger dTokenFee = floorDiv(calcTokenFee(amountsp, xp).multiply(dToken), FEE_DENOMINATOR)
                    .add(BigInteger.ONE);
            dToken = dToken.subtract(dTokenFee);
            tokens = tokens.add(dToken);
            tweakPrice(xp, -1, BigInteger.ZERO, newD, BigInteger.ZERO);
        } else {
            d = newD;
            virtualPrice = PRECISION;
            xcpProfit = PRECISION;
            tokens = tokens.add(dToken);
        }
        return dToken;
    }

    /**
     * LP tokens a deposit would mint, net of the imbalance fee.
     */
    public BigInteger calcTokenAmount(List<BigInteger> amounts) {
        List<BigInteger> xp = xp();
        List<BigInteger> amountsp = xpMem(amounts);
        for (int k = 0; k < n; k++) {
            xp.set(k, xp.get(k).add(amountsp.get(k)));
        }
        BigInteger newD = calculator.newtonD(amplification, gamma, xp, BigInteger.ZERO);
        BigInteger dToken = floorDiv(tokens.multiply(newD), d).subtract(tokens);
        return dToken.subtract(floorDiv(calcTokenFee(amountsp, xp).multiply(dToken), FEE_DENOMINATOR)
                .add(BigInteger.ONE));
    }

    /**
     * Proportional withdrawal; no fee and no price update.
     *
     * @return amounts withdrawn per coin
     */
    public List<BigInteger> removeLiquidity(BigInteger amount) {
        BigInteger totalSupply = tokens;
        tokens = tokens.subtract(amount);
        BigInteger share = amount.subtract(BigInteger.ONE);
        List<BigInteger> withdrawn = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            BigInteger out = floorDiv(balances.get(k).multiply(share), totalSupply);
            balances.set(k, balances.get(k).subtract(out));
            withdrawn.add(out);
        }
        d = d.subtract(floorDiv(d.multiply(share), totalSupply));
        return withdrawn;
    }

    /**
     * Redeem LP tokens for coin i and update the price state.
     */
    public BigInteger removeLiquidityOneCoin(BigInteger tokenAmount, int i) {
        WithdrawQuote quote = calcWithdrawOneCoin(tokenAmount, i, false, true);
        balances.set(i, balances.get(i).subtract(quote.dy()));
        tokens = tokens.subtract(tokenAmount);
        tweakPrice(quote.xp(), i, quote.price(), quote.d(), BigInteger.ZERO);
        return quote.dy();
    }

    public BigInteger calcWithdrawOneCoin(BigInteger tokenAmount, int i) {
        return calcWithdrawOneCoin(tokenAmount, i, true, false).dy();
    }

    private WithdrawQuote calcWithdrawOneCoin(BigInteger tokenAmount, int i, boolean updateD, boolean calcPrice) {
        BigInteger tokenSupply = tokens;
        checkArgument(tokenAmount.compareTo(tokenSupply) <= 0, "cannot withdraw more than the token supply");
        checkArgument(i >= 0 && i < n, "coin index out of range: %s", i);

        List<BigInteger> xx = new ArrayList<>(balances);
        List<BigInteger> xp = xpMem(xx);
        BigInteger d0 = updateD ? calculator.newtonD(amplification, gamma, xp, BigInteger.ZERO) : d;
        BigInteger fee = fee(xp);
        BigInteger dD = floorDiv(tokenAmount.multiply(d0), tokenSupply);
        BigInteger newD = d0.subtract(dD.subtract(floorDiv(fee.multiply(dD), FEE_DENOMINATOR.shiftLeft(1))
                .add(BigInteger.ONE)));
        BigInteger y = calculator.getY(amplification, gamma, xp, newD, i).y();

        BigInteger dy = i == 0
                ? floorDiv(xp.get(i).subtract(y), precisions.get(i))
                : floorDiv(xp.get(i).subtract(y).multiply(PRECISION),
                        precisions.get(i).multiply(priceScale.get(i - 1)));
        xp.set(i, y);

        BigInteger p = BigInteger.ZERO;
        if (calcPrice && n == 2 && dy.compareTo(MIN_PRICE_UPDATE_SIZE) > 0
                && tokenAmount.compareTo(MIN_PRICE_UPDATE_SIZE) > 0) {
            BigInteger s;
            BigInteger precision;
            if (i == 1) {
                s = xx.get(0).multiply(precisions.get(0));
                precision = precisions.get(1);
            } else {
                s = xx.get(1).multiply(precisions.get(1));
                precision = precisions.get(0);
            }
            s = floorDiv(s.multiply(dD), d0);
            p = floorDiv(s.multiply(PRECISION), dy.multiply(precision)
                    .subtract(floorDiv(dD.multiply(xx.get(i)).multiply(precision), d0)));
            if (i == 0) {
                p = floorDiv(E36, p);
            }
        }
        return new WithdrawQuote(dy, p, newD, xp);
    }

    private record WithdrawQuote(BigInteger dy, BigInteger price, BigInteger d, List<BigInteger> xp) {
    }

    // ========================================
    // PRICING
    // ========================================

    /**
     * EMA oracle as it would read at the current block time.
     */
    public List<BigInteger> priceOracle() {
        if (lastPricesTimestamp < blockTimestamp) {
            return movedOracle();
        }
        return List.copyOf(priceOracle);
    }

    public BigInteger lpPrice() {
        return calculator.lpPrice(virtualPrice, priceOracle());
    }

    /**
     * Virtual price recomputed from the stored invariant.
     */
    public BigInteger getVirtualPrice() {
        return floorDiv(PRECISION.multiply(getXcp(d)), tokens);
    }

    /**
     * Marginal price of coin i in units of coin j from the invariant's closed-form gradient.
     *
     * @param useFee discount by the fee at the current balances
     */
    public double price(int i, int j, boolean useFee) {
        List<BigInteger> xp = xp();
        List<BigInteger> curve = CryptoswapMath.curvePrices(xp, d, amplification, gamma);
        List<BigInteger> prices = new ArrayList<>(n);
        prices.add(PRECISION);
        for (int k = 1; k < n; k++) {
            prices.add(floorDiv(curve.get(k - 1).multiply(priceScale.get(k - 1)), PRECISION));
        }
        double price = FixedPointMath.ratio(prices.get(i).multiply(precisions.get(i)),
                prices.get(j).multiply(precisions.get(j)));
        if (useFee) {
            price *= 1 - fee(xp).doubleValue() / FEE_DENOMINATOR.doubleValue();
        }
        return price;
    }

    // ========================================
    // TIME
    // ========================================

    public void incrementTimestamp(int blocks) {
        blockTimestamp += SECONDS_PER_BLOCK * blocks;
    }

    public void setBlockTimestamp(long timestamp) {
        this.blockTimestamp = timestamp;
    }

    public long blockTimestamp() {
        return blockTimestamp;
    }

    public long lastPricesTimestamp() {
        return lastPricesTimestamp;
    }

    // ========================================
    // SNAPSHOT
    // ========================================

    /**
     * Every field a trade or liquidity operation can touch.
     */
    public record Snapshot(List<BigInteger> balances, BigInteger d, BigInteger tokens, BigInteger virtualPrice,
                           BigInteger xcpProfit, BigInteger xcpProfitA, List<BigInteger> priceScale,
                           List<BigInteger> priceOracle, List<BigInteger> lastPrices, long lastPricesTimestamp,
                           long blockTimestamp, boolean notAdjusted) {

        public Snapshot {
            balances = List.copyOf(balances);
            priceScale = List.copyOf(priceScale);
            priceOracle = List.copyOf(priceOracle);
            lastPrices = List.copyOf(lastPrices);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(balances, d, tokens, virtualPrice, xcpProfit, xcpProfitA, priceScale, priceOracle,
                lastPrices, lastPricesTimestamp, blockTimestamp, notAdjusted);
    }

    public void restore(Snapshot snapshot) {
        this.balances = new ArrayList<>(snapshot.balances());
        this.d = snapshot.d();
        this.tokens = snapshot.tokens();
        this.virtualPrice = snapshot.virtualPrice();
        this.xcpProfit = snapshot.xcpProfit();
        this.xcpProfitA = snapshot.xcpProfitA();
        this.priceScale = new ArrayList<>(snapshot.priceScale());
        this.priceOracle = new ArrayList<>(snapshot.priceOracle());
        this.lastPrices = new ArrayList<>(snapshot.lastPrices());
        this.lastPricesTimestamp = snapshot.lastPricesTimestamp();
        this.blockTimestamp = snapshot.blockTimestamp();
        this.notAdjusted = snapshot.notAdjusted();
    }

    // ========================================
    // ACCESSORS
    // ========================================

    public int coinCount() {
        return n;
    }

    public CryptoswapCalculator calculator() {
        return calculator;
    }

    public List<BigInteger> precisions() {
        return precisions;
    }

    public List<BigInteger> balances() {
        return List.copyOf(balances);
    }

    public BigInteger invariant() {
        return d;
    }

    public BigInteger tokens() {
        return tokens;
    }

    public BigInteger virtualPrice() {
        return virtualPrice;
    }

    public BigInteger xcpProfit() {
        return xcpProfit;
    }

    public BigInteger xcpProfitA() {
        return xcpProfitA;
    }

    public boolean notAdjusted() {
        return notAdjusted;
    }

    public List<BigInteger> priceScale() {
        return List.copyOf(priceScale);
    }

    public List<BigInteger> lastPrices() {
        return List.copyOf(lastPrices);
    }

    public BigInteger amplification() {
        return amplification;
    }

    public void setAmplification(BigInteger amplification) {
        this.amplification = checkNotNull(amplification, "amplification");
    }

    /**
     * Changes A and gamma on a live pool, re-solving D and the virtual price for the
     * current balances.
     */
    public void reshape(BigInteger amplification, BigInteger gamma) {
        checkNotNull(amplification, "amplification");
        checkNotNull(gamma, "gamma");
        BigInteger newD = calculator.newtonD(amplification, gamma, xp(), BigInteger.ZERO);
        this.amplification = amplification;
        this.gamma = gamma;
        this.d = newD;
        this.virtualPrice = tokens.signum() == 0 ? BigInteger.ZERO : getVirtualPrice();
    }

    /**
     * Replaces the balances with a balanced position worth {@code value} at the current price scale.
     */
    public void resetTotalValue(BigInteger value) {
        this.d = checkNotNull(value, "value");
        this.balances = convertDToBalances(value);
    }

    public BigInteger gamma() {
        return gamma;
    }

    public void setGamma(BigInteger gamma) {
        this.gamma = checkNotNull(gamma, "gamma");
    }

    public BigInteger midFee() {
        return midFee;
    }

    public void setMidFee(BigInteger midFee) {
        this.midFee = checkNotNull(midFee, "midFee");
    }

    public BigInteger outFee() {
        return outFee;
    }

    public void setOutFee(BigInteger outFee) {
        this.outFee = checkNotNull(outFee, "outFee");
    }

    public BigInteger feeGamma() {
        return feeGamma;
    }

    public void setFeeGamma(BigInteger feeGamma) {
        this.feeGamma = checkNotNull(feeGamma, "feeGamma");
    }

    public BigInteger allowedExtraProfit() {
        return allowedExtraProfit;
    }

    public void setAllowedExtraProfit(BigInteger allowedExtraProfit) {
        this.allowedExtraProfit = checkNotNull(allowedExtraProfit, "allowedExtraProfit");
    }

    public BigInteger adjustmentStep() {
        return adjustmentStep;
    }

    public void setAdjustmentStep(BigInteger adjustmentStep) {
        this.adjustmentStep = checkNotNull(adjustmentStep, "adjustmentStep");
    }

    public BigInteger adminFee() {
        return adminFee;
    }

    public void setAdminFee(BigInteger adminFee) {
        this.adminFee = checkNotNull(adminFee, "adminFee");
    }

    public long maHalfTime() {
        return maHalfTime;
    }

    public void setMaHalfTime(long maHalfTime) {
        checkArgument(maHalfTime > 0, "maHalfTime must be positive, got %s", maHalfTime);
        this.maHalfTime = maHalfTime;
    }

    public static final class Builder {
        private BigInteger amplification;
        private BigInteger gamma;
        private int coins;
        private List<BigInteger> precisions;
        private BigInteger midFee;
        private BigInteger outFee;
        private BigInteger allowedExtraProfit;
        private BigInteger feeGamma;
        private BigInteger adjustmentStep;
        private long maHalfTime;
        private List<BigInteger> priceScale;
        private List<BigInteger> priceOracle;
        private List<BigInteger> lastPrices;
        private List<BigInteger> balances;
        private BigInteger d;
        private BigInteger tokens;
        private BigInteger adminFee = DEFAULT_CRYPTO_ADMIN_FEE;
        private BigInteger xcpProfit = PRECISION;
        private BigInteger xcpProfitA = PRECISION;
        private Long blockTimestamp;

        private Builder() {
        }

        public Builder amplification(BigInteger amplification) {
            this.amplification = amplification;
            return this;
        }

        public Builder gamma(BigInteger gamma) {
            this.gamma = gamma;
            return this;
        }

        public Builder coins(int coins) {
            this.coins = coins;
            return this;
        }

        public Builder precisions(List<BigInteger> precisions) {
            this.precisions = precisions;
            return this;
        }

        public Builder midFee(BigInteger midFee) {
            this.midFee = midFee;
            return this;
        }

        public Builder outFee(BigInteger outFee) {
            this.outFee = outFee;
            return this;
        }

        public Builder allowedExtraProfit(BigInteger allowedExtraProfit) {
            this.allowedExtraProfit = allowedExtraProfit;
            return this;
        }

        public Builder feeGamma(BigInteger feeGamma) {
            this.feeGamma = feeGamma;
            return this;
        }

        public Builder adjustmentStep(BigInteger adjustmentStep) {
            this.adjustmentStep = adjustmentStep;
            return this;
        }

        public Builder maHalfTime(long maHalfTime) {
            this.maHalfTime = maHalfTime;
            return this;
        }

        public Builder priceScale(List<BigInteger> priceScale) {
            this.priceScale = priceScale;
            return this;
        }

        public Builder priceOracle(List<BigInteger> priceOracle) {
            this.priceOracle = priceOracle;
            return this;
        }

        public Builder lastPrices(List<BigInteger> lastPrices) {
            this.lastPrices = lastPrices;
            return this;
        }

        public Builder balances(List<BigInteger> balances) {
            this.balances = balances;
            return this;
        }

        public Builder d(BigInteger d) {
            this.d = d;
            return this;
        }

        public Builder tokens(BigInteger tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder adminFee(BigInteger adminFee) {
            this.adminFee = checkNotNull(adminFee, "adminFee");
            return this;
        }

        public Builder xcpProfit(BigInteger xcpProfit) {
            this.xcpProfit = checkNotNull(xcpProfit, "xcpProfit");
            return this;
        }

        public Builder xcpProfitA(BigInteger xcpProfitA) {
            this.xcpProfitA = checkNotNull(xcpProfitA, "xcpProfitA");
            return this;
        }

        /**
         * Unix time of the pool's clock at construction. Required, so oracle updates replay identically.
         */
        public Builder blockTimestamp(long blockTimestamp) {
            this.blockTimestamp = blockTimestamp;
            return this;
        }

        public CryptoswapPool build() {
            return new CryptoswapPool(this);
        }
    }
}
