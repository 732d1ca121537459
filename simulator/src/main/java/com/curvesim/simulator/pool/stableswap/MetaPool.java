// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.stableswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.MintQuote;
import com.curvesim.simulator.util.FixedPointMath;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.DEFAULT_STABLESWAP_FEE;
import static com.curvesim.simulator.constants.CurveConstants.FEE_DENOMINATOR;
import static com.curvesim.simulator.constants.CurveConstants.MAX_BASE_RATE;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stableswap pool whose last coin is the LP token of a base {@link StableswapPool}.
 *
 * <p>Underlying indices run over the primary coins first ({@code 0 .. maxCoin-1}) and then
 * over the base pool's coins ({@code maxCoin .. nTotal-1}). The LP token is priced at the
 * base pool's current virtual price.
 */
public class MetaPool {

    private static final BigInteger NUMERIC_STEP = BigInteger.TEN.pow(12);
    private static final BigInteger BASE_FEE_OFFSET = BigInteger.valueOf(500_000L);

    private BigInteger amplification;
    private final int n;
    private final int maxCoin;
    private BigInteger fee;
    private BigInteger feeMultiplier;
    private BigInteger adminFee;
    private final List<BigInteger> precisions;
    private final StableswapPool basePool;
    private List<BigInteger> balances;
    private List<BigInteger> adminBalances;
    private BigInteger tokens;

    MetaPool(Builder builder) {
        checkArgument(builder.coins >= 2, "a meta-pool needs at least 2 coins, got %s", builder.coins);
        this.amplification = checkNotNull(builder.amplification, "amplification");
        this.basePool = checkNotNull(builder.basePool, "basePool");
        for (BigInteger rate : basePool.rates()) {
            if (rate.compareTo(MAX_BASE_RATE) > 0) {
                throw new InvalidConfigurationError(rate + " too high: decimals must be >= 6.");
            }
        }
        this.n = builder.coins;
        this.maxCoin = n - 1;
        this.fee = builder.fee;
        this.feeMultiplier = builder.feeMultiplier;
        this.adminFee = builder.adminFee;
        this.precisions = builder.rates != null
                ? List.copyOf(builder.rates)
                : Collections.nCopies(n, PRECISION);
        if (precisions.size() != n) {
            throw new InvalidConfigurationError("expected " + n + " rates, got " + precisions.size());
        }

        if (builder.balances != null) {
            if (builder.balances.size() != n) {
                throw new InvalidConfigurationError("expected " + n + " balances, got " + builder.balances.size());
            }
            this.balances = new ArrayList<>(builder.balances);
        } else if (builder.totalValue != null) {
            this.balances = new ArrayList<>(n);
            BigInteger perCoin = builder.totalValue.divide(BigInteger.valueOf(n));
            for (BigInteger rate : rates()) {
                balances.add(perCoin.multiply(PRECISION).divide(rate));
            }
        } else {
            throw new InvalidConfigurationError("either balances or a total value D must be provided");
        }

        this.tokens = builder.tokens != null ? builder.tokens : invariant();
        this.adminBalances = new ArrayList<>(Collections.nCopies(n, BigInteger.ZERO));
    }

    private MetaPool(MetaPool other) {
        this.amplification = other.amplification;
        this.n = other.n;
        this.maxCoin = other.maxCoin;
        this.fee = other.fee;
        this.feeMultiplier = other.feeMultiplier;
        this.adminFee = other.adminFee;
        this.precisions = other.precisions;
        this.basePool = other.basePool.copy();
        this.balances = new ArrayList<>(other.balances);
        this.adminBalances = new ArrayList<>(other.adminBalances);
        this.tokens = other.tokens;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Deep copy, base pool included.
     */
    public MetaPool copy() {
        return new MetaPool(this);
    }

    /**
     * Rate multipliers with the LP token slot set to the base pool's virtual price.
     */
    public List<BigInteger> rates() {
        List<BigInteger> rates = new ArrayList<>(precisions);
        rates.set(maxCoin, basePool.virtualPrice());
        return rates;
    }

    public List<BigInteger> xp() {
        return StableswapInvariant.xp(balances, rates());
    }

    public BigInteger invariant() {
        return StableswapInvariant.getD(xp(), amplification);
    }

    public BigInteger invariant(List<BigInteger> xp) {
        return StableswapInvariant.getD(xp, amplification);
    }

    public BigInteger getY(int i, int j, BigInteger x, List<BigInteger> xp) {
        return StableswapInvariant.getY(i, j, x, xp, amplification);
    }

    // ========================================
    // TRADING
    // ========================================

    /**
     * Swap between primary coins (including the LP token slot).
     *
     * @throws SafetyBoundError if the computed output is negative
     */
    public AmountWithFee exchange(int i, int j, BigInteger dx) {
        List<BigInteger> rates = rates();
        List<BigInteger> xp = StableswapInvariant.xp(balances, rates);
        BigInteger x = xp.get(i).add(floorDiv(dx.multiply(rates.get(i)), PRECISION));
        BigInteger y = getY(i, j, x, xp);
        BigInteger dy = xp.get(j).subtract(y).subtract(BigInteger.ONE);

        BigInteger feeRate = feeMultiplier == null
                ? fee
                : dynamicFee(floorDiv(xp.get(i).add(x), 2), floorDiv(xp.get(j).add(y), 2));
        BigInteger dyFee = floorDiv(dy.multiply(feeRate), FEE_DENOMINATOR);
        BigInteger dyAdminFee = floorDiv(dyFee.multiply(adminFee), FEE_DENOMINATOR);

        BigInteger rate = rates.get(j);
        dy = floorDiv(dy.subtract(dyFee).multiply(PRECISION), rate);
        dyFee = floorDiv(dyFee.multiply(PRECISION), rate);
        dyAdminFee = floorDiv(dyAdminFee.multiply(PRECISION), rate);

        if (dy.signum() < 0) {
            throw new SafetyBoundError("exchange(" + i + ", " + j + ", " + dx + ") produced negative output " + dy);
        }

        balances.set(i, balances.get(i).add(dx));
        balances.set(j, balances.get(j).subtract(dy.add(dyAdminFee)));
        adminBalances.set(j, adminBalances.get(j).add(dyAdminFee));
        return new AmountWithFee(dy, dyFee);
    }

    /**
     * Swap over underlying indices, routing through the base pool as needed.
     *
     * <p>A base-coin input is deposited into the base pool first; a base-coin output is
     * withdrawn from it last. Two base coins trade directly in the base pool. The meta leg
     * always charges the static fee.
     */
    public AmountWithFee exchangeUnderlying(int i, int j, BigInteger dx) {
        int baseI = i - maxCoin;
        int baseJ = j - maxCoin;
        if (baseI >= 0 && baseJ >= 0) {
            return basePool.exchange(baseI, baseJ, dx);
        }

        int metaI = baseI < 0 ? i : maxCoin;
        int metaJ = baseJ < 0 ? j : maxCoin;
        List<BigInteger> rates = rates();
        List<BigInteger> xp = StableswapInvariant.xp(balances, rates);

        BigInteger metaDx = dx;
        BigInteger x;
        if (baseI < 0) {
            x = xp.get(i).add(floorDiv(dx.multiply(rates.get(i)), PRECISION));
        } else {
            List<BigInteger> baseInputs = new ArrayList<>(Collections.nCopies(basePool.coinCount(), BigInteger.ZERO));
            baseInputs.set(baseI, dx);
            metaDx = basePool.addLiquidity(baseInputs);
            x = floorDiv(metaDx.multiply(rates.get(maxCoin)), PRECISION).add(xp.get(maxCoin));
        }

        BigInteger y = getY(metaI, metaJ, x, xp);
        BigInteger dy = xp.get(metaJ).subtract(y).subtract(BigInteger.ONE);
        BigInteger dyFee = floorDiv(dy.multiply(fee), FEE_DENOMINATOR);
        BigInteger rate = rates.get(metaJ);
        dy = floorDiv(dy.subtract(dyFee).multiply(PRECISION), rate);
        BigInteger dyAdminFee = floorDiv(dyFee.multiply(adminFee), FEE_DENOMINATOR);
        dyAdminFee = floorDiv(dyAdminFee.multiply(PRECISION), rate);
        dyFee = floorDiv(dyFee.multiply(PRECISION), rate);

        balances.set(metaI, balances.get(metaI).add(metaDx));
        balances.set(metaJ, balances.get(metaJ).subtract(dy.add(dyAdminFee)));
        adminBalances.set(metaJ, adminBalances.get(metaJ).add(dyAdminFee));

        if (baseJ >= 0) {
            return basePool.removeLiquidityOneCoin(dy, baseJ);
        }
        return new AmountWithFee(dy, dyFee);
    }

    // ========================================
    // LIQUIDITY
    // ========================================

    public AmountWithFee calcWithdrawOneCoin(BigInteger tokenAmount, int i, boolean useFee) {
        List<BigInteger> rates = rates();
        List<BigInteger> xp = StableswapInvariant.xp(balances, rates);
        BigInteger d0 = invariant(xp);
        BigInteger d1 = d0.subtract(floorDiv(tokenAmount.multiply(d0), tokens));
        BigInteger newY = StableswapInvariant.getYD(amplification, i, xp, d1);
        BigInteger dyBeforeFee = floorDiv(xp.get(i).subtract(newY).multiply(PRECISION), rates.get(i));

        if (fee.signum() != 0 && useFee) {
            BigInteger baseFee = fee.multiply(BigInteger.valueOf(n)).divide(BigInteger.valueOf(4L * (n - 1)));
            for (int k = 0; k < n; k++) {
                BigInteger xk = xp.get(k);
                BigInteger dxExpected = k == i
                        ? floorDiv(xk.multiply(d1), d0).subtract(newY)
                        : xk.subtract(floorDiv(xk.multiply(d1), d0));
                xp.set(k, xk.subtract(floorDiv(baseFee.multiply(dxExpected), FEE_DENOMINATOR)));
            }
        }

        BigInteger dy = xp.get(i).subtract(StableswapInvariant.getYD(amplification, i, xp, d1));
        dy = floorDiv(dy.subtract(BigInteger.ONE).multiply(PRECISION), rates.get(i));
        BigInteger dyFee = useFee ? dyBeforeFee.subtract(dy) : BigInteger.ZERO;
        return new AmountWithFee(dy, dyFee);
    }

    public MintQuote calcTokenAmount(List<BigInteger> amounts, boolean useFee) {
        List<BigInteger> rates = rates();
        BigInteger d0 = StableswapInvariant.getD(StableswapInvariant.xp(balances, rates), amplification);
        List<BigInteger> newBalances = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            newBalances.add(balances.get(k).add(amounts.get(k)));
        }
        BigInteger d1 = StableswapInvariant.getD(StableswapInvariant.xp(newBalances, rates), amplification);

        List<BigInteger> mintBalances = new ArrayList<>(newBalances);
        List<BigInteger> fees = new ArrayList<>(Collections.nCopies(n, BigInteger.ZERO));
        if (useFee) {
            BigInteger baseFee = fee.multiply(BigInteger.valueOf(n)).divide(BigInteger.valueOf(4L * (n - 1)));
            for (int k = 0; k < n; k++) {
                BigInteger ideal = floorDiv(d1.multiply(balances.get(k)), d0);
                BigInteger difference = ideal.subtract(newBalances.get(k)).abs();
                fees.set(k, floorDiv(baseFee.multiply(difference), FEE_DENOMINATOR));
                mintBalances.set(k, mintBalances.get(k).subtract(fees.get(k)));
            }
        }
        BigInteger d2 = StableswapInvariant.getD(StableswapInvariant.xp(mintBalances, rates), amplification);
        return new MintQuote(floorDiv(tokens.multiply(d2.subtract(d0)), d0), fees);
    }

    public BigInteger addLiquidity(List<BigInteger> amounts) {
        checkArgument(amounts.size() == n, "expected %s amounts, got %s", n, amounts.size());
        MintQuote quote = calcTokenAmount(amounts, true);
        tokens = tokens.add(quote.amount());
        for (int k = 0; k < n; k++) {
            BigInteger withheld = floorDiv(quote.fees().get(k).multiply(adminFee), FEE_DENOMINATOR);
            balances.set(k, balances.get(k).add(amounts.get(k)).subtract(withheld));
            adminBalances.set(k, adminBalances.get(k).add(withheld));
        }
        return quote.amount();
    }

    public AmountWithFee removeLiquidityOneCoin(BigInteger tokenAmount, int i) {
        AmountWithFee out = calcWithdrawOneCoin(tokenAmount, i, true);
        BigInteger withheld = floorDiv(out.fee().multiply(adminFee), FEE_DENOMINATOR);
        balances.set(i, balances.get(i).subtract(out.amount().add(withheld)));
        adminBalances.set(i, adminBalances.get(i).add(withheld));
        tokens = tokens.subtract(tokenAmount);
        return out;
    }

    // ========================================
    // PRICING
    // ========================================

    public BigInteger virtualPrice() {
        return floorDiv(invariant().multiply(PRECISION), tokens);
    }

    public BigInteger dynamicFee(BigInteger xpi, BigInteger xpj) {
        return StableswapInvariant.dynamicFee(xpi, xpj, fee, feeMultiplier);
    }

    /**
     * Spot price dy/dx over underlying indices.
     *
     * <p>Primary to base coin uses the chain rule through the base invariant; base to primary
     * coin is measured with a 10**12 test deposit into the base pool.
     */
    public double dydx(int i, int j, boolean useFee) {
        int baseI = i - maxCoin;
        int baseJ = j - maxCoin;
        if (baseI >= 0 && baseJ >= 0) {
            return basePool.dydx(baseI, baseJ, useFee);
        }

        List<BigInteger> rates = rates();
        List<BigInteger> xp = StableswapInvariant.xp(balances, rates);
        if (baseI < 0 && baseJ < 0) {
            return primaryDydx(i, j, xp, useFee);
        }
        if (baseI < 0) {
            return primaryToBaseDydx(i, baseJ, xp, useFee);
        }
        return baseToPrimaryDydx(baseI, j, xp, rates, useFee);
    }

    public double dydxFee(int i, int j) {
        return dydx(i, j, true);
    }

    /**
     * Price between two primary slots, where {@code maxCoin} is the base LP token itself.
     */
    public double primaryPrice(int i, int j, boolean useFee) {
        checkArgument(i != j && i >= 0 && j >= 0 && i < n && j < n, "invalid primary pair (%s, %s)", i, j);
        return primaryDydx(i, j, xp(), useFee);
    }

    private double primaryToBaseDydx(int i, int baseJ, List<BigInteger> xp, boolean useFee) {
        List<BigInteger> baseXp = basePool.xp();
        int bn = basePool.coinCount();
        BigInteger xProd = FixedPointMath.product(baseXp);
        BigInteger d = basePool.invariant(baseXp);
        BigInteger aPow = basePool.amplification().multiply(BigInteger.valueOf(bn).pow(bn + 1));
        BigInteger xj = baseXp.get(baseJ);

        BigDecimal numerator = new BigDecimal(aPow.multiply(xProd))
                .add(new BigDecimal(d.pow(bn + 1)).divide(new BigDecimal(xj), MathContext.DECIMAL128));
        BigInteger denominator = BigInteger.valueOf(bn).pow(bn).multiply(xProd)
                .subtract(aPow.multiply(xProd))
                .subtract(BigInteger.valueOf(bn + 1L).multiply(d.pow(bn)));
        double dPrime = numerator.negate()
                .divide(new BigDecimal(denominator), MathContext.DECIMAL128)
                .doubleValue();

        double price = primaryDydx(i, maxCoin, xp, useFee) / dPrime;
        if (useFee && basePool.fee().signum() != 0) {
            BigInteger baseFee = basePool.fee()
                    .subtract(floorDiv(basePool.fee().multiply(xj), FixedPointMath.sum(baseXp)))
                    .add(BASE_FEE_OFFSET);
            price *= 1 - baseFee.doubleValue() / FEE_DENOMINATOR.doubleValue();
        }
        return price;
    }

    private double baseToPrimaryDydx(int baseI, int j, List<BigInteger> xp, List<BigInteger> rates,
                                     boolean useFee) {
        List<BigInteger> baseInputs = new ArrayList<>(Collections.nCopies(basePool.coinCount(), BigInteger.ZERO));
        baseInputs.set(baseI, floorDiv(NUMERIC_STEP.multiply(PRECISION), basePool.rates().get(baseI)));
        BigInteger dw = basePool.calcTokenAmount(baseInputs, true).amount();
        dw = floorDiv(dw.multiply(rates.get(maxCoin)), PRECISION);

        BigInteger y = getY(maxCoin, j, xp.get(maxCoin).add(dw), xp);
        BigInteger dy = xp.get(j).subtract(y).subtract(BigInteger.ONE);
        if (useFee) {
            dy = dy.subtract(floorDiv(dy.multiply(fee), FEE_DENOMINATOR));
        }
        return FixedPointMath.ratio(dy, NUMERIC_STEP);
    }

    private double primaryDydx(int i, int j, List<BigInteger> xp, boolean useFee) {
        double price = StableswapInvariant.dydx(i, j, xp, amplification, invariant(xp));
        if (!useFee) {
            return price;
        }
        double feeFactor;
        if (feeMultiplier == null) {
            feeFactor = fee.doubleValue() / FEE_DENOMINATOR.doubleValue();
        } else {
            BigInteger halfStep = NUMERIC_STEP.divide(BigInteger.TWO);
            BigInteger yStep = new BigDecimal(price).multiply(new BigDecimal(NUMERIC_STEP)).toBigInteger();
            BigInteger dynamic = dynamicFee(xp.get(i).add(halfStep), xp.get(j).subtract(floorDiv(yStep, 2)));
            feeFactor = dynamic.doubleValue() / FEE_DENOMINATOR.doubleValue();
        }
        return price * (1 - feeFactor);
    }

    // ========================================
    // SNAPSHOT
    // ========================================

    /**
     * Meta-pool state together with the base pool state it depends on.
     */
    public record Snapshot(List<BigInteger> balances, List<BigInteger> adminBalances, BigInteger tokens,
                           StableswapPool.Snapshot base) {

        public Snapshot {
            balances = List.copyOf(balances);
            adminBalances = List.copyOf(adminBalances);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(balances, adminBalances, tokens, basePool.snapshot());
    }

    public void restore(Snapshot snapshot) {
        basePool.restore(snapshot.base());
        this.balances = new ArrayList<>(snapshot.balances());
        this.adminBalances = new ArrayList<>(snapshot.adminBalances());
        this.tokens = snapshot.tokens();
    }

    // ========================================
    // ACCESSORS
    // ========================================

    public int coinCount() {
        return n;
    }

    public int maxCoin() {
        return maxCoin;
    }

    /**
     * Number of underlying coins: primaries plus the base pool's coins.
     */
    public int totalCoinCount() {
        return n + basePool.coinCount() - 1;
    }

    public StableswapPool basePool() {
        return basePool;
    }

    public BigInteger amplification() {
        return amplification;
    }

    public void setAmplification(BigInteger amplification) {
        this.amplification = checkNotNull(amplification, "amplification");
    }

    /**
     * Replaces the balances with an even split of total value {@code d}.
     */
    public void resetTotalValue(BigInteger d) {
        checkNotNull(d, "d");
        BigInteger perCoin = d.divide(BigInteger.valueOf(n));
        List<BigInteger> reset = new ArrayList<>(n);
        for (BigInteger rate : rates()) {
            reset.add(perCoin.multiply(PRECISION).divide(rate));
        }
        this.balances = reset;
    }

    public BigInteger fee() {
        return fee;
    }

    public void setFee(BigInteger fee) {
        this.fee = checkNotNull(fee, "fee");
    }

    public BigInteger feeMultiplier() {
        return feeMultiplier;
    }

    public void setFeeMultiplier(BigInteger feeMultiplier) {
        this.feeMultiplier = feeMultiplier;
    }

    public BigInteger adminFee() {
        return adminFee;
    }

    public void setAdminFee(BigInteger adminFee) {
        this.adminFee = checkNotNull(adminFee, "adminFee");
    }

    public List<BigInteger> precisions() {
        return precisions;
    }

    public List<BigInteger> balances() {
        return List.copyOf(balances);
    }

    public List<BigInteger> adminBalances() {
        return List.copyOf(adminBalances);
    }

    public BigInteger tokens() {
        return tokens;
    }

    public static final class Builder {
        private BigInteger amplification;
        private int coins;
        private StableswapPool basePool;
        private List<BigInteger> balances;
        private BigInteger totalValue;
        private List<BigInteger> rates;
        private BigInteger tokens;
        private BigInteger fee = DEFAULT_STABLESWAP_FEE;
        private BigInteger feeMultiplier;
        private BigInteger adminFee = BigInteger.ZERO;

        private Builder() {
        }

        public Builder amplification(BigInteger amplification) {
            this.amplification = amplification;
            return this;
        }

        public Builder amplification(long amplification) {
            return amplification(BigInteger.valueOf(amplification));
        }

        public Builder coins(int coins) {
            this.coins = coins;
            return this;
        }

        public Builder basePool(StableswapPool basePool) {
            this.basePool = basePool;
            return this;
        }

        public Builder balances(List<BigInteger> balances) {
            this.balances = balances;
            return this;
        }

        public Builder totalValue(BigInteger totalValue) {
            this.totalValue = totalValue;
            return this;
        }

        /**
         * Precision multipliers; the LP token entry is replaced by the base virtual price.
         */
        public Builder rates(List<BigInteger> rates) {
            this.rates = rates;
            return this;
        }

        public Builder tokens(BigInteger tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder fee(BigInteger fee) {
            this.fee = checkNotNull(fee, "fee");
            return this;
        }

        public Builder feeMultiplier(BigInteger feeMultiplier) {
            this.feeMultiplier = feeMultiplier;
            return this;
        }

        public Builder adminFee(BigInteger adminFee) {
            this.adminFee = checkNotNull(adminFee, "adminFee");
            return this;
        }

        public MetaPool build() {
            return new MetaPool(this);
        }
    }
}
