// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.stableswap;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import com.curvesim.simulator.common.errors.SnapshotError;
import com.curvesim.simulator.pool.AmountWithFee;
import com.curvesim.simulator.pool.MintQuote;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.DEFAULT_STABLESWAP_FEE;
import static com.curvesim.simulator.constants.CurveConstants.FEE_DENOMINATOR;
import static com.curvesim.simulator.constants.CurveConstants.PRECISION;
import static com.curvesim.simulator.util.FixedPointMath.floorDiv;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stableswap pool state machine reproducing the integer behavior of the plain pool contract.
 *
 * <p>Balances are kept in native token units; {@code rates} convert them to units of D
 * (a rate of 10**30 describes a 6-decimal coin). Not thread-safe: a pool has one owner.
 */
public class StableswapPool {

    private BigInteger amplification;
    private final int n;
    private BigInteger fee;
    private BigInteger feeMultiplier;
    private BigInteger adminFee;
    private final List<BigInteger> rates;
    private List<BigInteger> balances;
    private List<BigInteger> adminBalances;
    private BigInteger tokens;

    StableswapPool(Builder builder) {
        checkArgument(builder.coins >= 2, "a pool needs at least 2 coins, got %s", builder.coins);
        this.amplification = checkNotNull(builder.amplification, "amplification");
        this.n = builder.coins;
        this.fee = builder.fee;
        this.feeMultiplier = builder.feeMultiplier;
        this.adminFee = builder.adminFee;
        this.rates = builder.rates != null
                ? List.copyOf(builder.rates)
                : Collections.nCopies(n, PRECISION);
        if (rates.size() != n) {
            throw new InvalidConfigurationError("expected " + n + " rates, got " + rates.size());
        }

        if (builder.balances != null) {
            if (builder.balances.size() != n) {
                throw new InvalidConfigurationError("expected " + n + " balances, got " + builder.balances.size());
            }
            this.balances = new ArrayList<>(builder.balances);
        } else if (builder.totalValue != null) {
            this.balances = new ArrayList<>(n);
            BigInteger perCoin = builder.totalValue.divide(BigInteger.valueOf(n));
            for (BigInteger rate : rates) {
                balances.add(perCoin.multiply(PRECISION).divide(rate));
            }
        } else {
            throw new InvalidConfigurationError("either balances or a total value D must be provided");
        }

        this.tokens = builder.tokens != null ? builder.tokens : invariant();
        this.adminBalances = new ArrayList<>(Collections.nCopies(n, BigInteger.ZERO));
    }

    private StableswapPool(StableswapPool other) {
        this.amplification = other.amplification;
        this.n = other.n;
        this.fee = other.fee;
        this.feeMultiplier = other.feeMultiplier;
        this.adminFee = other.adminFee;
        this.rates = other.rates;
        this.balances = new ArrayList<>(other.balances);
        this.adminBalances = new ArrayList<>(other.adminBalances);
        this.tokens = other.tokens;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Independent deep copy; mutations of either pool never reach the other.
     */
    public StableswapPool copy() {
        return new StableswapPool(this);
    }

    // ========================================
    // INVARIANT
    // ========================================

    public List<BigInteger> xp() {
        return StableswapInvariant.xp(balances, rates);
    }

    /**
     * Current invariant D.
     */
    public BigInteger invariant() {
        return StableswapInvariant.getD(xp(), amplification);
    }

    public BigInteger invariant(List<BigInteger> xp) {
        return StableswapInvariant.getD(xp, amplification);
    }

    /**
     * Invariant of hypothetical native-unit balances.
     */
    public BigInteger getDMem(List<BigInteger> nativeBalances, BigInteger a) {
        return StableswapInvariant.getD(StableswapInvariant.xp(nativeBalances, rates), a);
    }

    public BigInteger getY(int i, int j, BigInteger x, List<BigInteger> xp) {
        return StableswapInvariant.getY(i, j, x, xp, amplification);
    }

    public BigInteger getYD(BigInteger a, int i, List<BigInteger> xp, BigInteger d) {
        return StableswapInvariant.getYD(a, i, xp, d);
    }

    // ========================================
    // TRADING
    // ========================================

    /**
     * Swap {@code dx} of coin i for coin j.
     *
     * @return amount of coin j received and the fee charged, in native units of j
     * @throws SafetyBoundError if the computed output is negative
     */
    public AmountWithFee exchange(int i, int j, BigInteger dx) {
        List<BigInteger> xp = xp();
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

    // ========================================
    // LIQUIDITY
    // ========================================

    /**
     * Amount of coin i received for redeeming {@code tokenAmount} LP tokens.
     *
     * @param useFee deduct the imbalance fee; when false the returned fee is zero
     */
    public AmountWithFee calcWithdrawOneCoin(BigInteger tokenAmount, int i, boolean useFee) {
        List<BigInteger> xp = xp();
        BigInteger d0 = invariant(xp);
        BigInteger d1 = d0.subtract(floorDiv(tokenAmount.multiply(d0), tokens));
        BigInteger newY = getYD(amplification, i, xp, d1);
        BigInteger dyBeforeFee = floorDiv(xp.get(i).subtract(newY).multiply(PRECISION), rates.get(i));

        // xp is reduced in place: the output is measured against the reduced balance of coin i
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

        BigInteger dy = xp.get(i).subtract(getYD(amplification, i, xp, d1));
        dy = floorDiv(dy.subtract(BigInteger.ONE).multiply(PRECISION), rates.get(i));
        BigInteger dyFee = useFee ? dyBeforeFee.subtract(dy) : BigInteger.ZERO;
        return new AmountWithFee(dy, dyFee);
    }

    /**
     * LP tokens minted for depositing {@code amounts}.
     *
     * @param useFee charge the imbalance fee (the contract's own quote does not)
     */
    public MintQuote calcTokenAmount(List<BigInteger> amounts, boolean useFee) {
        BigInteger d0 = getDMem(balances, amplification);
        List<BigInteger> newBalances = new ArrayList<>(n);
        for (int k = 0; k < n; k++) {
            newBalances.add(balances.get(k).add(amounts.get(k)));
        }
        BigInteger d1 = getDMem(newBalances, amplification);

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
        BigInteger d2 = getDMem(mintBalances, amplification);
        BigInteger minted = floorDiv(tokens.multiply(d2.subtract(d0)), d0);
        return new MintQuote(minted, fees);
    }

    /**
     * Deposit coins; the admin share of the imbalance fee is withheld from the balances.
     *
     * @return LP tokens minted
     */
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

    /**
     * Redeem LP tokens for coin i.
     */
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

    /**
     * Value of one LP token in units of D.
     */
    public BigInteger virtualPrice() {
        return floorDiv(invariant().multiply(PRECISION), tokens);
    }

    public BigInteger dynamicFee(BigInteger xpi, BigInteger xpj) {
        return StableswapInvariant.dynamicFee(xpi, xpj, fee, feeMultiplier);
    }

    /**
     * Spot price of coin i in coin j for an infinitesimal trade.
     *
     * @param useFee discount by the static fee, or by the dynamic fee at the current balances
     */
    public double dydx(int i, int j, boolean useFee) {
        List<BigInteger> xp = xp();
        double price = StableswapInvariant.dydx(i, j, xp, amplification, invariant(xp));
        double feeFactor = 0;
        if (useFee) {
            BigInteger feeRate = feeMultiplier == null ? fee : dynamicFee(xp.get(i), xp.get(j));
            feeFactor = feeRate.doubleValue() / FEE_DENOMINATOR.doubleValue();
        }
        return price * (1 - feeFactor);
    }

    public double dydxFee(int i, int j) {
        return dydx(i, j, true);
    }

    // ========================================
    // SNAPSHOT
    // ========================================

    /**
     * Immutable capture of everything trading and liquidity operations mutate.
     */
    public record Snapshot(List<BigInteger> balances, List<BigInteger> adminBalances, BigInteger tokens) {

        public Snapshot {
            balances = List.copyOf(balances);
            adminBalances = List.copyOf(adminBalances);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(balances, adminBalances, tokens);
    }

    public void restore(Snapshot snapshot) {
        if (snapshot.balances().size() != n) {
            throw new SnapshotError("snapshot holds " + snapshot.balances().size() + " coins, pool has " + n);
        }
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
        for (BigInteger rate : rates) {
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

    public List<BigInteger> rates() {
        return rates;
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

        public Builder balances(List<BigInteger> balances) {
            this.balances = balances;
            return this;
        }

        /**
         * Total value D, split evenly across coins and converted with each rate.
         */
        public Builder totalValue(BigInteger totalValue) {
            this.totalValue = totalValue;
            return this;
        }

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

        public StableswapPool build() {
            return new StableswapPool(this);
        }
    }
}
