// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import com.curvesim.simulator.config.SolverProperties;
import com.curvesim.simulator.metrics.ArbitrageMetrics;
import com.curvesim.simulator.pool.sim.SimCryptoswapPool;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.pool.sim.SnapshotScope;
import com.curvesim.simulator.util.Result;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Sizes arbitrage trades that move pool prices onto external target prices.
 *
 * <p>Every trial trade runs inside a {@link SnapshotScope}, so the pool handed in is left
 * exactly as it was found; only the caller executes the returned trades.
 *
 * <p>Pair prices are read as "price of the first coin in the second". Price errors are
 * relative: {@code (poolPrice - target) / target}, keyed by the direction traded.
 */
@Service
public class ArbitrageSolver {

    private static final Logger logger = LoggerFactory.getLogger(ArbitrageSolver.class);

    public static final String SOLVER_DEGRADED = "SOLVER_DEGRADED";

    private static final BigDecimal WAD = new BigDecimal(BigInteger.TEN.pow(18));

    private final SolverProperties properties;
    private final ArbitrageMetrics metrics;

    public ArbitrageSolver(SolverProperties properties, ArbitrageMetrics metrics) {
        this.properties = checkNotNull(properties, "properties");
        this.metrics = checkNotNull(metrics, "metrics");
    }

    // ========================================
    // SINGLE PAIR
    // ========================================

    /**
     * Independent single-pair solve for every priced pair, in map order.
     *
     * <p>A pair whose pool price is already on the favourable side of the target in both
     * directions yields a zero-size trade in its original orientation.
     */
    public List<ArbTrade> getArbTrades(SimPool pool, Map<CoinPair, Double> prices) {
        List<ArbTrade> trades = new ArrayList<>(prices.size());
        for (Map.Entry<CoinPair, Double> entry : prices.entrySet()) {
            trades.add(optArb(pool, entry.getKey(), entry.getValue()));
        }
        return trades;
    }

    /**
     * Trade size on one pair that brings the fee-inclusive pool price to the target.
     *
     * @param price target price of {@code pair.first()} in {@code pair.second()}
     */
    public ArbTrade optArb(SimPool pool, CoinPair pair, double price) {
        checkArgument(price > 0 && Double.isFinite(price), "target price must be positive, got %s", price);
        String coinIn;
        String coinOut;
        double target;
        if (pool.price(pair.first(), pair.second()) - price > 0) {
            coinIn = pair.first();
            coinOut = pair.second();
            target = price;
        } else if (pool.price(pair.second(), pair.first()) - 1 / price > 0) {
            coinIn = pair.second();
            coinOut = pair.first();
            target = 1 / price;
        } else {
            return new ArbTrade(pair.first(), pair.second(), BigInteger.ZERO, price);
        }

        BigInteger high = pool.getMaxTradeSize(coinIn, coinOut, maxTradeFraction(pool));
        if (high.signum() <= 0) {
            logger.warn("No trade bracket for ({}, {}): max trade size {}", coinIn, coinOut, high);
            return new ArbTrade(coinIn, coinOut, BigInteger.ZERO, target);
        }
        UnivariateFunction error = dx -> postTradePriceError(pool, coinIn, coinOut, toAmount(dx), target);
        BrentSolver solver = new BrentSolver(properties.getBrentRelativeAccuracy(),
                properties.getBrentAbsoluteAccuracy());
        BigInteger size;
        try {
            double root = solver.solve(properties.getBrentMaxEvaluations(), error, 0, high.doubleValue());
            size = toAmount(root);
        } catch (NoBracketingException | TooManyEvaluationsException e) {
            double poolPrice = pool.price(coinIn, coinOut);
            logger.warn("Opt_arb error: Pair: ({}, {}), Pool price: {}, Target price: {}, Diff: {} ({})",
                    coinIn, coinOut, poolPrice, target, poolPrice - target, e.getMessage());
            size = BigInteger.ZERO;
        }
        logger.debug("Single-pair solve {} -> {}: size={}, target={}", coinIn, coinOut, size, target);
        return new ArbTrade(coinIn, coinOut, size, target);
    }

    private static double postTradePriceError(SimPool pool, String coinIn, String coinOut, BigInteger dx,
                                              double target) {
        try (SnapshotScope ignored = pool.snapshot()) {
            if (dx.signum() > 0) {
                pool.trade(coinIn, coinOut, dx);
            }
            return pool.price(coinIn, coinOut, true) - target;
        }
    }

    // ========================================
    // MULTI PAIR
    // ========================================

    /**
     * Simultaneous solve over all priced pairs under per-pair volume caps.
     *
     * <p>Starts from the single-pair sizes clamped to their caps, largest first. Pairs whose
     * clamped size does not exceed the pool's minimum trade size are left out of the solve and
     * report the error of the unarbitraged pool.
     *
     * @param volumeLimits per-pair cap on the input amount, in whole coins
     * @return {@link Result.Ok} with the trades to execute, or {@link Result.Degraded} carrying
     *         no trades and the unarbitraged errors when the optimizer fails
     */
    public Result<ArbitrageOutcome> optArbMulti(SimPool pool, Map<CoinPair, Double> prices,
                                                Map<CoinPair, Double> volumeLimits) {
        long started = System.nanoTime();
        List<ArbTrade> initial = getArbTrades(pool, prices);
        List<CoinPair> pairs = new ArrayList<>(prices.keySet());

        List<ArbTrade> included = new ArrayList<>();
        List<BigInteger> limits = new ArrayList<>();
        List<ArbTrade> excluded = new ArrayList<>();
        for (int k = 0; k < initial.size(); k++) {
            ArbTrade trade = initial.get(k);
            BigInteger limit = toLimit(volumeLimits.get(pairs.get(k)), pairs.get(k));
            ArbTrade limited = trade.replaceAmountIn(trade.amountIn().min(limit));
            if (limited.amountIn().compareTo(pool.getMinTradeSize(limited.coinIn())) > 0) {
                included.add(limited);
                limits.add(limit);
            } else {
                excluded.add(limited.replaceAmountIn(BigInteger.ZERO));
            }
        }

        Map<CoinPair, Double> errors = new LinkedHashMap<>();
        List<Double> excludedErrors = priceErrors(pool, excluded, zeros(excluded.size()));
        for (int k = 0; k < excluded.size(); k++) {
            errors.put(excluded.get(k).pair(), excludedErrors.get(k));
        }

        if (included.isEmpty()) {
            return finish(Result.ok(new ArbitrageOutcome(List.of(), errors)), started);
        }

        Integer[] order = new Integer[included.size()];
        for (int k = 0; k < order.length; k++) {
            order[k] = k;
        }
        Arrays.sort(order, Comparator.comparing((Integer k) -> included.get(k).amountIn()).reversed());
        List<ArbTrade> sorted = new ArrayList<>(order.length);
        List<BigInteger> sortedLimits = new ArrayList<>(order.length);
        double[] start = new double[order.length];
        double[] lower = new double[order.length];
        double[] upper = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            ArbTrade trade = included.get(order[k]);
            sorted.add(trade);
            sortedLimits.add(limits.get(order[k]));
            start[k] = trade.amountIn().doubleValue();
            upper[k] = limits.get(order[k]).doubleValue();
        }

        BoundedLeastSquares leastSquares = new BoundedLeastSquares(
                properties.getLeastSquaresCostTolerance(),
                properties.getLeastSquaresParameterTolerance(),
                properties.getLeastSquaresOrthoTolerance(),
                properties.getLeastSquaresMaxEvaluations(),
                properties.getLeastSquaresMaxIterations());
        try {
            BoundedLeastSquares.Solution solution = leastSquares.solve(
                    x -> toArray(priceErrors(pool, sorted, toSizes(x, sortedLimits))), start, lower, upper);
            List<BigInteger> sizes = toSizes(solution.point(), sortedLimits);
            List<Double> solvedErrors = priceErrors(pool, sorted, sizes);
            List<ArbTrade> trades = new ArrayList<>();
            for (int k = 0; k < sorted.size(); k++) {
                BigInteger dx = sizes.get(k);
                if (dx.signum() > 0) {
                    trades.add(sorted.get(k).replaceAmountIn(dx));
                }
                errors.put(sorted.get(k).pair(), solvedErrors.get(k));
            }
            logger.debug("Multi-pair solve converged after {} evaluations: {} trades", solution.evaluations(),
                    trades.size());
            return finish(Result.ok(new ArbitrageOutcome(trades, errors)), started);
        } catch (RuntimeException e) {
            List<Double> targets = sorted.stream().map(ArbTrade::priceTarget).toList();
            logger.error("Optarbs args: x0: {}, lo: {}, hi: {}, prices: {}", Arrays.toString(start),
                    Arrays.toString(lower), Arrays.toString(upper), targets, e);
            List<Double> fallback = priceErrors(pool, sorted, zeros(sorted.size()));
            for (int k = 0; k < sorted.size(); k++) {
                errors.put(sorted.get(k).pair(), fallback.get(k));
            }
            return finish(Result.degraded(new ArbitrageOutcome(List.of(), errors), SOLVER_DEGRADED,
                    e.getClass().getSimpleName() + ": " + e.getMessage()), started);
        }
    }

    /**
     * Applies the sized trades in order inside one trial block and measures each pair's
     * relative error on the resulting state.
     */
    private static List<Double> priceErrors(SimPool pool, List<ArbTrade> trades, List<BigInteger> sizes) {
        try (SnapshotScope ignored = pool.snapshot()) {
            for (int k = 0; k < trades.size(); k++) {
                BigInteger dx = sizes.get(k);
                if (dx.signum() > 0) {
                    ArbTrade trade = trades.get(k);
                    pool.trade(trade.coinIn(), trade.coinOut(), dx);
                }
            }
            List<Double> errors = new ArrayList<>(trades.size());
            for (ArbTrade trade : trades) {
                double price = pool.price(trade.coinIn(), trade.coinOut(), true);
                errors.add((price - trade.priceTarget()) / trade.priceTarget());
            }
            return errors;
        }
    }

    private Result<ArbitrageOutcome> finish(Result<ArbitrageOutcome> result, long started) {
        metrics.recordSolve(System.nanoTime() - started, result.isDegraded());
        metrics.recordPriceErrors(result.value().priceErrors().values());
        return result;
    }

    double maxTradeFraction(SimPool pool) {
        return pool instanceof SimCryptoswapPool
                ? properties.getCryptoMaxTradeFraction()
                : properties.getMaxTradeFraction();
    }

    private static BigInteger toLimit(Double volumeLimit, CoinPair pair) {
        checkNotNull(volumeLimit, "no volume limit for pair %s", pair);
        checkArgument(volumeLimit >= 0 && Double.isFinite(volumeLimit),
                "volume limit must be finite and non-negative for %s, got %s", pair, volumeLimit);
        return new BigDecimal(volumeLimit).multiply(WAD).toBigInteger();
    }

    static BigInteger toAmount(double size) {
        if (!Double.isFinite(size) || size <= 0) {
            return BigInteger.ZERO;
        }
        return new BigDecimal(size).toBigInteger();
    }

    // NaN and negative candidates trade nothing; sizes never exceed their cap
    private static List<BigInteger> toSizes(double[] x, List<BigInteger> caps) {
        List<BigInteger> sizes = new ArrayList<>(x.length);
        for (int k = 0; k < x.length; k++) {
            sizes.add(toAmount(x[k]).min(caps.get(k)));
        }
        return sizes;
    }

    private static List<BigInteger> zeros(int count) {
        return new ArrayList<>(Collections.nCopies(count, BigInteger.ZERO));
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int k = 0; k < array.length; k++) {
            array[k] = values.get(k);
        }
        return array;
    }
}
