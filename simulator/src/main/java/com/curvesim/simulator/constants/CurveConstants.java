// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.constants;

import java.math.BigInteger;

/**
 * Centralized constants for Curve pool arithmetic.
 *
 * These values are part of the contracts' observable behavior; changing any of them
 * breaks integer-for-integer agreement with the deployed pools.
 */
public final class CurveConstants {

    private CurveConstants() {
        // Prevent instantiation
    }

    // ========================================
    // PRECISION & SCALE
    // ========================================

    /**
     * Fixed-point unit: 10**18 represents one whole token.
     */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    /**
     * Denominator for every fee quantity (10**10 = 100%).
     */
    public static final BigInteger FEE_DENOMINATOR = BigInteger.TEN.pow(10);

    /**
     * Internal scaling of the cryptoswap amplification coefficient.
     */
    public static final BigInteger A_MULTIPLIER = BigInteger.valueOf(10_000);

    // ========================================
    // ITERATION LIMITS
    // ========================================

    /**
     * Iteration cap for every Newton-style solver.
     */
    public static final int MAX_ITERATIONS = 255;

    /**
     * Iteration cap for the scaled square root and half-pow series.
     */
    public static final int MAX_SERIES_ITERATIONS = 256;

    // ========================================
    // STABLESWAP DEFAULTS
    // ========================================

    /**
     * Default stableswap fee (0.04%).
     */
    public static final BigInteger DEFAULT_STABLESWAP_FEE = BigInteger.valueOf(4_000_000);

    /**
     * Base pools with rates above this value would imply fewer than 6 decimals.
     */
    public static final BigInteger MAX_BASE_RATE = BigInteger.TEN.pow(30);

    // ========================================
    // CRYPTOSWAP
    // ========================================

    /**
     * Flat fee added to every liquidity-imbalance fee.
     */
    public static final BigInteger NOISE_FEE = BigInteger.TEN.pow(5);

    /**
     * Residual below which the half-pow series stops.
     */
    public static final BigInteger EXP_PRECISION = BigInteger.TEN.pow(10);

    /**
     * Default admin share of cryptoswap profit (50%).
     */
    public static final BigInteger DEFAULT_CRYPTO_ADMIN_FEE = BigInteger.valueOf(5).multiply(BigInteger.TEN.pow(9));

    /**
     * Seconds added to the simulated block clock per block.
     */
    public static final long SECONDS_PER_BLOCK = 12;

    /**
     * Trades at or below this size (in both legs) do not update the last traded price.
     */
    public static final BigInteger MIN_PRICE_UPDATE_SIZE = BigInteger.TEN.pow(5);

    /** Lower bound of x_i * 10**18 / D accepted by the cryptoswap solvers. */
    public static final BigInteger MIN_FRAC = BigInteger.TEN.pow(16);

    /** Upper bound of x_i * 10**18 / D accepted by the cryptoswap solvers. */
    public static final BigInteger MAX_FRAC = BigInteger.TEN.pow(20);

    /** Lower bound for the cryptoswap invariant. */
    public static final BigInteger MIN_D = BigInteger.TEN.pow(17);

    /** Upper bound for the cryptoswap invariant (10**15 tokens). */
    public static final BigInteger MAX_D = BigInteger.TEN.pow(33);
}
