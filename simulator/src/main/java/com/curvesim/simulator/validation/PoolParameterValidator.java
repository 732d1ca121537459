// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.validation;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.PoolSpec;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;

import static com.curvesim.simulator.constants.CurveConstants.FEE_DENOMINATOR;

/**
 * Structural checks on pool definitions before any engine is built.
 * Numeric safety ranges (A, gamma, balance ratios) stay with the engines.
 */
@Component
public class PoolParameterValidator {

    /**
     * Validate a pool definition, recursing into the base pool of a meta-pool.
     *
     * @throws InvalidConfigurationError if the definition cannot describe a pool
     */
    public void validate(PoolSpec spec) {
        if (spec == null) {
            throw new InvalidConfigurationError("pool definition is required");
        }
        String type = spec.type();
        if (type == null) {
            throw new InvalidConfigurationError("pool type is required");
        }
        validateCoins(spec.coins());
        requirePositive(spec.amplification(), "A");
        if (spec.totalValue() == null && spec.balances() == null) {
            throw new InvalidConfigurationError("Must provide at least one of balances or D");
        }
        if (spec.balances() != null && spec.balances().size() != spec.coins().size()) {
            throw new InvalidConfigurationError("expected " + spec.coins().size() + " balances, got "
                    + spec.balances().size());
        }
        validateFee(spec.fee(), "fee");
        validateFee(spec.adminFee(), "admin_fee");

        switch (type) {
            case PoolSpec.STABLESWAP -> {
                if (spec.basePool() != null) {
                    throw new InvalidConfigurationError("a stableswap pool cannot have a base pool");
                }
            }
            case PoolSpec.METAPOOL -> {
                if (spec.basePool() == null) {
                    throw new InvalidConfigurationError("metapool requires a basepool definition");
                }
                if (!PoolSpec.STABLESWAP.equals(spec.basePool().type())) {
                    throw new InvalidConfigurationError("basepool must be a stableswap pool, got "
                            + spec.basePool().type());
                }
                validate(spec.basePool());
            }
            case PoolSpec.CRYPTOSWAP -> validateCryptoswap(spec);
            default -> throw new InvalidConfigurationError("Unknown pool type: " + type);
        }
    }

    private void validateCryptoswap(PoolSpec spec) {
        int n = spec.coins().size();
        if (n != 2 && n != 3) {
            throw new InvalidConfigurationError("Only 2 or 3-coin crypto pools are supported, got " + n);
        }
        requirePositive(spec.gamma(), "gamma");
        requireNonNegative(spec.allowedExtraProfit(), "allowed_extra_profit");
        requirePositive(spec.feeGamma(), "fee_gamma");
        requireNonNegative(spec.adjustmentStep(), "adjustment_step");
        validateFee(spec.midFee(), "mid_fee");
        validateFee(spec.outFee(), "out_fee");
        if (spec.midFee() == null || spec.outFee() == null) {
            throw new InvalidConfigurationError("mid_fee and out_fee are required");
        }
        if (spec.maHalfTime() == null || spec.maHalfTime() <= 0) {
            throw new InvalidConfigurationError("ma_half_time must be positive, got " + spec.maHalfTime());
        }
        if (spec.priceScale() == null || spec.priceScale().size() != n - 1) {
            throw new InvalidConfigurationError("expected " + (n - 1) + " price_scale entries, got "
                    + spec.priceScale());
        }
        if (spec.blockTimestamp() == null) {
            throw new InvalidConfigurationError("block_timestamp is required for cryptoswap pools");
        }
    }

    private void validateCoins(List<String> coins) {
        if (coins == null || coins.size() < 2) {
            throw new InvalidConfigurationError("a pool needs at least 2 coin names, got " + coins);
        }
        if (new HashSet<>(coins).size() != coins.size()) {
            throw new InvalidConfigurationError("Duplicate coin names: " + coins);
        }
    }

    private void requirePositive(BigInteger value, String name) {
        if (value == null || value.signum() <= 0) {
            throw new InvalidConfigurationError(name + " must be positive, got " + value);
        }
    }

    private void requireNonNegative(BigInteger value, String name) {
        if (value == null || value.signum() < 0) {
            throw new InvalidConfigurationError(name + " must not be negative, got " + value);
        }
    }

    private void validateFee(BigInteger fee, String name) {
        if (fee == null) {
            return;
        }
        if (fee.signum() < 0 || fee.compareTo(FEE_DENOMINATOR) > 0) {
            throw new InvalidConfigurationError(name + " must be within [0, " + FEE_DENOMINATOR + "], got " + fee);
        }
    }
}
