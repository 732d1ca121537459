// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.simulation;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.cryptoswap.CryptoswapPool;
import com.curvesim.simulator.pool.sim.SimCryptoswapPool;
import com.curvesim.simulator.pool.sim.SimMetaPool;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.pool.sim.SimStableswapPool;
import com.curvesim.simulator.pool.stableswap.MetaPool;
import com.curvesim.simulator.pool.stableswap.StableswapPool;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cartesian product of pool parameters, one independent pool per combination.
 *
 * <p>Fixed parameters are applied once to a private copy of the template; each combination
 * then gets its own deep copy of that. Meta-pool base parameters take a {@value #BASE_SUFFIX}
 * suffix ({@code A_base}, {@code fee_base}, ...).
 */
public class ParameterGrid {

    public static final String BASE_SUFFIX = "_base";

    private static final Set<String> STABLESWAP_PARAMETERS = Set.of("A", "D", "fee", "fee_mul", "admin_fee");
    private static final Set<String> CRYPTOSWAP_PARAMETERS = Set.of("A", "gamma", "D", "mid_fee", "out_fee",
            "fee_gamma", "allowed_extra_profit", "adjustment_step", "ma_half_time", "admin_fee");

    private final SimPool template;
    private final List<Map<String, BigInteger>> combinations;

    public ParameterGrid(SimPool pool, Map<String, BigInteger> fixedParameters,
                         Map<String, List<BigInteger>> variableParameters) {
        validateNames(pool, fixedParameters.keySet());
        validateNames(pool, variableParameters.keySet());
        this.template = pool.copy();
        fixedParameters.forEach((name, value) -> apply(template, name, value));
        this.combinations = expand(variableParameters, fixedParameters);
    }

    public ParameterGrid(SimPool pool, Map<String, List<BigInteger>> variableParameters) {
        this(pool, Map.of(), variableParameters);
    }

    /**
     * One entry per combination, in row-major order of the variable parameters.
     */
    public List<Map<String, BigInteger>> combinations() {
        return combinations;
    }

    public int size() {
        return combinations.size();
    }

    /**
     * Fresh pool configured with the given combination.
     */
    public SimPool poolFor(Map<String, BigInteger> parameters) {
        SimPool pool = template.copy();
        parameters.forEach((name, value) -> apply(pool, name, value));
        return pool;
    }

    private static List<Map<String, BigInteger>> expand(Map<String, List<BigInteger>> variable,
                                                        Map<String, BigInteger> fixed) {
        if (variable.isEmpty()) {
            return List.of(ImmutableMap.copyOf(fixed));
        }
        List<String> names = new ArrayList<>(variable.keySet());
        List<List<BigInteger>> values = new ArrayList<>();
        for (String name : names) {
            List<BigInteger> options = variable.get(name);
            if (options == null || options.isEmpty()) {
                throw new InvalidConfigurationError("No values given for parameter " + name);
            }
            values.add(options);
        }
        List<Map<String, BigInteger>> expanded = new ArrayList<>();
        for (List<BigInteger> combination : Lists.cartesianProduct(values)) {
            Map<String, BigInteger> parameters = new LinkedHashMap<>();
            for (int k = 0; k < names.size(); k++) {
                parameters.put(names.get(k), combination.get(k));
            }
            expanded.add(ImmutableMap.copyOf(parameters));
        }
        return List.copyOf(expanded);
    }

    private static void validateNames(SimPool pool, Set<String> names) {
        for (String name : names) {
            boolean known;
            if (pool instanceof SimCryptoswapPool) {
                known = CRYPTOSWAP_PARAMETERS.contains(name);
            } else if (pool instanceof SimMetaPool) {
                known = STABLESWAP_PARAMETERS.contains(stripBaseSuffix(name));
            } else {
                known = STABLESWAP_PARAMETERS.contains(name);
            }
            if (!known) {
                throw new InvalidConfigurationError("Parameter " + name + " is not supported for pool type "
                        + pool.poolType());
            }
        }
    }

    private static void apply(SimPool pool, String name, BigInteger value) {
        if (pool instanceof SimStableswapPool stableswap) {
            applyStableswap(stableswap.pool(), name, value);
        } else if (pool instanceof SimMetaPool meta) {
            if (name.endsWith(BASE_SUFFIX)) {
                applyStableswap(meta.pool().basePool(), stripBaseSuffix(name), value);
            } else {
                applyMeta(meta.pool(), name, value);
            }
        } else if (pool instanceof SimCryptoswapPool crypto) {
            applyCryptoswap(crypto.pool(), name, value);
        }
    }

    private static void applyStableswap(StableswapPool pool, String name, BigInteger value) {
        switch (name) {
            case "A" -> pool.setAmplification(value);
            case "D" -> pool.resetTotalValue(value);
            case "fee" -> pool.setFee(value);
            case "fee_mul" -> pool.setFeeMultiplier(value);
            case "admin_fee" -> pool.setAdminFee(value);
            default -> throw new InvalidConfigurationError("Unknown stableswap parameter: " + name);
        }
    }

    private static void applyMeta(MetaPool pool, String name, BigInteger value) {
        switch (name) {
            case "A" -> pool.setAmplification(value);
            case "D" -> pool.resetTotalValue(value);
            case "fee" -> pool.setFee(value);
            case "fee_mul" -> pool.setFeeMultiplier(value);
            case "admin_fee" -> pool.setAdminFee(value);
            default -> throw new InvalidConfigurationError("Unknown metapool parameter: " + name);
        }
    }

    private static void applyCryptoswap(CryptoswapPool pool, String name, BigInteger value) {
        switch (name) {
            case "A" -> pool.reshape(value, pool.gamma());
            case "gamma" -> pool.reshape(pool.amplification(), value);
            case "D" -> pool.resetTotalValue(value);
            case "mid_fee" -> pool.setMidFee(value);
            case "out_fee" -> pool.setOutFee(value);
            case "fee_gamma" -> pool.setFeeGamma(value);
            case "allowed_extra_profit" -> pool.setAllowedExtraProfit(value);
            case "adjustment_step" -> pool.setAdjustmentStep(value);
            case "ma_half_time" -> pool.setMaHalfTime(value.longValueExact());
            case "admin_fee" -> pool.setAdminFee(value);
            default -> throw new InvalidConfigurationError("Unknown cryptoswap parameter: " + name);
        }
    }

    private static String stripBaseSuffix(String name) {
        return name.endsWith(BASE_SUFFIX) ? name.substring(0, name.length() - BASE_SUFFIX.length()) : name;
    }
}
