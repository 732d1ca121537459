// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.cryptoswap.CryptoswapPool;
import com.curvesim.simulator.pool.sim.SimCryptoswapPool;
import com.curvesim.simulator.pool.sim.SimMetaPool;
import com.curvesim.simulator.pool.sim.SimPool;
import com.curvesim.simulator.pool.sim.SimStableswapPool;
import com.curvesim.simulator.pool.stableswap.MetaPool;
import com.curvesim.simulator.pool.stableswap.StableswapPool;
import com.curvesim.simulator.validation.PoolParameterValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.List;

/**
 * Builds simulation pools from explicit parameters or from JSON pool definitions.
 */
@Component
public class PoolFactory {

    private static final Logger logger = LoggerFactory.getLogger(PoolFactory.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final PoolParameterValidator validator;

    public PoolFactory(PoolParameterValidator validator) {
        this.validator = validator;
    }

    /**
     * Stableswap pool holding total value {@code d} split evenly across {@code coins}.
     *
     * @param rates    rate multipliers, or null for 18-decimal coins
     * @param tokens   LP supply, or null to start at D
     * @param fee      swap fee over 10**10, or null for the default
     * @param feeMul   off-peg fee multiplier, or null to disable the dynamic fee
     * @param adminFee admin share of the fee over 10**10, or null for none
     */
    public SimStableswapPool make(List<String> coins, BigInteger amplification, BigInteger d, List<BigInteger> rates,
                                  BigInteger tokens, BigInteger fee, BigInteger feeMul, BigInteger adminFee) {
        StableswapPool pool = stableswapBuilder(coins.size(), amplification, rates, tokens, fee, feeMul, adminFee)
                .totalValue(d)
                .build();
        return new SimStableswapPool(coins, pool);
    }

    /**
     * Meta-pool over {@code basePool}; the last primary coin name is the base LP token.
     */
    public SimMetaPool makeMeta(List<String> coins, List<String> baseCoins, StableswapPool basePool,
                                BigInteger amplification, BigInteger d, List<BigInteger> rates, BigInteger tokens,
                                BigInteger fee, BigInteger feeMul, BigInteger adminFee) {
        MetaPool.Builder builder = MetaPool.builder()
                .coins(coins.size())
                .basePool(basePool)
                .amplification(amplification)
                .totalValue(d)
                .rates(rates)
                .tokens(tokens)
                .feeMultiplier(feeMul);
        if (fee != null) {
            builder.fee(fee);
        }
        if (adminFee != null) {
            builder.adminFee(adminFee);
        }
        return new SimMetaPool(coins, baseCoins, builder.build());
    }

    public SimPool fromJson(String json) {
        try {
            return fromSpec(mapper.readValue(json, PoolSpec.class));
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationError("Malformed pool definition: " + e.getOriginalMessage());
        }
    }

    public SimPool fromJson(InputStream json) {
        try {
            return fromSpec(mapper.readValue(json, PoolSpec.class));
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationError("Malformed pool definition: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pool definition", e);
        }
    }

    public SimPool fromSpec(PoolSpec spec) {
        validator.validate(spec);
        logger.info("Building {} pool for coins {}", spec.type(), spec.coins());
        return switch (spec.type()) {
            case PoolSpec.STABLESWAP -> new SimStableswapPool(spec.coins(), buildStableswap(spec));
            case PoolSpec.METAPOOL -> buildMeta(spec);
            case PoolSpec.CRYPTOSWAP -> new SimCryptoswapPool(spec.coins(), buildCryptoswap(spec));
            default -> throw new InvalidConfigurationError("Unknown pool type: " + spec.type());
        };
    }

    private StableswapPool buildStableswap(PoolSpec spec) {
        return stableswapBuilder(spec.coins().size(), spec.amplification(), spec.rates(), spec.tokens(),
                spec.fee(), spec.feeMultiplier(), spec.adminFee())
                .balances(spec.balances())
                .totalValue(spec.totalValue())
                .build();
    }

    private SimMetaPool buildMeta(PoolSpec spec) {
        PoolSpec base = spec.basePool();
        MetaPool.Builder builder = MetaPool.builder()
                .coins(spec.coins().size())
                .basePool(buildStableswap(base))
                .amplification(spec.amplification())
                .balances(spec.balances())
                .totalValue(spec.totalValue())
                .rates(spec.rates())
                .tokens(spec.tokens())
                .feeMultiplier(spec.feeMultiplier());
        if (spec.fee() != null) {
            builder.fee(spec.fee());
        }
        if (spec.adminFee() != null) {
            builder.adminFee(spec.adminFee());
        }
        return new SimMetaPool(spec.coins(), base.coins(), builder.build());
    }

    private CryptoswapPool buildCryptoswap(PoolSpec spec) {
        CryptoswapPool.Builder builder = CryptoswapPool.builder()
                .coins(spec.coins().size())
                .amplification(spec.amplification())
                .gamma(spec.gamma())
                .midFee(spec.midFee())
                .outFee(spec.outFee())
                .allowedExtraProfit(spec.allowedExtraProfit())
                .feeGamma(spec.feeGamma())
                .adjustmentStep(spec.adjustmentStep())
                .maHalfTime(spec.maHalfTime())
                .priceScale(spec.priceScale())
                .balances(spec.balances())
                .d(spec.totalValue())
                .tokens(spec.tokens());
        if (spec.adminFee() != null) {
            builder.adminFee(spec.adminFee());
        }
        if (spec.blockTimestamp() != null) {
            builder.blockTimestamp(spec.blockTimestamp());
        }
        return builder.build();
    }

    private static StableswapPool.Builder stableswapBuilder(int coins, BigInteger amplification,
                                                           List<BigInteger> rates, BigInteger tokens,
                                                           BigInteger fee, BigInteger feeMul, BigInteger adminFee) {
        StableswapPool.Builder builder = StableswapPool.builder()
                .coins(coins)
                .amplification(amplification)
                .rates(rates)
                .tokens(tokens)
                .feeMultiplier(feeMul);
        if (fee != null) {
            builder.fee(fee);
        }
        if (adminFee != null) {
            builder.adminFee(adminFee);
        }
        return builder;
    }
}
