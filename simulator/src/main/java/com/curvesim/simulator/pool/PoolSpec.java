package com.curvesim.simulator.pool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.List;

/**
 * Pool definition as read from JSON.
 *
 * Integers may be given as JSON numbers or strings. Fields that do not apply to the
 * pool type are ignored; absent optional fields fall back to the engine defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PoolSpec(
        @JsonProperty("type") String type,
        @JsonProperty("coins") List<String> coins,
        @JsonProperty("A") BigInteger amplification,
        @JsonProperty("D") BigInteger totalValue,
        @JsonProperty("balances") List<BigInteger> balances,
        @JsonProperty("rates") List<BigInteger> rates,
        @JsonProperty("tokens") BigInteger tokens,
        @JsonProperty("fee") BigInteger fee,
        @JsonProperty("fee_mul") BigInteger feeMultiplier,
        @JsonProperty("admin_fee") BigInteger adminFee,
        @JsonProperty("gamma") BigInteger gamma,
        @JsonProperty("mid_fee") BigInteger midFee,
        @JsonProperty("out_fee") BigInteger outFee,
        @JsonProperty("allowed_extra_profit") BigInteger allowedExtraProfit,
        @JsonProperty("fee_gamma") BigInteger feeGamma,
        @JsonProperty("adjustment_step") BigInteger adjustmentStep,
        @JsonProperty("ma_half_time") Long maHalfTime,
        @JsonProperty("price_scale") List<BigInteger> priceScale,
        @JsonProperty("block_timestamp") Long blockTimestamp,
        @JsonProperty("basepool") PoolSpec basePool
) {
    public static final String STABLESWAP = "stableswap";
    public static final String METAPOOL = "metapool";
    public static final String CRYPTOSWAP = "cryptoswap";
}
