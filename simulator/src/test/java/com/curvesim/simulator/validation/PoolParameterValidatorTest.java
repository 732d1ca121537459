// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.validation;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;
import com.curvesim.simulator.pool.PoolSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pool Parameter Validation Tests")
class PoolParameterValidatorTest {

    private static final BigInteger D = new BigInteger("2000000000000000000000000");

    private final PoolParameterValidator validator = new PoolParameterValidator();

    private static PoolSpec stableswap(List<String> coins, BigInteger a, BigInteger d, BigInteger fee) {
        return new PoolSpec(PoolSpec.STABLESWAP, coins, a, d, null, null, null, fee, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }

    private static PoolSpec cryptoswap(List<String> coins, Long maHalfTime, List<BigInteger> priceScale) {
        return cryptoswap(coins, maHalfTime, priceScale, 1_700_000_000L);
    }

    private static PoolSpec cryptoswap(List<String> coins, Long maHalfTime, List<BigInteger> priceScale,
                                       Long blockTimestamp) {
        return new PoolSpec(PoolSpec.CRYPTOSWAP, coins, BigInteger.valueOf(400_000), D, null, null, null, null,
                null, null, new BigInteger("145000000000000"), BigInteger.valueOf(26_000_000),
                BigInteger.valueOf(45_000_000), new BigInteger("2000000000000"), new BigInteger("230000000000000"),
                new BigInteger("146000000000000"), maHalfTime, priceScale, blockTimestamp, null);
    }

    @Test
    @DisplayName("Accept a well-formed stableswap definition")
    void testAcceptStableswap() {
        assertThatCode(() -> validator.validate(stableswap(List.of("DAI", "USDC"), BigInteger.TEN, D, null)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Reject duplicate coin names")
    void testRejectDuplicateCoins() {
        assertThatThrownBy(() -> validator.validate(stableswap(List.of("DAI", "DAI"), BigInteger.TEN, D, null)))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("Duplicate coin names");
    }

    @Test
    @DisplayName("Reject non-positive amplification")
    void testRejectZeroAmplification() {
        assertThatThrownBy(() -> validator.validate(stableswap(List.of("DAI", "USDC"), BigInteger.ZERO, D, null)))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("A must be positive");
    }

    @Test
    @DisplayName("Reject a pool with neither D nor balances")
    void testRejectMissingState() {
        assertThatThrownBy(() -> validator.validate(stableswap(List.of("DAI", "USDC"), BigInteger.TEN, null, null)))
                .isInstanceOf(InvalidConfigurationError.class);
    }

    @Test
    @DisplayName("Reject a fee above 100%")
    void testRejectFeeOverDenominator() {
        BigInteger fee = BigInteger.TEN.pow(10).add(BigInteger.ONE);

        assertThatThrownBy(() -> validator.validate(stableswap(List.of("DAI", "USDC"), BigInteger.TEN, D, fee)))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("fee must be within");
    }

    @Test
    @DisplayName("Reject a meta-pool without a stableswap base pool")
    void testRejectMetaPoolWithoutBase() {
        PoolSpec meta = new PoolSpec(PoolSpec.METAPOOL, List.of("GUSD", "3CRV"), BigInteger.TEN, D, null, null,
                null, null, null, null, null, null, null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> validator.validate(meta))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("basepool");
    }

    @Test
    @DisplayName("Accept a 2-coin cryptoswap definition")
    void testAcceptCryptoswap() {
        PoolSpec spec = cryptoswap(List.of("USDC", "WETH"), 600L, List.of(new BigInteger("1500000000000000000000")));

        assertThatCode(() -> validator.validate(spec)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Reject cryptoswap pools with more than 3 coins")
    void testRejectFourCoinCryptoswap() {
        PoolSpec spec = cryptoswap(List.of("A", "B", "C", "D"), 600L, List.of(BigInteger.ONE, BigInteger.ONE,
                BigInteger.ONE));

        assertThatThrownBy(() -> validator.validate(spec))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("2 or 3-coin");
    }

    @Test
    @DisplayName("Reject price scale of the wrong length and missing half time")
    void testRejectCryptoswapShape() {
        PoolSpec wrongScale = cryptoswap(List.of("USDC", "WETH"), 600L, List.of());
        PoolSpec noHalfTime = cryptoswap(List.of("USDC", "WETH"), null, List.of(BigInteger.ONE));

        assertThatThrownBy(() -> validator.validate(wrongScale)).isInstanceOf(InvalidConfigurationError.class);
        assertThatThrownBy(() -> validator.validate(noHalfTime))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("ma_half_time");
    }

    @Test
    @DisplayName("Reject a cryptoswap definition without a block timestamp")
    void testRejectCryptoswapWithoutTimestamp() {
        PoolSpec spec = cryptoswap(List.of("USDC", "WETH"), 600L, List.of(new BigInteger("1500000000000000000000")),
                null);

        assertThatThrownBy(() -> validator.validate(spec))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("block_timestamp is required");
    }

    @Test
    @DisplayName("Reject unknown pool types")
    void testRejectUnknownType() {
        PoolSpec spec = new PoolSpec("weighted", List.of("A", "B"), BigInteger.TEN, D, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> validator.validate(spec))
                .isInstanceOf(InvalidConfigurationError.class)
                .hasMessageContaining("Unknown pool type");
    }
}
