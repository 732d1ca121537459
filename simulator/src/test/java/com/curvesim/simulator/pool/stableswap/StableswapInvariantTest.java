// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.stableswap;

import com.curvesim.simulator.common.errors.ConvergenceError;
import com.curvesim.simulator.common.errors.SafetyBoundError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Stableswap Invariant Tests")
class StableswapInvariantTest {

    private static final BigInteger A_100 = BigInteger.valueOf(100);

    private static BigInteger big(String value) {
        return new BigInteger(value);
    }

    @Test
    @DisplayName("Balanced balances give D equal to their sum")
    void testBalancedD() {
        List<BigInteger> xp = List.of(big("1000000000000000000000000"), big("1000000000000000000000000"));

        assertEquals(big("2000000000000000000000000"), StableswapInvariant.getD(xp, A_100));
    }

    @Test
    @DisplayName("Empty pool has zero D")
    void testEmptyPool() {
        assertEquals(BigInteger.ZERO, StableswapInvariant.getD(List.of(BigInteger.ZERO, BigInteger.ZERO), A_100));
    }

    @Test
    @DisplayName("A drained coin is reported as an unsafe value naming the balances")
    void testZeroBalanceRejected() {
        // Arrange
        List<BigInteger> xp = List.of(BigInteger.ZERO, big("1000000000000000000000000"));

        // Act
        SafetyBoundError error = assertThrows(SafetyBoundError.class, () -> StableswapInvariant.getD(xp, A_100));

        // Assert
        assertEquals("UNSAFE_VALUE", error.code());
        assertThat(error.getMessage()).contains("xp=" + xp).contains("A=100");
    }

    @Test
    @DisplayName("Extreme imbalance exhausts the Newton iterations and reports its inputs")
    void testGetDDoesNotConverge() {
        // Arrange - 1 wei against 10^150 needs more than 255 Newton steps
        List<BigInteger> xp = List.of(BigInteger.ONE, BigInteger.TEN.pow(150));

        // Act
        ConvergenceError error = assertThrows(ConvergenceError.class, () -> StableswapInvariant.getD(xp, A_100));

        // Assert
        assertEquals("CONVERGENCE_FAILURE", error.code());
        assertThat(error.getMessage())
                .contains("get_D did not converge")
                .contains("xp=" + xp)
                .contains("A=100");
    }

    @Test
    @DisplayName("Moderate imbalance still converges within the iteration cap")
    void testGetDConvergesForImbalance() {
        List<BigInteger> xp = List.of(BigInteger.ONE, BigInteger.TEN.pow(30));

        BigInteger d = StableswapInvariant.getD(xp, A_100);

        assertThat(d).isPositive().isLessThan(BigInteger.TEN.pow(30).add(BigInteger.ONE));
    }

    @Test
    @DisplayName("get_y_D reports the balances and D when it runs out of iterations")
    void testGetYDDoesNotConverge() {
        // Arrange
        BigInteger d = BigInteger.TEN.pow(160);

        // Act
        ConvergenceError error = assertThrows(ConvergenceError.class,
                () -> StableswapInvariant.getYD(A_100, 0, List.of(BigInteger.ZERO, BigInteger.ONE), d));

        // Assert
        assertThat(error.getMessage())
                .contains("get_y_D did not converge")
                .contains("balances=[1]")
                .contains("D=" + d);
    }
}
