// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Bounded Least Squares Tests")
class BoundedLeastSquaresTest {

    private final BoundedLeastSquares solver = new BoundedLeastSquares(1e-15, 1e-15, 1e-15, 1000, 1000);

    @Test
    @DisplayName("Interior minimum is found")
    void testInteriorMinimum() {
        // Act
        BoundedLeastSquares.Solution solution = solver.solve(
                x -> new double[] {x[0] - 3, 2 * (x[1] - 5)},
                new double[] {0, 0}, new double[] {0, 0}, new double[] {10, 10});

        // Assert
        assertThat(solution.point()[0]).isCloseTo(3.0, within(1e-6));
        assertThat(solution.point()[1]).isCloseTo(5.0, within(1e-6));
    }

    @Test
    @DisplayName("Minimum outside the box lands on the bound")
    void testMinimumClampedToBound() {
        // Act
        BoundedLeastSquares.Solution solution = solver.solve(
                x -> new double[] {x[0] - 3},
                new double[] {1}, new double[] {0}, new double[] {2});

        // Assert
        assertThat(solution.point()[0]).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("Clamp maps NaN to the lower bound")
    void testClampNaN() {
        double[] clamped = BoundedLeastSquares.clamp(new double[] {Double.NaN, 20, -1},
                new double[] {1, 0, 0}, new double[] {5, 10, 10});

        assertThat(clamped).containsExactly(1, 10, 0);
    }

    @Test
    @DisplayName("Inverted bounds are rejected")
    void testInvertedBounds() {
        assertThatThrownBy(() -> solver.solve(x -> x, new double[] {1}, new double[] {2}, new double[] {1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty box");
    }
}
