// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the arbitrage root finder and least-squares solver.
 *
 * Bound from {@code curvesim.solver.*}. Every field has a default, so
 * {@code new SolverProperties()} is a working configuration outside Spring.
 */
@Validated
@ConfigurationProperties(prefix = "curvesim.solver")
public class SolverProperties {

    // Brent root finder (single pair), in trade-size units
    @Positive
    private double brentAbsoluteAccuracy = 1.0;
    @Positive
    private double brentRelativeAccuracy = 1e-12;
    @Positive
    private int brentMaxEvaluations = 100;

    // Bounded least squares (multi pair)
    @Positive
    private double leastSquaresCostTolerance = 1e-15;
    @Positive
    private double leastSquaresParameterTolerance = 1e-15;
    @Positive
    private double leastSquaresOrthoTolerance = 1e-15;
    @Positive
    private int leastSquaresMaxEvaluations = 1000;
    @Positive
    private int leastSquaresMaxIterations = 1000;

    // Share of the output coin left in the pool by the largest trade considered
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double maxTradeFraction = 0.01;
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double cryptoMaxTradeFraction = 0.05;

    public double getBrentAbsoluteAccuracy() {
        return brentAbsoluteAccuracy;
    }

    public void setBrentAbsoluteAccuracy(double brentAbsoluteAccuracy) {
        this.brentAbsoluteAccuracy = brentAbsoluteAccuracy;
    }

    public double getBrentRelativeAccuracy() {
        return brentRelativeAccuracy;
    }

    public void setBrentRelativeAccuracy(double brentRelativeAccuracy) {
        this.brentRelativeAccuracy = brentRelativeAccuracy;
    }

    public int getBrentMaxEvaluations() {
        return brentMaxEvaluations;
    }

    public void setBrentMaxEvaluations(int brentMaxEvaluations) {
        this.brentMaxEvaluations = brentMaxEvaluations;
    }

    public double getLeastSquaresCostTolerance() {
        return leastSquaresCostTolerance;
    }

    public void setLeastSquaresCostTolerance(double leastSquaresCostTolerance) {
        this.leastSquaresCostTolerance = leastSquaresCostTolerance;
    }

    public double getLeastSquaresParameterTolerance() {
        return leastSquaresParameterTolerance;
    }

    public void setLeastSquaresParameterTolerance(double leastSquaresParameterTolerance) {
        this.leastSquaresParameterTolerance = leastSquaresParameterTolerance;
    }

    public double getLeastSquaresOrthoTolerance() {
        return leastSquaresOrthoTolerance;
    }

    public void setLeastSquaresOrthoTolerance(double leastSquaresOrthoTolerance) {
        this.leastSquaresOrthoTolerance = leastSquaresOrthoTolerance;
    }

    public int getLeastSquaresMaxEvaluations() {
        return leastSquaresMaxEvaluations;
    }

    public void setLeastSquaresMaxEvaluations(int leastSquaresMaxEvaluations) {
        this.leastSquaresMaxEvaluations = leastSquaresMaxEvaluations;
    }

    public int getLeastSquaresMaxIterations() {
        return leastSquaresMaxIterations;
    }

    public void setLeastSquaresMaxIterations(int leastSquaresMaxIterations) {
        this.leastSquaresMaxIterations = leastSquaresMaxIterations;
    }

    public double getMaxTradeFraction() {
        return maxTradeFraction;
    }

    public void setMaxTradeFraction(double maxTradeFraction) {
        this.maxTradeFraction = maxTradeFraction;
    }

    public double getCryptoMaxTradeFraction() {
        return cryptoMaxTradeFraction;
    }

    public void setCryptoMaxTradeFraction(double cryptoMaxTradeFraction) {
        this.cryptoMaxTradeFraction = cryptoMaxTradeFraction;
    }

    @Override
    public String toString() {
        return "SolverProperties{brent=(" + brentAbsoluteAccuracy + ", " + brentRelativeAccuracy + ", "
                + brentMaxEvaluations + "), leastSquares=(" + leastSquaresCostTolerance + ", "
                + leastSquaresParameterTolerance + ", " + leastSquaresOrthoTolerance + ", "
                + leastSquaresMaxEvaluations + ", " + leastSquaresMaxIterations + "), maxTradeFraction="
                + maxTradeFraction + ", cryptoMaxTradeFraction=" + cryptoMaxTradeFraction + "}";
    }
}
