// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.arbitrage;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Box-constrained nonlinear least squares on top of Levenberg-Marquardt.
 *
 * <p>Bounds are enforced by clamping every evaluated point into {@code [lower, upper]};
 * the Jacobian is taken by forward differences, stepping backward at the upper bound.
 * Residual functions may be piecewise constant at small scales (integer trade sizes), so
 * the difference step is scaled to the parameter and to the width of its box.
 */
public class BoundedLeastSquares {

    private static final double RELATIVE_STEP = 1e-6;

    private final double costTolerance;
    private final double parameterTolerance;
    private final double orthoTolerance;
    private final int maxEvaluations;
    private final int maxIterations;

    public BoundedLeastSquares(double costTolerance, double parameterTolerance, double orthoTolerance,
                               int maxEvaluations, int maxIterations) {
        this.costTolerance = costTolerance;
        this.parameterTolerance = parameterTolerance;
        this.orthoTolerance = orthoTolerance;
        this.maxEvaluations = maxEvaluations;
        this.maxIterations = maxIterations;
    }

    /**
     * Minimizes the sum of squared residuals over the box.
     *
     * @param residuals maps a point to its residual vector; must not mutate its argument
     * @throws org.apache.commons.math3.exception.TooManyEvaluationsException if the evaluation budget runs out
     * @throws org.apache.commons.math3.exception.TooManyIterationsException  if the iteration budget runs out
     */
    public Solution solve(Function<double[], double[]> residuals, double[] start, double[] lower, double[] upper) {
        checkArgument(start.length == lower.length && start.length == upper.length,
                "start and bounds must have the same length");
        for (int k = 0; k < start.length; k++) {
            checkArgument(lower[k] <= upper[k], "empty box at %s: [%s, %s]", k, lower[k], upper[k]);
        }

        double[] clampedStart = clamp(start, lower, upper);
        int observations = residuals.apply(clampedStart.clone()).length;

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(clampedStart)
                .model(jacobianModel(residuals, lower, upper))
                .target(new double[observations])
                .parameterValidator(clampingValidator(lower, upper))
                .lazyEvaluation(false)
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxIterations)
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(costTolerance)
                .withParameterRelativeTolerance(parameterTolerance)
                .withOrthoTolerance(orthoTolerance);

        LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
        double[] point = clamp(optimum.getPoint().toArray(), lower, upper);
        return new Solution(point, optimum.getEvaluations(), optimum.getIterations());
    }

    private static MultivariateJacobianFunction jacobianModel(Function<double[], double[]> residuals,
                                                              double[] lower, double[] upper) {
        return point -> {
            double[] x = point.toArray();
            double[] f0 = residuals.apply(x.clone());
            RealMatrix jacobian = new Array2DRowRealMatrix(f0.length, x.length);
            for (int k = 0; k < x.length; k++) {
                double step = RELATIVE_STEP * Math.max(Math.max(Math.abs(x[k]), RELATIVE_STEP * (upper[k] - lower[k])), 1.0);
                double[] shifted = x.clone();
                double signedStep = x[k] + step <= upper[k] ? step : -step;
                shifted[k] = x[k] + signedStep;
                double[] f1 = residuals.apply(shifted);
                for (int row = 0; row < f0.length; row++) {
                    jacobian.setEntry(row, k, (f1[row] - f0[row]) / signedStep);
                }
            }
            return new Pair<RealVector, RealMatrix>(new ArrayRealVector(f0, false), jacobian);
        };
    }

    private static ParameterValidator clampingValidator(double[] lower, double[] upper) {
        return params -> new ArrayRealVector(clamp(params.toArray(), lower, upper), false);
    }

    static double[] clamp(double[] x, double[] lower, double[] upper) {
        double[] clamped = new double[x.length];
        for (int k = 0; k < x.length; k++) {
            double value = Double.isNaN(x[k]) ? lower[k] : x[k];
            clamped[k] = Math.min(Math.max(value, lower[k]), upper[k]);
        }
        return clamped;
    }

    /**
     * Point reached by the optimizer, clamped into the box.
     */
    public record Solution(double[] point, int evaluations, int iterations) {
    }
}
