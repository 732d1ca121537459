package com.curvesim.simulator.common.errors;

import com.curvesim.simulator.common.CurvesimError;

/**
 * An iterative solver exhausted its iteration cap.
 */
public final class ConvergenceError extends CurvesimError {

    public ConvergenceError(final String details) {
        super("CONVERGENCE_FAILURE", details);
    }
}
