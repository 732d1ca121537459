package com.curvesim.simulator.common.errors;

import com.curvesim.simulator.common.CurvesimError;

/**
 * A value left the range the invariant math is validated for.
 */
public final class SafetyBoundError extends CurvesimError {

    public SafetyBoundError(final String details) {
        super("UNSAFE_VALUE", details);
    }
}
