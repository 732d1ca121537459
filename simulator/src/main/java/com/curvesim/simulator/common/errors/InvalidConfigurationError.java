package com.curvesim.simulator.common.errors;

import com.curvesim.simulator.common.CurvesimError;

/**
 * Pool, sampler or coin configuration is invalid.
 */
public final class InvalidConfigurationError extends CurvesimError {

    public InvalidConfigurationError(final String details) {
        super("INVALID_CONFIGURATION", details);
    }
}
