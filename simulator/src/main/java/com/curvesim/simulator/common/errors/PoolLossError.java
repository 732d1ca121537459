package com.curvesim.simulator.common.errors;

import com.curvesim.simulator.common.CurvesimError;

/**
 * The cryptoswap virtual price decreased between profit checkpoints.
 */
public final class PoolLossError extends CurvesimError {

    public PoolLossError(final String details) {
        super("POOL_LOSS", details);
    }
}
