package com.curvesim.simulator.common.errors;

import com.curvesim.simulator.common.CurvesimError;

/**
 * A snapshot could not be taken or restored.
 */
public final class SnapshotError extends CurvesimError {

    public SnapshotError(final String details) {
        super("SNAPSHOT_ERROR", details);
    }
}
