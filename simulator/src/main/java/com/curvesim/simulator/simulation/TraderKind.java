package com.curvesim.simulator.simulation;

/**
 * Trading strategy applied at every step of a run.
 */
public enum TraderKind {
    /** Single most profitable trade per step, uncapped. */
    SIMPLE,
    /** Simultaneous trades on all pairs, capped by per-pair volume limits. */
    VOLUME_LIMITED
}
