package com.curvesim.simulator.pool.sim;

import java.util.Objects;

/**
 * Immutable copy of a pool's mutable state, tagged with the pool it was taken from.
 */
public record PoolSnapshot(SimPool owner, Record state) {

    public PoolSnapshot {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(state, "state");
    }
}
