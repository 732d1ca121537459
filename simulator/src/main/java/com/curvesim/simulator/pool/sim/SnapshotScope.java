// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.pool.sim;

/**
 * Trial block over a pool: whatever happens inside a try-with-resources on this scope,
 * the pool is put back to the captured state on close.
 *
 * <pre>{@code
 * try (SnapshotScope ignored = pool.snapshot()) {
 *     pool.trade("DAI", "USDC", amount);
 *     error = pool.price("DAI", "USDC", true) - target;
 * }
 * }</pre>
 */
public final class SnapshotScope implements AutoCloseable {

    private final SimPool pool;
    private final PoolSnapshot snapshot;
    private boolean closed;

    SnapshotScope(SimPool pool, PoolSnapshot snapshot) {
        this.pool = pool;
        this.snapshot = snapshot;
    }

    public PoolSnapshot snapshot() {
        return snapshot;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.restoreSnapshot(snapshot);
    }
}
