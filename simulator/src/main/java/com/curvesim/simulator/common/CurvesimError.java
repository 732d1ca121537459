// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.curvesim.simulator.common;

/**
 * Base type for domain-level errors raised by the pool engines and the solver.
 */
public abstract class CurvesimError extends RuntimeException {

    private final String code;

    protected CurvesimError(final String code, final String message) {
        super(message);
        this.code = code;
    }

    protected CurvesimError(final String code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
