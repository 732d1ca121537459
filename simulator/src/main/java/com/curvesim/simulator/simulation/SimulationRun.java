package com.curvesim.simulator.simulation;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All steps of one run, with the parameter combination the pool was configured with.
 */
public record SimulationRun(Map<String, BigInteger> parameters, List<StepRecord> steps) {

    public SimulationRun {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        steps = List.copyOf(steps);
    }

    public long degradedSteps() {
        return steps.stream().filter(StepRecord::degraded).count();
    }

    public int tradeCount() {
        return steps.stream().mapToInt(step -> step.trades().size()).sum();
    }
}
