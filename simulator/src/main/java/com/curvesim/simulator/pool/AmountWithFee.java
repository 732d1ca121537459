package com.curvesim.simulator.pool;

import java.math.BigInteger;

/**
 * Output of an exchange or single-coin withdrawal together with the fee charged,
 * both in native units of the output coin.
 */
public record AmountWithFee(BigInteger amount, BigInteger fee) {}
