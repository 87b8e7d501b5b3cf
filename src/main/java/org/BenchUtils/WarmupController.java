/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import java.util.concurrent.Callable;

/**
 * Runs a computation repeatedly, one execution per batch, before measurement starts, so that platform level
 * adaptive behavior (JIT compilation and deoptimization, cache population, branch predictor training) can
 * settle. All timings are discarded.
 * <p>
 * Warm-up ends when the accumulated execution time reaches the requested duration, or when the maximum
 * execution count is reached, whichever comes first. A computation slower than the whole warm-up duration is
 * therefore executed exactly once, and a zero duration skips warm-up altogether.
 * <p>
 * All times and time units are in nanoseconds
 */
public class WarmupController {
    private final ExecutionRunner runner;
    private final long maxExecutions;

    /**
     * @param runner the runner used to execute the computation
     * @param maxExecutions upper bound on the number of warm-up executions
     */
    public WarmupController(final ExecutionRunner runner, final long maxExecutions) {
        if (maxExecutions < 1) {
            throw new IllegalArgumentException("maxExecutions must be at least 1, was " + maxExecutions);
        }
        this.runner = runner;
        this.maxExecutions = maxExecutions;
    }

    /**
     * Warm up a computation.
     *
     * @param computation the computation to warm up
     * @param warmupDuration accumulated execution time to warm up for (0 to skip)
     * @return a summary of the executions performed
     * @throws ComputationFailureException if the computation throws
     */
    public WarmupSummary warmUp(final Callable<?> computation, final long warmupDuration) {
        if (warmupDuration < 0) {
            throw new IllegalArgumentException("warmupDuration must be >= 0, was " + warmupDuration);
        }
        long executions = 0;
        long elapsed = 0;
        while ((elapsed < warmupDuration) && (executions < maxExecutions)) {
            elapsed += runner.runBatch(computation, 1);
            executions++;
        }
        return new WarmupSummary(executions, elapsed);
    }
}
