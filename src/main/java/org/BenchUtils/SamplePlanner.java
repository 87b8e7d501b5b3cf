/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import java.util.concurrent.Callable;

/**
 * Chooses how many executions make up one sample, so that each sample's batch runs for approximately the
 * target sample duration. Batching amortizes the clock's own cost over many executions.
 * <p>
 * The single-execution estimate is the median of a few overhead-corrected single-execution timings. The batch
 * size is computed once from that estimate and held fixed for the whole run: a run never switches batch size
 * between samples, which keeps samples comparable at the cost of not tracking drift in the computation's cost.
 * <p>
 * All times and time units are in nanoseconds
 */
public class SamplePlanner {
    // Clock resolution: estimates below one tick of nanoTime() are noise, not a measurement.
    final static double MINIMUM_MeasurableExecutionTime = 1.0;

    private final ExecutionRunner runner;
    private final int initialEstimateExecutions;
    private final long minimumBatchSize;

    /**
     * @param runner the runner used to time single executions
     * @param initialEstimateExecutions number of single-execution timings behind the initial estimate
     * @param minimumBatchSize batch size used when a single execution is too short to measure
     */
    public SamplePlanner(final ExecutionRunner runner, final int initialEstimateExecutions,
                         final long minimumBatchSize) {
        if (initialEstimateExecutions < 1) {
            throw new IllegalArgumentException("initialEstimateExecutions must be at least 1, was " +
                    initialEstimateExecutions);
        }
        if (minimumBatchSize < 1) {
            throw new IllegalArgumentException("minimumBatchSize must be at least 1, was " + minimumBatchSize);
        }
        this.runner = runner;
        this.initialEstimateExecutions = initialEstimateExecutions;
        this.minimumBatchSize = minimumBatchSize;
    }

    /**
     * Compute the batch size for a given single-execution estimate. This is a pure function.
     *
     * @param estimatedExecutionTime estimated duration of a single execution
     * @param targetSampleDuration desired elapsed time of one sample's batch
     * @param minimumBatchSize batch size to fall back to when the estimate is zero or unmeasurable
     * @return {@code max(1, round(targetSampleDuration / estimatedExecutionTime))}, or
     * {@code max(1, minimumBatchSize)} if the estimate is below the clock's resolution (1 nsec)
     */
    public static long planBatchSize(final double estimatedExecutionTime, final long targetSampleDuration,
                                     final long minimumBatchSize) {
        if (!isMeasurable(estimatedExecutionTime)) {
            return Math.max(1, minimumBatchSize);
        }
        long batchSize = Math.round(targetSampleDuration / estimatedExecutionTime);
        return Math.max(1, batchSize);
    }

    /**
     * Estimate a computation's single-execution time and plan the batch size for a run.
     *
     * @param computation the computation to plan for
     * @param overheadPerInvocation measurement overhead per invocation
     * @param targetSampleDuration desired elapsed time of one sample's batch
     * @return the plan for the run
     * @throws ComputationFailureException if the computation throws
     */
    public SamplePlan plan(final Callable<?> computation, final double overheadPerInvocation,
                           final long targetSampleDuration) {
        double[] singleExecutionTimes = new double[initialEstimateExecutions];
        for (int i = 0; i < initialEstimateExecutions; i++) {
            long rawElapsed = runner.runBatch(computation, 1);
            singleExecutionTimes[i] = ExecutionRunner.sampleOf(rawElapsed, 1, overheadPerInvocation);
        }
        double estimate = SampleStatistics.quantile(singleExecutionTimes, 0.5);
        boolean fallbackUsed = !isMeasurable(estimate);
        long batchSize = planBatchSize(estimate, targetSampleDuration, minimumBatchSize);
        return new SamplePlan(estimate, batchSize, fallbackUsed);
    }

    static boolean isMeasurable(final double estimatedExecutionTime) {
        return estimatedExecutionTime >= MINIMUM_MeasurableExecutionTime;
    }
}
