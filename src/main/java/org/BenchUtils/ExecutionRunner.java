/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import java.util.concurrent.Callable;

/**
 * Executes a computation {@code n} times in a single timed region. One such batch is the unit from which a
 * sample is derived.
 * <p>
 * Every return value is compared against a sentinel object read from a volatile field, and the last
 * return value is published to a volatile field once the timed region ends. Since the sentinel is unknown
 * to the compiler and the published value is observable by other threads, the computation's calls cannot be
 * eliminated as dead code. The comparison never succeeds, so it costs a compare and a (well predicted)
 * branch per execution.
 * <p>
 * All times and time units are in nanoseconds
 */
public class ExecutionRunner {
    private volatile Object sentinel = new Object();
    private volatile Object lastResult;
    private volatile long sentinelHits;

    /**
     * Run a batch of executions of {@code computation} and return the raw elapsed time of the whole batch.
     * No overhead correction is applied.
     *
     * @param computation the computation to execute
     * @param n number of executions in the batch (at least 1)
     * @return raw elapsed time of the batch, in nanoseconds
     * @throws ComputationFailureException if the computation throws
     */
    public long runBatch(final Callable<?> computation, final long n) {
        if (n < 1) {
            throw new IllegalArgumentException("batch size must be at least 1, was " + n);
        }
        final Object localSentinel = sentinel;
        Object result = null;
        long hits = 0;
        long completed = 0;

        long startTime = TimeServices.nanoTime();
        try {
            for (; completed < n; completed++) {
                result = computation.call();
                if (result == localSentinel) {
                    hits++;
                }
            }
        } catch (Exception ex) {
            throw new ComputationFailureException(completed, ex);
        }
        long elapsed = TimeServices.nanoTime() - startTime;

        lastResult = result;
        if (hits != 0) {
            sentinelHits += hits;
        }
        return elapsed;
    }

    /**
     * Derive a sample (the overhead-corrected mean time of one execution) from a batch measurement.
     *
     * @param rawBatchElapsed raw elapsed time of the batch
     * @param n number of executions in the batch
     * @param overheadPerInvocation estimated measurement overhead of a single invocation
     * @return {@code (rawBatchElapsed - overheadPerInvocation * n) / n}, floored at zero
     */
    public static double sampleOf(final long rawBatchElapsed, final long n, final double overheadPerInvocation) {
        if (n < 1) {
            throw new IllegalArgumentException("batch size must be at least 1, was " + n);
        }
        double corrected = (rawBatchElapsed - (overheadPerInvocation * n)) / n;
        return Math.max(corrected, 0.0);
    }

    /**
     * @return the value returned by the last execution of the most recent batch
     */
    Object getLastResult() {
        return lastResult;
    }

    long getSentinelHits() {
        return sentinelHits;
    }
}
