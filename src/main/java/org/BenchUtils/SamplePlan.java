/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * The batch size chosen for a benchmark run, together with the single-execution estimate it was derived
 * from. The batch size is held fixed for every sample of the run.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class SamplePlan {
    private final double estimatedExecutionTime;
    private final long batchSize;
    private final boolean fallbackUsed;

    SamplePlan(final double estimatedExecutionTime, final long batchSize, final boolean fallbackUsed) {
        this.estimatedExecutionTime = estimatedExecutionTime;
        this.batchSize = batchSize;
        this.fallbackUsed = fallbackUsed;
    }

    /**
     * @return the overhead-corrected estimate of a single execution's duration
     */
    public double getEstimatedExecutionTime() {
        return estimatedExecutionTime;
    }

    public long getBatchSize() {
        return batchSize;
    }

    /**
     * @return true if a single execution was too short to measure and the minimum batch size was used instead
     */
    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    @Override
    public String toString() {
        return "SamplePlan{batchSize=" + batchSize + ", estimatedExecutionTime=" + estimatedExecutionTime +
                " nsec" + (fallbackUsed ? ", fallback" : "") + "}";
    }
}
