/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * The estimated measurement overhead of a single invocation through {@link ExecutionRunner}, either
 * calibrated by an {@link OverheadCalibrator} or pinned to a fixed value by the caller.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class OverheadEstimate {
    private final double overheadPerInvocation;
    private final long calibrationInvocations;
    private final long calibrationElapsed;
    private final boolean pinned;

    OverheadEstimate(final double overheadPerInvocation, final long calibrationInvocations,
                     final long calibrationElapsed, final boolean pinned) {
        this.overheadPerInvocation = overheadPerInvocation;
        this.calibrationInvocations = calibrationInvocations;
        this.calibrationElapsed = calibrationElapsed;
        this.pinned = pinned;
    }

    /**
     * Create an estimate pinned to a fixed value, e.g. to reproduce results measured in another process.
     *
     * @param overheadPerInvocation overhead per invocation, in nanoseconds
     * @return a pinned estimate
     */
    public static OverheadEstimate pinned(final double overheadPerInvocation) {
        if (!(overheadPerInvocation >= 0.0) || Double.isInfinite(overheadPerInvocation)) {
            throw new IllegalArgumentException("pinned overhead must be a finite value >= 0, was "
                    + overheadPerInvocation);
        }
        return new OverheadEstimate(overheadPerInvocation, 0, 0, true);
    }

    public double getOverheadPerInvocation() {
        return overheadPerInvocation;
    }

    /**
     * @return number of no-op invocations the estimate was calibrated with (0 for a pinned estimate)
     */
    public long getCalibrationInvocations() {
        return calibrationInvocations;
    }

    /**
     * @return wall time spent calibrating (0 for a pinned estimate)
     */
    public long getCalibrationElapsed() {
        return calibrationElapsed;
    }

    public boolean isPinned() {
        return pinned;
    }

    @Override
    public String toString() {
        return "OverheadEstimate{" + overheadPerInvocation + " nsec/invocation" +
                (pinned ? ", pinned" : ", calibrated over " + calibrationInvocations + " invocations") + "}";
    }
}
