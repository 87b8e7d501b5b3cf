/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * A point estimate of a statistic together with its bootstrap confidence interval.
 */
public final class BootstrapEstimate {
    private final double pointEstimate;
    private final double lowerBound;
    private final double upperBound;
    private final double confidenceLevel;
    private final int resampleCount;

    BootstrapEstimate(final double pointEstimate, final double lowerBound, final double upperBound,
                      final double confidenceLevel, final int resampleCount) {
        this.pointEstimate = pointEstimate;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.confidenceLevel = confidenceLevel;
        this.resampleCount = resampleCount;
    }

    /**
     * @return the statistic computed on the original samples
     */
    public double getPointEstimate() {
        return pointEstimate;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public int getResampleCount() {
        return resampleCount;
    }

    public double getWidth() {
        return upperBound - lowerBound;
    }

    public boolean contains(final double value) {
        return (value >= lowerBound) && (value <= upperBound);
    }

    @Override
    public String toString() {
        return "BootstrapEstimate{" + pointEstimate + " [" + lowerBound + ", " + upperBound + "] @ " +
                confidenceLevel + "}";
    }
}
