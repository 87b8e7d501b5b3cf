/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Arrays;

/**
 * Descriptive statistics of a set of samples: mean, Bessel-corrected (n - 1) variance, standard deviation,
 * and linearly interpolated quantiles.
 * <p>
 * Moments come from commons-math {@link DescriptiveStatistics}, computed over the samples in insertion order,
 * so they are bit-identical to {@link #mean(double[])} and {@link #variance(double[])}. Quantiles use the
 * {@link EstimationType#R_7} estimator.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class SampleStatistics {
    private final double[] samples;
    private final double[] sortedSamples;
    private final double mean;
    private final double variance;
    private final double stdDev;

    private SampleStatistics(final DescriptiveStatistics descriptive) {
        this.samples = descriptive.getValues();
        this.sortedSamples = descriptive.getSortedValues();
        this.mean = descriptive.getMean();
        this.variance = descriptive.getVariance();
        this.stdDev = descriptive.getStandardDeviation();
    }

    /**
     * Compute the statistics of a set of samples.
     *
     * @param samples the samples (at least 2, all finite). Not modified.
     * @return the statistics of {@code samples}
     */
    public static SampleStatistics of(final double[] samples) {
        if (samples.length < 2) {
            throw new IllegalArgumentException("at least 2 samples are needed, got " + samples.length);
        }
        for (double sample : samples) {
            if (Double.isNaN(sample) || Double.isInfinite(sample)) {
                throw new IllegalArgumentException("samples must be finite, found " + sample);
            }
        }
        return new SampleStatistics(new DescriptiveStatistics(samples));
    }

    /**
     * @param values values to average (at least 1)
     * @return the arithmetic mean of {@code values}
     */
    public static double mean(final double[] values) {
        if (values.length < 1) {
            throw new IllegalArgumentException("cannot compute the mean of no values");
        }
        return StatUtils.mean(values);
    }

    /**
     * @param values values (at least 2)
     * @return the sample variance of {@code values}, divided by {@code n - 1}
     */
    public static double variance(final double[] values) {
        if (values.length < 2) {
            throw new IllegalArgumentException("at least 2 values are needed for a variance, got " + values.length);
        }
        return StatUtils.variance(values);
    }

    /**
     * Linear interpolation quantile: for a fraction {@code p}, the value at (zero based) index
     * {@code p * (length - 1)} of the sorted values, interpolated between the neighboring floor and ceiling
     * indices.
     *
     * @param values values, in any order (at least 1). Not modified.
     * @param p the fraction, in [0, 1]
     * @return the {@code p} quantile of {@code values}
     */
    public static double quantile(final double[] values, final double p) {
        if (values.length < 1) {
            throw new IllegalArgumentException("cannot compute a quantile of no values");
        }
        if (!((p >= 0.0) && (p <= 1.0))) {
            throw new IllegalArgumentException("quantile fraction must be in [0, 1], was " + p);
        }
        if (p == 0.0) {
            // Percentile only accepts (0, 100]
            return StatUtils.min(values);
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p * 100.0);
    }

    public double quantile(final double p) {
        return quantile(sortedSamples, p);
    }

    public int getCount() {
        return sortedSamples.length;
    }

    public double getMean() {
        return mean;
    }

    public double getVariance() {
        return variance;
    }

    public double getStdDev() {
        return stdDev;
    }

    /**
     * @return standard deviation relative to the mean, or NaN if the mean is zero
     */
    public double getRelativeStdDev() {
        if (mean == 0.0) {
            return Double.NaN;
        }
        return stdDev / mean;
    }

    public double getMin() {
        return sortedSamples[0];
    }

    public double getMax() {
        return sortedSamples[sortedSamples.length - 1];
    }

    public double getMedian() {
        return quantile(0.5);
    }

    public double getFirstQuartile() {
        return quantile(0.25);
    }

    public double getThirdQuartile() {
        return quantile(0.75);
    }

    public double getInterquartileRange() {
        return getThirdQuartile() - getFirstQuartile();
    }

    /**
     * @return a copy of the samples, in insertion order
     */
    public double[] getSamples() {
        return Arrays.copyOf(samples, samples.length);
    }

    /**
     * @return a copy of the samples, in ascending order
     */
    public double[] getSortedSamples() {
        return Arrays.copyOf(sortedSamples, sortedSamples.length);
    }

    @Override
    public String toString() {
        return "SampleStatistics{count=" + sortedSamples.length + ", mean=" + mean + ", stdDev=" + stdDev +
                ", min=" + getMin() + ", median=" + getMedian() + ", max=" + getMax() + "}";
    }
}
