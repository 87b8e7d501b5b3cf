/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Non-parametric (percentile) bootstrap confidence intervals.
 * <p>
 * To estimate a statistic, {@code resampleCount} resamples are drawn, each the size of the original sample set
 * and formed by sampling from it with replacement. The statistic is computed on every resample, and the
 * interval bounds are the linearly interpolated {@code (1 - c) / 2} and {@code 1 - (1 - c) / 2} quantiles of
 * the resampled statistics, for a confidence level {@code c}. No normality assumption is made, which
 * suits execution time distributions: they are typically right-skewed, with occasional large outliers.
 * <p>
 * The point estimate is the statistic computed on the original samples. On small or heavily skewed sample
 * sets the percentile interval can exclude it; in that case the interval is widened to include it.
 * <p>
 * A Bootstrap instance owns its random source (a commons-math {@link Well19937c}), and is not thread safe.
 * Two instances created with the same seed produce the same resamples.
 */
public class Bootstrap {
    final static int DEFAULT_ResampleCount = 10000;

    private final int resampleCount;
    private final RandomGenerator random;

    /**
     * @param resampleCount number of resamples to draw per estimate (1000 or more recommended)
     * @param seed seed for the resampling random source
     */
    public Bootstrap(final int resampleCount, final long seed) {
        this(resampleCount, new Well19937c(seed));
    }

    /**
     * @param resampleCount number of resamples to draw per estimate (1000 or more recommended)
     */
    public Bootstrap(final int resampleCount) {
        this(resampleCount, new Well19937c());
    }

    private Bootstrap(final int resampleCount, final RandomGenerator random) {
        if (resampleCount < 1) {
            throw new IllegalArgumentException("resampleCount must be at least 1, was " + resampleCount);
        }
        this.resampleCount = resampleCount;
        this.random = random;
    }

    /**
     * Estimate the mean of a set of samples.
     *
     * @param samples the samples (at least 1)
     * @param confidenceLevel the confidence level of the interval, strictly between 0 and 1
     * @return the mean and its confidence interval
     */
    public BootstrapEstimate estimateMean(final double[] samples, final double confidenceLevel) {
        return estimate(samples, confidenceLevel, Statistic.MEAN);
    }

    /**
     * Estimate the variance of a set of samples.
     *
     * @param samples the samples (at least 2)
     * @param confidenceLevel the confidence level of the interval, strictly between 0 and 1
     * @return the variance and its confidence interval
     */
    public BootstrapEstimate estimateVariance(final double[] samples, final double confidenceLevel) {
        if (samples.length < 2) {
            throw new IllegalArgumentException("at least 2 samples are needed for a variance, got " + samples.length);
        }
        return estimate(samples, confidenceLevel, Statistic.VARIANCE);
    }

    private BootstrapEstimate estimate(final double[] samples, final double confidenceLevel,
                                       final Statistic statistic) {
        validateConfidenceLevel(confidenceLevel);
        if (samples.length < 1) {
            throw new IllegalArgumentException("cannot bootstrap an empty sample set");
        }
        double pointEstimate = statistic.compute(samples);

        final int n = samples.length;
        double[] resample = new double[n];
        double[] resampledStatistics = new double[resampleCount];
        for (int i = 0; i < resampleCount; i++) {
            for (int j = 0; j < n; j++) {
                resample[j] = samples[random.nextInt(n)];
            }
            resampledStatistics[i] = statistic.compute(resample);
        }

        double tail = (1.0 - confidenceLevel) / 2.0;
        double lowerBound = SampleStatistics.quantile(resampledStatistics, tail);
        double upperBound = SampleStatistics.quantile(resampledStatistics, 1.0 - tail);

        return new BootstrapEstimate(pointEstimate,
                Math.min(lowerBound, pointEstimate),
                Math.max(upperBound, pointEstimate),
                confidenceLevel, resampleCount);
    }

    static void validateConfidenceLevel(final double confidenceLevel) {
        if (!((confidenceLevel > 0.0) && (confidenceLevel < 1.0))) {
            throw new IllegalArgumentException("confidence level must be strictly between 0 and 1, was " +
                    confidenceLevel);
        }
    }

    public int getResampleCount() {
        return resampleCount;
    }

    private enum Statistic {
        MEAN {
            @Override
            double compute(double[] values) {
                return SampleStatistics.mean(values);
            }
        },
        VARIANCE {
            @Override
            double compute(double[] values) {
                return SampleStatistics.variance(values);
            }
        };

        abstract double compute(double[] values);
    }
}
