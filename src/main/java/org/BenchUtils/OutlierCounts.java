/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * Counts of samples falling into each outlier category, relative to the interquartile range (IQR) of the
 * sample set:
 * <ul>
 * <li>low severe: below Q1 - 3 * IQR</li>
 * <li>low mild: in [Q1 - 3 * IQR, Q1 - 1.5 * IQR)</li>
 * <li>high mild: in (Q3 + 1.5 * IQR, Q3 + 3 * IQR]</li>
 * <li>high severe: above Q3 + 3 * IQR</li>
 * </ul>
 * All other samples are not outliers. Counts always sum to the number of samples. Outliers are only
 * counted, never removed: they describe the quality of a measurement, they do not correct it.
 */
public final class OutlierCounts {

    public enum Category {LOW_SEVERE, LOW_MILD, NONE, HIGH_MILD, HIGH_SEVERE}

    private final long[] counts = new long[Category.values().length];
    private final double lowSevereFence;
    private final double lowMildFence;
    private final double highMildFence;
    private final double highSevereFence;

    private OutlierCounts(final double firstQuartile, final double thirdQuartile) {
        double iqr = thirdQuartile - firstQuartile;
        this.lowSevereFence = firstQuartile - (3.0 * iqr);
        this.lowMildFence = firstQuartile - (1.5 * iqr);
        this.highMildFence = thirdQuartile + (1.5 * iqr);
        this.highSevereFence = thirdQuartile + (3.0 * iqr);
    }

    /**
     * Classify the samples described by a {@link SampleStatistics}.
     *
     * @param statistics the statistics of the samples to classify
     * @return the outlier counts of the samples
     */
    public static OutlierCounts classify(final SampleStatistics statistics) {
        OutlierCounts outlierCounts =
                new OutlierCounts(statistics.getFirstQuartile(), statistics.getThirdQuartile());
        for (double sample : statistics.getSortedSamples()) {
            outlierCounts.counts[outlierCounts.categorize(sample).ordinal()]++;
        }
        return outlierCounts;
    }

    /**
     * Classify a set of samples.
     *
     * @param samples the samples to classify (at least 2)
     * @return the outlier counts of the samples
     */
    public static OutlierCounts classify(final double[] samples) {
        return classify(SampleStatistics.of(samples));
    }

    /**
     * @param value a value
     * @return the category {@code value} falls into under this set's fences
     */
    public Category categorize(final double value) {
        if (value < lowSevereFence) {
            return Category.LOW_SEVERE;
        }
        if (value < lowMildFence) {
            return Category.LOW_MILD;
        }
        if (value > highSevereFence) {
            return Category.HIGH_SEVERE;
        }
        if (value > highMildFence) {
            return Category.HIGH_MILD;
        }
        return Category.NONE;
    }

    public long getCount(final Category category) {
        return counts[category.ordinal()];
    }

    public long getLowSevere() {
        return getCount(Category.LOW_SEVERE);
    }

    public long getLowMild() {
        return getCount(Category.LOW_MILD);
    }

    public long getNone() {
        return getCount(Category.NONE);
    }

    public long getHighMild() {
        return getCount(Category.HIGH_MILD);
    }

    public long getHighSevere() {
        return getCount(Category.HIGH_SEVERE);
    }

    /**
     * @return the number of samples that are outliers of any kind
     */
    public long getOutliers() {
        return getTotal() - getNone();
    }

    public long getTotal() {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }

    public double getLowSevereFence() {
        return lowSevereFence;
    }

    public double getLowMildFence() {
        return lowMildFence;
    }

    public double getHighMildFence() {
        return highMildFence;
    }

    public double getHighSevereFence() {
        return highSevereFence;
    }

    @Override
    public String toString() {
        return "OutlierCounts{lowSevere=" + getLowSevere() + ", lowMild=" + getLowMild() +
                ", none=" + getNone() + ", highMild=" + getHighMild() + ", highSevere=" + getHighSevere() + "}";
    }
}
