/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.HdrHistogram.DoubleHistogram;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The outcome of one completed {@link Benchmark} run: the samples, their descriptive statistics, outlier
 * counts and bootstrap estimates, together with everything needed to judge the measurement's quality (the
 * overhead estimate and sample plan used, noise observed while sampling, and warnings).
 * <p>
 * Results are immutable. The bootstrap point estimates are the descriptive mean and variance of the same
 * samples.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class BenchmarkResult {
    private final BenchmarkConfiguration configuration;
    private final double[] samples;
    private final SampleStatistics statistics;
    private final OutlierCounts outlierCounts;
    private final BootstrapEstimate meanEstimate;
    private final BootstrapEstimate varianceEstimate;
    private final OverheadEstimate overheadEstimate;
    private final SamplePlan samplePlan;
    private final WarmupSummary warmupSummary;
    private final long postRunQuiescenceTime;
    private final PauseSummary pauseSummary;
    private final int samplesWithCollection;
    private final Set<BenchmarkWarning> warnings;
    private final DoubleHistogram sampleHistogram;
    private final Object environment;

    BenchmarkResult(final BenchmarkConfiguration configuration,
                    final SampleStatistics statistics,
                    final OutlierCounts outlierCounts,
                    final BootstrapEstimate meanEstimate,
                    final BootstrapEstimate varianceEstimate,
                    final OverheadEstimate overheadEstimate,
                    final SamplePlan samplePlan,
                    final WarmupSummary warmupSummary,
                    final long postRunQuiescenceTime,
                    final PauseSummary pauseSummary,
                    final int samplesWithCollection,
                    final EnumSet<BenchmarkWarning> warnings,
                    final DoubleHistogram sampleHistogram,
                    final Object environment) {
        this.configuration = configuration;
        this.samples = statistics.getSamples();
        this.statistics = statistics;
        this.outlierCounts = outlierCounts;
        this.meanEstimate = meanEstimate;
        this.varianceEstimate = varianceEstimate;
        this.overheadEstimate = overheadEstimate;
        this.samplePlan = samplePlan;
        this.warmupSummary = warmupSummary;
        this.postRunQuiescenceTime = postRunQuiescenceTime;
        this.pauseSummary = pauseSummary;
        this.samplesWithCollection = samplesWithCollection;
        this.warnings = Collections.unmodifiableSet(EnumSet.copyOf(warnings));
        this.sampleHistogram = sampleHistogram;
        this.environment = environment;
    }

    public BenchmarkConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return a copy of the samples (overhead-corrected mean time per execution), in collection order
     */
    public double[] getSamples() {
        return Arrays.copyOf(samples, samples.length);
    }

    public SampleStatistics getStatistics() {
        return statistics;
    }

    public double getMean() {
        return statistics.getMean();
    }

    public double getVariance() {
        return statistics.getVariance();
    }

    public double getStdDev() {
        return statistics.getStdDev();
    }

    public double quantile(final double p) {
        return statistics.quantile(p);
    }

    public OutlierCounts getOutlierCounts() {
        return outlierCounts;
    }

    public BootstrapEstimate getMeanEstimate() {
        return meanEstimate;
    }

    public BootstrapEstimate getVarianceEstimate() {
        return varianceEstimate;
    }

    public OverheadEstimate getOverheadEstimate() {
        return overheadEstimate;
    }

    public SamplePlan getSamplePlan() {
        return samplePlan;
    }

    public WarmupSummary getWarmupSummary() {
        return warmupSummary;
    }

    /**
     * @return time spent in the quiescence request made after all samples were collected. This is cleanup
     * cost left behind by the run, reported separately from (and never included in) the samples.
     */
    public long getPostRunQuiescenceTime() {
        return postRunQuiescenceTime;
    }

    public PauseSummary getPauseSummary() {
        return pauseSummary;
    }

    /**
     * @return number of samples during whose timed batch at least one garbage collection ran
     */
    public int getSamplesWithCollection() {
        return samplesWithCollection;
    }

    public Set<BenchmarkWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarning(final BenchmarkWarning warning) {
        return warnings.contains(warning);
    }

    /**
     * @return a copy of the sample distribution, for percentile distribution output
     */
    public DoubleHistogram getSampleHistogram() {
        return sampleHistogram.copy();
    }

    /**
     * @return the environment description attached to the benchmark, returned untouched (may be null)
     */
    public Object getEnvironment() {
        return environment;
    }

    @Override
    public String toString() {
        return "BenchmarkResult{mean=" + meanEstimate + ", variance=" + varianceEstimate + ", " + outlierCounts +
                ", " + samplePlan + ", " + overheadEstimate + ", warnings=" + warnings + "}";
    }
}
