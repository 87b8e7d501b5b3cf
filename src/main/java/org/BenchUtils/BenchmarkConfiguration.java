/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import java.util.concurrent.TimeUnit;

/**
 * The settings a {@link Benchmark} runs under. Instances are immutable, and are created with the fluent
 * {@link Builder}, which validates every setting when {@link Builder#build()} is called.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class BenchmarkConfiguration {
    private final long warmupDuration;
    private final long targetSampleDuration;
    private final int sampleCount;
    private final boolean quiescenceBeforeSample;
    private final double confidenceLevel;
    private final int bootstrapResampleCount;
    private final Double pinnedOverhead;
    private final long minimumBatchSize;
    private final long maxWarmupExecutions;
    private final int initialEstimateExecutions;
    private final Long bootstrapSeed;

    private BenchmarkConfiguration(final Builder builder) {
        this.warmupDuration = builder.warmupDuration;
        this.targetSampleDuration = builder.targetSampleDuration;
        this.sampleCount = builder.sampleCount;
        this.quiescenceBeforeSample = builder.quiescenceBeforeSample;
        this.confidenceLevel = builder.confidenceLevel;
        this.bootstrapResampleCount = builder.bootstrapResampleCount;
        this.pinnedOverhead = builder.pinnedOverhead;
        this.minimumBatchSize = builder.minimumBatchSize;
        this.maxWarmupExecutions = builder.maxWarmupExecutions;
        this.initialEstimateExecutions = builder.initialEstimateExecutions;
        this.bootstrapSeed = builder.bootstrapSeed;
    }

    /**
     * @return a configuration with all default settings (see {@link Builder})
     */
    public static BenchmarkConfiguration defaults() {
        return new Builder().build();
    }

    /**
     * @return how long to warm up for, as accumulated execution time (0 to skip warm-up)
     */
    public long getWarmupDuration() {
        return warmupDuration;
    }

    /**
     * @return desired elapsed time of the batch behind each sample
     */
    public long getTargetSampleDuration() {
        return targetSampleDuration;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * @return true if quiescence is requested before every sample
     */
    public boolean isQuiescenceBeforeSample() {
        return quiescenceBeforeSample;
    }

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    public int getBootstrapResampleCount() {
        return bootstrapResampleCount;
    }

    /**
     * @return the overhead per invocation to use instead of a calibrated one, or null if none was pinned
     */
    public Double getPinnedOverhead() {
        return pinnedOverhead;
    }

    public long getMinimumBatchSize() {
        return minimumBatchSize;
    }

    public long getMaxWarmupExecutions() {
        return maxWarmupExecutions;
    }

    public int getInitialEstimateExecutions() {
        return initialEstimateExecutions;
    }

    /**
     * @return the seed used for bootstrap resampling, or null for a randomly seeded bootstrap
     */
    public Long getBootstrapSeed() {
        return bootstrapSeed;
    }

    @Override
    public String toString() {
        return "BenchmarkConfiguration{" +
                "warmupDuration=" + warmupDuration +
                ", targetSampleDuration=" + targetSampleDuration +
                ", sampleCount=" + sampleCount +
                ", quiescenceBeforeSample=" + quiescenceBeforeSample +
                ", confidenceLevel=" + confidenceLevel +
                ", bootstrapResampleCount=" + bootstrapResampleCount +
                ", pinnedOverhead=" + pinnedOverhead +
                ", minimumBatchSize=" + minimumBatchSize +
                ", maxWarmupExecutions=" + maxWarmupExecutions +
                ", initialEstimateExecutions=" + initialEstimateExecutions +
                ", bootstrapSeed=" + bootstrapSeed +
                '}';
    }

    /**
     * A fluent API builder class for creating BenchmarkConfiguration objects.
     * <br>Uses the following defaults:
     * <ul>
     * <li>warmupDuration:                  1000000000L (1 sec) </li>
     * <li>targetSampleDuration:            10000000L (10 msec) </li>
     * <li>sampleCount:                     100 </li>
     * <li>quiescenceBeforeSample:          true </li>
     * <li>confidenceLevel:                 0.95 </li>
     * <li>bootstrapResampleCount:          10000 </li>
     * <li>pinnedOverhead:                  (none, use the calibrated overhead) </li>
     * <li>minimumBatchSize:                1000 </li>
     * <li>maxWarmupExecutions:             1000000 </li>
     * <li>initialEstimateExecutions:       10 </li>
     * <li>bootstrapSeed:                   (none, randomly seeded) </li>
     * </ul>
     */
    public static class Builder {
        private long warmupDuration = 1000000000L; /* 1 sec */
        private long targetSampleDuration = 10000000L; /* 10 msec */
        private int sampleCount = 100;
        private boolean quiescenceBeforeSample = true;
        private double confidenceLevel = 0.95;
        private int bootstrapResampleCount = Bootstrap.DEFAULT_ResampleCount;
        private Double pinnedOverhead = null;
        private long minimumBatchSize = 1000;
        private long maxWarmupExecutions = 1000000L;
        private int initialEstimateExecutions = 10;
        private Long bootstrapSeed = null;

        public static Builder create() {
            return new Builder();
        }

        /**
         * A preset for a fast, rough measurement: 100 msec of warm-up, 20 samples of 1 msec each, and 1000
         * bootstrap resamples.
         *
         * @return a builder preset for quick runs
         */
        public static Builder quick() {
            return new Builder()
                    .warmupDuration(100, TimeUnit.MILLISECONDS)
                    .targetSampleDuration(1, TimeUnit.MILLISECONDS)
                    .sampleCount(20)
                    .bootstrapResampleCount(1000);
        }

        /**
         * A preset for a careful measurement: 5 sec of warm-up, 300 samples of 50 msec each, and 10000
         * bootstrap resamples.
         *
         * @return a builder preset for thorough runs
         */
        public static Builder thorough() {
            return new Builder()
                    .warmupDuration(5, TimeUnit.SECONDS)
                    .targetSampleDuration(50, TimeUnit.MILLISECONDS)
                    .sampleCount(300)
                    .bootstrapResampleCount(10000);
        }

        public Builder() {

        }

        public Builder warmupDuration(long warmupDuration, TimeUnit unit) {
            this.warmupDuration = unit.toNanos(warmupDuration);
            return this;
        }

        public Builder targetSampleDuration(long targetSampleDuration, TimeUnit unit) {
            this.targetSampleDuration = unit.toNanos(targetSampleDuration);
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder enableQuiescenceBeforeSample(boolean quiescenceBeforeSample) {
            this.quiescenceBeforeSample = quiescenceBeforeSample;
            return this;
        }

        public Builder confidenceLevel(double confidenceLevel) {
            this.confidenceLevel = confidenceLevel;
            return this;
        }

        public Builder bootstrapResampleCount(int bootstrapResampleCount) {
            this.bootstrapResampleCount = bootstrapResampleCount;
            return this;
        }

        /**
         * Pin the overhead per invocation for runs with this configuration. Such runs neither calibrate nor
         * touch the process-wide overhead estimate.
         *
         * @param overheadPerInvocation overhead per invocation, in nanoseconds
         * @return this builder
         */
        public Builder pinnedOverhead(double overheadPerInvocation) {
            this.pinnedOverhead = overheadPerInvocation;
            return this;
        }

        public Builder minimumBatchSize(long minimumBatchSize) {
            this.minimumBatchSize = minimumBatchSize;
            return this;
        }

        public Builder maxWarmupExecutions(long maxWarmupExecutions) {
            this.maxWarmupExecutions = maxWarmupExecutions;
            return this;
        }

        public Builder initialEstimateExecutions(int initialEstimateExecutions) {
            this.initialEstimateExecutions = initialEstimateExecutions;
            return this;
        }

        public Builder bootstrapSeed(long bootstrapSeed) {
            this.bootstrapSeed = bootstrapSeed;
            return this;
        }

        /**
         * @return a validated configuration
         * @throws InvalidConfigurationException if any setting is out of range
         */
        public BenchmarkConfiguration build() {
            if (sampleCount < 2) {
                throw new InvalidConfigurationException("sampleCount must be at least 2, was " + sampleCount);
            }
            if (targetSampleDuration <= 0) {
                throw new InvalidConfigurationException("targetSampleDuration must be positive, was " +
                        targetSampleDuration);
            }
            if (warmupDuration < 0) {
                throw new InvalidConfigurationException("warmupDuration must be >= 0, was " + warmupDuration);
            }
            if (!((confidenceLevel > 0.0) && (confidenceLevel < 1.0))) {
                throw new InvalidConfigurationException("confidenceLevel must be strictly between 0 and 1, was " +
                        confidenceLevel);
            }
            if (bootstrapResampleCount < 1) {
                throw new InvalidConfigurationException("bootstrapResampleCount must be at least 1, was " +
                        bootstrapResampleCount);
            }
            if ((pinnedOverhead != null) &&
                    (!(pinnedOverhead >= 0.0) || Double.isInfinite(pinnedOverhead))) {
                throw new InvalidConfigurationException("pinnedOverhead must be a finite value >= 0, was " +
                        pinnedOverhead);
            }
            if (minimumBatchSize < 1) {
                throw new InvalidConfigurationException("minimumBatchSize must be at least 1, was " +
                        minimumBatchSize);
            }
            if (maxWarmupExecutions < 1) {
                throw new InvalidConfigurationException("maxWarmupExecutions must be at least 1, was " +
                        maxWarmupExecutions);
            }
            if (initialEstimateExecutions < 1) {
                throw new InvalidConfigurationException("initialEstimateExecutions must be at least 1, was " +
                        initialEstimateExecutions);
            }
            return new BenchmarkConfiguration(this);
        }
    }
}
