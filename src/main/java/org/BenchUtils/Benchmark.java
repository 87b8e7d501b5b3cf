/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.HdrHistogram.DoubleHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A Benchmark measures the execution time of a zero-argument computation, and produces a
 * {@link BenchmarkResult} with descriptive statistics, outlier counts and bootstrap confidence intervals.
 * <p>
 * A run proceeds through the following phases:
 * <ol>
 * <li>CALIBRATING: only when no overhead estimate is available yet (see {@link OverheadCalibrator}), and the
 * configuration does not pin one.</li>
 * <li>WARMING_UP: the computation is executed, untimed, for the configured warm-up duration
 * (see {@link WarmupController}).</li>
 * <li>PLANNING: the batch size is chosen so that one sample's batch approximates the target sample duration
 * (see {@link SamplePlanner}). The batch size is fixed for the rest of the run.</li>
 * <li>SAMPLING: for each sample, quiescence is optionally requested, then one batch is timed and turned into
 * an overhead-corrected sample.</li>
 * <li>FINALIZING: quiescence is requested once more (and timed, as auxiliary data), and statistics are
 * computed.</li>
 * </ol>
 * Runs are single threaded and synchronous, and no timeout is applied to the computation. A Benchmark instance
 * runs exactly once; the process-wide overhead estimate outlives it.
 * <p>
 * If the computation throws, the run fails with a {@link ComputationFailureException}, and the samples
 * collected so far are discarded.
 * <p>
 * Benchmark objects can be instantiated using the fluent API builder supported by {@link Benchmark.Builder},
 * or run directly with {@link #run(Callable)} and {@link #run(Callable, BenchmarkConfiguration)}.
 */
public class Benchmark {
    private static final Logger log = LoggerFactory.getLogger(Benchmark.class);

    public enum Phase {IDLE, CALIBRATING, WARMING_UP, PLANNING, SAMPLING, FINALIZING, DONE, FAILED}

    // All times and time units are in nanoseconds

    static final double SAMPLE_RESOLUTION = 0.001;
    static final long SAMPLE_HISTOGRAM_RANGE = 100L * 1000 * 1000 * 1000 * 1000; // highest to lowest value ratio

    private final Callable<?> computation;
    private final BenchmarkConfiguration configuration;
    private final OverheadCalibrator overheadCalibrator;
    private final QuiescenceController quiescenceController;
    private final PauseDetector pauseDetector;
    private final Object environment;

    private final ExecutionRunner runner = new ExecutionRunner();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Phase phase = Phase.IDLE;

    /**
     * Benchmark a computation with default settings.
     *
     * @param computation the computation to measure
     * @return the benchmark result
     */
    public static BenchmarkResult run(final Callable<?> computation) {
        return Builder.create(computation).build().run();
    }

    /**
     * Benchmark a computation.
     *
     * @param computation the computation to measure
     * @param configuration the settings to run with
     * @return the benchmark result
     */
    public static BenchmarkResult run(final Callable<?> computation, final BenchmarkConfiguration configuration) {
        return Builder.create(computation).configuration(configuration).build().run();
    }

    /**
     * @param computation the computation to measure
     * @param configuration the settings to run with
     * @param overheadCalibrator the source of overhead estimates
     * @param quiescenceController the controller used to request quiescence between samples
     * @param pauseDetector pause detector to observe while sampling, or null for none
     * @param environment an environment description to pass through to the result, or null
     */
    public Benchmark(final Callable<?> computation,
                     final BenchmarkConfiguration configuration,
                     final OverheadCalibrator overheadCalibrator,
                     final QuiescenceController quiescenceController,
                     final PauseDetector pauseDetector,
                     final Object environment) {
        if (computation == null) {
            throw new IllegalArgumentException("computation must not be null");
        }
        if (configuration == null) {
            throw new InvalidConfigurationException("configuration must not be null");
        }
        this.computation = computation;
        this.configuration = configuration;
        this.overheadCalibrator = (overheadCalibrator != null) ? overheadCalibrator : OverheadCalibrator.processWide();
        this.quiescenceController = (quiescenceController != null) ? quiescenceController : new GcQuiescenceController();
        this.pauseDetector = pauseDetector;
        this.environment = environment;
    }

    /**
     * Run the benchmark.
     *
     * @return the result of the run
     * @throws ComputationFailureException if the computation throws
     * @throws IllegalStateException if this benchmark has already been run
     */
    public BenchmarkResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A Benchmark can only be run once, this one is " + phase);
        }
        try {
            BenchmarkResult result = execute();
            enter(Phase.DONE);
            return result;
        } catch (RuntimeException ex) {
            enter(Phase.FAILED);
            throw ex;
        } catch (Error err) {
            enter(Phase.FAILED);
            throw err;
        }
    }

    public Phase getPhase() {
        return phase;
    }

    public BenchmarkConfiguration getConfiguration() {
        return configuration;
    }

    private BenchmarkResult execute() {
        final OverheadEstimate overheadEstimate = resolveOverheadEstimate();
        final double overheadPerInvocation = overheadEstimate.getOverheadPerInvocation();

        enter(Phase.WARMING_UP);
        WarmupSummary warmupSummary = new WarmupController(runner, configuration.getMaxWarmupExecutions())
                .warmUp(computation, configuration.getWarmupDuration());

        enter(Phase.PLANNING);
        SamplePlan samplePlan = new SamplePlanner(runner, configuration.getInitialEstimateExecutions(),
                configuration.getMinimumBatchSize())
                .plan(computation, overheadPerInvocation, configuration.getTargetSampleDuration());
        if (samplePlan.isFallbackUsed()) {
            log.info("single execution too short to measure, falling back to a batch size of {}",
                    samplePlan.getBatchSize());
        }
        final long batchSize = samplePlan.getBatchSize();

        enter(Phase.SAMPLING);
        final int sampleCount = configuration.getSampleCount();
        final double[] samples = new double[sampleCount];
        final List<GarbageCollectorMXBean> collectors = ManagementFactory.getGarbageCollectorMXBeans();
        int samplesWithCollection = 0;

        PauseSummary pauseSummary = PauseSummary.NONE;
        PauseRecorder pauseRecorder = (pauseDetector != null) ? pauseDetector.startRecording() : null;
        try {
            for (int i = 0; i < sampleCount; i++) {
                if (configuration.isQuiescenceBeforeSample()) {
                    quiescenceController.requestQuiescence();
                }
                long collectionsBefore = GcQuiescenceController.totalCollectionCount(collectors);
                long rawBatchElapsed = runner.runBatch(computation, batchSize);
                if (GcQuiescenceController.totalCollectionCount(collectors) != collectionsBefore) {
                    samplesWithCollection++;
                }
                samples[i] = ExecutionRunner.sampleOf(rawBatchElapsed, batchSize, overheadPerInvocation);
            }
        } finally {
            if (pauseRecorder != null) {
                pauseSummary = pauseDetector.stopRecording(pauseRecorder);
            }
        }

        enter(Phase.FINALIZING);
        long postRunQuiescenceTime = TimeServices.measure(new Runnable() {
            @Override
            public void run() {
                quiescenceController.requestQuiescence();
            }
        });

        SampleStatistics statistics = SampleStatistics.of(samples);
        OutlierCounts outlierCounts = OutlierCounts.classify(statistics);

        Bootstrap bootstrap = (configuration.getBootstrapSeed() != null) ?
                new Bootstrap(configuration.getBootstrapResampleCount(), configuration.getBootstrapSeed()) :
                new Bootstrap(configuration.getBootstrapResampleCount());
        BootstrapEstimate meanEstimate = bootstrap.estimateMean(samples, configuration.getConfidenceLevel());
        BootstrapEstimate varianceEstimate = bootstrap.estimateVariance(samples, configuration.getConfidenceLevel());

        DoubleHistogram sampleHistogram = sampleHistogramOf(samples);

        EnumSet<BenchmarkWarning> warnings = EnumSet.noneOf(BenchmarkWarning.class);
        if (statistics.getMedian() == 0.0) {
            warnings.add(BenchmarkWarning.UNMEASURABLE_EXECUTION);
        }
        if (pauseSummary.getPauseCount() > 0) {
            warnings.add(BenchmarkWarning.PAUSES_DETECTED);
        }
        if (samplesWithCollection > 0) {
            warnings.add(BenchmarkWarning.COLLECTION_DURING_SAMPLING);
        }
        if (!warnings.isEmpty()) {
            log.warn("benchmark completed with warnings: {}", warnings);
        }

        return new BenchmarkResult(configuration, statistics, outlierCounts, meanEstimate, varianceEstimate,
                overheadEstimate, samplePlan, warmupSummary, postRunQuiescenceTime, pauseSummary,
                samplesWithCollection, warnings, sampleHistogram, environment);
    }

    /**
     * Record samples into a histogram covering {@link #SAMPLE_HISTOGRAM_RANGE} (1 psec to 100 sec). Samples
     * below {@link #SAMPLE_RESOLUTION} are residue of the floating point overhead correction, and are
     * recorded as zero.
     */
    static DoubleHistogram sampleHistogramOf(final double[] samples) {
        DoubleHistogram sampleHistogram = new DoubleHistogram(SAMPLE_HISTOGRAM_RANGE, 3);
        for (double sample : samples) {
            sampleHistogram.recordValue((sample < SAMPLE_RESOLUTION) ? 0.0 : sample);
        }
        return sampleHistogram;
    }

    private OverheadEstimate resolveOverheadEstimate() {
        Double pinnedOverhead = configuration.getPinnedOverhead();
        if (pinnedOverhead != null) {
            return OverheadEstimate.pinned(pinnedOverhead);
        }
        OverheadEstimate cached = overheadCalibrator.getCachedEstimate();
        if (cached != null) {
            return cached;
        }
        enter(Phase.CALIBRATING);
        return overheadCalibrator.estimateOverhead();
    }

    private void enter(final Phase newPhase) {
        log.debug("{} -> {}", phase, newPhase);
        phase = newPhase;
    }

    /**
     * A fluent API builder class for creating Benchmark objects.
     * <br>Uses the following defaults:
     * <ul>
     * <li>configuration:               {@link BenchmarkConfiguration#defaults()} </li>
     * <li>overheadCalibrator:          {@link OverheadCalibrator#processWide()} </li>
     * <li>quiescenceController:        a {@link GcQuiescenceController} with a 10 msec settle time </li>
     * <li>pauseDetector:               (none) </li>
     * <li>environment:                 (none) </li>
     * </ul>
     */
    public static class Builder {
        private final Callable<?> computation;
        private BenchmarkConfiguration configuration = null;
        private OverheadCalibrator overheadCalibrator = null;
        private QuiescenceController quiescenceController = null;
        private PauseDetector pauseDetector = null;
        private Object environment = null;

        public static Builder create(final Callable<?> computation) {
            return new Builder(computation);
        }

        public Builder(final Callable<?> computation) {
            this.computation = computation;
        }

        public Builder configuration(BenchmarkConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder overheadCalibrator(OverheadCalibrator overheadCalibrator) {
            this.overheadCalibrator = overheadCalibrator;
            return this;
        }

        public Builder quiescenceController(QuiescenceController quiescenceController) {
            this.quiescenceController = quiescenceController;
            return this;
        }

        public Builder pauseDetector(PauseDetector pauseDetector) {
            this.pauseDetector = pauseDetector;
            return this;
        }

        public Builder environment(Object environment) {
            this.environment = environment;
            return this;
        }

        public Benchmark build() {
            return new Benchmark(computation,
                    (configuration != null) ? configuration : BenchmarkConfiguration.defaults(),
                    overheadCalibrator,
                    quiescenceController,
                    pauseDetector,
                    environment);
        }
    }
}
