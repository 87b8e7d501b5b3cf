/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JUnit test for {@link Benchmark}
 */
public class BenchmarkTest {

    static {
        System.setProperty("BenchUtils.useActualTime", "false");
    }

    static final long DELAY = 1000L; // 1 usec per execution

    static class CountingQuiescenceController extends QuiescenceController {
        final AtomicInteger requests = new AtomicInteger();

        @Override
        public void requestQuiescence() {
            requests.incrementAndGet();
        }
    }

    static BenchmarkConfiguration.Builder fixedDelayConfiguration() {
        return BenchmarkConfiguration.Builder.create()
                .warmupDuration(20 * DELAY, TimeUnit.NANOSECONDS)
                .targetSampleDuration(5 * DELAY, TimeUnit.NANOSECONDS)
                .sampleCount(10)
                .initialEstimateExecutions(5)
                .bootstrapResampleCount(1000)
                .bootstrapSeed(42L)
                .pinnedOverhead(0.0);
    }

    @Test
    public void testFixedDelayComputation() throws Exception {
        FixedDelayComputation computation = new FixedDelayComputation(DELAY);
        CountingQuiescenceController quiescence = new CountingQuiescenceController();

        Benchmark benchmark = Benchmark.Builder.create(computation)
                .configuration(fixedDelayConfiguration().build())
                .quiescenceController(quiescence)
                .build();
        Assert.assertEquals(Benchmark.Phase.IDLE, benchmark.getPhase());

        BenchmarkResult result = benchmark.run();

        Assert.assertEquals(Benchmark.Phase.DONE, benchmark.getPhase());
        Assert.assertEquals(20, result.getWarmupSummary().getExecutions());
        Assert.assertEquals(5, result.getSamplePlan().getBatchSize());
        Assert.assertEquals(DELAY, result.getSamplePlan().getEstimatedExecutionTime(), 0.0);
        Assert.assertEquals("warm-up, initial estimate and 10 batches of 5", 20 + 5 + 50, computation.getInvocations());

        double[] samples = result.getSamples();
        Assert.assertEquals(10, samples.length);
        for (double sample : samples) {
            Assert.assertEquals(DELAY, sample, 0.0);
        }
        Assert.assertEquals(DELAY, result.getMean(), 0.0);
        Assert.assertEquals(0.0, result.getVariance(), 0.0);
        Assert.assertEquals(DELAY, result.quantile(0.5), 0.0);
        Assert.assertEquals(10, result.getOutlierCounts().getNone());

        Assert.assertEquals(result.getMean(), result.getMeanEstimate().getPointEstimate(), 0.0);
        Assert.assertEquals(result.getVariance(), result.getVarianceEstimate().getPointEstimate(), 0.0);
        Assert.assertTrue(result.getMeanEstimate().contains(DELAY));
        Assert.assertEquals(0.95, result.getMeanEstimate().getConfidenceLevel(), 0.0);

        Assert.assertTrue(result.getOverheadEstimate().isPinned());
        Assert.assertEquals(0.0, result.getOverheadEstimate().getOverheadPerInvocation(), 0.0);
        Assert.assertFalse(result.hasWarning(BenchmarkWarning.UNMEASURABLE_EXECUTION));
        Assert.assertFalse(result.hasWarning(BenchmarkWarning.PAUSES_DETECTED));
        Assert.assertEquals(0, result.getPauseSummary().getPauseCount());
        Assert.assertEquals(10, result.getSampleHistogram().getTotalCount());
        Assert.assertEquals(DELAY, result.getSampleHistogram().getMean(), DELAY * 0.01);
    }

    @Test
    public void testOverheadIsSubtractedFromSamples() throws Exception {
        BenchmarkResult result = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(fixedDelayConfiguration().pinnedOverhead(100.0).build())
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        // Estimate is 900 nsec, so round(5000 / 900) = 6 executions per batch:
        Assert.assertEquals(6, result.getSamplePlan().getBatchSize());
        Assert.assertEquals(900.0, result.getMean(), 1e-9);
    }

    @Test
    public void testQuiescenceBeforeEachSampleWhenEnabled() throws Exception {
        CountingQuiescenceController quiescence = new CountingQuiescenceController();
        Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(fixedDelayConfiguration().enableQuiescenceBeforeSample(true).build())
                .quiescenceController(quiescence)
                .build()
                .run();

        Assert.assertEquals("one request per sample, plus one after sampling", 11, quiescence.requests.get());
    }

    @Test
    public void testQuiescenceBeforeEachSampleCanBeDisabled() throws Exception {
        CountingQuiescenceController quiescence = new CountingQuiescenceController();
        BenchmarkResult result = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(fixedDelayConfiguration().enableQuiescenceBeforeSample(false).build())
                .quiescenceController(quiescence)
                .build()
                .run();

        Assert.assertEquals("only the post-sampling request should be made", 1, quiescence.requests.get());
        Assert.assertFalse(result.getConfiguration().isQuiescenceBeforeSample());
    }

    @Test
    public void testOutliersAreCountedNotRemoved() throws Exception {
        final AtomicLong invocations = new AtomicLong();
        Callable<Long> computation = new Callable<Long>() {
            @Override
            public Long call() throws Exception {
                long invocation = invocations.incrementAndGet();
                // Invocations 1-3 form the initial estimate, 4-13 are the (single execution) samples:
                TimeServices.moveTimeForward((invocation == 8) ? 100 * DELAY : DELAY);
                return invocation;
            }
        };

        BenchmarkResult result = Benchmark.Builder.create(computation)
                .configuration(fixedDelayConfiguration()
                        .warmupDuration(0, TimeUnit.NANOSECONDS)
                        .initialEstimateExecutions(3)
                        .targetSampleDuration(DELAY, TimeUnit.NANOSECONDS)
                        .build())
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        Assert.assertEquals(0, result.getWarmupSummary().getExecutions());
        Assert.assertEquals(1, result.getSamplePlan().getBatchSize());
        Assert.assertEquals(10, result.getSamples().length);
        Assert.assertEquals(100 * DELAY, result.getStatistics().getMax(), 0.0);
        Assert.assertEquals(1, result.getOutlierCounts().getHighSevere());
        Assert.assertEquals(9, result.getOutlierCounts().getNone());
        Assert.assertEquals((9 * DELAY + 100 * DELAY) / 10.0, result.getMean(), 1e-9);
        Assert.assertTrue(result.getMeanEstimate().contains(result.getMean()));
        Assert.assertTrue(result.getVarianceEstimate().getPointEstimate() > 0.0);
    }

    @Test
    public void testComputationUnmeasurableEvenInFallbackBatchesWarns() throws Exception {
        BenchmarkResult result = Benchmark.Builder.create(new FixedDelayComputation(0L))
                .configuration(fixedDelayConfiguration()
                        .minimumBatchSize(100)
                        .maxWarmupExecutions(10)
                        .build())
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        Assert.assertTrue(result.getSamplePlan().isFallbackUsed());
        Assert.assertEquals(100, result.getSamplePlan().getBatchSize());
        Assert.assertEquals(10, result.getWarmupSummary().getExecutions());
        Assert.assertTrue(result.hasWarning(BenchmarkWarning.UNMEASURABLE_EXECUTION));
        Assert.assertEquals(0.0, result.getStatistics().getMedian(), 0.0);
        Assert.assertEquals(0.0, result.getMean(), 0.0);
        Assert.assertEquals(10, result.getSamples().length);
    }

    @Test
    public void testFallbackBatchThatMeasuresCleanlyDoesNotWarn() throws Exception {
        final AtomicLong invocations = new AtomicLong();
        Callable<Long> computation = new Callable<Long>() {
            @Override
            public Long call() throws Exception {
                long invocation = invocations.incrementAndGet();
                // The 5 single executions of the initial estimate read as 0 nsec, later ones take 1 nsec:
                if (invocation > 5) {
                    TimeServices.moveTimeForward(1L);
                }
                return invocation;
            }
        };

        BenchmarkResult result = Benchmark.Builder.create(computation)
                .configuration(fixedDelayConfiguration()
                        .warmupDuration(0, TimeUnit.NANOSECONDS)
                        .sampleCount(5)
                        .minimumBatchSize(100)
                        .build())
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        Assert.assertTrue(result.getSamplePlan().isFallbackUsed());
        Assert.assertEquals(100, result.getSamplePlan().getBatchSize());
        Assert.assertEquals(1.0, result.getMean(), 0.0);
        Assert.assertEquals(1.0, result.getStatistics().getMedian(), 0.0);
        Assert.assertFalse(result.hasWarning(BenchmarkWarning.UNMEASURABLE_EXECUTION));
    }

    @Test
    public void testOverheadCorrectionResidueDoesNotBreakSampleHistogram() throws Exception {
        final AtomicLong invocations = new AtomicLong();
        Callable<Long> computation = new Callable<Long>() {
            @Override
            public Long call() throws Exception {
                long invocation = invocations.incrementAndGet();
                // Invocations 1-5 form the initial estimate, then samples are batches of 100 starting at 6.
                // Batches alternately take 29 nsec and 129 nsec in total:
                if ((invocation > 5) && ((invocation - 6) % 100 == 0)) {
                    long sampleIndex = (invocation - 6) / 100;
                    TimeServices.moveTimeForward((sampleIndex % 2 == 0) ? 29L : 129L);
                }
                return invocation;
            }
        };

        BenchmarkResult result = Benchmark.Builder.create(computation)
                .configuration(fixedDelayConfiguration()
                        .warmupDuration(0, TimeUnit.NANOSECONDS)
                        .pinnedOverhead(0.29)
                        .minimumBatchSize(100)
                        .build())
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        Assert.assertEquals(100, result.getSamplePlan().getBatchSize());
        // 29 - (0.29 * 100) leaves floating point residue, not an exact 0:
        Assert.assertTrue(result.getStatistics().getMin() < Benchmark.SAMPLE_RESOLUTION);
        Assert.assertEquals(1.0, result.getStatistics().getMax(), 1e-9);
        Assert.assertEquals(10, result.getSampleHistogram().getTotalCount());
        Assert.assertEquals(5, result.getSampleHistogram().getCountAtValue(0.0));
    }

    @Test
    public void testCalibratesWhenNoOverheadEstimateIsAvailable() throws Exception {
        final Benchmark[] benchmarkHolder = new Benchmark[1];
        final Benchmark.Phase[] phaseDuringCalibration = new Benchmark.Phase[1];
        OverheadCalibrator calibrator = new OverheadCalibrator(2, 100) {
            @Override
            protected OverheadEstimate calibrate() {
                phaseDuringCalibration[0] = benchmarkHolder[0].getPhase();
                return super.calibrate();
            }
        };
        BenchmarkConfiguration configuration = BenchmarkConfiguration.Builder.create()
                .warmupDuration(0, TimeUnit.NANOSECONDS)
                .targetSampleDuration(5 * DELAY, TimeUnit.NANOSECONDS)
                .sampleCount(3)
                .initialEstimateExecutions(1)
                .bootstrapResampleCount(100)
                .build();

        benchmarkHolder[0] = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(configuration)
                .overheadCalibrator(calibrator)
                .quiescenceController(new CountingQuiescenceController())
                .build();
        BenchmarkResult result = benchmarkHolder[0].run();

        Assert.assertEquals(Benchmark.Phase.CALIBRATING, phaseDuringCalibration[0]);
        Assert.assertSame("the calibrated estimate should be cached and reused",
                calibrator.getCachedEstimate(), result.getOverheadEstimate());
        Assert.assertFalse(result.getOverheadEstimate().isPinned());
    }

    @Test
    public void testPinnedConfigurationDoesNotTouchCalibrator() throws Exception {
        OverheadCalibrator calibrator = new OverheadCalibrator(2, 100);

        BenchmarkResult result = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(fixedDelayConfiguration().pinnedOverhead(2.0).build())
                .overheadCalibrator(calibrator)
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        Assert.assertNull(calibrator.getCachedEstimate());
        Assert.assertEquals(2.0, result.getOverheadEstimate().getOverheadPerInvocation(), 0.0);
    }

    @Test
    public void testCalibratorPinnedValueIsUsed() throws Exception {
        OverheadCalibrator calibrator = new OverheadCalibrator(2, 100);
        OverheadEstimate pinned = calibrator.set(0.0);

        BenchmarkResult result = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(BenchmarkConfiguration.Builder.create()
                        .warmupDuration(0, TimeUnit.NANOSECONDS)
                        .targetSampleDuration(2 * DELAY, TimeUnit.NANOSECONDS)
                        .sampleCount(2)
                        .bootstrapResampleCount(10)
                        .build())
                .overheadCalibrator(calibrator)
                .quiescenceController(new CountingQuiescenceController())
                .build()
                .run();

        Assert.assertSame(pinned, result.getOverheadEstimate());
    }

    @Test
    public void testComputationFailurePropagates() throws Exception {
        final AtomicLong invocations = new AtomicLong();
        final IllegalStateException failure = new IllegalStateException("boom");
        Callable<Long> computation = new Callable<Long>() {
            @Override
            public Long call() throws Exception {
                if (invocations.incrementAndGet() == 40) { // in the middle of sampling
                    throw failure;
                }
                TimeServices.moveTimeForward(DELAY);
                return invocations.get();
            }
        };
        Benchmark benchmark = Benchmark.Builder.create(computation)
                .configuration(fixedDelayConfiguration().build())
                .quiescenceController(new CountingQuiescenceController())
                .build();

        try {
            benchmark.run();
            Assert.fail("expected a ComputationFailureException");
        } catch (ComputationFailureException ex) {
            Assert.assertSame(failure, ex.getCause());
        }
        Assert.assertEquals(Benchmark.Phase.FAILED, benchmark.getPhase());
        Assert.assertEquals("no retry after a failure", 40, invocations.get());
    }

    @Test
    public void testBenchmarkRunsOnlyOnce() throws Exception {
        Benchmark benchmark = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(fixedDelayConfiguration().build())
                .quiescenceController(new CountingQuiescenceController())
                .build();
        benchmark.run();
        try {
            benchmark.run();
            Assert.fail("expected an IllegalStateException");
        } catch (IllegalStateException expected) {
            Assert.assertEquals(Benchmark.Phase.DONE, benchmark.getPhase());
        }
    }

    @Test
    public void testInvalidConfigurationFailsBeforeMeasuring() throws Exception {
        FixedDelayComputation computation = new FixedDelayComputation(DELAY);
        try {
            Benchmark.run(computation, fixedDelayConfiguration().sampleCount(1).build());
            Assert.fail("expected an InvalidConfigurationException");
        } catch (InvalidConfigurationException expected) {
            Assert.assertEquals(0, computation.getInvocations());
        }
    }

    @Test
    public void testEnvironmentIsPassedThrough() throws Exception {
        Object environment = new Object();
        BenchmarkResult result = Benchmark.Builder.create(new FixedDelayComputation(DELAY))
                .configuration(fixedDelayConfiguration().build())
                .quiescenceController(new CountingQuiescenceController())
                .environment(environment)
                .build()
                .run();
        Assert.assertSame(environment, result.getEnvironment());
    }

    @Test
    public void testPausesDuringSamplingAreReported() throws Exception {
        final ManualPauseDetector pauseDetector = new ManualPauseDetector();
        final AtomicLong invocations = new AtomicLong();
        Callable<Long> computation = new Callable<Long>() {
            @Override
            public Long call() throws Exception {
                long invocation = invocations.incrementAndGet();
                // Invocation 10 is in warm-up, invocation 40 is in the middle of sampling:
                if ((invocation == 10) || (invocation == 40)) {
                    pauseDetector.reportPauseEndingNow(invocation * 1000000L);
                }
                TimeServices.moveTimeForward(DELAY);
                return invocation;
            }
        };

        try {
            BenchmarkResult result = Benchmark.Builder.create(computation)
                    .configuration(fixedDelayConfiguration().build())
                    .quiescenceController(new CountingQuiescenceController())
                    .pauseDetector(pauseDetector)
                    .build()
                    .run();

            PauseSummary pauses = result.getPauseSummary();
            Assert.assertEquals("only the pause reported while sampling counts", 1, pauses.getPauseCount());
            Assert.assertEquals(40000000L, pauses.getTotalPauseLength());
            Assert.assertEquals(40000000L, pauses.getMaxPauseLength());
            Assert.assertEquals(1, pauses.getPauseHistogram().getTotalCount());
            Assert.assertTrue(result.hasWarning(BenchmarkWarning.PAUSES_DETECTED));
        } finally {
            pauseDetector.shutdown();
        }
    }
}
