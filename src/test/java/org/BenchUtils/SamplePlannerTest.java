/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

/**
 * JUnit test for {@link SamplePlanner}
 */
public class SamplePlannerTest {

    static {
        System.setProperty("BenchUtils.useActualTime", "false");
    }

    @Test
    public void testBatchSizeHitsTargetDuration() throws Exception {
        Assert.assertEquals(5, SamplePlanner.planBatchSize(1000.0, 5000L, 1000L));
        Assert.assertEquals(6, SamplePlanner.planBatchSize(800.0, 5000L, 1000L)); // 6.25 rounds down
        Assert.assertEquals(7, SamplePlanner.planBatchSize(700.0, 5000L, 1000L)); // 7.14 rounds down
        Assert.assertEquals(10000000, SamplePlanner.planBatchSize(1.0, 10000000L, 1000L));
    }

    @Test
    public void testBatchSizeIsAtLeastOne() throws Exception {
        Assert.assertEquals("a computation slower than the target is run once per sample",
                1, SamplePlanner.planBatchSize(1.0e9, 5000L, 1000L));
        Assert.assertEquals(1, SamplePlanner.planBatchSize(0.0, 5000L, 0L));

        Random random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            double estimate = random.nextDouble() * 1.0e7;
            long target = 1 + random.nextInt(100000000);
            long batchSize = SamplePlanner.planBatchSize(estimate, target, 1000L);
            Assert.assertTrue(batchSize >= 1);
            Assert.assertEquals("planning must be a pure function",
                    batchSize, SamplePlanner.planBatchSize(estimate, target, 1000L));
        }
    }

    @Test
    public void testUnmeasurableEstimateFallsBackToMinimumBatchSize() throws Exception {
        Assert.assertEquals(1000, SamplePlanner.planBatchSize(0.0, 5000L, 1000L));
        Assert.assertEquals(1000, SamplePlanner.planBatchSize(-3.0, 5000L, 1000L));
        Assert.assertEquals(1000, SamplePlanner.planBatchSize(Double.NaN, 5000L, 1000L));
    }

    @Test
    public void testEstimateBelowClockResolutionFallsBack() throws Exception {
        Assert.assertEquals(1000, SamplePlanner.planBatchSize(1.0e-8, 10000000L, 1000L));
        Assert.assertEquals(1000, SamplePlanner.planBatchSize(0.999, 10000000L, 1000L));
        Assert.assertEquals(10000000, SamplePlanner.planBatchSize(1.0, 10000000L, 1000L));
    }

    @Test
    public void testPlanFallsBackWhenOverheadLeavesLessThanOneNanosecond() throws Exception {
        SamplePlanner planner = new SamplePlanner(new ExecutionRunner(), 5, 1000L);

        // 1 nsec per execution, minus 0.99999999 nsec of overhead, leaves about 1e-8 nsec:
        SamplePlan plan = planner.plan(new FixedDelayComputation(1L), 0.99999999, 10000000L);

        Assert.assertTrue(plan.getEstimatedExecutionTime() > 0.0);
        Assert.assertTrue(plan.getEstimatedExecutionTime() < 1.0);
        Assert.assertTrue(plan.isFallbackUsed());
        Assert.assertEquals(1000, plan.getBatchSize());
    }

    @Test
    public void testPlanFromInitialEstimate() throws Exception {
        FixedDelayComputation computation = new FixedDelayComputation(1000L);
        SamplePlanner planner = new SamplePlanner(new ExecutionRunner(), 7, 1000L);

        SamplePlan plan = planner.plan(computation, 0.0, 5000L);

        Assert.assertEquals("initial estimate uses single executions", 7, computation.getInvocations());
        Assert.assertEquals(1000.0, plan.getEstimatedExecutionTime(), 0.0);
        Assert.assertEquals(5, plan.getBatchSize());
        Assert.assertFalse(plan.isFallbackUsed());
    }

    @Test
    public void testPlanCorrectsForOverhead() throws Exception {
        SamplePlanner planner = new SamplePlanner(new ExecutionRunner(), 3, 1000L);

        SamplePlan plan = planner.plan(new FixedDelayComputation(1000L), 200.0, 5000L);

        Assert.assertEquals(800.0, plan.getEstimatedExecutionTime(), 0.0);
        Assert.assertEquals(6, plan.getBatchSize());
    }

    @Test
    public void testPlanFallsBackForInstantComputation() throws Exception {
        SamplePlanner planner = new SamplePlanner(new ExecutionRunner(), 5, 250L);

        SamplePlan plan = planner.plan(new FixedDelayComputation(0L), 0.0, 5000L);

        Assert.assertTrue(plan.isFallbackUsed());
        Assert.assertEquals(250, plan.getBatchSize());
        Assert.assertEquals(0.0, plan.getEstimatedExecutionTime(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroEstimateExecutionsRejected() throws Exception {
        new SamplePlanner(new ExecutionRunner(), 0, 1000L);
    }
}
