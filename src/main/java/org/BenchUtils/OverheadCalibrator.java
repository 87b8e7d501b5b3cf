/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Measures the cost of the measurement machinery itself, by running a large, fixed number of no-op
 * invocations through the same {@link ExecutionRunner} call path used for benchmarking, and taking the mean
 * time per invocation.
 * <p>
 * Calibration takes a non-trivial amount of time, so its result is cached: {@link #estimateOverhead()}
 * calibrates lazily on first use and returns the same {@link OverheadEstimate} instance until the cache is
 * {@link #invalidate() invalidated}. An estimate can be pinned to a fixed value with {@link #set(double)};
 * while pinned, nothing recomputes it (invalidation included) until {@link #unpin()} or an explicit
 * {@link #recalibrate()}.
 * <p>
 * The cached estimate is guarded by a read-write lock: concurrent readers share it, and only calibration and
 * pinning write it. {@link #processWide()} provides the instance shared by all benchmarks in the process.
 * <p>
 * All times and time units are in nanoseconds
 */
public class OverheadCalibrator {
    private static final Logger log = LoggerFactory.getLogger(OverheadCalibrator.class);

    final static int DEFAULT_CalibrationRounds = 100;
    final static long DEFAULT_CalibrationBatchSize = 1000000L;

    private static volatile OverheadCalibrator processWideCalibrator;

    private final int calibrationRounds;
    private final long calibrationBatchSize;
    private final ExecutionRunner runner = new ExecutionRunner();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private OverheadEstimate cachedEstimate;
    private boolean pinned;

    /**
     * Get the calibrator shared by all benchmarks in this process. Created on first use with the default
     * calibration settings (100 rounds of 1,000,000 no-op invocations).
     *
     * @return the process-wide calibrator
     */
    public static OverheadCalibrator processWide() {
        // Avoid double-checked locking race by using a local variable reading from a volatile:
        OverheadCalibrator calibrator = processWideCalibrator;
        if (calibrator == null) {
            synchronized (OverheadCalibrator.class) {
                calibrator = processWideCalibrator;
                if (calibrator == null) {
                    processWideCalibrator = calibrator = new OverheadCalibrator();
                }
            }
        }
        return calibrator;
    }

    public OverheadCalibrator() {
        this(DEFAULT_CalibrationRounds, DEFAULT_CalibrationBatchSize);
    }

    /**
     * @param calibrationRounds number of timed batches to run when calibrating
     * @param calibrationBatchSize number of no-op invocations in each timed batch
     */
    public OverheadCalibrator(final int calibrationRounds, final long calibrationBatchSize) {
        if (calibrationRounds < 1) {
            throw new IllegalArgumentException("calibrationRounds must be at least 1, was " + calibrationRounds);
        }
        if (calibrationBatchSize < 1) {
            throw new IllegalArgumentException("calibrationBatchSize must be at least 1, was " + calibrationBatchSize);
        }
        this.calibrationRounds = calibrationRounds;
        this.calibrationBatchSize = calibrationBatchSize;
    }

    /**
     * Get the current overhead estimate, calibrating first if none is cached.
     *
     * @return the cached (or pinned) overhead estimate
     */
    public OverheadEstimate estimateOverhead() {
        lock.readLock().lock();
        try {
            if (cachedEstimate != null) {
                return cachedEstimate;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (cachedEstimate == null) {
                cachedEstimate = calibrate();
            }
            return cachedEstimate;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the cached (or pinned) estimate, or null if calibration has not happened yet. Never calibrates.
     */
    public OverheadEstimate getCachedEstimate() {
        lock.readLock().lock();
        try {
            return cachedEstimate;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drop the cached estimate, so that the next {@link #estimateOverhead()} recalibrates. Has no effect while
     * the estimate is pinned.
     */
    public void invalidate() {
        lock.writeLock().lock();
        try {
            if (pinned) {
                log.debug("overhead estimate is pinned, ignoring invalidation");
                return;
            }
            cachedEstimate = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Pin the overhead estimate to a fixed value. Disables recalibration until {@link #unpin()} or
     * {@link #recalibrate()} is called.
     *
     * @param overheadPerInvocation overhead per invocation, in nanoseconds
     * @return the pinned estimate
     */
    public OverheadEstimate set(final double overheadPerInvocation) {
        OverheadEstimate estimate = OverheadEstimate.pinned(overheadPerInvocation);
        lock.writeLock().lock();
        try {
            cachedEstimate = estimate;
            pinned = true;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("overhead estimate pinned to {} nsec/invocation", overheadPerInvocation);
        return estimate;
    }

    /**
     * Re-enable automatic calibration after {@link #set(double)}. The pinned value is dropped and the next
     * {@link #estimateOverhead()} recalibrates.
     */
    public void unpin() {
        lock.writeLock().lock();
        try {
            if (pinned) {
                pinned = false;
                cachedEstimate = null;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Calibrate now, replacing any cached or pinned estimate.
     *
     * @return the newly calibrated estimate
     */
    public OverheadEstimate recalibrate() {
        lock.writeLock().lock();
        try {
            pinned = false;
            cachedEstimate = calibrate();
            return cachedEstimate;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isPinned() {
        lock.readLock().lock();
        try {
            return pinned;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Run the calibration. Called with the write lock held.
     *
     * @return a new, unpinned estimate
     */
    protected OverheadEstimate calibrate() {
        log.info("calibrating measurement overhead: {} rounds of {} no-op invocations",
                calibrationRounds, calibrationBatchSize);
        final Callable<Object> noOp = new NoOp();
        long totalElapsed = 0;
        long totalInvocations = 0;
        for (int i = 0; i < calibrationRounds; i++) {
            totalElapsed += runner.runBatch(noOp, calibrationBatchSize);
            totalInvocations += calibrationBatchSize;
        }
        double overheadPerInvocation = ((double) totalElapsed) / totalInvocations;
        log.info("measurement overhead: {} nsec/invocation ({} nsec spent calibrating)",
                overheadPerInvocation, totalElapsed);
        return new OverheadEstimate(overheadPerInvocation, totalInvocations, totalElapsed, false);
    }

    private static class NoOp implements Callable<Object> {
        @Override
        public Object call() {
            return null;
        }
    }
}
