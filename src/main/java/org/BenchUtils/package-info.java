/*
 * package-info.java
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

/**
 * <h3>A micro-benchmarking package</h3>
 * <p>
 * The BenchUtils package measures the execution time of small, in-process computations, and summarizes the
 * measurements into estimates that come with uncertainty bounds.
 * <p>
 * <h3>The problem</h3>
 * Timing a computation by reading the clock before and after a single call is dominated by noise for short
 * computations: the clock's own cost and resolution, JIT compilation still in progress, garbage collection
 * triggered by earlier allocation, and process-wide pauses all end up in the measured values. A single mean
 * over such values says nothing about how much of it is noise.
 * <p>
 * <h3>The Solution</h3>
 * A {@link org.BenchUtils.Benchmark} warms the computation up before measuring it, times batches of
 * executions sized to a target sample duration (amortizing clock cost), subtracts the calibrated measurement
 * overhead (see {@link org.BenchUtils.OverheadCalibrator}), and optionally requests a garbage collection
 * before each sample. The resulting samples are summarized into descriptive statistics, IQR-based
 * outlier counts, and bootstrap confidence intervals for the mean and variance, all collected in a
 * {@link org.BenchUtils.BenchmarkResult}. Noise the run cannot avoid (collections during timed batches, pauses
 * reported by an attached {@link org.BenchUtils.PauseDetector}) is detected and reported, not hidden.
 * <p>
 * All times and time units are in nanoseconds.
 */

package org.BenchUtils;
