/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.HdrHistogram.Histogram;

/**
 * The process-wide pauses a {@link PauseDetector} reported while a benchmark was collecting samples.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class PauseSummary {
    static final PauseSummary NONE = new PauseSummary(0, 0, 0, null);

    private final long pauseCount;
    private final long totalPauseLength;
    private final long maxPauseLength;
    private final Histogram pauseHistogram;

    PauseSummary(final long pauseCount, final long totalPauseLength, final long maxPauseLength,
                 final Histogram pauseHistogram) {
        this.pauseCount = pauseCount;
        this.totalPauseLength = totalPauseLength;
        this.maxPauseLength = maxPauseLength;
        this.pauseHistogram = pauseHistogram;
    }

    public long getPauseCount() {
        return pauseCount;
    }

    public long getTotalPauseLength() {
        return totalPauseLength;
    }

    public long getMaxPauseLength() {
        return maxPauseLength;
    }

    /**
     * @return a copy of the distribution of reported pause lengths, or null if no pause detector was attached
     */
    public Histogram getPauseHistogram() {
        return (pauseHistogram == null) ? null : pauseHistogram.copy();
    }

    @Override
    public String toString() {
        return "PauseSummary{count=" + pauseCount + ", total=" + totalPauseLength + " nsec, max=" +
                maxPauseLength + " nsec}";
    }
}
