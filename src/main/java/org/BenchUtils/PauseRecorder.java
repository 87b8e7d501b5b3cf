/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.HdrHistogram.AtomicHistogram;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Records the pauses that end inside one recording window of a {@link PauseDetector}. Reports arrive on the
 * detector's dispatcher thread while the window's owner reads the summary, hence the atomic structures.
 * <p>
 * All times and time units are in nanoseconds
 */
final class PauseRecorder {
    static final long HIGHEST_TrackablePause = 3600L * 1000 * 1000 * 1000; // 1 hr

    private final long windowStartTime;
    private volatile long windowEndTime = Long.MAX_VALUE;

    private final AtomicHistogram pauseHistogram = new AtomicHistogram(1000L, HIGHEST_TrackablePause, 2);
    private final AtomicLong pauseCount = new AtomicLong();
    private final AtomicLong totalPauseLength = new AtomicLong();
    private final AtomicLong maxPauseLength = new AtomicLong();

    PauseRecorder(final long windowStartTime) {
        this.windowStartTime = windowStartTime;
    }

    void close(final long windowEndTime) {
        this.windowEndTime = windowEndTime;
    }

    /**
     * @return true if the pause ended inside the window and was recorded
     */
    boolean record(final long pauseLength, final long pauseEndTime) {
        if ((pauseEndTime < windowStartTime) || (pauseEndTime > windowEndTime)) {
            return false;
        }
        // Pauses shorter than the histogram's lowest discernible value still land in its first bucket
        pauseHistogram.recordValue(Math.min(pauseLength, HIGHEST_TrackablePause));
        pauseCount.incrementAndGet();
        totalPauseLength.addAndGet(pauseLength);
        long max;
        do {
            max = maxPauseLength.get();
        } while ((pauseLength > max) && !maxPauseLength.compareAndSet(max, pauseLength));
        return true;
    }

    PauseSummary summarize() {
        return new PauseSummary(pauseCount.get(), totalPauseLength.get(), maxPauseLength.get(),
                pauseHistogram.copy());
    }
}
