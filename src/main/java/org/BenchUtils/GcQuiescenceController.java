/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A {@link QuiescenceController} that requests a full garbage collection ({@code System.gc()}) and then
 * sleeps for a settle time, giving concurrent collector phases and reference processing a chance to finish.
 * The request is a hint: the JVM may ignore it (e.g. with -XX:+DisableExplicitGC).
 * <p>
 * The settle time is real (wall clock) time, regardless of the BenchUtils.useActualTime setting.
 */
public class GcQuiescenceController extends QuiescenceController {
    final static long DEFAULT_SettleTimeMsec = 10;

    private final long settleTimeMsec;

    public GcQuiescenceController() {
        this(DEFAULT_SettleTimeMsec);
    }

    /**
     * @param settleTimeMsec time to sleep after requesting a collection, in milliseconds (0 for none)
     */
    public GcQuiescenceController(final long settleTimeMsec) {
        if (settleTimeMsec < 0) {
            throw new IllegalArgumentException("settleTimeMsec must be >= 0, was " + settleTimeMsec);
        }
        this.settleTimeMsec = settleTimeMsec;
    }

    @Override
    public void requestQuiescence() {
        System.gc();
        if (settleTimeMsec > 0) {
            try {
                TimeUnit.MILLISECONDS.sleep(settleTimeMsec);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Sum the collection counts of all garbage collectors in this JVM. Collectors that do not report a
     * count are ignored.
     *
     * @return total number of collections that have occurred so far
     */
    public static long totalCollectionCount() {
        return totalCollectionCount(ManagementFactory.getGarbageCollectorMXBeans());
    }

    static long totalCollectionCount(final List<GarbageCollectorMXBean> collectors) {
        long total = 0;
        for (GarbageCollectorMXBean collector : collectors) {
            long count = collector.getCollectionCount();
            if (count > 0) {
                total += count;
            }
        }
        return total;
    }
}
