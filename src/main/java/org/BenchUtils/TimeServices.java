/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import java.util.concurrent.TimeUnit;

/**
 * The clock used by all BenchUtils measurements. By default, time is provided by the JDK's monotonic
 * high resolution source (System.nanoTime()), which is not affected by wall-clock adjustments.
 * However, if the property BenchUtils.useActualTime is set to "false", TimeServices will only move
 * the notion of time in response to calls to the {@link #setCurrentTime} and {@link #moveTimeForward}
 * methods, which makes timing behavior fully deterministic (e.g. in tests).
 * <p>
 * All times and time units are in nanoseconds
 */
public class TimeServices {
    static final boolean useActualTime;

    static volatile long currentTime;

    // Use a monitor to notify any waiters that time has changed.
    final static Object timeUpdateMonitor = new Object();

    static {
        String useActualTimeProperty = System.getProperty("BenchUtils.useActualTime", "true");
        useActualTime = !useActualTimeProperty.equals("false");
    }

    public static long nanoTime() {
        if (useActualTime) {
            return System.nanoTime();
        }
        return currentTime;
    }

    /**
     * Measure the elapsed time of a single execution of a block of code.
     *
     * @param block the block to execute exactly once
     * @return elapsed time (in nanoseconds) observed around the execution of {@code block}
     */
    public static long measure(Runnable block) {
        long startTime = nanoTime();
        block.run();
        return nanoTime() - startTime;
    }

    /**
     * @return true if this process uses actual (rather than artificially moved) time
     */
    public static boolean isUsingActualTime() {
        return useActualTime;
    }

    public static void sleepNanos(long sleepTimeNsec) {
        try {
            if (useActualTime) {
                TimeUnit.NANOSECONDS.sleep(sleepTimeNsec);
            } else {
                waitUntilTime(currentTime + (sleepTimeNsec));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    public static void waitUntilTime(long timeToWakeAt) throws InterruptedException {
        synchronized (timeUpdateMonitor) {
            while (timeToWakeAt > currentTime) {
                timeUpdateMonitor.wait();
            }
        }
    }

    public static void moveTimeForward(long timeDeltaNsec) throws InterruptedException {
        setCurrentTime(currentTime + timeDeltaNsec);
    }

    public static void moveTimeForwardMsec(long timeDeltaMsec) throws InterruptedException {
        moveTimeForward(timeDeltaMsec * 1000000L);
    }

    public static void setCurrentTime(long newCurrentTime) throws InterruptedException {
        if (newCurrentTime < nanoTime()) {
            throw new IllegalStateException("Can't set current time to the past.");
        }
        if (useActualTime) {
            while (newCurrentTime > nanoTime()) {
                TimeUnit.NANOSECONDS.sleep(newCurrentTime - nanoTime());
            }
            return;
        }
        while (currentTime < newCurrentTime) {
            long timeDelta = Math.min((newCurrentTime - currentTime), 5000000L);
            currentTime += timeDelta;
            synchronized (timeUpdateMonitor) {
                timeUpdateMonitor.notifyAll();
                // Give waiting threads a chance to observe each step:
                TimeUnit.NANOSECONDS.sleep(50000);
            }
        }
    }
}
