/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * What a warm-up phase did: how many executions it ran, and how long they took in total.
 * <p>
 * All times and time units are in nanoseconds
 */
public final class WarmupSummary {
    private final long executions;
    private final long elapsed;

    WarmupSummary(final long executions, final long elapsed) {
        this.executions = executions;
        this.elapsed = elapsed;
    }

    public long getExecutions() {
        return executions;
    }

    public long getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "WarmupSummary{executions=" + executions + ", elapsed=" + elapsed + " nsec}";
    }
}
