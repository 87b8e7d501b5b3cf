/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * Thrown when the benchmarked computation itself fails. The computation's exception is available as
 * the cause. Samples collected before the failure are discarded.
 */
public class ComputationFailureException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long completedExecutions;

    public ComputationFailureException(long completedExecutions, Throwable cause) {
        super("Benchmarked computation failed after " + completedExecutions + " completed executions in batch: "
                + cause, cause);
        this.completedExecutions = completedExecutions;
    }

    /**
     * @return the number of executions in the failing batch that completed before the failure
     */
    public long getCompletedExecutions() {
        return completedExecutions;
    }
}
