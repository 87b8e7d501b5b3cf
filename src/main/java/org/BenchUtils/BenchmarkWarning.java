/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * Conditions that degrade the quality of a {@link BenchmarkResult} without invalidating it. Warnings are
 * embedded in the result; they are never thrown.
 */
public enum BenchmarkWarning {
    /**
     * A single execution could not be distinguished from the clock's resolution, even at the
     * minimum batch size. The result has degraded precision.
     */
    UNMEASURABLE_EXECUTION,

    /**
     * The attached pause detector reported process-wide pauses while samples were being collected.
     */
    PAUSES_DETECTED,

    /**
     * A garbage collection ran inside the timed region of at least one sample.
     */
    COLLECTION_DURING_SAMPLING
}
