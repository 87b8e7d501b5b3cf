/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * QuiescenceController is used to request that deferred cleanup work (memory reclamation in particular)
 * happens between samples rather than inside them. Requests are best effort: they never fail, and
 * provide no guarantee that any cleanup actually completed.
 */
public abstract class QuiescenceController {

    /**
     * Request quiescence, blocking briefly to let it progress.
     */
    abstract public void requestQuiescence();
}
