/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

/**
 * Thrown when a {@link BenchmarkConfiguration} holds values a benchmark cannot run with (e.g. fewer than two
 * samples, or a non-positive target sample duration). Always thrown before any measurement begins.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
