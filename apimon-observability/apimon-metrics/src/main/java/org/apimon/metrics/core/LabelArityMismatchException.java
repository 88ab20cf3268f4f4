// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

/**
 * Thrown when the number of supplied label values differs from the number of label names of a metric family.
 */
public class LabelArityMismatchException extends IllegalArgumentException {

    public LabelArityMismatchException(int expected, int actual) {
        super("Expected " + expected + " label values, got " + actual);
    }
}
