// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

/**
 * Thrown when an operation is not applicable to a series, e.g. a negative counter increment,
 * a {@code NaN} histogram observation or an operation of the wrong metric type.
 */
public class InvalidMetricOperationException extends IllegalArgumentException {

    public InvalidMetricOperationException(String message) {
        super(message);
    }
}
