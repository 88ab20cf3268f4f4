// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

/**
 * Thrown when a metric is registered under a name that is already taken by a metric with a different descriptor.
 */
public class DuplicateMetricNameException extends IllegalArgumentException {

    public DuplicateMetricNameException(String message) {
        super(message);
    }
}
