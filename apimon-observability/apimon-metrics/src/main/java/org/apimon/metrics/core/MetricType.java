// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The type of metric family as exposed in the Prometheus text exposition format.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing value.
     */
    COUNTER("counter"),
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down and set to any value.
     */
    GAUGE("gauge"),
    /**
     * A metric that samples observations into cumulative buckets and tracks their count and sum.
     */
    HISTOGRAM("histogram");

    private final String exposedName;

    MetricType(String exposedName) {
        this.exposedName = exposedName;
    }

    /**
     * @return the lower-case type name used on {@code # TYPE} lines
     */
    @NonNull
    public String exposedName() {
        return exposedName;
    }
}
