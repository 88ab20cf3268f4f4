// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A snapshot of a counter or gauge series holding a single {@code double} value.
 */
public final class ValueMeasurementSnapshot extends MeasurementSnapshot {

    private final double value;

    public ValueMeasurementSnapshot(@NonNull LabelValues labelValues, double value) {
        super(labelValues);
        this.value = value;
    }

    /**
     * @return the value of the series at snapshot time
     */
    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", value=" + value + "}";
    }
}
