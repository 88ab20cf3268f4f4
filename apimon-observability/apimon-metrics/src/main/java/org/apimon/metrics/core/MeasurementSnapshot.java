// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * An immutable snapshot of a single series of a {@link Metric} taken at a specific point in time.
 */
public abstract class MeasurementSnapshot {

    private final LabelValues labelValues;

    protected MeasurementSnapshot(@NonNull LabelValues labelValues) {
        this.labelValues = Objects.requireNonNull(labelValues, "label values must not be null");
    }

    /**
     * @return the label values of the series this snapshot was taken from
     */
    @NonNull
    public final LabelValues labelValues() {
        return labelValues;
    }

    @Override
    public String toString() {
        return "labelValues=" + labelValues;
    }
}
