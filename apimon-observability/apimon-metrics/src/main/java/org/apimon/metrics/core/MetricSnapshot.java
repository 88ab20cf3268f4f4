// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable snapshot of all series of one metric family, in series creation order.
 */
public final class MetricSnapshot implements Iterable<MeasurementSnapshot> {

    private final MetricDescriptor descriptor;
    private final List<MeasurementSnapshot> measurements;

    public MetricSnapshot(@NonNull MetricDescriptor descriptor, @NonNull List<MeasurementSnapshot> measurements) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.measurements = List.copyOf(measurements);
    }

    @NonNull
    public MetricDescriptor descriptor() {
        return descriptor;
    }

    @NonNull
    public String name() {
        return descriptor.name();
    }

    @NonNull
    public MetricType type() {
        return descriptor.type();
    }

    /**
     * @return unmodifiable list of series snapshots
     */
    @NonNull
    public List<MeasurementSnapshot> measurements() {
        return measurements;
    }

    @NonNull
    @Override
    public Iterator<MeasurementSnapshot> iterator() {
        return measurements.iterator();
    }

    @Override
    public String toString() {
        return "MetricSnapshot{name=" + descriptor.name() + ", measurements=" + measurements + "}";
    }
}
