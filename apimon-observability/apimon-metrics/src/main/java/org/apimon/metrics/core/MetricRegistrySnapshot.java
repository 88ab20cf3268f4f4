// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A snapshot of all metrics in a {@link MetricRegistry} at a specific point in time,
 * allowing iteration over {@link MetricSnapshot}s in registration order.
 * A new instance is produced for every render, so it can be shared between threads.
 */
public final class MetricRegistrySnapshot implements Iterable<MetricSnapshot> {

    private final List<MetricSnapshot> snapshots;

    public MetricRegistrySnapshot() {
        this(List.of());
    }

    public MetricRegistrySnapshot(@NonNull List<MetricSnapshot> snapshots) {
        this.snapshots = List.copyOf(snapshots);
    }

    @NonNull
    @Override
    public Iterator<MetricSnapshot> iterator() {
        return snapshots.iterator();
    }

    /**
     * @return number of metric snapshots
     */
    public int size() {
        return snapshots.size();
    }

    /**
     * Finds the snapshot of the metric with the given name.
     *
     * @param name the metric name
     * @return the snapshot or empty if no such metric was snapshotted
     */
    @NonNull
    public Optional<MetricSnapshot> find(@NonNull String name) {
        return snapshots.stream().filter(s -> s.name().equals(name)).findFirst();
    }
}
