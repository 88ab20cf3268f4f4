// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.util.function.Supplier;

/**
 * Pull-based exporter of a {@link MetricRegistry}, such as a scrape endpoint.
 * <p>
 * The registry hands its {@link MetricRegistry#snapshot()} to the exporter on creation and closes the exporter
 * when the registry is closed. The exporter calls the supplier whenever a reader asks for data; every call takes
 * a new independent snapshot, so concurrent calls are fine.
 */
public interface MetricsExporter extends Closeable {

    /**
     * Sets the source of snapshots. May be called again to replace it.
     *
     * @param snapshotSupplier takes a snapshot of the registry
     */
    void setSnapshotSupplier(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier);
}
