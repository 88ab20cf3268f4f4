// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Abstract extension of {@link Metric}, that holds one {@link LabeledSeries} per combination of label values,
 * or a single series if no labels are defined.
 * <p>
 * Subclasses must implement the creation of series and series snapshots.
 * All series are created lazily, whenever a new combination of label values is requested,
 * exactly once per combination even under concurrent first access. Series are never removed and are
 * snapshotted in creation order.
 * <p>
 * Clients should pay attention to the label values cardinality. <b>Do not use</b> labels with values having
 * unbounded cardinality, such as IDs or timestamps.
 *
 * @param <S> The type of the series associated with this metric.
 */
public abstract class SettableMetric<S extends LabeledSeries> extends Metric {

    private volatile S noLabelsSeries;
    private final Map<LabelValues, S> series = new ConcurrentHashMap<>();
    private final Queue<SeriesEntry<S>> creationOrder = new ConcurrentLinkedQueue<>();

    protected SettableMetric(@NonNull Metric.Builder<?, ?> builder) {
        super(builder);
    }

    /**
     * Get or create the series of a family without labels.
     *
     * @return the series
     * @throws LabelArityMismatchException if the metric has labels
     */
    @NonNull
    public final S getOrCreateSeries() {
        if (descriptor().hasLabels()) {
            throw new LabelArityMismatchException(labelNames().size(), 0);
        }
        // lazy init of no labels series
        S localRef = noLabelsSeries;
        if (localRef == null) {
            synchronized (this) {
                localRef = noLabelsSeries;
                if (localRef == null) {
                    noLabelsSeries = localRef = createAndRemember(LabelValues.EMPTY);
                }
            }
        }
        return localRef;
    }

    /**
     * Get or create the series with the specified label values.
     * Values are positional and must be given in the order of {@link #labelNames()}.
     *
     * @param labelValues the label values, e.g. {@code "GET", "/data", "200"}
     * @return the series for these label values
     * @throws NullPointerException        if any label value is {@code null}
     * @throws LabelArityMismatchException if the number of values does not match the number of label names
     */
    @NonNull
    public final S getOrCreateSeries(@NonNull String... labelValues) {
        final LabelValues values = createLabelValues(labelValues);
        if (values.size() == 0) {
            return getOrCreateSeries();
        }
        return series.computeIfAbsent(values, this::createAndRemember);
    }

    /**
     * @return number of series created so far
     */
    public final int seriesCount() {
        return creationOrder.size();
    }

    @Override
    protected final void collectMeasurementSnapshots(@NonNull List<MeasurementSnapshot> target) {
        for (SeriesEntry<S> entry : creationOrder) {
            target.add(createMeasurementSnapshot(entry.series(), entry.labelValues()));
        }
    }

    /**
     * Create a new series with initial state.
     *
     * @return the created series
     */
    @NonNull
    protected abstract S createSeries();

    /**
     * Create a series snapshot for the given series and label values.
     *
     * @param series      the series to create snapshot for
     * @param labelValues the label values associated with the series
     * @return the created series snapshot
     */
    @NonNull
    protected abstract MeasurementSnapshot createMeasurementSnapshot(@NonNull S series, @NonNull LabelValues labelValues);

    private S createAndRemember(LabelValues labelValues) {
        final S created = createSeries();
        creationOrder.add(new SeriesEntry<>(labelValues, created));
        return created;
    }

    private record SeriesEntry<S>(LabelValues labelValues, S series) {}
}
