// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import org.apimon.metrics.core.LabelValues;
import org.apimon.metrics.core.MeasurementSnapshot;
import org.apimon.metrics.core.Metric;
import org.apimon.metrics.core.MetricKey;
import org.apimon.metrics.core.MetricType;
import org.apimon.metrics.core.MetricUtils;
import org.apimon.metrics.core.ValueMeasurementSnapshot;

/**
 * A metric of type {@link MetricType#GAUGE} or {@link MetricType#COUNTER}, which doesn't hold measurements
 * providing methods to update the values, but instead holds value suppliers per unique combination of label values.
 * <p>
 * Every supplier is called exactly once per {@link #snapshot()}, so values are read only when metrics are rendered.
 * A supplier of a counter family must return a non-decreasing value.
 * <p>
 * Value suppliers are provided per label values during metric construction using
 * {@link Builder#observe(DoubleSupplier, String...)}, {@link Builder#observe(LongSupplier, String...)}
 * or could be added later after metric creation using {@link #observe(DoubleSupplier, String...)}.
 */
public final class ObservableMetric extends Metric {

    private final Set<LabelValues> labelValuesSet = ConcurrentHashMap.newKeySet();
    private final Queue<ObservedValue> observedValues = new ConcurrentLinkedQueue<>();

    private ObservableMetric(Builder builder) {
        super(builder);

        final int size = builder.valuesSuppliers.size();
        for (int i = 0; i < size; i++) {
            observe(builder.valuesSuppliers.get(i), builder.labelValues.get(i));
        }
    }

    /**
     * Create a metric key for a {@link ObservableMetric} with the given name. <br>
     * Name must match {@value MetricUtils#NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<ObservableMetric> key(@NonNull String name) {
        return MetricKey.of(name, ObservableMetric.class);
    }

    /**
     * Create a builder for an observable gauge with the given metric name.
     *
     * @param name the metric name
     * @return the builder
     */
    @NonNull
    public static Builder gaugeBuilder(@NonNull String name) {
        return new Builder(MetricType.GAUGE, key(name));
    }

    /**
     * Create a builder for an observable counter with the given metric name.
     *
     * @param name the metric name
     * @return the builder
     */
    @NonNull
    public static Builder counterBuilder(@NonNull String name) {
        return new Builder(MetricType.COUNTER, key(name));
    }

    /**
     * Register a value supplier for the given label values.
     *
     * @param valueSupplier the supplier to get the value at snapshot time
     * @param labelValues   label values in the order of {@link #labelNames()}
     * @return this metric
     * @throws IllegalArgumentException if a supplier for the same label values was already registered
     */
    @NonNull
    public ObservableMetric observe(@NonNull DoubleSupplier valueSupplier, @NonNull String... labelValues) {
        Objects.requireNonNull(valueSupplier, "value supplier must not be null");

        LabelValues values = createLabelValues(labelValues);
        if (!labelValuesSet.add(values)) {
            throw new IllegalArgumentException("A supplier with the same label values already exists: " + values);
        }
        observedValues.add(new ObservedValue(values, valueSupplier));
        return this;
    }

    @Override
    protected void collectMeasurementSnapshots(@NonNull List<MeasurementSnapshot> target) {
        for (ObservedValue observedValue : observedValues) {
            target.add(new ValueMeasurementSnapshot(
                    observedValue.labelValues(), observedValue.supplier().getAsDouble()));
        }
    }

    private record ObservedValue(LabelValues labelValues, DoubleSupplier supplier) {}

    /**
     * A builder for {@link ObservableMetric}.
     */
    public static final class Builder extends Metric.Builder<Builder, ObservableMetric> {

        private final List<String[]> labelValues = new ArrayList<>();
        private final List<DoubleSupplier> valuesSuppliers = new ArrayList<>();

        private Builder(MetricType type, MetricKey<ObservableMetric> key) {
            super(type, key);
            if (type == MetricType.HISTOGRAM) {
                throw new IllegalArgumentException("Observable metric can't be a histogram");
            }
        }

        /**
         * Register an observable value with the given {@code double} value supplier and label values.
         * Label values are validated when the metric is built, because label names may be added later.
         *
         * @param valueSupplier the supplier to get the {@code double} value
         * @param labelValues   label values in label names order
         * @return this builder
         */
        @NonNull
        public Builder observe(@NonNull DoubleSupplier valueSupplier, @NonNull String... labelValues) {
            Objects.requireNonNull(valueSupplier, "value supplier must not be null");
            Objects.requireNonNull(labelValues, "label values must not be null");
            valuesSuppliers.add(valueSupplier);
            this.labelValues.add(labelValues);
            return this;
        }

        /**
         * Register an observable value with the given {@code long} value supplier and label values.
         *
         * @param valueSupplier the supplier to get the {@code long} value
         * @param labelValues   label values in label names order
         * @return this builder
         */
        @NonNull
        public Builder observe(@NonNull LongSupplier valueSupplier, @NonNull String... labelValues) {
            Objects.requireNonNull(valueSupplier, "value supplier must not be null");
            return observe((DoubleSupplier) valueSupplier::getAsLong, labelValues);
        }

        @NonNull
        @Override
        protected ObservableMetric buildMetric() {
            return new ObservableMetric(this);
        }
    }
}
