// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.DoubleAdder;
import org.apimon.metrics.core.InvalidMetricOperationException;
import org.apimon.metrics.core.LabelValues;
import org.apimon.metrics.core.LabeledSeries;
import org.apimon.metrics.core.MeasurementSnapshot;
import org.apimon.metrics.core.Metric;
import org.apimon.metrics.core.MetricKey;
import org.apimon.metrics.core.MetricType;
import org.apimon.metrics.core.MetricUtils;
import org.apimon.metrics.core.SettableMetric;
import org.apimon.metrics.core.ValueMeasurementSnapshot;

/**
 * A metric of type {@link MetricType#COUNTER} that holds {@link Measurement} per label set,
 * containing non-decreasing {@code double} value starting at {@code 0}.
 */
public final class Counter extends SettableMetric<Counter.Measurement> {

    private Counter(Builder builder) {
        super(builder);
    }

    /**
     * Create a metric key for a {@link Counter} with the given name. <br>
     * Name must match {@value MetricUtils#NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<Counter> key(@NonNull String name) {
        return MetricKey.of(name, Counter.class);
    }

    /**
     * Create a builder for a {@link Counter} with the given metric key.
     *
     * @param key the metric key
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull MetricKey<Counter> key) {
        return new Builder(key);
    }

    /**
     * Create a builder for a {@link Counter} with the given metric name. <br>
     * Name must match {@value MetricUtils#NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Measurement createSeries() {
        return new Measurement();
    }

    @NonNull
    @Override
    protected MeasurementSnapshot createMeasurementSnapshot(
            @NonNull Measurement measurement, @NonNull LabelValues labelValues) {
        return new ValueMeasurementSnapshot(labelValues, measurement.get());
    }

    /**
     * Builder for {@link Counter}.
     */
    public static final class Builder extends Metric.Builder<Builder, Counter> {

        private Builder(@NonNull MetricKey<Counter> key) {
            super(MetricType.COUNTER, key);
        }

        @NonNull
        @Override
        protected Counter buildMetric() {
            return new Counter(this);
        }
    }

    /**
     * The series of a counter holding a non-decreasing {@code double} value.
     * Increments are lock-free and thread-safe.
     */
    public static final class Measurement implements LabeledSeries {

        private final DoubleAdder container = new DoubleAdder();

        private Measurement() {}

        @NonNull
        @Override
        public MetricType type() {
            return MetricType.COUNTER;
        }

        /**
         * Increment the counter by {@code 1}.
         */
        public void increment() {
            container.add(1.0);
        }

        /**
         * Increment the counter by the given non-negative value.
         *
         * @param delta the value to add
         * @throws InvalidMetricOperationException if the value is negative or {@code NaN}
         */
        public void increment(double delta) {
            if (delta < 0.0 || Double.isNaN(delta)) {
                throw new InvalidMetricOperationException("Increment value must be non-negative, but was: " + delta);
            }
            container.add(delta);
        }

        /**
         * @return the current value of the counter
         */
        public double get() {
            return container.sum();
        }
    }
}
