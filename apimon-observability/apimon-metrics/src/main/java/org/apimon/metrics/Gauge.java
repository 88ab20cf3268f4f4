// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.concurrent.atomic.AtomicLong;
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
 * A metric of type {@link MetricType#GAUGE} that holds {@link Measurement} per label set,
 * containing a {@code double} value that can go up and down, starting at {@code 0}.
 */
public final class Gauge extends SettableMetric<Gauge.Measurement> {

    private Gauge(Builder builder) {
        super(builder);
    }

    /**
     * Create a metric key for a {@link Gauge} with the given name. <br>
     * Name must match {@value MetricUtils#NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<Gauge> key(@NonNull String name) {
        return MetricKey.of(name, Gauge.class);
    }

    @NonNull
    public static Builder builder(@NonNull MetricKey<Gauge> key) {
        return new Builder(key);
    }

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
     * Builder for {@link Gauge}.
     */
    public static final class Builder extends Metric.Builder<Builder, Gauge> {

        private Builder(@NonNull MetricKey<Gauge> key) {
            super(MetricType.GAUGE, key);
        }

        @NonNull
        @Override
        protected Gauge buildMetric() {
            return new Gauge(this);
        }
    }

    /**
     * The series of a gauge holding last set {@code double} value.
     * Operations are thread-safe and atomic.
     */
    public static final class Measurement implements LabeledSeries {

        private final AtomicLong container = new AtomicLong(Double.doubleToRawLongBits(0.0));

        private Measurement() {}

        @NonNull
        @Override
        public MetricType type() {
            return MetricType.GAUGE;
        }

        /**
         * Set the value of this gauge.
         *
         * @param value the value to set
         */
        public void set(double value) {
            container.set(Double.doubleToRawLongBits(value));
        }

        /**
         * Add the given value, which may be negative.
         *
         * @param delta the value to add
         */
        public void add(double delta) {
            long current;
            long updated;
            do {
                current = container.get();
                updated = Double.doubleToRawLongBits(Double.longBitsToDouble(current) + delta);
            } while (!container.compareAndSet(current, updated));
        }

        public void increment() {
            add(1.0);
        }

        public void decrement() {
            add(-1.0);
        }

        /**
         * @return the current value of the gauge
         */
        public double get() {
            return Double.longBitsToDouble(container.get());
        }
    }
}
