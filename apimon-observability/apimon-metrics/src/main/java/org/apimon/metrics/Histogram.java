// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.apimon.metrics.core.HistogramMeasurementSnapshot;
import org.apimon.metrics.core.InvalidMetricOperationException;
import org.apimon.metrics.core.LabelValues;
import org.apimon.metrics.core.LabeledSeries;
import org.apimon.metrics.core.MeasurementSnapshot;
import org.apimon.metrics.core.Metric;
import org.apimon.metrics.core.MetricKey;
import org.apimon.metrics.core.MetricType;
import org.apimon.metrics.core.MetricUtils;
import org.apimon.metrics.core.SettableMetric;

/**
 * A metric of type {@link MetricType#HISTOGRAM} that holds {@link Measurement} per label set.
 * Every measurement counts observations into buckets with fixed upper bounds and tracks their sum and count.
 * <p>
 * Bucket bounds are fixed when the metric is built, {@link #DEFAULT_BUCKETS} are used if none are set.
 * The {@code +Inf} bucket always exists and does not need to be configured.
 */
public final class Histogram extends SettableMetric<Histogram.Measurement> {

    /** Default bucket upper bounds in seconds, suitable for request latencies. */
    public static final List<Double> DEFAULT_BUCKETS =
            List.of(0.005, 0.01, 0.025, 0.05, 0.075, 0.1, 0.25, 0.5, 0.75, 1.0, 2.5, 5.0, 7.5, 10.0);

    private final double[] bounds;

    private Histogram(Builder builder) {
        super(builder);
        bounds = descriptor().bucketBounds().stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Create a metric key for a {@link Histogram} with the given name. <br>
     * Name must match {@value MetricUtils#NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the metric key
     */
    @NonNull
    public static MetricKey<Histogram> key(@NonNull String name) {
        return MetricKey.of(name, Histogram.class);
    }

    @NonNull
    public static Builder builder(@NonNull MetricKey<Histogram> key) {
        return new Builder(key);
    }

    @NonNull
    public static Builder builder(@NonNull String name) {
        return builder(key(name));
    }

    @NonNull
    @Override
    protected Measurement createSeries() {
        return new Measurement(bounds);
    }

    @NonNull
    @Override
    protected MeasurementSnapshot createMeasurementSnapshot(
            @NonNull Measurement measurement, @NonNull LabelValues labelValues) {
        return measurement.snapshot(labelValues);
    }

    /**
     * Builder for {@link Histogram}.
     */
    public static final class Builder extends Metric.Builder<Builder, Histogram> {

        private List<Double> buckets = DEFAULT_BUCKETS;

        private Builder(@NonNull MetricKey<Histogram> key) {
            super(MetricType.HISTOGRAM, key);
        }

        /**
         * Set bucket upper bounds. They must be finite and strictly increasing, except an optional trailing
         * {@code +Inf} which is ignored. Validation happens when the metric is built or registered.
         *
         * @param buckets the bucket upper bounds
         * @return this builder
         */
        @NonNull
        public Builder setBuckets(@NonNull double... buckets) {
            Objects.requireNonNull(buckets, "buckets must not be null");
            List<Double> list = new ArrayList<>(buckets.length);
            for (double bucket : buckets) {
                list.add(bucket);
            }
            this.buckets = list;
            return this;
        }

        @NonNull
        @Override
        protected List<Double> bucketBounds() {
            return buckets;
        }

        @NonNull
        @Override
        protected Histogram buildMetric() {
            return new Histogram(this);
        }
    }

    /**
     * The series of a histogram. Observations update bucket counts, sum and count atomically
     * with respect to each other and to snapshots.
     */
    public static final class Measurement implements LabeledSeries {

        private final double[] bounds;
        // non-cumulative, last element counts observations above the highest finite bound
        private final long[] bucketCounts;
        private double sum;
        private long count;

        private Measurement(double[] bounds) {
            this.bounds = bounds;
            this.bucketCounts = new long[bounds.length + 1];
        }

        @NonNull
        @Override
        public MetricType type() {
            return MetricType.HISTOGRAM;
        }

        /**
         * Record an observation.
         *
         * @param value the observed value
         * @throws InvalidMetricOperationException if the value is {@code NaN}
         */
        public void observe(double value) {
            if (Double.isNaN(value)) {
                throw new InvalidMetricOperationException("Observed value must not be NaN");
            }
            final int index = bucketIndex(value);
            synchronized (this) {
                bucketCounts[index]++;
                sum += value;
                count++;
            }
        }

        /**
         * @return number of observations so far
         */
        public synchronized long count() {
            return count;
        }

        /**
         * @return sum of observations so far
         */
        public synchronized double sum() {
            return sum;
        }

        synchronized HistogramMeasurementSnapshot snapshot(LabelValues labelValues) {
            final long[] cumulative = new long[bucketCounts.length];
            long running = 0;
            for (int i = 0; i < bucketCounts.length; i++) {
                running += bucketCounts[i];
                cumulative[i] = running;
            }
            return new HistogramMeasurementSnapshot(labelValues, cumulative, sum, count);
        }

        private int bucketIndex(double value) {
            int index = Arrays.binarySearch(bounds, value);
            // insertion point is the first bound greater than the value
            return index >= 0 ? index : -index - 1;
        }
    }
}
