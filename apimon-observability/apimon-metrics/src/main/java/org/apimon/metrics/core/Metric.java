// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for all metric family implementations.
 * <p>
 * It contains the immutable {@link MetricDescriptor} common to all metrics: name, type, help text,
 * label names and histogram bucket bounds. Label names keep their declaration order, which is also
 * the order of label values when a series is looked up and when it is rendered.
 * <p>
 * Constructor of this class requires a {@link Builder} instance to initialize the descriptor.
 * Subclasses extending this class must provide their own builder extending {@link Builder}.
 * <p>
 * Every call of {@link #snapshot()} produces a new immutable {@link MetricSnapshot}, subclasses provide
 * series snapshots by implementing {@link #collectMeasurementSnapshots(List)}.
 */
public abstract class Metric {

    @NonNull
    private final MetricDescriptor descriptor;

    protected Metric(@NonNull Builder<?, ?> builder) {
        descriptor = builder.descriptor();
    }

    @NonNull
    public final MetricDescriptor descriptor() {
        return descriptor;
    }

    @NonNull
    public final String name() {
        return descriptor.name();
    }

    @NonNull
    public final MetricType type() {
        return descriptor.type();
    }

    @NonNull
    public final String help() {
        return descriptor.help();
    }

    @NonNull
    public final List<String> labelNames() {
        return descriptor.labelNames();
    }

    /**
     * Takes a snapshot of all series of this family.
     *
     * @return new snapshot, never {@code null}
     * @throws RuntimeException if reading a series value fails, e.g. a failing callback of an observable metric
     */
    @NonNull
    public final MetricSnapshot snapshot() {
        List<MeasurementSnapshot> measurements = new ArrayList<>();
        collectMeasurementSnapshots(measurements);
        return new MetricSnapshot(descriptor, measurements);
    }

    /**
     * Adds snapshots of all series of this family to the target list, in series creation order.
     *
     * @param target the list to add snapshots to
     */
    protected abstract void collectMeasurementSnapshots(@NonNull List<MeasurementSnapshot> target);

    /**
     * Creates {@link LabelValues} from the provided values, given in the order of {@link #labelNames()}.
     *
     * @param labelValues the label values
     * @return the created {@link LabelValues} instance
     * @throws NullPointerException        if {@code labelValues} is {@code null} or any label value is {@code null}
     * @throws LabelArityMismatchException if the number of values does not match the number of label names
     */
    @NonNull
    protected final LabelValues createLabelValues(@NonNull String... labelValues) {
        return LabelValues.of(descriptor.labelNames().size(), labelValues);
    }

    @Override
    public final String toString() {
        StringBuilder sb = new StringBuilder();

        sb.append("type=").append(descriptor.type());
        sb.append(", name='").append(descriptor.name()).append('\'');
        if (!descriptor.help().isEmpty()) {
            sb.append(", help='").append(descriptor.help()).append('\'');
        }
        sb.append(", labelNames=").append(descriptor.labelNames());
        if (!descriptor.bucketBounds().isEmpty()) {
            sb.append(", bucketBounds=").append(descriptor.bucketBounds());
        }

        return sb.toString();
    }

    /**
     * Base builder class for constructing {@link Metric} instances.
     *
     * @param <B> the concrete builder type to return for method chaining
     * @param <M> the concrete metric type to build
     */
    public abstract static class Builder<B extends Metric.Builder<B, M>, M extends Metric> {

        private final MetricType type;
        private final MetricKey<M> key;
        private String help = "";
        private final List<String> labelNames = new ArrayList<>();

        /**
         * Constructor for a metric builder.
         *
         * @param type the metric type, must not be {@code null}
         * @param key  the metric key, must not be {@code null}
         * @throws NullPointerException if any of the parameters is {@code null}
         */
        protected Builder(@NonNull MetricType type, @NonNull MetricKey<M> key) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.key = Objects.requireNonNull(key, "key must not be null");
        }

        /**
         * @return the metric key, never {@code null}
         */
        @NonNull
        public final MetricKey<M> key() {
            return key;
        }

        /**
         * Sets the help text rendered on the {@code # HELP} line.
         *
         * @param help the help text, {@code null} is treated as empty
         * @return the builder instance
         */
        @NonNull
        public final B setHelp(@Nullable String help) {
            this.help = help == null ? "" : help;
            return self();
        }

        /**
         * Adds label names to the metric, keeping the order they are added in.
         * Label values are later supplied positionally in this order.
         *
         * @param labelNames the label names to add, must not be {@code null}
         * @return the builder instance
         * @throws NullPointerException     if any label name is {@code null}
         * @throws IllegalArgumentException if any label name doesn't match regex {@value MetricUtils#NAME_REGEX},
         *                                  equals the metric name or was already added
         */
        @NonNull
        public final B addLabelNames(@NonNull String... labelNames) {
            Objects.requireNonNull(labelNames, "label names must not be null");
            for (String labelName : labelNames) {
                MetricUtils.validateLabelName(labelName);
                if (labelName.equals(key.name())) {
                    throw new IllegalArgumentException("Label name must not be the same as metric name: " + labelName);
                }
                if (this.labelNames.contains(labelName)) {
                    throw new IllegalArgumentException("Duplicate label name: " + labelName);
                }
                this.labelNames.add(labelName);
            }
            return self();
        }

        /**
         * Creates the descriptor of the metric this builder would build.
         * Used by {@link MetricRegistry} to detect idempotent registrations.
         *
         * @return the descriptor
         * @throws IllegalArgumentException if the builder state is invalid
         */
        @NonNull
        public final MetricDescriptor descriptor() {
            return new MetricDescriptor(key.name(), type, help, labelNames, bucketBounds());
        }

        /**
         * Builds the metric instance.
         *
         * @return the built metric instance, never {@code null}
         */
        @NonNull
        public final M build() {
            return buildMetric();
        }

        /**
         * Registers the built metric instance with the provided metric registry.
         *
         * @param registry the metric registry to register with, must not be {@code null}
         * @return the registered metric instance, never {@code null}
         */
        @NonNull
        public final M register(@NonNull MetricRegistry registry) {
            Objects.requireNonNull(registry, "registry must not be null");
            return registry.register(this);
        }

        /**
         * @return histogram bucket bounds, empty for other metric types
         */
        @NonNull
        protected List<Double> bucketBounds() {
            return Collections.emptyList();
        }

        /**
         * Builds the metric instance. Subclasses must implement this method to create the specific metric type.
         *
         * @return the built metric instance, never {@code null}
         */
        @NonNull
        protected abstract M buildMetric();

        /**
         * @return the builder instance concrete type to support fluent API
         */
        @NonNull
        @SuppressWarnings("unchecked")
        protected final B self() {
            return (B) this;
        }
    }
}
