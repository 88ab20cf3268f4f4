// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * A key for identifying a {@link Metric} by its name and class type.
 * Key instance is immutable and can be used to retrieve a metric from a {@link MetricRegistry}.
 * Instrumentation components keep keys in {@code public static final} fields.
 */
public record MetricKey<M extends Metric>(
        @NonNull String name, @NonNull Class<M> type) {

    /**
     * @throws NullPointerException    if name or type is {@code null}
     * @throws IllegalArgumentException if name doesn't match regex {@value MetricUtils#NAME_REGEX}
     */
    public MetricKey {
        MetricUtils.validateMetricName(name);
        Objects.requireNonNull(type, "metric type must not be null");
    }

    /**
     * Convenient factory method to construct metric key with generics.
     */
    @SuppressWarnings("unchecked")
    public static <M extends Metric> MetricKey<M> of(@NonNull String name, @NonNull Class<? super M> type) {
        return new MetricKey<>(name, (Class<M>) type);
    }
}
