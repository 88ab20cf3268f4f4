// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable identity and shape of a metric family: name, type, help text, ordered label names
 * and, for histograms, the finite bucket upper bounds.
 * <p>
 * Bucket bounds never contain {@code +Inf}, that bucket always exists implicitly.
 * A caller supplied trailing {@code +Inf} is accepted and dropped.
 * Two families are interchangeable in a {@link MetricRegistry} only if their descriptors are equal.
 *
 * @param name         the family name, must match {@value MetricUtils#NAME_REGEX}
 * @param type         the family type
 * @param help         the help text, may be empty
 * @param labelNames   the distinct label names in declaration order
 * @param bucketBounds strictly increasing finite bucket upper bounds, empty for non histograms
 */
public record MetricDescriptor(
        @NonNull String name,
        @NonNull MetricType type,
        @NonNull String help,
        @NonNull List<String> labelNames,
        @NonNull List<Double> bucketBounds) {

    /** Label name reserved for histogram bucket upper bounds. */
    public static final String BUCKET_LABEL = "le";

    public MetricDescriptor {
        MetricUtils.validateMetricName(name);
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(help, "help must not be null");
        labelNames = validateLabelNames(name, type, labelNames);
        bucketBounds = validateBucketBounds(type, bucketBounds);
    }

    /**
     * @return {@code true} if the family has at least one label
     */
    public boolean hasLabels() {
        return !labelNames.isEmpty();
    }

    private static List<String> validateLabelNames(String name, MetricType type, List<String> labelNames) {
        Objects.requireNonNull(labelNames, "label names must not be null");
        Set<String> unique = new HashSet<>();
        for (String labelName : labelNames) {
            MetricUtils.validateLabelName(labelName);
            if (labelName.equals(name)) {
                throw new IllegalArgumentException("Label name must not be the same as metric name: " + labelName);
            }
            if (type == MetricType.HISTOGRAM && BUCKET_LABEL.equals(labelName)) {
                throw new IllegalArgumentException("Label name is reserved for histogram buckets: " + labelName);
            }
            if (!unique.add(labelName)) {
                throw new IllegalArgumentException("Duplicate label name: " + labelName);
            }
        }
        return List.copyOf(labelNames);
    }

    private static List<Double> validateBucketBounds(MetricType type, List<Double> bucketBounds) {
        Objects.requireNonNull(bucketBounds, "bucket bounds must not be null");
        if (type != MetricType.HISTOGRAM) {
            if (!bucketBounds.isEmpty()) {
                throw new IllegalArgumentException("Bucket bounds are only allowed for histograms, type: " + type);
            }
            return List.of();
        }

        List<Double> bounds = new ArrayList<>(bucketBounds);
        if (!bounds.isEmpty() && bounds.get(bounds.size() - 1) == Double.POSITIVE_INFINITY) {
            bounds.remove(bounds.size() - 1);
        }
        double previous = Double.NEGATIVE_INFINITY;
        for (Double bound : bounds) {
            Objects.requireNonNull(bound, "bucket bound must not be null");
            if (Double.isNaN(bound) || Double.isInfinite(bound)) {
                throw new IllegalArgumentException("Bucket bound must be finite, but was: " + bound);
            }
            if (bound <= previous) {
                throw new IllegalArgumentException("Bucket bounds must be strictly increasing: " + bucketBounds);
            }
            previous = bound;
        }
        return List.copyOf(bounds);
    }
}
