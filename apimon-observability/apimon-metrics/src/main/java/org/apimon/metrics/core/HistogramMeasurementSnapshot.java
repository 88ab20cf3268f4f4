// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * A snapshot of a histogram series: cumulative bucket counts, sum and count of observations.
 * <p>
 * Bucket count at index {@code i} is the number of observations less than or equal to
 * {@link MetricDescriptor#bucketBounds()} at index {@code i}. The last element belongs to the implicit
 * {@code +Inf} bucket and always equals {@link #count()}.
 */
public final class HistogramMeasurementSnapshot extends MeasurementSnapshot {

    private final long[] cumulativeCounts;
    private final double sum;
    private final long count;

    public HistogramMeasurementSnapshot(
            @NonNull LabelValues labelValues, @NonNull long[] cumulativeCounts, double sum, long count) {
        super(labelValues);
        Objects.requireNonNull(cumulativeCounts, "cumulative counts must not be null");
        if (cumulativeCounts.length == 0 || cumulativeCounts[cumulativeCounts.length - 1] != count) {
            throw new IllegalArgumentException("Last cumulative bucket count must be equal to count: " + count);
        }
        this.cumulativeCounts = cumulativeCounts.clone();
        this.sum = sum;
        this.count = count;
    }

    /**
     * @return number of buckets including the implicit {@code +Inf} bucket
     */
    public int bucketCount() {
        return cumulativeCounts.length;
    }

    /**
     * @param index bucket index, the last index is the {@code +Inf} bucket
     * @return cumulative number of observations in the bucket
     */
    public long cumulativeCount(int index) {
        return cumulativeCounts[index];
    }

    public double sum() {
        return sum;
    }

    public long count() {
        return count;
    }

    @Override
    public String toString() {
        return "{" + super.toString() + ", buckets=" + Arrays.toString(cumulativeCounts) + ", sum=" + sum
                + ", count=" + count + "}";
    }
}
