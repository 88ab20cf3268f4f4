// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;

/**
 * Ordered tuple of label values identifying one series inside a metric family.
 * Values are positional and correspond to {@link MetricDescriptor#labelNames()}.
 */
public final class LabelValues {

    /** Label values of a family without labels. */
    public static final LabelValues EMPTY = new LabelValues(new String[0]);

    private final String[] values;

    private int hashCode = 0;

    private LabelValues(String[] values) {
        this.values = values;
    }

    /**
     * Creates label values validated against the expected number of labels.
     *
     * @param expectedSize number of label names of the family
     * @param values       the label values in label name order
     * @return the label values
     * @throws NullPointerException         if the array or any value is {@code null}
     * @throws LabelArityMismatchException  if the number of values differs from {@code expectedSize}
     */
    @NonNull
    static LabelValues of(int expectedSize, @NonNull String... values) {
        if (values == null) {
            throw new NullPointerException("label values must not be null");
        }
        if (values.length != expectedSize) {
            throw new LabelArityMismatchException(expectedSize, values.length);
        }
        if (values.length == 0) {
            return EMPTY;
        }
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new NullPointerException("label value must not be null at index: " + i);
            }
        }
        return new LabelValues(values.clone());
    }

    /**
     * @return number of label values (equal to number of labels of the family it belongs to)
     */
    public int size() {
        return values.length;
    }

    /**
     * Get the label value at the specified index.
     *
     * @param index the index of the label value to retrieve
     * @return the label value at the specified index
     */
    @NonNull
    public String get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof LabelValues that && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int h = hashCode;
        if (h == 0) {
            h = Arrays.hashCode(values);
            hashCode = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
