// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.apimon.metrics.core.InvalidMetricOperationException;
import org.apimon.metrics.core.LabeledSeries;

/**
 * Type-checked update operations on any {@link LabeledSeries}.
 * <p>
 * Each operation dispatches on {@link LabeledSeries#type()} and fails with
 * {@link InvalidMetricOperationException} when applied to a series of another type.
 */
public final class Accumulator {

    private Accumulator() {}

    /**
     * Increment a counter series.
     *
     * @param series the series, must be a counter series
     * @param delta  the non-negative increment
     * @throws InvalidMetricOperationException if the series is not a counter or {@code delta} is negative or NaN
     */
    public static void increment(@NonNull LabeledSeries series, double delta) {
        Objects.requireNonNull(series, "series must not be null");
        switch (series.type()) {
            case COUNTER -> cast(series, Counter.Measurement.class, "increment").increment(delta);
            case GAUGE, HISTOGRAM -> throw typeMismatch("increment", series);
        }
    }

    /**
     * Set a gauge series.
     *
     * @param series the series, must be a gauge series
     * @param value  the new value
     * @throws InvalidMetricOperationException if the series is not a gauge
     */
    public static void set(@NonNull LabeledSeries series, double value) {
        Objects.requireNonNull(series, "series must not be null");
        switch (series.type()) {
            case GAUGE -> cast(series, Gauge.Measurement.class, "set").set(value);
            case COUNTER, HISTOGRAM -> throw typeMismatch("set", series);
        }
    }

    /**
     * Record an observation in a histogram series.
     *
     * @param series the series, must be a histogram series
     * @param value  the observed value
     * @throws InvalidMetricOperationException if the series is not a histogram or the value is NaN
     */
    public static void observe(@NonNull LabeledSeries series, double value) {
        Objects.requireNonNull(series, "series must not be null");
        switch (series.type()) {
            case HISTOGRAM -> cast(series, Histogram.Measurement.class, "observe").observe(value);
            case COUNTER, GAUGE -> throw typeMismatch("observe", series);
        }
    }

    private static <S extends LabeledSeries> S cast(LabeledSeries series, Class<S> expected, String operation) {
        if (!expected.isInstance(series)) {
            throw new InvalidMetricOperationException("Operation '" + operation + "' is not supported by series: "
                    + series.getClass().getName());
        }
        return expected.cast(series);
    }

    private static InvalidMetricOperationException typeMismatch(String operation, LabeledSeries series) {
        return new InvalidMetricOperationException(
                "Operation '" + operation + "' is not applicable to series of type " + series.type());
    }
}
