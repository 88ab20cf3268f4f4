// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apimon.metrics.core.HistogramMeasurementSnapshot;
import org.apimon.metrics.core.LabelValues;
import org.apimon.metrics.core.MeasurementSnapshot;
import org.apimon.metrics.core.MetricDescriptor;
import org.apimon.metrics.core.MetricRegistrySnapshot;
import org.apimon.metrics.core.MetricSnapshot;
import org.apimon.metrics.core.ValueMeasurementSnapshot;

/**
 * A writer that writes metrics in the Prometheus text exposition format, version 0.0.4.
 * <p>
 * Every family is written as {@code # HELP} and {@code # TYPE} lines followed by one line per series,
 * histograms expand to cumulative {@code _bucket} lines, {@code _sum} and {@code _count}.
 * The writer keeps no state and is safe to use from concurrent requests.
 *
 * <p>See <a href="https://prometheus.io/docs/instrumenting/exposition_formats/">Exposition formats</a>.
 */
public final class PrometheusTextWriter {

    private static final Logger logger = LogManager.getLogger(PrometheusTextWriter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private static final byte COMMA = ',';
    private static final byte QUOTE = '"';
    private static final byte SPACE = ' ';
    private static final byte NEW_LINE = '\n';
    private static final byte OPEN_BRACKET = '{';
    private static final byte CLOSE_BRACKET = '}';
    private static final byte[] EQUALS_QUOTE = "=\"".getBytes(StandardCharsets.UTF_8);

    private static final byte[] TYPE = "# TYPE ".getBytes(StandardCharsets.UTF_8);
    private static final byte[] HELP = "# HELP ".getBytes(StandardCharsets.UTF_8);

    private static final byte[] BUCKET_SUFFIX = "_bucket".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SUM_SUFFIX = "_sum".getBytes(StandardCharsets.UTF_8);
    private static final byte[] COUNT_SUFFIX = "_count".getBytes(StandardCharsets.UTF_8);
    private static final byte[] BUCKET_LABEL = MetricDescriptor.BUCKET_LABEL.getBytes(StandardCharsets.UTF_8);

    private static final String POSITIVE_INF = "+Inf";
    private static final String NEGATIVE_INF = "-Inf";
    private static final String NAN = "NaN";

    /**
     * Writes all families of the snapshot in their order.
     *
     * @param registrySnapshot the snapshot to write
     * @param output           the stream to write to, flushed but not closed
     * @throws IOException if writing to the stream fails
     */
    public void write(@NonNull MetricRegistrySnapshot registrySnapshot, @NonNull OutputStream output)
            throws IOException {
        Objects.requireNonNull(registrySnapshot, "registry snapshot must not be null");
        Objects.requireNonNull(output, "output must not be null");

        for (MetricSnapshot metricSnapshot : registrySnapshot) {
            writeMetric(metricSnapshot, output);
        }
        output.flush();
    }

    /**
     * Renders the snapshot into a new byte array.
     *
     * @param registrySnapshot the snapshot to render
     * @return UTF-8 encoded exposition text
     */
    @NonNull
    public byte[] render(@NonNull MetricRegistrySnapshot registrySnapshot) {
        UnsynchronizedByteArrayOutputStream output = new UnsynchronizedByteArrayOutputStream(1024);
        try {
            write(registrySnapshot, output);
        } catch (IOException e) {
            // in-memory stream never throws
            throw new UncheckedIOException(e);
        }
        return output.toByteArray();
    }

    private void writeMetric(MetricSnapshot metricSnapshot, OutputStream output) throws IOException {
        final MetricDescriptor descriptor = metricSnapshot.descriptor();
        final byte[] metricNameBytes = utf8(descriptor.name());

        output.write(HELP);
        output.write(metricNameBytes);
        output.write(SPACE);
        output.write(utf8(escapeHelp(descriptor.help())));
        output.write(NEW_LINE);

        output.write(TYPE);
        output.write(metricNameBytes);
        output.write(SPACE);
        output.write(utf8(descriptor.type().exposedName()));
        output.write(NEW_LINE);

        for (MeasurementSnapshot measurementSnapshot : metricSnapshot) {
            if (measurementSnapshot instanceof ValueMeasurementSnapshot valueSnapshot) {
                writeSample(output, metricNameBytes, null, descriptor.labelNames(), valueSnapshot.labelValues(), null);
                output.write(utf8(formatValue(valueSnapshot.value())));
                output.write(NEW_LINE);
            } else if (measurementSnapshot instanceof HistogramMeasurementSnapshot histogramSnapshot) {
                writeHistogram(output, metricNameBytes, descriptor, histogramSnapshot);
            } else {
                logger.warn(
                        "Skipping unsupported measurement snapshot type: {}",
                        measurementSnapshot.getClass().getName());
            }
        }
    }

    private void writeHistogram(
            OutputStream output,
            byte[] metricNameBytes,
            MetricDescriptor descriptor,
            HistogramMeasurementSnapshot snapshot)
            throws IOException {
        final List<String> labelNames = descriptor.labelNames();
        final LabelValues labelValues = snapshot.labelValues();
        final List<Double> bounds = descriptor.bucketBounds();

        for (int i = 0; i < snapshot.bucketCount(); i++) {
            String le = i < bounds.size() ? formatValue(bounds.get(i)) : POSITIVE_INF;
            writeSample(output, metricNameBytes, BUCKET_SUFFIX, labelNames, labelValues, le);
            output.write(utf8(Long.toString(snapshot.cumulativeCount(i))));
            output.write(NEW_LINE);
        }

        writeSample(output, metricNameBytes, SUM_SUFFIX, labelNames, labelValues, null);
        output.write(utf8(formatValue(snapshot.sum())));
        output.write(NEW_LINE);

        writeSample(output, metricNameBytes, COUNT_SUFFIX, labelNames, labelValues, null);
        output.write(utf8(Long.toString(snapshot.count())));
        output.write(NEW_LINE);
    }

    /**
     * Writes sample name and labels followed by a space, the value is written by the caller.
     */
    private void writeSample(
            OutputStream output,
            byte[] metricNameBytes,
            byte[] suffix,
            List<String> labelNames,
            LabelValues labelValues,
            String bucketBound)
            throws IOException {
        output.write(metricNameBytes);
        if (suffix != null) {
            output.write(suffix);
        }

        if (!labelNames.isEmpty() || bucketBound != null) {
            output.write(OPEN_BRACKET);
            for (int i = 0; i < labelNames.size(); i++) {
                if (i > 0) {
                    output.write(COMMA);
                }
                writeLabel(output, utf8(labelNames.get(i)), labelValues.get(i));
            }
            if (bucketBound != null) {
                if (!labelNames.isEmpty()) {
                    output.write(COMMA);
                }
                writeLabel(output, BUCKET_LABEL, bucketBound);
            }
            output.write(CLOSE_BRACKET);
        }

        output.write(SPACE);
    }

    private static void writeLabel(OutputStream output, byte[] name, String value) throws IOException {
        output.write(name);
        output.write(EQUALS_QUOTE);
        output.write(utf8(escapeLabelValue(value)));
        output.write(QUOTE);
    }

    static String formatValue(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INF;
        } else if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INF;
        } else if (Double.isNaN(value)) {
            return NAN;
        } else {
            return Double.toString(value);
        }
    }

    /**
     * Escape backslash {@code \} and newline {@code \n} characters in help text.
     */
    static String escapeHelp(String value) {
        return value.replace("\\", "\\\\").replace("\n", "\\n");
    }

    /**
     * Escape backslash {@code \}, double quote {@code "} and newline {@code \n} characters in label values.
     */
    static String escapeLabelValue(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
