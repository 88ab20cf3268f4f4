// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;
import org.apimon.metrics.Counter;
import org.apimon.metrics.Gauge;
import org.apimon.metrics.Histogram;
import org.apimon.metrics.ObservableMetric;
import org.apimon.metrics.core.LabelValues;
import org.apimon.metrics.core.MeasurementSnapshot;
import org.apimon.metrics.core.MetricDescriptor;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.core.MetricRegistrySnapshot;
import org.apimon.metrics.core.MetricSnapshot;
import org.apimon.metrics.core.MetricType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

public class PrometheusTextWriterTest {

    private final PrometheusTextWriter writer = new PrometheusTextWriter();
    private MetricRegistry registry;

    @BeforeEach
    void setUp() {
        registry = MetricRegistry.builder().withoutProcessMetrics().build();
    }

    private String render() {
        return new String(writer.render(registry.snapshot()), StandardCharsets.UTF_8);
    }

    @Test
    void testEmptyRegistryRendersNothing() {
        assertThat(render()).isEmpty();
    }

    @Test
    void testWriteToStream() throws IOException {
        registry.register(Counter.builder("c").setHelp("h")).getOrCreateSeries().increment();
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        writer.write(registry.snapshot(), output);

        assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo(render());
    }

    @Test
    void testRenderingWithoutMutationIsByteIdentical() {
        Counter counter = registry.register(Counter.builder("http_requests_total")
                .setHelp("Total number of HTTP requests")
                .addLabelNames("method", "endpoint", "http_status"));
        counter.getOrCreateSeries("GET", "/data", "200").increment(3);
        counter.getOrCreateSeries("POST", "/data", "201").increment();
        Histogram histogram = registry.register(Histogram.builder("http_request_duration_seconds")
                .setHelp("HTTP request latency")
                .addLabelNames("method", "endpoint")
                .setBuckets(0.1, 0.5, 1.0));
        histogram.getOrCreateSeries("GET", "/data").observe(0.05);
        histogram.getOrCreateSeries("GET", "/data").observe(0.7);
        histogram.getOrCreateSeries("POST", "/data").observe(2.5);
        registry.register(Gauge.builder("inprogress_requests")).getOrCreateSeries().set(2);

        MetricRegistrySnapshot snapshot = registry.snapshot();
        byte[] first = writer.render(snapshot);
        byte[] second = writer.render(snapshot);
        byte[] fromNewSnapshot = writer.render(registry.snapshot());

        assertThat(first).isNotEmpty();
        assertThat(second).isEqualTo(first);
        assertThat(fromNewSnapshot).isEqualTo(first);
        assertThat(new String(first, StandardCharsets.UTF_8))
                .contains("http_requests_total{method=\"GET\",endpoint=\"/data\",http_status=\"200\"} 3.0")
                .contains("http_request_duration_seconds_bucket{method=\"GET\",endpoint=\"/data\",le=\"0.5\"} 1")
                .contains("inprogress_requests 2.0");
    }

    @Nested
    class CounterAndGaugeTests {

        @Test
        void testFamilyWithoutSeries() {
            registry.register(Counter.builder("http_requests_total")
                    .setHelp("Total number of HTTP requests")
                    .addLabelNames("method", "endpoint", "http_status"));

            assertThat(render()).isEqualTo("""
                    # HELP http_requests_total Total number of HTTP requests
                    # TYPE http_requests_total counter
                    """);
        }

        @Test
        void testLabeledCounterInSeriesCreationOrder() {
            Counter counter = registry.register(Counter.builder("http_requests_total")
                    .setHelp("Total number of HTTP requests")
                    .addLabelNames("method", "endpoint", "http_status"));
            counter.getOrCreateSeries("POST", "/data", "201").increment();
            counter.getOrCreateSeries("GET", "/data", "200").increment(2);
            counter.getOrCreateSeries("POST", "/data", "201").increment();

            assertThat(render()).isEqualTo("""
                    # HELP http_requests_total Total number of HTTP requests
                    # TYPE http_requests_total counter
                    http_requests_total{method="POST",endpoint="/data",http_status="201"} 2.0
                    http_requests_total{method="GET",endpoint="/data",http_status="200"} 2.0
                    """);
        }

        @Test
        void testUnlabeledGaugeHasNoBraces() {
            registry.register(Gauge.builder("inprogress_requests").setHelp("Number of in-progress HTTP requests"))
                    .getOrCreateSeries()
                    .set(3);

            assertThat(render()).isEqualTo("""
                    # HELP inprogress_requests Number of in-progress HTTP requests
                    # TYPE inprogress_requests gauge
                    inprogress_requests 3.0
                    """);
        }

        @Test
        void testEmptyHelp() {
            registry.register(Gauge.builder("no_help")).getOrCreateSeries().set(0);

            assertThat(render()).isEqualTo("# HELP no_help \n# TYPE no_help gauge\nno_help 0.0\n");
        }

        @Test
        void testFamiliesInRegistrationOrder() {
            registry.register(Gauge.builder("b")).getOrCreateSeries().set(1);
            registry.register(Counter.builder("a")).getOrCreateSeries().increment();

            assertThat(render()).isEqualTo("""
                    # HELP b \n# TYPE b gauge
                    b 1.0
                    # HELP a \n# TYPE a counter
                    a 1.0
                    """);
        }

        @Test
        void testObservableGauge() {
            registry.register(ObservableMetric.gaugeBuilder("db_pool_size").observe(() -> 5L));

            assertThat(render()).endsWith("db_pool_size 5.0\n");
        }
    }

    @Nested
    class ValueFormattingTests {

        private static Stream<Arguments> values() {
            return Stream.of(
                    Arguments.of(0.0, "0.0"),
                    Arguments.of(1.0, "1.0"),
                    Arguments.of(1.71, "1.71"),
                    Arguments.of(0.05, "0.05"),
                    Arguments.of(-2.5, "-2.5"),
                    Arguments.of(1.0E10, "1.0E10"),
                    Arguments.of(Double.POSITIVE_INFINITY, "+Inf"),
                    Arguments.of(Double.NEGATIVE_INFINITY, "-Inf"),
                    Arguments.of(Double.NaN, "NaN"));
        }

        @ParameterizedTest
        @MethodSource("values")
        void testGaugeValue(double value, String expected) {
            registry.register(Gauge.builder("g")).getOrCreateSeries().set(value);

            assertThat(render()).endsWith("\ng " + expected + "\n");
        }
    }

    @Nested
    class EscapeTests {

        private static Stream<Arguments> labelValues() {
            return Stream.of(
                    Arguments.of("\n Newline", "\\n Newline"),
                    Arguments.of("\t Tab", "\t Tab"),
                    Arguments.of("\" Double Quote", "\\\" Double Quote"),
                    Arguments.of("\\ Backslash", "\\\\ Backslash"),
                    Arguments.of("\\n Escaped Newline", "\\\\n Escaped Newline"),
                    Arguments.of("#$%^&*()_+-=[]{}|;':,.<>/?`~", "#$%^&*()_+-=[]{}|;':,.<>/?`~"),
                    Arguments.of("測試指標", "測試指標"),
                    Arguments.of("", ""));
        }

        @ParameterizedTest
        @MethodSource("labelValues")
        void testLabelValueEscape(String labelValue, String expected) {
            registry.register(Counter.builder("c").addLabelNames("l"))
                    .getOrCreateSeries(labelValue)
                    .increment();

            assertThat(render()).endsWith("c{l=\"" + expected + "\"} 1.0\n");
        }

        @Test
        void testHelpEscapesBackslashAndNewlineOnly() {
            registry.register(Counter.builder("c").setHelp("line \"one\"\nback\\slash"));

            assertThat(render()).startsWith("# HELP c line \"one\"\\nback\\\\slash\n");
        }
    }

    @Nested
    class HistogramTests {

        @Test
        void testHistogramLines() {
            Histogram histogram = registry.register(Histogram.builder("latency")
                    .setHelp("Latency")
                    .setBuckets(0.05, 0.5, 2.0));
            Histogram.Measurement series = histogram.getOrCreateSeries();
            series.observe(0.01);
            series.observe(0.2);
            series.observe(1.5);

            String rendered = render();
            assertThat(rendered).startsWith("""
                    # HELP latency Latency
                    # TYPE latency histogram
                    latency_bucket{le="0.05"} 1
                    latency_bucket{le="0.5"} 2
                    latency_bucket{le="2.0"} 3
                    latency_bucket{le="+Inf"} 3
                    latency_sum\s""");
            assertThat(rendered).contains("\nlatency_count 3\n");

            double sum = Double.parseDouble(rendered.lines()
                    .filter(l -> l.startsWith("latency_sum "))
                    .findFirst()
                    .orElseThrow()
                    .substring("latency_sum ".length()));
            assertThat(sum).isCloseTo(1.71, within(1e-9));
        }

        @Test
        void testLabeledHistogramPutsBucketLabelLast() {
            Histogram histogram = registry.register(Histogram.builder("db_query_duration_seconds")
                    .addLabelNames("operation")
                    .setBuckets(1.0));
            histogram.getOrCreateSeries("select").observe(2.0);

            assertThat(render()).endsWith("""
                    db_query_duration_seconds_bucket{operation="select",le="1.0"} 0
                    db_query_duration_seconds_bucket{operation="select",le="+Inf"} 1
                    db_query_duration_seconds_sum{operation="select"} 2.0
                    db_query_duration_seconds_count{operation="select"} 1
                    """);
        }

        @Test
        void testHistogramWithoutObservations() {
            registry.register(Histogram.builder("empty").setBuckets(1.0)).getOrCreateSeries();

            assertThat(render()).endsWith("""
                    empty_bucket{le="1.0"} 0
                    empty_bucket{le="+Inf"} 0
                    empty_sum 0.0
                    empty_count 0
                    """);
        }
    }

    @Test
    void testUnsupportedMeasurementIsSkipped() {
        MeasurementSnapshot unsupported = new MeasurementSnapshot(LabelValues.EMPTY) {};
        MetricSnapshot metricSnapshot = new MetricSnapshot(
                new MetricDescriptor("odd", MetricType.GAUGE, "", List.of(), List.of()), List.of(unsupported));

        String rendered =
                new String(writer.render(new MetricRegistrySnapshot(List.of(metricSnapshot))), StandardCharsets.UTF_8);

        assertThat(rendered).isEqualTo("# HELP odd \n# TYPE odd gauge\n");
    }
}
