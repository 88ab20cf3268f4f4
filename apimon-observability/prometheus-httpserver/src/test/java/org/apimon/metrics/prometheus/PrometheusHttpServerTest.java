// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import static org.assertj.core.api.Assertions.assertThat;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.apimon.metrics.Counter;
import org.apimon.metrics.Histogram;
import org.apimon.metrics.core.MetricKey;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.prometheus.config.PrometheusHttpServerConfig;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

/**
 * Runs a registry with its exporter discovered through the service loader.
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class PrometheusHttpServerTest {

    private static final MetricKey<Counter> LABELED_COUNTER = Counter.key("labeled_counter");
    private static final MetricKey<Histogram> LATENCY = Histogram.key("latency_seconds");

    private static MetricRegistry registry;
    private static HttpClient httpClient;
    private static URI uri;

    @BeforeAll
    static void setUpAll() {
        final int port = findFreePort();
        Config config = new SmallRyeConfigBuilder()
                .addDiscoveredCustomizers()
                .withSources(new PropertiesConfigSource(
                        Map.of(
                                PrometheusHttpServerConfig.PREFIX + ".port", Integer.toString(port),
                                PrometheusHttpServerConfig.PREFIX + ".path", "/custom-metrics"),
                        "test",
                        500))
                .build();

        registry = MetricRegistry.builder()
                .withoutProcessMetrics()
                .discoverMetricsExporter(config)
                .build();
        httpClient = HttpClient.newHttpClient();
        uri = URI.create("http://localhost:" + port + "/custom-metrics");
    }

    @AfterAll
    static void shutdown() throws IOException {
        registry.close();
    }

    // helper to find an ephemeral free port
    private static int findFreePort() {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Unable to find free port", e);
        }
    }

    @Test
    @Order(1)
    void testExporterDiscovered() {
        assertThat(registry.hasMetricsExporter()).isTrue();
        assertThat(callMetrics().statusCode()).isEqualTo(200);
        assertThat(callMetrics().body()).isEmpty();
    }

    @Test
    @Order(2)
    void testMetricsRegisteredButNoObservations() {
        registry.register(Counter.builder(LABELED_COUNTER).setHelp("Labeled counter").addLabelNames("method", "path"));
        registry.register(Histogram.builder(LATENCY).setHelp("Latency").setBuckets(0.1, 1.0));

        assertThat(callMetrics().body()).isEqualTo("""
                # HELP labeled_counter Labeled counter
                # TYPE labeled_counter counter
                # HELP latency_seconds Latency
                # TYPE latency_seconds histogram
                """);
    }

    @Test
    @Order(3)
    void testMetricsObserved() {
        registry.getMetric(LABELED_COUNTER).getOrCreateSeries("GET", "/api/resource").increment(5);
        registry.getMetric(LABELED_COUNTER).getOrCreateSeries("POST", "/api/resource").increment(8);
        registry.getMetric(LATENCY).getOrCreateSeries().observe(0.5);

        assertThat(callMetrics().body()).isEqualTo("""
                # HELP labeled_counter Labeled counter
                # TYPE labeled_counter counter
                labeled_counter{method="GET",path="/api/resource"} 5.0
                labeled_counter{method="POST",path="/api/resource"} 8.0
                # HELP latency_seconds Latency
                # TYPE latency_seconds histogram
                latency_seconds_bucket{le="0.1"} 0
                latency_seconds_bucket{le="1.0"} 1
                latency_seconds_bucket{le="+Inf"} 1
                latency_seconds_sum 0.5
                latency_seconds_count 1
                """);
    }

    @Test
    @Order(4)
    void testOtherPathsNotServed() {
        HttpResponse<String> response = send(URI.create(uri.toString().replace("/custom-metrics", "/other")));

        assertThat(response.statusCode()).isEqualTo(404);
    }

    private HttpResponse<String> callMetrics() {
        return send(uri);
    }

    private HttpResponse<String> send(URI target) {
        try {
            return httpClient.send(
                    HttpRequest.newBuilder(target)
                            .timeout(Duration.ofSeconds(5))
                            .GET()
                            .build(),
                    PrometheusMetricsHandlerTest.BODY_HANDLER);
        } catch (Exception e) {
            throw new RuntimeException("Error sending request", e);
        }
    }
}
