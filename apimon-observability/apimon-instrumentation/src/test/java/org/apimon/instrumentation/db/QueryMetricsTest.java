// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apimon.metrics.Counter;
import org.apimon.metrics.Histogram;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.prometheus.PrometheusTextWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryMetricsTest {

    private MetricRegistry registry;

    @BeforeEach
    void setUp() {
        registry = MetricRegistry.builder().withoutProcessMetrics().build();
    }

    private Counter queries() {
        return registry.getMetric(Counter.key(QueryMetrics.QUERIES_TOTAL));
    }

    private Histogram queryDuration() {
        return registry.getMetric(Histogram.key(QueryMetrics.QUERY_DURATION_SECONDS));
    }

    @Test
    void testDefaultBuckets() {
        new QueryMetrics().bind(registry);

        assertThat(queryDuration().descriptor().bucketBounds()).isEqualTo(Histogram.DEFAULT_BUCKETS);
        assertThat(queries().labelNames()).containsExactly("operation");
    }

    @Test
    void testRecordQueryByOperation() {
        QueryMetrics metrics = new QueryMetrics();
        metrics.bind(registry);

        metrics.recordQuery("  UPDATE users SET x=1", Duration.ofMillis(10).toNanos());
        metrics.recordQuery("select * from user_data", Duration.ofMillis(20).toNanos());
        metrics.recordQuery("SELECT 1", Duration.ofMillis(30).toNanos());

        assertThat(queries().getOrCreateSeries("update").get()).isEqualTo(1.0);
        assertThat(queries().getOrCreateSeries("select").get()).isEqualTo(2.0);
        assertThat(queryDuration().getOrCreateSeries("select").sum()).isCloseTo(0.05, within(1e-9));
    }

    @Test
    void testUnrecognizedStatementsSilentlyIgnored() {
        QueryMetrics metrics = new QueryMetrics();
        metrics.bind(registry);

        metrics.recordQuery("CREATE TABLE t (id int)", 1L);
        metrics.recordQuery("", 1L);
        metrics.recordQuery(null, 1L);

        assertThat(queries().seriesCount()).isZero();
        assertThat(queryDuration().seriesCount()).isZero();
    }

    @Test
    void testSelectDurationScenario() {
        QueryMetrics metrics = new QueryMetrics(0.05, 0.5, 2.0);
        metrics.bind(registry);

        metrics.recordQuery("SELECT 1", Duration.ofMillis(10).toNanos());
        metrics.recordQuery("SELECT 1", Duration.ofMillis(200).toNanos());
        metrics.recordQuery("SELECT 1", Duration.ofMillis(1500).toNanos());

        String rendered = new String(new PrometheusTextWriter().render(registry.snapshot()), StandardCharsets.UTF_8);
        assertThat(rendered)
                .contains("db_query_duration_seconds_bucket{operation=\"select\",le=\"0.05\"} 1\n")
                .contains("db_query_duration_seconds_bucket{operation=\"select\",le=\"0.5\"} 2\n")
                .contains("db_query_duration_seconds_bucket{operation=\"select\",le=\"2.0\"} 3\n")
                .contains("db_query_duration_seconds_bucket{operation=\"select\",le=\"+Inf\"} 3\n")
                .contains("db_query_duration_seconds_count{operation=\"select\"} 3\n")
                .contains("db_queries_total{operation=\"select\"} 3.0\n");
        assertThat(queryDuration().getOrCreateSeries("select").sum()).isCloseTo(1.71, within(1e-9));
    }

    @Test
    void testTimerRecordsOnceOnClose() {
        QueryMetrics metrics = new QueryMetrics();
        metrics.bind(registry);

        QueryTimer timer = metrics.start("DELETE FROM user_data WHERE id = 1");
        assertThat(queries().seriesCount()).isZero();
        timer.close();
        timer.close();

        assertThat(queries().getOrCreateSeries("delete").get()).isEqualTo(1.0);
        assertThat(queryDuration().getOrCreateSeries("delete").count()).isEqualTo(1);
        assertThat(queryDuration().getOrCreateSeries("delete").sum()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    void testTimerInTryWithResources() {
        QueryMetrics metrics = new QueryMetrics();
        metrics.bind(registry);

        try (QueryTimer ignored = metrics.start("INSERT INTO user_data VALUES (1)")) {
            assertThat(queries().seriesCount()).isZero();
        }

        assertThat(queries().getOrCreateSeries("insert").get()).isEqualTo(1.0);
    }

    @Test
    void testUnboundMetricsRejectRecording() {
        QueryMetrics metrics = new QueryMetrics();

        assertThatThrownBy(() -> metrics.recordQuery("SELECT 1", 1L)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> metrics.start("SELECT 1")).isInstanceOf(IllegalStateException.class);
    }
}
