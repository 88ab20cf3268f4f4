// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import org.apimon.metrics.Counter;
import org.apimon.metrics.Gauge;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.prometheus.PrometheusTextWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConnectionPoolMetricsTest {

    @Mock
    private ConnectionPoolStatusSource statusSource;

    private MetricRegistry registry;
    private ConnectionPoolMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = MetricRegistry.builder().withoutProcessMetrics().build();
        metrics = new ConnectionPoolMetrics(statusSource);
        metrics.bind(registry);
    }

    private double gauge(String name) {
        return registry.getMetric(Gauge.key(name)).getOrCreateSeries().get();
    }

    private String render() {
        return new String(new PrometheusTextWriter().render(registry.snapshot()), StandardCharsets.UTF_8);
    }

    @Test
    void testGaugesRefreshedOnEverySnapshot() {
        when(statusSource.status())
                .thenReturn("Connections in pool: 4 Checked out connections: 1")
                .thenReturn("Connections in pool: 2 Checked out connections: 3 Waiters: 1");

        assertThat(render())
                .contains("db_pool_checked_out_connections 1.0\n")
                .contains("db_pool_idle_connections 4.0\n")
                .contains("db_pool_waiters 0.0\n");
        assertThat(render())
                .contains("db_pool_checked_out_connections 3.0\n")
                .contains("db_pool_idle_connections 2.0\n")
                .contains("db_pool_waiters 1.0\n");

        verify(statusSource, times(2)).status();
    }

    @Test
    void testParseFailureKeepsPreviousValuesAndRenders() {
        registry.register(Counter.builder("other_total")).getOrCreateSeries().increment();
        when(statusSource.status())
                .thenReturn("Connections in pool: 4 Checked out connections: 1")
                .thenReturn("unexpected status text");

        assertThat(metrics.refresh()).isTrue();
        String rendered = render();

        assertThat(gauge(ConnectionPoolMetrics.IDLE_CONNECTIONS)).isEqualTo(4.0);
        assertThat(gauge(ConnectionPoolMetrics.CHECKED_OUT_CONNECTIONS)).isEqualTo(1.0);
        assertThat(rendered).contains("db_pool_idle_connections 4.0\n").contains("other_total 1.0\n");
    }

    @Test
    void testFailingSourceDoesNotBreakRendering() {
        when(statusSource.status()).thenThrow(new IllegalStateException("pool closed"));

        assertThat(metrics.refresh()).isFalse();
        assertThat(render()).contains("db_pool_waiters 0.0\n");
    }
}
