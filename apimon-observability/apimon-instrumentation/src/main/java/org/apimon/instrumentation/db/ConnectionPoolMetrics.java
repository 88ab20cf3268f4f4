// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apimon.metrics.Gauge;
import org.apimon.metrics.core.IdempotentMetricsBinder;
import org.apimon.metrics.core.MetricRegistry;

/**
 * Connection pool gauges refreshed from a {@link ConnectionPoolStatusSource} right before every registry snapshot.
 * <p>
 * If the status can't be read or parsed, a warning is logged and the gauges keep their previous values.
 */
public final class ConnectionPoolMetrics extends IdempotentMetricsBinder {

    private static final Logger logger = LogManager.getLogger(ConnectionPoolMetrics.class);

    public static final String CHECKED_OUT_CONNECTIONS = "db_pool_checked_out_connections";
    public static final String IDLE_CONNECTIONS = "db_pool_idle_connections";
    public static final String WAITERS = "db_pool_waiters";

    private final ConnectionPoolStatusSource statusSource;

    private volatile Gauge.Measurement checkedOut;
    private volatile Gauge.Measurement idle;
    private volatile Gauge.Measurement waiters;

    public ConnectionPoolMetrics(@NonNull ConnectionPoolStatusSource statusSource) {
        this.statusSource = Objects.requireNonNull(statusSource, "pool status source must not be null");
    }

    @Override
    protected void bindMetricsNonIdempotent(@NonNull MetricRegistry registry) {
        checkedOut = registry.register(Gauge.builder(CHECKED_OUT_CONNECTIONS)
                        .setHelp("Number of connections currently checked out of the pool"))
                .getOrCreateSeries();
        idle = registry.register(Gauge.builder(IDLE_CONNECTIONS).setHelp("Number of idle connections in the pool"))
                .getOrCreateSeries();
        waiters = registry.register(Gauge.builder(WAITERS).setHelp("Number of callers waiting for a connection"))
                .getOrCreateSeries();

        registry.addSnapshotHook(this::refresh);
    }

    /**
     * Reads the pool status and updates the gauges. Called automatically before every registry snapshot.
     *
     * @return {@code true} if the gauges were updated
     */
    public boolean refresh() {
        if (!isMetricsBound()) {
            throw new IllegalStateException("Connection pool metrics are not bound to a registry");
        }

        final PoolStatus status;
        try {
            status = PoolStatus.parse(statusSource.status());
        } catch (RuntimeException e) {
            logger.warn("Failed to read connection pool status, keeping previous values", e);
            return false;
        }

        checkedOut.set(status.checkedOut());
        idle.set(status.idle());
        waiters.set(status.waiters());
        return true;
    }
}
