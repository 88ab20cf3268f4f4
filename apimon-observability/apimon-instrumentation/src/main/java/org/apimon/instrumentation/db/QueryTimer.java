// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

/**
 * Measures one query started by {@link QueryMetrics#start(String)}. Closing the timer records the query,
 * later calls of {@link #close()} have no effect.
 * <pre>{@code
 * try (QueryTimer ignored = queryMetrics.start(sql)) {
 *     statement.execute(sql);
 * }
 * }</pre>
 */
public final class QueryTimer implements AutoCloseable {

    private final QueryMetrics metrics;
    private final String sql;
    private final long startNanos;
    private boolean closed;

    QueryTimer(QueryMetrics metrics, String sql, long startNanos) {
        this.metrics = metrics;
        this.sql = sql;
        this.startNanos = startNanos;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            metrics.recordQuery(sql, System.nanoTime() - startNanos);
        }
    }
}
