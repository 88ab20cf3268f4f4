// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Objects;
import org.apimon.metrics.Counter;
import org.apimon.metrics.Histogram;
import org.apimon.metrics.core.IdempotentMetricsBinder;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.core.MetricUtils;

/**
 * Database query metrics: number and duration of queries per {@link QueryOperation}.
 * Statements of any other kind are not recorded.
 */
public final class QueryMetrics extends IdempotentMetricsBinder {

    public static final String QUERIES_TOTAL = "db_queries_total";
    public static final String QUERY_DURATION_SECONDS = "db_query_duration_seconds";
    public static final String OPERATION_LABEL = "operation";

    @Nullable
    private final double[] buckets;

    private volatile Counter queries;
    private volatile Histogram queryDuration;

    /**
     * Creates query metrics with {@link Histogram#DEFAULT_BUCKETS}.
     */
    public QueryMetrics() {
        this.buckets = null;
    }

    /**
     * Creates query metrics with custom duration buckets in seconds.
     *
     * @param buckets strictly increasing bucket upper bounds
     */
    public QueryMetrics(@NonNull double... buckets) {
        this.buckets = Objects.requireNonNull(buckets, "buckets must not be null").clone();
    }

    @Override
    protected void bindMetricsNonIdempotent(@NonNull MetricRegistry registry) {
        queries = registry.register(Counter.builder(QUERIES_TOTAL)
                .setHelp("Total number of database queries")
                .addLabelNames(OPERATION_LABEL));

        Histogram.Builder durationBuilder = Histogram.builder(QUERY_DURATION_SECONDS)
                .setHelp("Database query duration in seconds")
                .addLabelNames(OPERATION_LABEL);
        if (buckets != null) {
            durationBuilder.setBuckets(buckets);
        }
        queryDuration = registry.register(durationBuilder);
    }

    /**
     * Starts measuring a query.
     *
     * @param sql the statement about to be executed
     * @return the timer to close once the statement completes
     * @throws IllegalStateException if not bound to a registry yet
     */
    @NonNull
    public QueryTimer start(@Nullable String sql) {
        checkBound();
        return new QueryTimer(this, sql, System.nanoTime());
    }

    /**
     * Records a completed query, ignoring statements that are not a {@link QueryOperation}.
     *
     * @param sql          the executed statement
     * @param elapsedNanos time the statement took in nanoseconds
     * @throws IllegalStateException if not bound to a registry yet
     */
    public void recordQuery(@Nullable String sql, long elapsedNanos) {
        checkBound();
        QueryOperation.fromSql(sql).ifPresent(operation -> record(operation, elapsedNanos));
    }

    /**
     * Records a completed query of a known operation.
     *
     * @param operation    the operation
     * @param elapsedNanos time the statement took in nanoseconds
     * @throws IllegalStateException if not bound to a registry yet
     */
    public void record(@NonNull QueryOperation operation, long elapsedNanos) {
        checkBound();
        Objects.requireNonNull(operation, "operation must not be null");
        queries.getOrCreateSeries(operation.label()).increment();
        queryDuration.getOrCreateSeries(operation.label()).observe(MetricUtils.nanosToSeconds(elapsedNanos));
    }

    private void checkBound() {
        if (!isMetricsBound()) {
            throw new IllegalStateException("Query metrics are not bound to a registry");
        }
    }
}
