// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.http;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.apimon.metrics.Counter;
import org.apimon.metrics.Gauge;
import org.apimon.metrics.Histogram;
import org.apimon.metrics.core.IdempotentMetricsBinder;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.core.MetricUtils;

/**
 * Request lifecycle metrics of an HTTP server: request count and latency per method, endpoint and status,
 * and the number of requests in progress.
 * <p>
 * Call {@link #onRequestStart()} when a request arrives and {@link #onRequestEnd(String, String, int, long)}
 * once it is answered, {@link HttpMetricsFilter} does both for a JDK HTTP server.
 */
public final class HttpServerMetrics extends IdempotentMetricsBinder {

    public static final String REQUESTS_TOTAL = "http_requests_total";
    public static final String REQUEST_DURATION_SECONDS = "http_request_duration_seconds";
    public static final String IN_PROGRESS_REQUESTS = "inprogress_requests";

    public static final String METHOD_LABEL = "method";
    public static final String ENDPOINT_LABEL = "endpoint";
    public static final String STATUS_LABEL = "http_status";

    private static final double[] DURATION_BUCKETS = {0.1, 0.3, 0.5, 1.0, 3.0, 5.0};

    private volatile Counter requests;
    private volatile Histogram requestDuration;
    private volatile Gauge.Measurement inProgress;

    @Override
    protected void bindMetricsNonIdempotent(@NonNull MetricRegistry registry) {
        requests = registry.register(Counter.builder(REQUESTS_TOTAL)
                .setHelp("Total HTTP requests")
                .addLabelNames(METHOD_LABEL, ENDPOINT_LABEL, STATUS_LABEL));
        requestDuration = registry.register(Histogram.builder(REQUEST_DURATION_SECONDS)
                .setHelp("HTTP request latency")
                .addLabelNames(METHOD_LABEL, ENDPOINT_LABEL, STATUS_LABEL)
                .setBuckets(DURATION_BUCKETS));
        inProgress = registry.register(Gauge.builder(IN_PROGRESS_REQUESTS).setHelp("In-progress HTTP requests"))
                .getOrCreateSeries();
    }

    /**
     * Marks a request as started.
     *
     * @throws IllegalStateException if not bound to a registry yet
     */
    public void onRequestStart() {
        checkBound();
        inProgress.increment();
    }

    /**
     * Records a finished request and marks it as no longer in progress.
     * The in-progress gauge is decremented even if recording fails.
     *
     * @param method       the request method, e.g. {@code GET}
     * @param endpoint     the request path
     * @param status       the response status code
     * @param elapsedNanos time the request took in nanoseconds
     * @throws IllegalStateException if not bound to a registry yet
     */
    public void onRequestEnd(@NonNull String method, @NonNull String endpoint, int status, long elapsedNanos) {
        checkBound();
        try {
            Objects.requireNonNull(method, "method must not be null");
            Objects.requireNonNull(endpoint, "endpoint must not be null");

            final String statusLabel = Integer.toString(status);
            requests.getOrCreateSeries(method, endpoint, statusLabel).increment();
            requestDuration
                    .getOrCreateSeries(method, endpoint, statusLabel)
                    .observe(MetricUtils.nanosToSeconds(elapsedNanos));
        } finally {
            inProgress.decrement();
        }
    }

    private void checkBound() {
        if (!isMetricsBound()) {
            throw new IllegalStateException("HTTP server metrics are not bound to a registry");
        }
    }
}
