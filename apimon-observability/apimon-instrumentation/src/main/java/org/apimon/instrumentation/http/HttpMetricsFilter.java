// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A JDK HTTP server {@link Filter} recording every request passing through it with {@link HttpServerMetrics}.
 * <p>
 * The endpoint label is the request path and the status label is the response code. A handler failing with
 * a {@link RuntimeException} before responding is answered and recorded with status 500.
 */
public final class HttpMetricsFilter extends Filter {

    private static final Logger logger = LogManager.getLogger(HttpMetricsFilter.class);

    private static final int INTERNAL_SERVER_ERROR = 500;

    private final HttpServerMetrics metrics;

    public HttpMetricsFilter(@NonNull HttpServerMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "HTTP server metrics must not be null");
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        metrics.onRequestStart();
        final long start = System.nanoTime();
        try {
            chain.doFilter(exchange);
        } catch (RuntimeException e) {
            logger.warn(
                    "Request handler failed. method={}, path={}",
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    e);
            if (exchange.getResponseCode() == -1) {
                exchange.sendResponseHeaders(INTERNAL_SERVER_ERROR, -1);
            }
            exchange.close();
        } finally {
            final int responseCode = exchange.getResponseCode();
            metrics.onRequestEnd(
                    exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(),
                    responseCode == -1 ? INTERNAL_SERVER_ERROR : responseCode,
                    System.nanoTime() - start);
        }
    }

    @Override
    public String description() {
        return "Records request count, latency and in-progress requests";
    }
}
