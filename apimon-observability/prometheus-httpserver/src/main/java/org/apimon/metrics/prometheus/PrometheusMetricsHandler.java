// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apimon.metrics.core.MetricRegistrySnapshot;

/**
 * An {@link HttpHandler} that serves a fresh metrics snapshot in the Prometheus text format.
 * <p>
 * GET requests render the snapshot, gzip compressed if the client indicates support for it via the
 * "Accept-Encoding" header. HEAD requests are supported for health checks, any other method is answered
 * with 405 (Method Not Allowed). Until a snapshot supplier is set, requests are answered with 204 (No Content).
 * <p>
 * The whole body is rendered in memory before the status line is sent, so a failure while taking or
 * rendering the snapshot is reported as 500 (Internal Server Error). Concurrent requests are served
 * independently.
 */
public final class PrometheusMetricsHandler implements HttpHandler {

    private static final Logger logger = LogManager.getLogger(PrometheusMetricsHandler.class);

    private final PrometheusTextWriter writer = new PrometheusTextWriter();
    private final int bufferSize;

    private volatile Supplier<MetricRegistrySnapshot> snapshotSupplier;

    /**
     * @param bufferSize initial capacity of the per-request render buffer
     */
    public PrometheusMetricsHandler(int bufferSize) {
        if (bufferSize < 0) {
            throw new IllegalArgumentException("Buffer size must not be negative: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /**
     * Creates a handler serving snapshots of the given supplier.
     *
     * @param snapshotSupplier the snapshot supplier, usually {@code registry::snapshot}
     */
    public PrometheusMetricsHandler(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier) {
        this(1024);
        setSnapshotSupplier(snapshotSupplier);
    }

    /**
     * @param snapshotSupplier the supplier to take a snapshot per request, {@code null} to stop serving metrics
     */
    public void setSnapshotSupplier(@Nullable Supplier<MetricRegistrySnapshot> snapshotSupplier) {
        this.snapshotSupplier = snapshotSupplier;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                handleGetRequest(exchange);
            } else if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
                handleHeadRequest(exchange);
            } else {
                exchange.getResponseHeaders().set("Allow", "GET, HEAD");
                exchange.sendResponseHeaders(405, -1);
            }
        } catch (RuntimeException e) {
            logger.warn("Unexpected error while handling metrics request", e);
            // only possible while the response is not committed yet
            if (exchange.getResponseCode() == -1) {
                exchange.getResponseHeaders().set("Cache-Control", "no-store");
                exchange.sendResponseHeaders(500, -1);
            }
        } finally {
            exchange.close();
        }
    }

    private void handleHeadRequest(HttpExchange exchange) throws IOException {
        if (snapshotSupplier == null) {
            handleNoSnapshotSupplier(exchange);
        } else {
            setCommonOkResponseHeaders(exchange.getResponseHeaders());
            handleGzipHeaders(exchange);
            exchange.sendResponseHeaders(200, -1);
        }
    }

    private void handleGetRequest(HttpExchange exchange) throws IOException {
        final Supplier<MetricRegistrySnapshot> snapshotSupplierRef = this.snapshotSupplier;

        if (snapshotSupplierRef == null) {
            handleNoSnapshotSupplier(exchange);
            return;
        }

        final MetricRegistrySnapshot registrySnapshot = snapshotSupplierRef.get();
        final boolean useGzip = acceptsGzip(exchange);

        final UnsynchronizedByteArrayOutputStream body = new UnsynchronizedByteArrayOutputStream(bufferSize);
        OutputStream outputStream = useGzip ? new GZIPOutputStream(body) : body;
        try (OutputStream os = outputStream) {
            writer.write(registrySnapshot, os);
        }

        setCommonOkResponseHeaders(exchange.getResponseHeaders());
        if (useGzip) {
            exchange.getResponseHeaders().set("Content-Encoding", "gzip");
        }
        exchange.sendResponseHeaders(200, body.size() == 0 ? -1 : body.size());
        if (body.size() > 0) {
            body.writeTo(exchange.getResponseBody());
        }
    }

    private void handleNoSnapshotSupplier(HttpExchange exchange) throws IOException {
        logger.info("No snapshot supplier configured yet. method={}", exchange.getRequestMethod());
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(204, -1); // No Content
    }

    private static void setCommonOkResponseHeaders(Headers responseHeaders) {
        responseHeaders.set("Content-Type", PrometheusTextWriter.CONTENT_TYPE);
        responseHeaders.set("Cache-Control", "no-store");
        responseHeaders.set("Vary", "Accept-Encoding");
    }

    private static void handleGzipHeaders(HttpExchange exchange) {
        if (acceptsGzip(exchange)) {
            exchange.getResponseHeaders().set("Content-Encoding", "gzip");
        }
    }

    private static boolean acceptsGzip(HttpExchange exchange) {
        List<String> encodingHeaders = exchange.getRequestHeaders().get("Accept-Encoding");
        if (encodingHeaders == null) {
            return false;
        }
        for (String encodingHeader : encodingHeaders) {
            for (String encoding : encodingHeader.split(",")) {
                // drop quality value, e.g. "gzip;q=1.0"
                String name = encoding.split(";")[0].trim();
                if (name.equalsIgnoreCase("gzip")) {
                    return true;
                }
            }
        }
        return false;
    }
}
