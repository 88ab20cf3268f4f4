// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.spi.HttpServerProvider;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apimon.metrics.core.MetricRegistrySnapshot;
import org.apimon.metrics.core.MetricsExporter;
import org.apimon.metrics.prometheus.config.PrometheusHttpServerConfig;

/**
 * A {@link MetricsExporter} running its own HTTP server that exposes metrics in the Prometheus text format.
 * <p>
 * The server listens on a configurable hostname, port and path and serves requests with
 * {@link PrometheusMetricsHandler} on a fixed pool of daemon threads.
 */
public final class PrometheusHttpServer implements MetricsExporter {

    private static final Logger logger = LogManager.getLogger(PrometheusHttpServer.class);

    private final PrometheusMetricsHandler handler;
    private final ExecutorService executorService;
    private final HttpServer server;

    /**
     * Creates and starts the server.
     *
     * @param config the server configuration
     * @throws IOException if the server can't be bound to the configured address
     */
    public PrometheusHttpServer(@NonNull PrometheusHttpServerConfig config) throws IOException {
        Objects.requireNonNull(config, "Prometheus HTTP server config must not be null");

        handler = new PrometheusMetricsHandler(config.bufferSize());

        final InetSocketAddress address = new InetSocketAddress(config.hostname(), config.port());
        server = HttpServerProvider.provider().createHttpServer(address, 0);

        final AtomicInteger threadCounter = new AtomicInteger();
        executorService = Executors.newFixedThreadPool(config.threads(), runnable -> {
            Thread thread = new Thread(runnable, "prometheus-http-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executorService);
        server.createContext(config.path(), handler);
        server.start();

        logger.info(
                "Prometheus HTTP server started. hostname={}, port={}, path={}",
                config.hostname(),
                port(),
                config.path());
    }

    /**
     * @return the port the server is bound to
     */
    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void setSnapshotSupplier(@NonNull Supplier<MetricRegistrySnapshot> snapshotSupplier) {
        handler.setSnapshotSupplier(snapshotSupplier);
    }

    @Override
    public void close() {
        logger.info("Stopping Prometheus HTTP server...");
        server.stop(1);
        executorService.shutdownNow();
    }
}
