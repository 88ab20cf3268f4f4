// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apimon.instrumentation.db.ConnectionPoolMetrics;
import org.apimon.instrumentation.db.QueryMetrics;
import org.apimon.instrumentation.http.HttpMetricsFilter;
import org.apimon.instrumentation.http.HttpServerMetrics;
import org.apimon.metrics.core.MetricRegistry;
import org.apimon.metrics.prometheus.PrometheusMetricsHandler;
import org.eclipse.microprofile.config.Config;

/**
 * A small CRUD web API instrumented with request, query and connection pool metrics, which it exposes itself on
 * {@code /metrics} in the Prometheus text format. Every endpoint, {@code /metrics} included, is recorded by the
 * request metrics.
 */
public final class CrudExampleApplication implements Closeable {

    private static final Logger logger = LogManager.getLogger(CrudExampleApplication.class);

    public static final String METRICS_PATH = "/metrics";

    private static final Duration CONNECTION_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);

    private final MetricRegistry registry;
    private final SimulatedConnectionPool pool;
    private final ExecutorService executorService;
    private final HttpServer server;

    /**
     * Creates and starts the application.
     *
     * @param config the configuration, a {@link SmallRyeConfig} with {@link CrudExampleConfig} registered
     * @throws IOException if the server can't be bound to the configured address
     */
    public CrudExampleApplication(@NonNull Config config) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        final CrudExampleConfig appConfig =
                config.unwrap(SmallRyeConfig.class).getConfigMapping(CrudExampleConfig.class);

        registry = MetricRegistry.builder().discoverMetricProviders().build();

        final HttpServerMetrics httpMetrics = new HttpServerMetrics();
        final QueryMetrics queryMetrics = new QueryMetrics();
        pool = new SimulatedConnectionPool(appConfig.poolSize(), CONNECTION_ACQUIRE_TIMEOUT);
        final ConnectionPoolMetrics poolMetrics = new ConnectionPoolMetrics(pool);
        httpMetrics.bind(registry);
        queryMetrics.bind(registry);
        poolMetrics.bind(registry);

        final ObjectMapper mapper = new ObjectMapper();
        final UserDataStore store = new UserDataStore(pool, queryMetrics);
        final HttpMetricsFilter metricsFilter = new HttpMetricsFilter(httpMetrics);

        server = HttpServer.create(new InetSocketAddress(appConfig.hostname(), appConfig.port()), 0);
        final AtomicInteger threadCounter = new AtomicInteger();
        executorService = Executors.newFixedThreadPool(appConfig.threads(), runnable -> {
            Thread thread = new Thread(runnable, "crud-http-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executorService);

        final HttpContext dataContext = server.createContext(UserDataHandler.PATH, new UserDataHandler(store, mapper));
        dataContext.getFilters().add(metricsFilter);
        final HttpContext healthContext = server.createContext(HealthHandler.PATH, new HealthHandler(store, mapper));
        healthContext.getFilters().add(metricsFilter);
        final HttpContext metricsContext =
                server.createContext(METRICS_PATH, new PrometheusMetricsHandler(registry::snapshot));
        metricsContext.getFilters().add(metricsFilter);
        server.start();

        logger.info(
                "CRUD example started. hostname={}, port={}, poolSize={}",
                appConfig.hostname(),
                port(),
                appConfig.poolSize());
    }

    /**
     * @return the port the server is bound to
     */
    public int port() {
        return server.getAddress().getPort();
    }

    @NonNull
    public MetricRegistry registry() {
        return registry;
    }

    @NonNull
    public SimulatedConnectionPool pool() {
        return pool;
    }

    @Override
    public void close() throws IOException {
        logger.info("Stopping CRUD example...");
        server.stop(1);
        executorService.shutdownNow();
        registry.close();
    }

    public static void main(String[] args) throws IOException {
        final Config config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredSources()
                .addDiscoveredConverters()
                .addDiscoveredCustomizers()
                .build();
        final CrudExampleApplication application = new CrudExampleApplication(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                application.close();
            } catch (IOException e) {
                logger.error("Failed to stop CRUD example", e);
            }
        }, "crud-shutdown"));
    }
}
