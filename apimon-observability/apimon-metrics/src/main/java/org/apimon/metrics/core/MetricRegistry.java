// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apimon.metrics.process.ProcessMetricsRegistration;
import org.eclipse.microprofile.config.Config;

/**
 * A thread-safe registry for {@link Metric} instances, that allows registering new metrics by their builders
 * and retrieving existing metrics by their {@link MetricKey}.
 * <p>
 * New registry can be created via {@link #builder()} using builder pattern. There is no global registry:
 * the application creates one and hands it to its {@link MetricsBinder}s. Unless disabled with
 * {@link Builder#withoutProcessMetrics()}, process and runtime metrics are registered on creation.
 * <p>
 * Every call of {@link #snapshot()} first runs the registered snapshot hooks and then takes a new snapshot of
 * every metric in registration order. A failing hook or metric is logged and skipped, the rest is still
 * snapshotted.
 * <p>
 * Metric registry can optionally be associated with a {@link MetricsExporter}. It can be set during the registry
 * creation via the builder: {@link Builder#setMetricsExporter(MetricsExporter)} or
 * {@link Builder#discoverMetricsExporter(Config)}.
 * It implements {@link Closeable} to allow closing associated {@link MetricsExporter}, if present.
 */
public final class MetricRegistry implements Closeable {

    /** Configuration property to disable metrics exporter discovery.*/
    public static final String PROPERTY_EXPORT_DISCOVERY_DISABLED = "apimon.metrics.export.discovery.disabled";

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    @Nullable
    private final MetricsExporter exporter;

    private final Map<String, Metric> metrics = new ConcurrentHashMap<>();
    private final Queue<Metric> registrationOrder = new ConcurrentLinkedQueue<>();
    private final Collection<Metric> metricsView = Collections.unmodifiableCollection(registrationOrder);
    private final Queue<Runnable> snapshotHooks = new ConcurrentLinkedQueue<>();

    private MetricRegistry(@Nullable MetricsExporter exporter) {
        this.exporter = exporter;

        if (exporter != null) {
            exporter.setSnapshotSupplier(this::snapshot);
            logger.info("Created metric registry. exporter={}", exporter.getClass().getName());
        } else {
            logger.info("Created metric registry without exporter.");
        }
    }

    /**
     * @return a new {@link Builder} for constructing {@link MetricRegistry} instance.
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if this registry has an associated {@link MetricsExporter}, {@code false} otherwise
     */
    public boolean hasMetricsExporter() {
        return exporter != null;
    }

    /**
     * @return unmodifiable collection of all registered metrics in registration order, may be empty but never
     * {@code null}. The view can be iterated any number of times and reflects later registrations.
     */
    @NonNull
    public Collection<Metric> metrics() {
        return metricsView;
    }

    /**
     * Creates and registers a metric using the given metric builder.
     * <p>
     * Registration is idempotent: if a metric of the same class with an identical {@link MetricDescriptor} is
     * already registered under the same name, the existing metric is returned and the builder is not used.
     *
     * @param builder the metric builder, must not be {@code null}
     * @param <M>     the type of the metric to be created and registered
     * @param <B>     the type of the metric builder that creates the metric
     * @return the registered metric, never {@code null}
     * @throws NullPointerException         if the builder is {@code null}
     * @throws DuplicateMetricNameException if a different metric with the same name already exists in the registry
     */
    @NonNull
    public <M extends Metric, B extends Metric.Builder<?, M>> M register(final @NonNull B builder) {
        Objects.requireNonNull(builder, "metric builder must not be null");

        final MetricKey<M> metricKey = builder.key();
        final MetricDescriptor descriptor = builder.descriptor();

        return metricKey.type().cast(metrics.compute(metricKey.name(), (name, existingMetric) -> {
            if (existingMetric != null) {
                if (existingMetric.getClass() == metricKey.type()
                        && existingMetric.descriptor().equals(descriptor)) {
                    logger.debug("Metric already registered, reusing it. name={}", name);
                    return existingMetric;
                }
                throw new DuplicateMetricNameException("Duplicate metric name: " + name + ". Existing metric: "
                        + existingMetric + ", new metric: " + descriptor);
            }

            M metric = builder.build();
            registrationOrder.add(metric);
            logger.debug("Registered metric. name={}", name);
            return metric;
        }));
    }

    /**
     * Checks if a metric with the given key is registered in the registry.
     * Metric to be found has to have the same name as the provided key and be of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @return {@code true} if a metric with the given key is registered, {@code false} otherwise
     * @throws NullPointerException if the key is {@code null}
     */
    public boolean containsMetric(@NonNull MetricKey<?> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        Metric metric = metrics.get(key.name());
        return key.type().isInstance(metric);
    }

    /**
     * Gets a metric by its key.
     * Metric to be found has to have the same name as the provided key and be of compatible type.
     *
     * @param key the metric key, must not be {@code null}
     * @param <M> the type of the metric
     * @return the found metric, never {@code null}
     * @throws NullPointerException if the key is {@code null}
     * @throws NoSuchElementException if no metric is found for the given key name
     * @throws ClassCastException if metric found with the given key name is not of the expected key type
     */
    @NonNull
    public <M extends Metric> M getMetric(@NonNull MetricKey<M> key) {
        Objects.requireNonNull(key, "metric key must not be null");
        Metric metric = metrics.get(key.name());
        if (metric == null) {
            throw new NoSuchElementException("Metric not found: " + key);
        }
        return key.type().cast(metric);
    }

    /**
     * Adds a hook that runs at the start of every {@link #snapshot()}, before any metric is read.
     * Hooks are used to refresh gauges from external state, e.g. a connection pool status.
     *
     * @param hook the hook, must not be {@code null}
     */
    public void addSnapshotHook(@NonNull Runnable hook) {
        snapshotHooks.add(Objects.requireNonNull(hook, "snapshot hook must not be null"));
    }

    /**
     * Takes a new snapshot of all registered metrics.
     *
     * @return the snapshot, never {@code null}
     */
    @NonNull
    public MetricRegistrySnapshot snapshot() {
        for (Runnable hook : snapshotHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                logger.warn("Snapshot hook failed, continuing without it. hook={}", hook, e);
            }
        }

        final List<MetricSnapshot> snapshots = new ArrayList<>();
        for (Metric metric : registrationOrder) {
            try {
                snapshots.add(metric.snapshot());
            } catch (RuntimeException e) {
                logger.warn("Failed to snapshot metric, skipping it. name={}", metric.name(), e);
            }
        }
        return new MetricRegistrySnapshot(snapshots);
    }

    @Override
    public void close() throws IOException {
        if (exporter != null) {
            logger.info("Closing metrics exporter: {}", exporter.getClass().getName());
            exporter.close();
        }
    }

    /**
     * Builder for constructing {@link MetricRegistry} instances.
     */
    public static final class Builder {

        private boolean registerProcessMetrics = true;
        private boolean discoverMetricProviders = false;
        private MetricsExporter metricsExporter;
        private Config configuration;

        /**
         * Do not register process and runtime metrics on creation.
         *
         * @return this builder instance
         */
        @NonNull
        public Builder withoutProcessMetrics() {
            registerProcessMetrics = false;
            return this;
        }

        /**
         * Sets the {@link MetricsExporter} to be associated with the registry.
         *
         * @param metricsExporter the metrics exporter, must not be {@code null}
         * @return this builder instance
         * @throws NullPointerException if the metrics exporter is {@code null}
         */
        @NonNull
        public Builder setMetricsExporter(@NonNull MetricsExporter metricsExporter) {
            this.metricsExporter = Objects.requireNonNull(metricsExporter, "metrics exporter must not be null");
            return this;
        }

        /**
         * Enable discovery of {@link MetricsRegistrationProvider} implementations to register in the registry.
         * Actual discovery happens during the {@link #build()} call.
         *
         * @return this builder instance
         */
        @NonNull
        public Builder discoverMetricProviders() {
            discoverMetricProviders = true;
            return this;
        }

        /**
         * Enables discovery of a {@link MetricsExporterFactory} implementation that creates {@link MetricsExporter}
         * using the provided configuration.
         * Actual discovery happens during the {@link #build()} call and if successful, overrides exporter set
         * by {@link #setMetricsExporter(MetricsExporter)}.
         * {@link MetricsExporter} will be used only if single {@link MetricsExporterFactory} is discovered and
         * {@value #PROPERTY_EXPORT_DISCOVERY_DISABLED} configuration property is not set to {@code true}.
         *
         * @param configuration the configuration to use for creating an instance of {@link MetricsExporter}
         * @return this builder instance
         * @throws NullPointerException if the configuration is {@code null}
         */
        @NonNull
        public Builder discoverMetricsExporter(@NonNull Config configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
            return this;
        }

        /**
         * Builds the {@link MetricRegistry} instance.
         * <p>
         * If exporter discovery is enabled and not disabled by configuration property
         * {@value #PROPERTY_EXPORT_DISCOVERY_DISABLED}, it attempts to discover a single
         * {@link MetricsExporterFactory} via service loader and create an exporter using it.
         * If multiple factories are found, they are ignored and a warning is logged.
         * <p>
         * Process metrics are registered first, then metrics of discovered {@link MetricsRegistrationProvider}s.
         *
         * @return the constructed {@link MetricRegistry}
         */
        @NonNull
        public MetricRegistry build() {
            if (configuration != null) {
                boolean exporterDiscoveryDisabled = configuration
                        .getOptionalValue(PROPERTY_EXPORT_DISCOVERY_DISABLED, Boolean.class)
                        .orElse(false);
                if (exporterDiscoveryDisabled) {
                    logger.info(
                            "Exporter discovery is disabled by configuration property: {}",
                            PROPERTY_EXPORT_DISCOVERY_DISABLED);
                } else {
                    discoverExporter();
                }
            }

            final MetricRegistry registry = new MetricRegistry(metricsExporter);

            if (registerProcessMetrics) {
                registerAll(registry, new ProcessMetricsRegistration());
            }

            if (discoverMetricProviders) {
                List<MetricsRegistrationProvider> providers = MetricUtils.load(MetricsRegistrationProvider.class);

                if (providers.isEmpty()) {
                    logger.info("No metrics registration providers found.");
                }

                for (MetricsRegistrationProvider provider : providers) {
                    registerAll(registry, provider);
                }
            }

            return registry;
        }

        private void discoverExporter() {
            List<MetricsExporterFactory> factories = MetricUtils.load(MetricsExporterFactory.class);
            if (factories.size() > 1) {
                logger.warn(
                        "Multiple metrics exporter factories found: {}. "
                                + "Expected at most one. Ignoring discovered exporter factories.",
                        factories);
            } else if (factories.size() == 1) {
                MetricsExporterFactory factory = factories.get(0);
                MetricsExporter exporter = factory.createExporter(configuration);

                if (exporter != null) {
                    this.metricsExporter = exporter;
                } else {
                    logger.info("Exporter factory did not create an exporter: {}", factory.getClass().getName());
                }
            }
        }

        private static void registerAll(MetricRegistry registry, MetricsRegistrationProvider provider) {
            Objects.requireNonNull(provider, "metrics registration provider must not be null");
            logger.info("Registering metrics from provider: {}", provider.getClass().getName());

            Collection<Metric.Builder<?, ?>> metricsToRegister = provider.getMetricsToRegister();
            Objects.requireNonNull(metricsToRegister, "metrics collection must not be null");

            for (Metric.Builder<?, ?> builder : metricsToRegister) {
                registry.register(builder);
            }
        }
    }
}
