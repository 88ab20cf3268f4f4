// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.eclipse.microprofile.config.Config;

/**
 * A factory interface for creating {@link MetricsExporter} instances based on the provided configuration.
 * Implementations are discovered by {@link java.util.ServiceLoader} when a {@link MetricRegistry} is built
 * with {@link MetricRegistry.Builder#discoverMetricsExporter(Config)}.
 */
@FunctionalInterface
public interface MetricsExporterFactory {

    /**
     * Creates a new {@link MetricsExporter} instance based on the provided configuration.
     * May return {@code null} if the factory cannot create an exporter with the given configuration
     * (e.g. disabled flag).
     *
     * @param configuration the configuration to use for creating the exporter, must not be {@code null}
     * @return a new instance of {@link MetricsExporter}, or {@code null} if not able to create one.
     */
    @Nullable
    MetricsExporter createExporter(@NonNull Config configuration);
}
