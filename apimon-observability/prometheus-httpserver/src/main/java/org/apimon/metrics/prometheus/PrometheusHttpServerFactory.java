// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus;

import com.google.auto.service.AutoService;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import io.smallrye.config.SmallRyeConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.apimon.metrics.core.MetricsExporter;
import org.apimon.metrics.core.MetricsExporterFactory;
import org.apimon.metrics.prometheus.config.PrometheusHttpServerConfig;
import org.eclipse.microprofile.config.Config;

/**
 * Implementation of {@link MetricsExporterFactory} for creating Prometheus HTTP server exporters.
 * Uses {@link PrometheusHttpServerConfig} for configuration, so the passed configuration must be a
 * {@link SmallRyeConfig} with that mapping registered.
 */
@AutoService(MetricsExporterFactory.class)
public final class PrometheusHttpServerFactory implements MetricsExporterFactory {

    @Nullable
    @Override
    public MetricsExporter createExporter(@NonNull Config configuration) {
        PrometheusHttpServerConfig exportConfig =
                configuration.unwrap(SmallRyeConfig.class).getConfigMapping(PrometheusHttpServerConfig.class);

        if (!exportConfig.enabled()) {
            return null;
        }

        try {
            return new PrometheusHttpServer(exportConfig);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
