// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * Configuration for the Prometheus HTTP server, mapped from properties under {@value #PREFIX}.
 * <ul>
 *     <li>{@code enabled} whether the server is enabled (default: true)</li>
 *     <li>{@code hostname} the hostname to bind to, {@code 0.0.0.0} means all interfaces (default: localhost)</li>
 *     <li>{@code port} the port to listen on (default: 8888, range: 1024-65535)</li>
 *     <li>{@code path} the HTTP path to serve metrics on, starting with {@code /} (default: /metrics)</li>
 *     <li>{@code bufferSize} initial capacity of the response render buffer (default: 1024, range: 0-2mb)</li>
 *     <li>{@code threads} number of threads handling scrape requests (default: 2, range: 1-64)</li>
 * </ul>
 * Registered with the configuration by {@link PrometheusHttpServerConfigCustomizer}.
 */
// spotless:off
@ConfigMapping(prefix = PrometheusHttpServerConfig.PREFIX, namingStrategy = ConfigMapping.NamingStrategy.VERBATIM)
public interface PrometheusHttpServerConfig {

    String PREFIX = "metrics.exporter.prometheus.http";

    @WithDefault("true")
    boolean enabled();

    @WithDefault("localhost")
    String hostname();

    @WithDefault("8888") @Min(1024) @Max(65535)
    int port();

    @WithDefault("/metrics") @Pattern(regexp = "/.*")
    String path();

    @WithDefault("1024") @Min(0) @Max(2097152)
    int bufferSize();

    @WithDefault("2") @Min(1) @Max(64)
    int threads();
}
// spotless:on
