// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.prometheus.config;

import com.google.auto.service.AutoService;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.SmallRyeConfigBuilderCustomizer;
import io.smallrye.config.validator.BeanValidationConfigValidatorImpl;

/**
 * {@link SmallRyeConfigBuilderCustomizer} for the Prometheus HTTP endpoint, allowing to fetch
 * {@link PrometheusHttpServerConfig}. Picked up by builders calling
 * {@link SmallRyeConfigBuilder#addDiscoveredCustomizers()}.
 */
@AutoService(SmallRyeConfigBuilderCustomizer.class)
public final class PrometheusHttpServerConfigCustomizer implements SmallRyeConfigBuilderCustomizer {

    @Override
    public void configBuilder(SmallRyeConfigBuilder builder) {
        builder.withMapping(PrometheusHttpServerConfig.class).withValidator(new BeanValidationConfigValidatorImpl());
    }
}
