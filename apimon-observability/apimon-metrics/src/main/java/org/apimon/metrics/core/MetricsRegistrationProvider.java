// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Collection;

/**
 * An SPI for providing metrics to register in a {@link MetricRegistry}.
 * <p>
 * The implementation class must have no-arg constructor and be registered in the file
 * {@code META-INF/services/org.apimon.metrics.core.MetricsRegistrationProvider} of its module,
 * usually generated with {@code @AutoService(MetricsRegistrationProvider.class)}.
 * <p>
 * Implementations will be discovered by {@link java.util.ServiceLoader} when creating a {@link MetricRegistry}
 * with {@link MetricRegistry.Builder#discoverMetricProviders()} activated.
 *
 * @see MetricsBinder
 */
public interface MetricsRegistrationProvider {

    /**
     * @return a collection of metric builders to register, never {@code null}
     */
    @NonNull
    Collection<Metric.Builder<?, ?>> getMetricsToRegister();
}
