// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for {@link MetricsBinder}s whose metrics must be registered only once.
 * <p>
 * The first {@link #bind(MetricRegistry)} call runs {@link #bindMetricsNonIdempotent(MetricRegistry)}. Binding the
 * same registry again is a no-op, binding a different registry fails, since the subclass already holds the
 * metrics of the first one.
 */
public abstract class IdempotentMetricsBinder implements MetricsBinder {

    private static final Logger logger = LogManager.getLogger(IdempotentMetricsBinder.class);

    private final AtomicReference<MetricRegistry> boundRegistry = new AtomicReference<>();

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if already bound to a different registry
     */
    @Override
    public final void bind(@NonNull MetricRegistry registry) {
        Objects.requireNonNull(registry, "metrics registry must not be null");

        final MetricRegistry previous = boundRegistry.compareAndExchange(null, registry);
        if (previous == null) {
            bindMetricsNonIdempotent(registry);
        } else if (previous == registry) {
            logger.warn("Metrics registry already bound. instance={}", getClass().getName());
        } else {
            throw new IllegalStateException(getClass().getName() + " is already bound to another metrics registry");
        }
    }

    /**
     * @return {@code true} once {@link #bind(MetricRegistry)} has been called
     */
    public final boolean isMetricsBound() {
        return boundRegistry.get() != null;
    }

    /**
     * Registers the metrics of this binder. Called at most once per instance.
     *
     * @param registry the registry to register with
     */
    protected abstract void bindMetricsNonIdempotent(@NonNull MetricRegistry registry);
}
