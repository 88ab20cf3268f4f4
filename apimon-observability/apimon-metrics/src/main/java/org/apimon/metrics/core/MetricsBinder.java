// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Interface for binding a {@link MetricRegistry} for metrics registration or retrieval. <br>
 * Instrumentation components implement it to register their metric families once and keep them
 * in local fields for recording.
 * <p>
 * Binding the same component type to the same registry twice is allowed, because registration of
 * an identical metric is idempotent and returns the already registered family.
 *
 * @see MetricsRegistrationProvider
 */
public interface MetricsBinder {

    /**
     * Binds the provided {@link MetricRegistry}.
     * This method is called during the initialization phase to register or retrieve metrics.
     *
     * @param registry the {@link MetricRegistry} to bind, must not be {@code null}
     */
    void bind(@NonNull MetricRegistry registry);
}
