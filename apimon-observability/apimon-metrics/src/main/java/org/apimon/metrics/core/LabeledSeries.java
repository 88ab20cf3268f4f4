// SPDX-License-Identifier: Apache-2.0
package org.apimon.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Mutable state of one series of a metric family, identified by its {@link LabelValues}.
 * Series are created lazily by the family and never removed.
 */
public interface LabeledSeries {

    /**
     * @return the type tag of this series, equal to the type of the owning family
     */
    @NonNull
    MetricType type();
}
