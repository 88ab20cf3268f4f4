// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Supplies a point-in-time status text of a connection pool in the format read by {@link PoolStatus#parse(String)}.
 */
@FunctionalInterface
public interface ConnectionPoolStatusSource {

    /**
     * @return the current pool status text
     */
    @NonNull
    String status();
}
