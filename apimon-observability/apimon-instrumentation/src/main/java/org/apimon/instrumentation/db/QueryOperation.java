// SPDX-License-Identifier: Apache-2.0
package org.apimon.instrumentation.db;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Locale;
import java.util.Optional;

/**
 * SQL statement kinds recorded by {@link QueryMetrics}.
 */
public enum QueryOperation {
    SELECT,
    INSERT,
    UPDATE,
    DELETE;

    /**
     * @return the value of the {@code operation} label
     */
    @NonNull
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Detects the operation from the first whitespace-delimited token of the trimmed statement, ignoring case.
     *
     * @param sql the SQL statement, may be {@code null}
     * @return the operation, or empty for blank statements and any other statement kind
     */
    @NonNull
    public static Optional<QueryOperation> fromSql(@Nullable String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        final String trimmed = sql.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        final String token = trimmed.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        for (QueryOperation operation : values()) {
            if (operation.label().equals(token)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
