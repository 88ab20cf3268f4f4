// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apimon.instrumentation.db.QueryMetrics;
import org.apimon.instrumentation.db.QueryTimer;

/**
 * In-memory user data table.
 * <p>
 * Every operation leases a connection from the {@link SimulatedConnectionPool} and runs its statements through
 * {@link QueryMetrics}, the way a repository backed by a real database would. Items are kept in id order.
 */
public final class UserDataStore {

    private static final String TABLE = "user_data";

    private final SimulatedConnectionPool pool;
    private final QueryMetrics queryMetrics;
    private final NavigableMap<Long, UserData> rows = new TreeMap<>();
    private long nextId = 1;

    public UserDataStore(@NonNull SimulatedConnectionPool pool, @NonNull QueryMetrics queryMetrics) {
        this.pool = Objects.requireNonNull(pool, "connection pool must not be null");
        this.queryMetrics = Objects.requireNonNull(queryMetrics, "query metrics must not be null");
    }

    @NonNull
    public UserData create(@NonNull UserDataCreate data) {
        Objects.requireNonNull(data, "data must not be null");
        try (SimulatedConnectionPool.Connection connection = pool.acquire()) {
            return execute(connection, "INSERT INTO " + TABLE + " (name, email, message) VALUES (?, ?, ?)", () -> {
                synchronized (rows) {
                    UserData created = UserData.of(nextId++, data);
                    rows.put(created.id(), created);
                    return created;
                }
            });
        }
    }

    /**
     * @param skip  number of items to skip, in id order
     * @param limit maximum number of items to return
     * @return the page of items
     * @throws IllegalArgumentException if skip or limit is negative
     */
    @NonNull
    public List<UserData> list(int skip, int limit) {
        if (skip < 0 || limit < 0) {
            throw new IllegalArgumentException("skip and limit must not be negative");
        }
        try (SimulatedConnectionPool.Connection connection = pool.acquire()) {
            return execute(connection, "SELECT * FROM " + TABLE + " ORDER BY id LIMIT ? OFFSET ?", () -> {
                synchronized (rows) {
                    return rows.values().stream().skip(skip).limit(limit).collect(Collectors.toList());
                }
            });
        }
    }

    @NonNull
    public Optional<UserData> update(long id, @NonNull UserDataCreate data) {
        Objects.requireNonNull(data, "data must not be null");
        try (SimulatedConnectionPool.Connection connection = pool.acquire()) {
            if (findById(connection, id).isEmpty()) {
                return Optional.empty();
            }
            final String sql = "UPDATE " + TABLE + " SET name = ?, email = ?, message = ? WHERE id = ?";
            return execute(connection, sql, () -> {
                synchronized (rows) {
                    // may have been deleted in between
                    return Optional.ofNullable(rows.computeIfPresent(id, (key, old) -> UserData.of(key, data)));
                }
            });
        }
    }

    @NonNull
    public Optional<UserData> delete(long id) {
        try (SimulatedConnectionPool.Connection connection = pool.acquire()) {
            if (findById(connection, id).isEmpty()) {
                return Optional.empty();
            }
            return execute(connection, "DELETE FROM " + TABLE + " WHERE id = ?", () -> {
                synchronized (rows) {
                    return Optional.ofNullable(rows.remove(id));
                }
            });
        }
    }

    /**
     * Runs a trivial statement to verify the database is reachable.
     *
     * @throws DataAccessException if it is not
     */
    public void ping() {
        try (SimulatedConnectionPool.Connection connection = pool.acquire()) {
            execute(connection, "SELECT 1", () -> null);
        }
    }

    private Optional<UserData> findById(SimulatedConnectionPool.Connection connection, long id) {
        return execute(connection, "SELECT * FROM " + TABLE + " WHERE id = ?", () -> {
            synchronized (rows) {
                return Optional.ofNullable(rows.get(id));
            }
        });
    }

    private <T> T execute(SimulatedConnectionPool.Connection connection, String sql, Supplier<T> statement) {
        try (QueryTimer ignored = queryMetrics.start(sql)) {
            connection.checkReachable();
            return statement.get();
        }
    }
}
